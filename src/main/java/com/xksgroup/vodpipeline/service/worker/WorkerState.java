package com.xksgroup.vodpipeline.service.worker;

public enum WorkerState {
    STARTUP,
    RECOVERING,     // Claiming entries left pending by earlier runs
    CONSUMING,
    SHUTTING_DOWN,
    STOPPED
}
