package com.xksgroup.vodpipeline.service.pipeline;

import lombok.Value;

/**
 * A best-effort metadata write that failed without failing the job.
 */
@Value
public class NonFatalFailure {
    String operation;
    String message;
}
