package com.xksgroup.vodpipeline.service.pipeline;

import lombok.Value;

import java.util.List;

@Value
public class ProcessingResult {
    String jobId;
    ProcessingOutcome outcome;
    int renditionCount;
    String errorMessage;
    List<NonFatalFailure> nonFatalFailures;

    public static ProcessingResult completed(String jobId, int renditionCount, List<NonFatalFailure> nonFatal) {
        return new ProcessingResult(jobId, ProcessingOutcome.COMPLETED, renditionCount, null, List.copyOf(nonFatal));
    }

    public static ProcessingResult alreadyCompleted(String jobId, List<NonFatalFailure> nonFatal) {
        return new ProcessingResult(jobId, ProcessingOutcome.ALREADY_COMPLETED, 0, null, List.copyOf(nonFatal));
    }

    public static ProcessingResult failed(String jobId, String errorMessage, List<NonFatalFailure> nonFatal) {
        return new ProcessingResult(jobId, ProcessingOutcome.FAILED, 0, errorMessage, List.copyOf(nonFatal));
    }
}
