package com.dailyresearch.pipeline.exception;

/** Base of all pipeline failures; carries the stage that raised it. */
public class PipelineException extends RuntimeException {
    private final PipelineStage stage;

    public PipelineException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public PipelineException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
