package com.dailyresearch.pipeline.exception;

/**
 * A fetch collaborator call failed or timed out. Recovered per topic as zero
 * items; only raised to the caller when every track of a run failed.
 */
public class FetchFailureException extends PipelineException {

    public FetchFailureException(String message) {
        super(PipelineStage.FETCH, message);
    }

    public FetchFailureException(String message, Throwable cause) {
        super(PipelineStage.FETCH, message, cause);
    }
}
