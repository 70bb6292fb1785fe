package com.dailyresearch.pipeline.exception;

/**
 * The note corpus cannot be listed or read as a whole. Always fatal: running on
 * an empty history index would resurface every previously written item.
 */
public class CorpusUnavailableException extends PipelineException {

    public CorpusUnavailableException(String message) {
        super(PipelineStage.HISTORY_INDEX, message);
    }

    public CorpusUnavailableException(PipelineStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
