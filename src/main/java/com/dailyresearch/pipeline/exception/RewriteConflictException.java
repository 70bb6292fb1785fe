package com.dailyresearch.pipeline.exception;

/**
 * A tag rewrite in a note could not be committed (line changed underneath us,
 * or the store refused the write). The tentative record for it is discarded.
 */
public class RewriteConflictException extends PipelineException {
    private final String notePath;
    private final int lineNumber;

    public RewriteConflictException(String notePath, int lineNumber, String message) {
        super(PipelineStage.PROMOTION, message);
        this.notePath = notePath;
        this.lineNumber = lineNumber;
    }

    public RewriteConflictException(String notePath, int lineNumber, String message, Throwable cause) {
        super(PipelineStage.PROMOTION, message, cause);
        this.notePath = notePath;
        this.lineNumber = lineNumber;
    }

    public String getNotePath() { return notePath; }
    public int getLineNumber() { return lineNumber; }
}
