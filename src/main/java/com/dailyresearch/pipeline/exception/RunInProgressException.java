package com.dailyresearch.pipeline.exception;

/** A run was requested while another one is still in flight. */
public class RunInProgressException extends RuntimeException {
    public RunInProgressException(String message) {
        super(message);
    }
}
