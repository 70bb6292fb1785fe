package com.dailyresearch.pipeline.service;

/** What a pipeline invocation does. */
public enum RunMode {
    /** Promotion sweep, every topic plus must-follow, note written. */
    FULL("full"),
    /** Promotion sweep, one topic, note written. */
    SINGLE_TOPIC("topic"),
    /** Every stage except corpus writes: no sweep, note rendered but not stored. */
    PREVIEW("preview"),
    /** Promotion sweep only. */
    PROMOTE_ONLY("promote");

    private final String key;

    RunMode(String key) {
        this.key = key;
    }

    public String getKey() { return key; }

    public boolean sweeps() {
        return this != PREVIEW;
    }

    public boolean writesNote() {
        return this == FULL || this == SINGLE_TOPIC;
    }
}
