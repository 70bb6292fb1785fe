package com.dailyresearch.pipeline.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/** Pipeline stage names used in errors and run reports. */
public enum PipelineStage {
    CONFIG("config"),
    PROMOTION("promotion"),
    HISTORY_INDEX("history_index"),
    FETCH("fetch"),
    SPAM_FILTER("spam_filter"),
    SCORING("scoring"),
    DEDUP("dedup"),
    SYNTHESIS("synthesis"),
    NOTE_WRITE("note_write");

    private final String key;

    PipelineStage(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() { return key; }
}
