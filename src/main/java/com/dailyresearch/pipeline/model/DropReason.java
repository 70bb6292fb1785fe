package com.dailyresearch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Why an item left the pipeline before reaching the ranked output. */
public enum DropReason {
    SPAM("spam"),
    ENGAGEMENT_FLOOR("engagement_floor"),
    DUPLICATE("duplicate");

    private final String key;

    DropReason(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() { return key; }
}
