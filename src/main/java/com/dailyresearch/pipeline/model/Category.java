package com.dailyresearch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Presentation bucket assigned by the classifier. */
public enum Category {
    LAB_PULSE("lab-pulse"),
    DEEP_DIVE("deep-dive"),
    GENERAL("general");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }
}
