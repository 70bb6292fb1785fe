package com.dailyresearch.pipeline.model;

/**
 * A must-follow account. Solo accounts get a dedicated fetch call; the rest
 * are batched with the other non-solo accounts of the same group.
 */
public final class AccountConfig {
    private final String handle;
    private final String label;
    private final String groupLabel;
    private final boolean solo;

    public AccountConfig(String handle, String label, String groupLabel, boolean solo) {
        this.handle = stripAt(handle);
        this.label = label == null || label.isBlank() ? this.handle : label;
        this.groupLabel = groupLabel == null || groupLabel.isBlank() ? "Other" : groupLabel;
        this.solo = solo;
    }

    private static String stripAt(String h) {
        if (h == null) return "";
        String t = h.trim();
        return t.startsWith("@") ? t.substring(1) : t;
    }

    public String getHandle() { return handle; }
    public String getLabel() { return label; }
    public String getGroupLabel() { return groupLabel; }
    public boolean isSolo() { return solo; }

    /** Search query that returns this account's own posts. */
    public String fromQuery() {
        return "from:@" + handle;
    }
}
