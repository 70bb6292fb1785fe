package com.dailyresearch.pipeline.service.filter;

/** Outcome of a spam check; {@code reason} names the rule that fired. */
public final class SpamVerdict {
    private static final SpamVerdict CLEAN = new SpamVerdict(false, null);

    private final boolean spam;
    private final String reason;

    private SpamVerdict(boolean spam, String reason) {
        this.spam = spam;
        this.reason = reason;
    }

    public static SpamVerdict clean() {
        return CLEAN;
    }

    public static SpamVerdict spam(String reason) {
        return new SpamVerdict(true, reason);
    }

    public boolean isSpam() { return spam; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return spam ? "spam(" + reason + ")" : "clean";
    }
}
