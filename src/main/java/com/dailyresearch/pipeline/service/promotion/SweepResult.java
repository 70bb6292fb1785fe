package com.dailyresearch.pipeline.service.promotion;

import com.dailyresearch.pipeline.model.FeedbackRecord;
import com.dailyresearch.pipeline.model.PromotionRecord;

import java.util.List;

/** What one promotion sweep committed. Discarded transitions only show up in {@code conflicts}. */
public final class SweepResult {
    private final List<PromotionRecord> promotions;
    private final List<FeedbackRecord> feedback;
    private final List<String> conflicts;
    private final int alreadyPromoted;
    private final int notesScanned;

    public SweepResult(List<PromotionRecord> promotions, List<FeedbackRecord> feedback, List<String> conflicts,
                       int alreadyPromoted, int notesScanned) {
        this.promotions = List.copyOf(promotions);
        this.feedback = List.copyOf(feedback);
        this.conflicts = List.copyOf(conflicts);
        this.alreadyPromoted = alreadyPromoted;
        this.notesScanned = notesScanned;
    }

    public List<PromotionRecord> getPromotions() { return promotions; }
    public List<FeedbackRecord> getFeedback() { return feedback; }
    public List<String> getConflicts() { return conflicts; }
    /** {@code #keep} lines resolved without a new record because the fingerprint was promoted before. */
    public int getAlreadyPromoted() { return alreadyPromoted; }
    public int getNotesScanned() { return notesScanned; }

    public boolean isEmpty() {
        return promotions.isEmpty() && feedback.isEmpty() && conflicts.isEmpty() && alreadyPromoted == 0;
    }
}
