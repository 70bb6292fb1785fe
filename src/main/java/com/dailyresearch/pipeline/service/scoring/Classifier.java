package com.dailyresearch.pipeline.service.scoring;

import com.dailyresearch.pipeline.model.Category;
import com.dailyresearch.pipeline.model.ContentItem;

/**
 * Assigns the presentation bucket. First match wins: lab-pulse, then
 * deep-dive (same long-form test the scorer uses), then general.
 */
public class Classifier {
    private final QualityScorer scorer;

    public Classifier(QualityScorer scorer) {
        this.scorer = scorer;
    }

    public Category classify(ContentItem item) {
        if (item.isLabAccount()) return Category.LAB_PULSE;
        if (scorer.isLongForm(item)) return Category.DEEP_DIVE;
        return Category.GENERAL;
    }

    public ContentItem apply(ContentItem item) {
        return item.withCategory(classify(item));
    }
}
