package com.dailyresearch.pipeline.service.scoring;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.model.Source;
import com.dailyresearch.pipeline.util.UrlUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Additive point score for an item:
 * <ol>
 *   <li>engagement points from the source's primary metric (log scale, capped)</li>
 *   <li>recency points, decaying linearly over the recency window</li>
 *   <li>long-form bonus</li>
 *   <li>priority-account bonus</li>
 * </ol>
 * The subtotal is capped at {@value #MAX_BASE_SCORE} and then multiplied by the
 * topic weight.
 *
 * <p>Recency is measured in whole days against the clock's current date, so
 * scores only move when the day changes.
 */
public class QualityScorer {
    public static final double MAX_BASE_SCORE = 100.0;
    /** Reddit titles longer than this count as long-form even without a body. */
    static final int LONG_TITLE_CHARS = 100;

    private final PipelineConfig config;
    private final Clock clock;

    public QualityScorer(PipelineConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * True when the item must be dropped before scoring: not a trusted account,
     * and its source's floor metric is reported and below the floor. A metric
     * that was not reported never fails the floor.
     */
    public boolean failsEngagementFloor(ContentItem item) {
        if (item.isTrustedAccount()) return false;
        int floor = config.floorFor(item.getSource());
        if (floor <= 0) return false;
        OptionalInt metric = item.metric(item.getSource().getPrimaryMetric());
        return metric.isPresent() && metric.getAsInt() < floor;
    }

    /** Long body, a link to a recognized article domain, or a very long Reddit title. */
    public boolean isLongForm(ContentItem item) {
        if (item.getBodyLength() >= config.getLongFormMinChars()) return true;
        for (String domain : config.getArticleDomains()) {
            if (UrlUtils.matchesDomain(item.getUrl(), domain)) return true;
        }
        return item.getSource() == Source.REDDIT && item.getTitle().length() > LONG_TITLE_CHARS;
    }

    public double score(ContentItem item, double topicWeight) {
        double points = engagementPoints(item) + recencyPoints(item);
        if (isLongForm(item)) {
            points += config.getLongFormBonus();
        }
        if (item.isPriorityAccount()) {
            points += config.getPriorityAccountBonus();
        }
        return Math.min(MAX_BASE_SCORE, points) * topicWeight;
    }

    /**
     * Floor gate then score. Empty when the item is dropped for low engagement.
     */
    public Optional<ContentItem> apply(ContentItem item, double topicWeight) {
        if (failsEngagementFloor(item)) {
            return Optional.empty();
        }
        return Optional.of(item.withScore(score(item, topicWeight)));
    }

    /** Scores without the floor gate (must-follow track). */
    public ContentItem scoreUnfiltered(ContentItem item, double topicWeight) {
        return item.withScore(score(item, topicWeight));
    }

    double engagementPoints(ContentItem item) {
        OptionalInt metric = item.metric(item.getSource().getPrimaryMetric());
        if (metric.isEmpty() || metric.getAsInt() <= 0) return 0.0;
        double pts = config.getEngagementPointsPerDecade() * Math.log10(1.0 + metric.getAsInt());
        return Math.min(config.getEngagementPointsMax(), pts);
    }

    double recencyPoints(ContentItem item) {
        if (item.getPublishedAt() == null || config.getRecencyPointsMax() <= 0) return 0.0;
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate published = item.getPublishedAt().atZone(ZoneOffset.UTC).toLocalDate();
        long ageDays = Math.max(0, ChronoUnit.DAYS.between(published, today));
        int window = config.getRecencyWindowDays();
        if (ageDays >= window) return 0.0;
        return config.getRecencyPointsMax() * (window - ageDays) / window;
    }
}
