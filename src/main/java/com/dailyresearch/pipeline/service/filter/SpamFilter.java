package com.dailyresearch.pipeline.service.filter;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.model.ContentItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every enabled {@link SpamRule} over an item. One vote is enough to
 * flag it. Priority and lab accounts are never checked.
 */
public class SpamFilter {
    private static final Logger log = LoggerFactory.getLogger(SpamFilter.class);
    public static final String CHECK_ERROR_REASON = "spam-check-error";

    private final PipelineConfig config;
    private final List<SpamRule> rules;

    public SpamFilter(PipelineConfig config) {
        this(config, List.of(new ClaimLinkMismatchRule(config), new LowEffortRule(config)));
    }

    public SpamFilter(PipelineConfig config, List<SpamRule> rules) {
        this.config = config;
        this.rules = new ArrayList<>(rules);
    }

    public SpamVerdict classify(ContentItem item) {
        if (!config.isSpamDetectionEnabled() || item.isTrustedAccount()) {
            return SpamVerdict.clean();
        }
        for (SpamRule rule : rules) {
            if (!rule.isEnabled()) continue;
            Optional<String> reason;
            try {
                reason = rule.check(item);
            } catch (RuntimeException e) {
                log.warn("Spam rule {} failed on {}: {}", rule.name(), item.getUrl(), e.toString());
                return SpamVerdict.spam(CHECK_ERROR_REASON);
            }
            if (reason.isPresent()) {
                return SpamVerdict.spam(reason.get());
            }
        }
        return SpamVerdict.clean();
    }

    /** Classifies and records the verdict on a copy of the item. */
    public ContentItem mark(ContentItem item) {
        return item.withSpamFlag(classify(item).isSpam());
    }
}
