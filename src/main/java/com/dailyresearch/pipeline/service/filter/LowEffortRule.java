package com.dailyresearch.pipeline.service.filter;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.model.ContentItem;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Short body, no engagement data at all, and a clickbait title template.
 * All three must hold.
 */
public class LowEffortRule implements SpamRule {
    private final PipelineConfig config;

    public LowEffortRule(PipelineConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return "low-effort";
    }

    @Override
    public boolean isEnabled() {
        return config.isLowEffortEnabled() && !config.getLowEffortPatterns().isEmpty();
    }

    @Override
    public Optional<String> check(ContentItem item) {
        if (item.getBodyLength() >= config.getLowEffortMaxBodyChars()) return Optional.empty();
        if (!item.isEngagementUnknown()) return Optional.empty();
        for (Pattern p : config.getLowEffortPatterns()) {
            if (p.matcher(item.getTitle()).find()) {
                return Optional.of(name() + ": title matches /" + p.pattern() + "/");
            }
        }
        return Optional.empty();
    }
}
