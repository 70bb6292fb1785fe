package com.dailyresearch.pipeline.service.filter;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.util.UrlUtils;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Title claims official or authoritative content ("Anthropic announces",
 * "official release notes") while the link points somewhere that cannot back
 * the claim.
 */
public class ClaimLinkMismatchRule implements SpamRule {
    private final PipelineConfig config;

    public ClaimLinkMismatchRule(PipelineConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return "claim-link-mismatch";
    }

    @Override
    public boolean isEnabled() {
        return config.isClaimLinkMismatchEnabled() && !config.getClaimLinkRules().isEmpty();
    }

    @Override
    public Optional<String> check(ContentItem item) {
        for (PipelineConfig.ClaimLinkRule rule : config.getClaimLinkRules()) {
            Matcher m = rule.getClaim().matcher(item.getTitle());
            if (!m.find()) continue;
            if (!linksToAllowedDomain(item.getUrl(), rule.getAllowedDomains())) {
                return Optional.of(name() + ": '" + m.group() + "' links to " + describeHost(item.getUrl()));
            }
        }
        return Optional.empty();
    }

    private static boolean linksToAllowedDomain(String url, List<String> domains) {
        for (String d : domains) {
            if (UrlUtils.matchesDomain(url, d)) return true;
        }
        return false;
    }

    private static String describeHost(String url) {
        String host = UrlUtils.host(url);
        return host.isEmpty() ? "no recognizable host" : host;
    }
}
