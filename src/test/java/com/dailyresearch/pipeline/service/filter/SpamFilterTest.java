package com.dailyresearch.pipeline.service.filter;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.model.Source;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SpamFilterTest {
    private final PipelineConfig config = PipelineConfig.builder()
            .claimLinkPattern("\\banthropic\\b.*\\bannounce[sd]?\\b", List.of("anthropic.com", "x.com/anthropicai"))
            .lowEffortPatterns(List.of("^breaking\\b", "\\?!$"))
            .lowEffortMaxBodyChars(80)
            .build();
    private final SpamFilter filter = new SpamFilter(config);

    private static ContentItem.Builder item(String title, String url) {
        return ContentItem.builder().source(Source.X).title(title).url(url).bodyLength(300).metric("likes", 40);
    }

    @Test
    public void claimWithUnrelatedLinkIsSpam() {
        SpamVerdict v = filter.classify(item("Anthropic announces Claude 5", "https://random-blog.io/post").build());
        assertTrue(v.isSpam());
        assertTrue(v.getReason().startsWith("claim-link-mismatch"), v.getReason());
    }

    @Test
    public void claimWithOfficialLinkIsClean() {
        assertFalse(filter.classify(item("Anthropic announces Claude 5", "https://www.anthropic.com/news/x").build()).isSpam());
        assertFalse(filter.classify(item("Anthropic announces Claude 5", "https://x.com/AnthropicAI/status/1").build()).isSpam());
    }

    @Test
    public void lowEffortNeedsShortBodyUnknownEngagementAndBaitTitle() {
        ContentItem bait = ContentItem.builder().source(Source.WEB).title("BREAKING: agents replace devs").url("https://e.com/a").bodyLength(20).build();
        assertTrue(filter.classify(bait).isSpam());
        assertTrue(filter.classify(bait).getReason().startsWith("low-effort"));

        assertFalse(filter.classify(bait.toBuilder().bodyLength(500).build()).isSpam(), "long body");
        assertFalse(filter.classify(bait.toBuilder().metric("likes", 3).build()).isSpam(), "engagement known");
        assertFalse(filter.classify(bait.toBuilder().title("Agents replace devs, a study").build()).isSpam(), "plain title");
    }

    @Test
    public void anySingleRuleIsEnough() {
        ContentItem both = ContentItem.builder().source(Source.WEB)
                .title("Breaking: Anthropic announced a thing?!").url("https://spam.example/x").bodyLength(10).build();
        ContentItem onlyClaim = item("Anthropic announced a thing", "https://spam.example/x").build();
        assertTrue(filter.classify(both).isSpam());
        assertTrue(filter.classify(onlyClaim).isSpam());
    }

    @Test
    public void trustedAccountsAreNeverChecked() {
        ContentItem priority = item("Anthropic announces Claude 5", "https://random-blog.io/post").priorityAccount(true).build();
        ContentItem lab = item("Anthropic announces Claude 5", "https://random-blog.io/post").labAccount(true).build();
        assertFalse(filter.classify(priority).isSpam());
        assertFalse(filter.classify(lab).isSpam());
    }

    @Test
    public void disabledDetectionPassesEverything() {
        PipelineConfig off = PipelineConfig.builder()
                .spamDetectionEnabled(false)
                .claimLinkPattern("announce", List.of("anthropic.com"))
                .build();
        assertFalse(new SpamFilter(off).classify(item("Anthropic announces", "https://x.io").build()).isSpam());
    }

    @Test
    public void throwingRuleDropsItemAsSpam() {
        SpamRule broken = new SpamRule() {
            @Override public String name() { return "broken"; }
            @Override public boolean isEnabled() { return true; }
            @Override public Optional<String> check(ContentItem item) { throw new IllegalArgumentException("malformed"); }
        };
        SpamVerdict v = new SpamFilter(config, List.of(broken)).classify(item("Anything at all", "https://e.com").build());
        assertTrue(v.isSpam());
        assertEquals(SpamFilter.CHECK_ERROR_REASON, v.getReason());
    }

    @Test
    public void markRecordsVerdictOnCopy() {
        ContentItem original = item("Anthropic announces Claude 5", "https://random-blog.io/post").build();
        ContentItem marked = filter.mark(original);
        assertEquals(Boolean.TRUE, marked.getSpamFlag());
        assertNull(original.getSpamFlag());
    }
}
