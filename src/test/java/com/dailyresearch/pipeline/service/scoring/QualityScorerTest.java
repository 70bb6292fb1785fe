package com.dailyresearch.pipeline.service.scoring;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.model.Category;
import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.model.Source;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class QualityScorerTest {
    static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private final PipelineConfig config = PipelineConfig.builder()
            .xLikesFloor(100)
            .redditScoreFloor(10)
            .articleDomains(List.of("arxiv.org"))
            .build();
    private final QualityScorer scorer = new QualityScorer(config, clock);

    private static ContentItem.Builder x(Integer likes) {
        return ContentItem.builder().source(Source.X).url("https://x.com/a/status/1").title("A short post").metric("likes", likes);
    }

    @Test
    public void reportedMetricBelowFloorIsDropped() {
        assertTrue(scorer.failsEngagementFloor(x(5).build()));
        assertEquals(Optional.empty(), scorer.apply(x(5).build(), 1.0));
        assertFalse(scorer.failsEngagementFloor(x(100).build()));
    }

    @Test
    public void unknownMetricPassesFloor() {
        ContentItem unknown = x(null).build();
        assertTrue(unknown.isEngagementUnknown());
        assertFalse(scorer.failsEngagementFloor(unknown));
        assertTrue(scorer.apply(unknown, 1.0).isPresent());
    }

    @Test
    public void explicitZeroIsAReportedMetric() {
        assertTrue(scorer.failsEngagementFloor(x(0).build()));
    }

    @Test
    public void trustedAccountsBypassFloorEvenWithZeroEngagement() {
        assertFalse(scorer.failsEngagementFloor(x(0).priorityAccount(true).build()));
        assertFalse(scorer.failsEngagementFloor(x(0).labAccount(true).build()));
    }

    @Test
    public void floorUsesSourcePrimaryMetric() {
        ContentItem reddit = ContentItem.builder().source(Source.REDDIT).url("https://reddit.com/r/a/1").title("t")
                .metric("score", 3).metric("likes", 1000).build();
        assertTrue(scorer.failsEngagementFloor(reddit));
        ContentItem web = ContentItem.builder().source(Source.WEB).url("https://e.com").title("t").build();
        assertFalse(scorer.failsEngagementFloor(web));
    }

    @Test
    public void scoreAddsEngagementRecencyAndBonusesThenAppliesWeight() {
        ContentItem item = x(99).publishedAt(NOW).bodyLength(500).priorityAccount(true).build();
        // 20 engagement + 10 recency + 15 long-form + 10 priority
        assertEquals(55.0 * 1.2, scorer.score(item, 1.2), 1e-9);
    }

    @Test
    public void recencyDecaysLinearlyPerDay() {
        assertEquals(10.0, scorer.recencyPoints(x(1).publishedAt(NOW.minus(Duration.ofHours(5))).build()), 1e-9);
        assertEquals(10.0 * 4 / 7, scorer.recencyPoints(x(1).publishedAt(NOW.minus(Duration.ofDays(3))).build()), 1e-9);
        assertEquals(0.0, scorer.recencyPoints(x(1).publishedAt(NOW.minus(Duration.ofDays(7))).build()), 1e-9);
        assertEquals(0.0, scorer.recencyPoints(x(1).build()), 1e-9);
    }

    @Test
    public void engagementPointsAreCapped() {
        assertEquals(40.0, scorer.engagementPoints(x(1_000_000_000).build()), 1e-9);
        assertEquals(0.0, scorer.engagementPoints(x(null).build()), 1e-9);
    }

    @Test
    public void baseScoreIsCappedBeforeWeight() {
        PipelineConfig generous = PipelineConfig.builder().longFormBonus(80).build();
        QualityScorer s = new QualityScorer(generous, clock);
        ContentItem item = x(1_000_000).publishedAt(NOW).bodyLength(1000).priorityAccount(true).build();
        assertEquals(50.0, s.score(item, 0.5), 1e-9);
    }

    @Test
    public void labAccountsGetNoBonus() {
        ContentItem plain = x(null).build();
        ContentItem lab = x(null).labAccount(true).build();
        assertEquals(scorer.score(plain, 1.0), scorer.score(lab, 1.0), 1e-9);
    }

    @Test
    public void longFormByBodyDomainOrRedditTitle() {
        assertTrue(scorer.isLongForm(x(1).bodyLength(400).build()));
        assertTrue(scorer.isLongForm(x(1).url("https://arxiv.org/abs/2501.1").build()));
        assertFalse(scorer.isLongForm(x(1).bodyLength(399).build()));
        ContentItem reddit = ContentItem.builder().source(Source.REDDIT).url("https://reddit.com/r/a/1")
                .title("t".repeat(101)).metric("score", 50).build();
        assertTrue(scorer.isLongForm(reddit));
    }

    @Test
    public void longFirstLineOfShortXPostIsNotLongForm() {
        String title = "Agents that plan, call tools, and recover from errors are finally shipping in production setups today";
        ContentItem post = x(500).title(title + "...").bodyLength(119).build();
        assertTrue(post.getTitle().length() > QualityScorer.LONG_TITLE_CHARS);

        assertFalse(scorer.isLongForm(post));
        assertEquals(Category.GENERAL, new Classifier(scorer).classify(post));
        assertEquals(10 * Math.log10(501), scorer.score(post, 1.0), 1e-9);
    }

    @Test
    public void sameInputsSameScore() {
        ContentItem item = x(250).publishedAt(NOW.minus(Duration.ofDays(1))).build();
        assertEquals(scorer.score(item, 1.1), new QualityScorer(config, clock).score(item, 1.1), 0.0);
    }
}
