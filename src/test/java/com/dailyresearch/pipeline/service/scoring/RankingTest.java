package com.dailyresearch.pipeline.service.scoring;

import com.dailyresearch.pipeline.model.ContentItem;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class RankingTest {

    private static ContentItem item(String url, double score, String published) {
        return ContentItem.builder().url(url).title(url).score(score)
                .publishedAt(published == null ? null : Instant.parse(published)).build();
    }

    @Test
    public void scoreThenRecencyThenInputOrder() {
        List<ContentItem> ranked = Ranking.rank(List.of(
                item("a", 10, "2025-03-01T00:00:00Z"),
                item("b", 20, null),
                item("c", 10, null),
                item("d", 10, "2025-03-05T00:00:00Z"),
                item("e", 10, null)));
        assertEquals(List.of("b", "d", "a", "c", "e"),
                ranked.stream().map(ContentItem::getUrl).collect(Collectors.toList()));
    }
}
