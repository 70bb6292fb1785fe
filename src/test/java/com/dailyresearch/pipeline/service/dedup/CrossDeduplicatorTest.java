package com.dailyresearch.pipeline.service.dedup;

import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.model.Fingerprint;
import com.dailyresearch.pipeline.model.FingerprintSet;
import com.dailyresearch.pipeline.model.HistoryIndex;
import com.dailyresearch.pipeline.model.Source;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CrossDeduplicatorTest {
    private final CrossDeduplicator dedup = new CrossDeduplicator();

    private static ContentItem item(String topic, String url, String title) {
        return ContentItem.builder().source(Source.REDDIT).topicSlug(topic).url(url).title(title).build();
    }

    private static HistoryIndex history(String url, String title, String note) {
        FingerprintSet seen = new FingerprintSet(0.8);
        seen.add(Fingerprint.of(url, title), note);
        return new HistoryIndex(seen, 1, 0);
    }

    @Test
    public void sameUrlInTwoTopicsKeepsFirstTopicsCopy() {
        CrossDeduplicator.Session session = dedup.session(HistoryIndex.empty(0.8));
        DedupResult agents = session.accept("agents", List.of(item("agents", "https://example.com/x", "Agents do retrieval now")));
        DedupResult rag = session.accept("rag", List.of(item("rag", "https://example.com/x?utm_source=feed", "A totally different headline here")));

        assertEquals(1, agents.getSurvivors().size());
        assertTrue(rag.getSurvivors().isEmpty());
        assertEquals("agents", rag.getDuplicates().get(0).getCollidedWith());
        assertFalse(rag.getDuplicates().get(0).isFromHistory());
    }

    @Test
    public void historyMatchIsDroppedWithProvenance() {
        HistoryIndex index = history("https://example.com/old", null, "Research/Dailies/2025/03/2025-03-01.md");
        DedupResult r = dedup.filter(List.of(item("agents", "https://www.example.com/old/", "Something")), index);
        assertTrue(r.getSurvivors().isEmpty());
        assertTrue(r.getDuplicates().get(0).isFromHistory());
        assertEquals("Research/Dailies/2025/03/2025-03-01.md", r.getDuplicates().get(0).getCollidedWith());
    }

    @Test
    public void exactTitleMatchIsDuplicateEvenWithDifferentUrl() {
        HistoryIndex index = history(null, "Claude Code ships subagents", "note.md");
        DedupResult r = dedup.filter(List.of(item("agents", "https://other.example/post", "claude code  ships SUBAGENTS")), index);
        assertTrue(r.getSurvivors().isEmpty());
    }

    @Test
    public void similarTitlesCollideButShortTitlesNeverDo() {
        HistoryIndex index = history(null, "open source agent framework released today", "note.md");
        DedupResult similar = dedup.filter(List.of(
                item("agents", "https://a.example/1", "new open source agent framework released today")), index);
        assertTrue(similar.getSurvivors().isEmpty());

        CrossDeduplicator.Session session = dedup.session(HistoryIndex.empty(0.8));
        DedupResult shorts = session.accept("agents", List.of(
                item("agents", "https://a.example/1", "GPT-5"),
                item("agents", "https://a.example/2", "GPT-5")));
        assertEquals(2, shorts.getSurvivors().size());
    }

    @Test
    public void withinBatchFirstOccurrenceWins() {
        DedupResult r = dedup.filter(List.of(
                item("agents", "https://example.com/a", "first copy of this post"),
                item("agents", "https://example.com/b", "something unrelated entirely"),
                item("agents", "https://example.com/a#top", "second copy")), HistoryIndex.empty(0.8));
        assertEquals(List.of("https://example.com/a", "https://example.com/b"),
                r.getSurvivors().stream().map(ContentItem::getUrl).collect(Collectors.toList()));
        assertEquals(1, r.getDuplicates().size());
    }

    @Test
    public void survivorsAreNeverInHistoryAndPairwiseDistinct() {
        HistoryIndex index = history("https://example.com/seen", null, "n.md");
        DedupResult r = dedup.filter(List.of(
                item("a", "https://example.com/seen", "title number one here"),
                item("a", "https://example.com/1", "title number two here"),
                item("a", "https://example.com/1/", "title number three here")), index);
        for (ContentItem s : r.getSurvivors()) {
            assertFalse(index.contains(s.getFingerprint()));
        }
        assertEquals(1, r.getSurvivors().size());
    }
}
