package com.dailyresearch.pipeline.service.note;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.corpus.InMemoryCorpusStore;
import com.dailyresearch.pipeline.corpus.MarkdownNoteFormat;
import com.dailyresearch.pipeline.corpus.TaggedLine;
import com.dailyresearch.pipeline.model.AccountConfig;
import com.dailyresearch.pipeline.model.Category;
import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.model.Source;
import com.dailyresearch.pipeline.model.TopicConfig;
import com.dailyresearch.pipeline.service.synthesis.ReadingList;
import com.dailyresearch.pipeline.service.synthesis.Synthesis;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DailyNoteWriterTest {
    private static final LocalDate DAY = LocalDate.of(2025, 3, 1);
    private final TopicConfig agents = new TopicConfig("agents", "Agent Development", 1.2, List.of());
    private final PipelineConfig config = PipelineConfig.builder()
            .topic(agents)
            .mustFollow(new AccountConfig("karpathy", "Andrej Karpathy", "Researchers", true))
            .build();

    private final ContentItem redditItem = ContentItem.builder().source(Source.REDDIT)
            .url("https://www.reddit.com/r/LocalLLaMA/comments/1").title("Agents [beta] in practice")
            .community("LocalLLaMA").metric("score", 321).topicSlug("agents").category(Category.DEEP_DIVE).score(40.0).build();
    private final ContentItem labItem = ContentItem.builder().source(Source.X)
            .url("https://x.com/AnthropicAI/status/7").title("New model card").author("AnthropicAI")
            .metric("likes", 1200).topicSlug("agents").category(Category.LAB_PULSE).score(30.0).build();
    private final ContentItem mustFollowItem = ContentItem.builder().source(Source.X)
            .url("https://x.com/karpathy/status/9").title("Thoughts on agents").author("karpathy")
            .category(Category.GENERAL).score(5.0).build();

    private ReadingList list() {
        return ReadingList.of(List.of(redditItem, labItem), List.of(mustFollowItem), List.of(agents), config);
    }

    @Test
    public void rendersSectionsAndReadingList() {
        Synthesis synthesis = new Synthesis("Agents everywhere.", "Anthropic shipped.",
                List.of(new Synthesis.TopicSummary("agents", "Loops get longer", List.of("point one"))), null);
        String note = new DailyNoteWriter(new InMemoryCorpusStore(), config).render(list(), synthesis, DAY);

        assertTrue(note.startsWith("---\ntype: daily-research\ndate: 2025-03-01\ntopics: [agents]\n---\n"));
        assertTrue(note.contains("# Daily Research 2025-03-01"));
        assertTrue(note.contains("## Briefing\n\nAgents everywhere."));
        assertTrue(note.contains("## Lab Pulse"));
        assertTrue(note.contains("## Must-Follow\n\n### Researchers\n- [ ] [Thoughts on agents](https://x.com/karpathy/status/9) — @karpathy"));
        assertTrue(note.contains("## Agent Development\n\n**Loops get longer**\n\n- point one"));
        assertTrue(note.contains("- [ ] [Agents (beta) in practice](https://www.reddit.com/r/LocalLLaMA/comments/1) — r/LocalLLaMA · 321 pts · deep-dive #agents"));
        assertTrue(note.contains("- [ ] [New model card](https://x.com/AnthropicAI/status/7) — @AnthropicAI · 1200 likes · lab-pulse #agents"));
    }

    @Test
    public void emptyReadingListStillProducesNote() {
        ReadingList empty = ReadingList.of(List.of(), List.of(), List.of(agents), config);
        String note = new DailyNoteWriter(new InMemoryCorpusStore(), config).render(empty, Synthesis.empty(), DAY);
        assertTrue(note.contains("_Nothing new today._"));
        assertFalse(note.contains("## Briefing"));
    }

    @Test
    public void writesUnderYearAndMonthAndNeverOverwrites() {
        InMemoryCorpusStore corpus = new InMemoryCorpusStore();
        DailyNoteWriter writer = new DailyNoteWriter(corpus, config);

        assertEquals("Research/Dailies/2025/03/2025-03-01.md", writer.write(list(), Synthesis.empty(), DAY));
        assertEquals("Research/Dailies/2025/03/2025-03-01-2.md", writer.write(list(), Synthesis.empty(), DAY));
    }

    @Test
    public void readingLinesParseBackForPromotion() {
        String note = new DailyNoteWriter(new InMemoryCorpusStore(), config).render(list(), Synthesis.empty(), DAY);
        String tagged = note.replace("deep-dive #agents", "deep-dive #agents #keep");

        List<TaggedLine> lines = new MarkdownNoteFormat().parseTaggedLines(tagged, List.of("keep"));
        assertEquals(1, lines.size());
        assertEquals("https://www.reddit.com/r/LocalLLaMA/comments/1", lines.get(0).getUrl());
        assertEquals("Agents (beta) in practice", lines.get(0).getTitle());
        assertEquals("r/LocalLLaMA · 321 pts · deep-dive", lines.get(0).getSummary());
        assertTrue(lines.get(0).getHashtags().contains("agents"));
    }
}
