package com.dailyresearch.pipeline.corpus;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MarkdownNoteFormatTest {
    private final MarkdownNoteFormat format = new MarkdownNoteFormat();

    @Test
    public void extractsLinksBareUrlsAndBodyHeadings() {
        String note = "---\n"
                + "title: # not a heading\n"
                + "---\n"
                + "# Daily Research 2025-03-01\n"
                + "- [ ] [Agents at scale](https://example.com/agents) — r/LocalLLaMA #agents\n"
                + "See also https://example.com/other.\n";
        List<NoteReference> refs = format.extractReferences(note);

        List<String> urls = refs.stream().map(NoteReference::getUrl).filter(u -> u != null).collect(Collectors.toList());
        assertEquals(List.of("https://example.com/agents", "https://example.com/other"), urls);
        List<String> titles = refs.stream().map(NoteReference::getTitle).filter(t -> t != null).collect(Collectors.toList());
        assertEquals(List.of("Daily Research 2025-03-01", "Agents at scale"), titles);
    }

    @Test
    public void malformedFrontmatterDoesNotThrow() {
        String note = "---\nbroken: [\n# Heading without close\n[link](https://a.example/x";
        assertDoesNotThrow(() -> format.extractReferences(note));
    }

    @Test
    public void parsesTaggedLinesWithSummaryAndHashtags() {
        String note = "intro\n"
                + "- [ ] [Agents at scale](https://example.com/agents) — @simonw · 120 likes #agents #keep\n"
                + "- [ ] [Bad take](https://example.com/bad) — r/foo #rag #bad\n"
                + "- note to self #keepers\n";
        List<TaggedLine> lines = format.parseTaggedLines(note, List.of("keep", "good", "bad"));

        assertEquals(2, lines.size());
        TaggedLine keep = lines.get(0);
        assertEquals(1, keep.getLineNumber());
        assertEquals("keep", keep.getTag());
        assertEquals("Agents at scale", keep.getTitle());
        assertEquals("https://example.com/agents", keep.getUrl());
        assertEquals("@simonw · 120 likes", keep.getSummary());
        assertEquals(List.of("agents", "keep"), keep.getHashtags());
        assertEquals("bad", lines.get(1).getTag());
    }

    @Test
    public void hashInsideUrlIsNotATag() {
        String note = "- [x](https://example.com/page#keep) plain\n";
        assertTrue(format.parseTaggedLines(note, List.of("keep")).isEmpty());
    }

    @Test
    public void replaceTagOnlyTouchesStandaloneTag() {
        String line = "- [T](https://e.com/a) #keeper #keep";
        assertEquals("- [T](https://e.com/a) #keeper #kept", format.replaceTag(line, "keep", "kept"));
        assertEquals(line, format.replaceTag(line, "good", "good-noted"));
    }

    @Test
    public void urlsKeepBalancedParentheses() {
        String note = "- [ ] [Transformer](https://en.wikipedia.org/wiki/Transformer_(deep_learning)) — web #models #keep\n"
                + "(background: https://en.wikipedia.org/wiki/Attention_(machine_learning))\n";

        List<String> urls = format.extractReferences(note).stream()
                .map(NoteReference::getUrl).filter(u -> u != null).collect(Collectors.toList());
        assertEquals(List.of("https://en.wikipedia.org/wiki/Transformer_(deep_learning)",
                "https://en.wikipedia.org/wiki/Attention_(machine_learning)"), urls);

        TaggedLine keep = format.parseTaggedLines(note, List.of("keep")).get(0);
        assertEquals("https://en.wikipedia.org/wiki/Transformer_(deep_learning)", keep.getUrl());
        assertEquals("web", keep.getSummary());
    }
}
