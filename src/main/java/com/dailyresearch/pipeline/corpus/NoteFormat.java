package com.dailyresearch.pipeline.corpus;

import java.util.Collection;
import java.util.List;

/**
 * Parser for one note serialization. Keeps the history index and the
 * promotion tracker independent of how notes are written.
 */
public interface NoteFormat {

    /** Every hyperlink, bare URL and heading in the note, in document order. */
    List<NoteReference> extractReferences(String text);

    /**
     * Lines carrying any of the given pending tags (names without '#').
     * A line with two pending tags yields two entries, in the order of {@code tags}.
     */
    List<TaggedLine> parseTaggedLines(String text, Collection<String> tags);

    /** Replaces the first standalone occurrence of {@code #from} in the line with {@code #to}. */
    String replaceTag(String line, String from, String to);
}
