package com.dailyresearch.pipeline.corpus;

import java.util.List;

/**
 * A note line carrying one pending tag, plus what could be parsed from it.
 * {@code title}/{@code url} are null when the line holds no Markdown link.
 */
public final class TaggedLine {
    private final int lineNumber;
    private final String tag;
    private final String rawLine;
    private final String title;
    private final String url;
    private final String summary;
    private final List<String> hashtags;

    public TaggedLine(int lineNumber, String tag, String rawLine, String title, String url,
                      String summary, List<String> hashtags) {
        this.lineNumber = lineNumber;
        this.tag = tag;
        this.rawLine = rawLine;
        this.title = title;
        this.url = url;
        this.summary = summary == null ? "" : summary;
        this.hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }

    /** Zero-based. */
    public int getLineNumber() { return lineNumber; }
    /** The tag without '#', e.g. "keep". */
    public String getTag() { return tag; }
    public String getRawLine() { return rawLine; }
    public String getTitle() { return title; }
    public String getUrl() { return url; }
    public String getSummary() { return summary; }
    /** All hashtags on the line, without '#', in order of appearance. */
    public List<String> getHashtags() { return hashtags; }

    public boolean hasLink() {
        return url != null;
    }
}
