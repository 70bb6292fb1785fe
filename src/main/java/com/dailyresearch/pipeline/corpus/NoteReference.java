package com.dailyresearch.pipeline.corpus;

/** A link or heading found in a note; either field may be null. */
public final class NoteReference {
    private final String title;
    private final String url;

    public NoteReference(String title, String url) {
        this.title = title;
        this.url = url;
    }

    public static NoteReference link(String title, String url) {
        return new NoteReference(title, url);
    }

    public static NoteReference heading(String title) {
        return new NoteReference(title, null);
    }

    public static NoteReference bareUrl(String url) {
        return new NoteReference(null, url);
    }

    public String getTitle() { return title; }
    public String getUrl() { return url; }
}
