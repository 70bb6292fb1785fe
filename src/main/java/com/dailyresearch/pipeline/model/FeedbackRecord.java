package com.dailyresearch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/** One resolved {@code #good} / {@code #bad} tag occurrence. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedbackRecord {
    public static final String GOOD = "good";
    public static final String BAD = "bad";

    private String title;
    private String url;
    private String tag;
    private Instant notedAt;
    /** YYYY-MM-DD of the note the tag was found in, if the path carries one. */
    private String date;
    private String sourceNote;

    public FeedbackRecord() {}

    public FeedbackRecord(String title, String url, String tag, Instant notedAt, String date, String sourceNote) {
        this.title = title;
        this.url = url;
        this.tag = tag;
        this.notedAt = notedAt;
        this.date = date;
        this.sourceNote = sourceNote;
    }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getTag() { return tag; }
    public void setTag(String tag) { this.tag = tag; }
    public Instant getNotedAt() { return notedAt; }
    public void setNotedAt(Instant notedAt) { this.notedAt = notedAt; }
    public String getDate() { return date; }
    public void setDate(String date) { this.date = date; }
    public String getSourceNote() { return sourceNote; }
    public void setSourceNote(String sourceNote) { this.sourceNote = sourceNote; }
}
