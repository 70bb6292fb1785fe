package com.dailyresearch.pipeline.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RunDtos {

    /** Per-track counters. {@code dropped} is keyed by reason: spam, engagement_floor, duplicate. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TopicReport {
        private String slug;
        private int fetched;
        private int kept;
        private Map<String, Integer> dropped = new LinkedHashMap<>();
        private Map<String, Integer> spam_reasons; // rule → count
        private List<String> fetch_errors;
        private boolean failed;

        public String getSlug() { return slug; }
        public void setSlug(String slug) { this.slug = slug; }
        public int getFetched() { return fetched; }
        public void setFetched(int fetched) { this.fetched = fetched; }
        public int getKept() { return kept; }
        public void setKept(int kept) { this.kept = kept; }
        public Map<String, Integer> getDropped() { return dropped; }
        public void setDropped(Map<String, Integer> dropped) { this.dropped = dropped; }
        public Map<String, Integer> getSpam_reasons() { return spam_reasons; }
        public void setSpam_reasons(Map<String, Integer> spam_reasons) { this.spam_reasons = spam_reasons; }
        public List<String> getFetch_errors() { return fetch_errors; }
        public void setFetch_errors(List<String> fetch_errors) { this.fetch_errors = fetch_errors; }
        public boolean isFailed() { return failed; }
        public void setFailed(boolean failed) { this.failed = failed; }
    }

    /** Fatal failure of a run and the stage that raised it. */
    public static class RunError {
        private String exception;
        private String message;
        private String stage;

        public RunError() {}

        public RunError(String exception, String message, String stage) {
            this.exception = exception;
            this.message = message;
            this.stage = stage;
        }

        public String getException() { return exception; }
        public void setException(String exception) { this.exception = exception; }
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
        public String getStage() { return stage; }
        public void setStage(String stage) { this.stage = stage; }
    }

    /** Summary of one pipeline invocation, returned by the run endpoints and saved to run history. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RunReport {
        private String run_id;
        private String mode; // full | topic | preview | promote
        private String status; // running | completed | failed
        private Instant started_at;
        private Instant ended_at;
        private Integer history_notes_scanned;
        private Integer history_notes_skipped;
        private List<TopicReport> topics;
        private TopicReport must_follow;
        private Map<String, Integer> dropped_total; // reason → count across tracks
        private Integer reading_list_count;
        private Integer must_follow_count;
        private int promotions;
        private int feedback;
        private List<String> rewrite_conflicts;
        private String note_path;
        private String preview; // rendered note, preview runs only
        private String synthesis_error;
        private RunError error;

        public String getRun_id() { return run_id; }
        public void setRun_id(String run_id) { this.run_id = run_id; }
        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public Instant getStarted_at() { return started_at; }
        public void setStarted_at(Instant started_at) { this.started_at = started_at; }
        public Instant getEnded_at() { return ended_at; }
        public void setEnded_at(Instant ended_at) { this.ended_at = ended_at; }
        public Integer getHistory_notes_scanned() { return history_notes_scanned; }
        public void setHistory_notes_scanned(Integer history_notes_scanned) { this.history_notes_scanned = history_notes_scanned; }
        public Integer getHistory_notes_skipped() { return history_notes_skipped; }
        public void setHistory_notes_skipped(Integer history_notes_skipped) { this.history_notes_skipped = history_notes_skipped; }
        public List<TopicReport> getTopics() { return topics; }
        public void setTopics(List<TopicReport> topics) { this.topics = topics; }
        public TopicReport getMust_follow() { return must_follow; }
        public void setMust_follow(TopicReport must_follow) { this.must_follow = must_follow; }
        public Map<String, Integer> getDropped_total() { return dropped_total; }
        public void setDropped_total(Map<String, Integer> dropped_total) { this.dropped_total = dropped_total; }
        public Integer getReading_list_count() { return reading_list_count; }
        public void setReading_list_count(Integer reading_list_count) { this.reading_list_count = reading_list_count; }
        public Integer getMust_follow_count() { return must_follow_count; }
        public void setMust_follow_count(Integer must_follow_count) { this.must_follow_count = must_follow_count; }
        public int getPromotions() { return promotions; }
        public void setPromotions(int promotions) { this.promotions = promotions; }
        public int getFeedback() { return feedback; }
        public void setFeedback(int feedback) { this.feedback = feedback; }
        public List<String> getRewrite_conflicts() { return rewrite_conflicts; }
        public void setRewrite_conflicts(List<String> rewrite_conflicts) { this.rewrite_conflicts = rewrite_conflicts; }
        public String getNote_path() { return note_path; }
        public void setNote_path(String note_path) { this.note_path = note_path; }
        public String getPreview() { return preview; }
        public void setPreview(String preview) { this.preview = preview; }
        public String getSynthesis_error() { return synthesis_error; }
        public void setSynthesis_error(String synthesis_error) { this.synthesis_error = synthesis_error; }
        public RunError getError() { return error; }
        public void setError(RunError error) { this.error = error; }
    }

    /** History index dump. */
    public static class DedupDump {
        private int notes_scanned;
        private int notes_skipped;
        private Map<String, String> urls; // normalized url → first note
        private Map<String, String> titles; // normalized title → first note

        public int getNotes_scanned() { return notes_scanned; }
        public void setNotes_scanned(int notes_scanned) { this.notes_scanned = notes_scanned; }
        public int getNotes_skipped() { return notes_skipped; }
        public void setNotes_skipped(int notes_skipped) { this.notes_skipped = notes_skipped; }
        public Map<String, String> getUrls() { return urls; }
        public void setUrls(Map<String, String> urls) { this.urls = urls; }
        public Map<String, String> getTitles() { return titles; }
        public void setTitles(Map<String, String> titles) { this.titles = titles; }
    }
}
