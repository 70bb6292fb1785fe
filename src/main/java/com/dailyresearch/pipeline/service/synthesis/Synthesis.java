package com.dailyresearch.pipeline.service.synthesis;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** Prose produced for a reading list. {@code error} is set when synthesis degraded. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Synthesis {
    private final String briefing;
    private final String labPulseSummary;
    private final List<TopicSummary> topics;
    private final String error;

    public Synthesis(String briefing, String labPulseSummary, List<TopicSummary> topics, String error) {
        this.briefing = briefing == null ? "" : briefing;
        this.labPulseSummary = labPulseSummary == null ? "" : labPulseSummary;
        this.topics = topics == null ? List.of() : List.copyOf(topics);
        this.error = error;
    }

    public static Synthesis empty() {
        return new Synthesis("", "", List.of(), null);
    }

    public static Synthesis failed(String error) {
        return new Synthesis("Synthesis failed: " + error, "", List.of(), error);
    }

    public String getBriefing() { return briefing; }
    public String getLabPulseSummary() { return labPulseSummary; }
    public List<TopicSummary> getTopics() { return topics; }
    public String getError() { return error; }

    public boolean isDegraded() {
        return error != null;
    }

    public TopicSummary topic(String slug) {
        for (TopicSummary t : topics) {
            if (slug.equals(t.getSlug())) return t;
        }
        return null;
    }

    public static final class TopicSummary {
        private final String slug;
        private final String headline;
        private final List<String> keyPoints;

        public TopicSummary(String slug, String headline, List<String> keyPoints) {
            this.slug = slug;
            this.headline = headline == null ? "" : headline;
            this.keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        }

        public String getSlug() { return slug; }
        public String getHeadline() { return headline; }
        public List<String> getKeyPoints() { return keyPoints; }
    }
}
