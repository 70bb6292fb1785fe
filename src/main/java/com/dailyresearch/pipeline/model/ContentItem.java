package com.dailyresearch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * One piece of discovered content travelling through the pipeline.
 *
 * <p>Instances are immutable. Every pipeline stage that decorates an item
 * (spam check, scoring, classification) returns a new copy via one of the
 * {@code with*} methods, so the same input item can be fed through a stage
 * twice and compared.
 *
 * <p>{@code score}, {@code category} and {@code spamFlag} stay null until the
 * corresponding stage has run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ContentItem {
    private final Source source;
    private final String url;
    private final String title;
    private final String author;
    private final String community;
    private final Instant publishedAt;
    private final Map<String, Integer> engagement;
    private final int bodyLength;
    private final String topicSlug;
    private final boolean priorityAccount;
    private final boolean labAccount;
    private final Double score;
    private final Category category;
    private final Boolean spamFlag;
    private final Fingerprint fingerprint;

    private ContentItem(Builder b) {
        this.source = b.source == null ? Source.WEB : b.source;
        this.url = b.url == null ? "" : b.url;
        this.title = b.title == null ? "" : b.title;
        this.author = b.author;
        this.community = b.community;
        this.publishedAt = b.publishedAt;
        this.engagement = Collections.unmodifiableMap(new LinkedHashMap<>(b.engagement));
        this.bodyLength = Math.max(0, b.bodyLength);
        this.topicSlug = b.topicSlug == null ? "" : b.topicSlug;
        this.priorityAccount = b.priorityAccount;
        this.labAccount = b.labAccount;
        this.score = b.score;
        this.category = b.category;
        this.spamFlag = b.spamFlag;
        this.fingerprint = Fingerprint.of(this.url, this.title);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.source = source;
        b.url = url;
        b.title = title;
        b.author = author;
        b.community = community;
        b.publishedAt = publishedAt;
        b.engagement = new LinkedHashMap<>(engagement);
        b.bodyLength = bodyLength;
        b.topicSlug = topicSlug;
        b.priorityAccount = priorityAccount;
        b.labAccount = labAccount;
        b.score = score;
        b.category = category;
        b.spamFlag = spamFlag;
        return b;
    }

    public ContentItem withScore(double newScore) {
        return toBuilder().score(newScore).build();
    }

    public ContentItem withCategory(Category newCategory) {
        return toBuilder().category(newCategory).build();
    }

    public ContentItem withSpamFlag(boolean flag) {
        return toBuilder().spamFlag(flag).build();
    }

    public Source getSource() { return source; }
    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getAuthor() { return author; }
    public String getCommunity() { return community; }
    public Instant getPublishedAt() { return publishedAt; }
    public Map<String, Integer> getEngagement() { return engagement; }
    public int getBodyLength() { return bodyLength; }
    public String getTopicSlug() { return topicSlug; }
    public boolean isPriorityAccount() { return priorityAccount; }
    public boolean isLabAccount() { return labAccount; }
    public Double getScore() { return score; }
    public Category getCategory() { return category; }
    public Boolean getSpamFlag() { return spamFlag; }

    @JsonIgnore
    public Fingerprint getFingerprint() { return fingerprint; }

    /** Priority and lab accounts bypass spam checks and the engagement floor. */
    @JsonIgnore
    public boolean isTrustedAccount() {
        return priorityAccount || labAccount;
    }

    /** Value of a metric, or empty when the platform did not report it. */
    public OptionalInt metric(String name) {
        if (name == null) return OptionalInt.empty();
        Integer v = engagement.get(name);
        return v == null ? OptionalInt.empty() : OptionalInt.of(v);
    }

    @JsonIgnore
    public boolean isEngagementUnknown() {
        return engagement.isEmpty();
    }

    @Override
    public String toString() {
        return "ContentItem{" + source.getSlug() + " " + url + " '" + title + "'" +
                (score != null ? " score=" + score : "") +
                (category != null ? " " + category.getLabel() : "") + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentItem)) return false;
        ContentItem that = (ContentItem) o;
        return bodyLength == that.bodyLength
                && priorityAccount == that.priorityAccount
                && labAccount == that.labAccount
                && source == that.source
                && url.equals(that.url)
                && title.equals(that.title)
                && Objects.equals(author, that.author)
                && Objects.equals(community, that.community)
                && Objects.equals(publishedAt, that.publishedAt)
                && engagement.equals(that.engagement)
                && topicSlug.equals(that.topicSlug)
                && Objects.equals(score, that.score)
                && category == that.category
                && Objects.equals(spamFlag, that.spamFlag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, url, title, author, publishedAt, topicSlug, score, category);
    }

    public static final class Builder {
        private Source source;
        private String url;
        private String title;
        private String author;
        private String community;
        private Instant publishedAt;
        private Map<String, Integer> engagement = new LinkedHashMap<>();
        private int bodyLength;
        private String topicSlug;
        private boolean priorityAccount;
        private boolean labAccount;
        private Double score;
        private Category category;
        private Boolean spamFlag;

        private Builder() {}

        public Builder source(Source source) { this.source = source; return this; }
        public Builder url(String url) { this.url = url; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder author(String author) { this.author = author; return this; }
        public Builder community(String community) { this.community = community; return this; }
        public Builder publishedAt(Instant publishedAt) { this.publishedAt = publishedAt; return this; }
        public Builder bodyLength(int bodyLength) { this.bodyLength = bodyLength; return this; }
        public Builder topicSlug(String topicSlug) { this.topicSlug = topicSlug; return this; }
        public Builder priorityAccount(boolean priorityAccount) { this.priorityAccount = priorityAccount; return this; }
        public Builder labAccount(boolean labAccount) { this.labAccount = labAccount; return this; }
        public Builder score(Double score) { this.score = score; return this; }
        public Builder category(Category category) { this.category = category; return this; }
        public Builder spamFlag(Boolean spamFlag) { this.spamFlag = spamFlag; return this; }

        public Builder engagement(Map<String, Integer> engagement) {
            this.engagement = new LinkedHashMap<>();
            if (engagement != null) {
                engagement.forEach(this::metric);
            }
            return this;
        }

        public Builder metric(String name, Integer value) {
            if (name != null && value != null) {
                this.engagement.put(name, value);
            }
            return this;
        }

        public ContentItem build() {
            return new ContentItem(this);
        }
    }
}
