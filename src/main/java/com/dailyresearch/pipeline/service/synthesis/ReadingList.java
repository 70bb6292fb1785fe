package com.dailyresearch.pipeline.service.synthesis;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.model.AccountConfig;
import com.dailyresearch.pipeline.model.Category;
import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.model.TopicConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The final item set handed to synthesis and the note writer: the ranked
 * topic items capped at {@code reading-list-max}, grouped by category then
 * topic, plus the must-follow items grouped by account group (never capped).
 */
public final class ReadingList {
    private final List<ContentItem> items;
    private final Map<Category, Map<String, List<ContentItem>>> byCategory;
    private final Map<String, List<ContentItem>> mustFollow;
    private final Map<String, String> topicNames;

    private ReadingList(List<ContentItem> items, Map<Category, Map<String, List<ContentItem>>> byCategory,
                        Map<String, List<ContentItem>> mustFollow, Map<String, String> topicNames) {
        this.items = items;
        this.byCategory = byCategory;
        this.mustFollow = mustFollow;
        this.topicNames = topicNames;
    }

    /**
     * @param rankedTopicItems deduplicated topic items, already in rank order
     * @param mustFollowItems  deduplicated must-follow items
     */
    public static ReadingList of(List<ContentItem> rankedTopicItems, List<ContentItem> mustFollowItems,
                                 List<TopicConfig> topics, PipelineConfig config) {
        List<ContentItem> capped = rankedTopicItems.size() > config.getReadingListMax()
                ? rankedTopicItems.subList(0, config.getReadingListMax())
                : rankedTopicItems;

        Map<String, String> names = new LinkedHashMap<>();
        for (TopicConfig t : topics) names.put(t.getSlug(), t.getDisplayName());

        Map<Category, Map<String, List<ContentItem>>> grouped = new EnumMap<>(Category.class);
        for (Category c : Category.values()) {
            Map<String, List<ContentItem>> perTopic = new LinkedHashMap<>();
            for (TopicConfig t : topics) perTopic.put(t.getSlug(), new ArrayList<>());
            grouped.put(c, perTopic);
        }
        for (ContentItem item : capped) {
            Category c = item.getCategory() == null ? Category.GENERAL : item.getCategory();
            grouped.get(c).computeIfAbsent(item.getTopicSlug(), k -> new ArrayList<>()).add(item);
        }
        for (Map<String, List<ContentItem>> perTopic : grouped.values()) {
            perTopic.values().removeIf(List::isEmpty);
        }

        Map<String, String> groupOfHandle = new LinkedHashMap<>();
        Map<String, List<ContentItem>> mustFollow = new LinkedHashMap<>();
        for (AccountConfig a : config.getMustFollowAccounts()) {
            groupOfHandle.put(a.getHandle().toLowerCase(Locale.ROOT), a.getGroupLabel());
            mustFollow.putIfAbsent(a.getGroupLabel(), new ArrayList<>());
        }
        for (ContentItem item : mustFollowItems) {
            String author = item.getAuthor() == null ? "" : item.getAuthor().toLowerCase(Locale.ROOT);
            if (author.startsWith("@")) author = author.substring(1);
            mustFollow.computeIfAbsent(groupOfHandle.getOrDefault(author, "Other"), k -> new ArrayList<>()).add(item);
        }
        mustFollow.values().removeIf(List::isEmpty);

        return new ReadingList(List.copyOf(capped), Collections.unmodifiableMap(grouped),
                Collections.unmodifiableMap(mustFollow), Collections.unmodifiableMap(names));
    }

    /** Capped topic items in rank order. */
    public List<ContentItem> getItems() { return items; }

    /** Category → topic slug → items; empty groups omitted. */
    public Map<Category, Map<String, List<ContentItem>>> getByCategory() { return byCategory; }

    /** Group label → items, in configured group order. */
    public Map<String, List<ContentItem>> getMustFollow() { return mustFollow; }

    public String topicName(String slug) {
        return topicNames.getOrDefault(slug, slug);
    }

    public List<String> topicSlugs() {
        return new ArrayList<>(topicNames.keySet());
    }

    public List<ContentItem> itemsOfTopic(String slug) {
        List<ContentItem> out = new ArrayList<>();
        for (ContentItem i : items) {
            if (slug.equals(i.getTopicSlug())) out.add(i);
        }
        return out;
    }

    public boolean isEmpty() {
        return items.isEmpty() && mustFollow.isEmpty();
    }
}
