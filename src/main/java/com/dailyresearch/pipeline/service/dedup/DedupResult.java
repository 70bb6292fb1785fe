package com.dailyresearch.pipeline.service.dedup;

import com.dailyresearch.pipeline.model.ContentItem;

import java.util.List;

public final class DedupResult {
    private final List<ContentItem> survivors;
    private final List<Duplicate> duplicates;

    public DedupResult(List<ContentItem> survivors, List<Duplicate> duplicates) {
        this.survivors = List.copyOf(survivors);
        this.duplicates = List.copyOf(duplicates);
    }

    public List<ContentItem> getSurvivors() { return survivors; }
    public List<Duplicate> getDuplicates() { return duplicates; }

    /** A dropped item and what it collided with: a note path, or an earlier batch label. */
    public static final class Duplicate {
        private final ContentItem item;
        private final String collidedWith;
        private final boolean fromHistory;

        public Duplicate(ContentItem item, String collidedWith, boolean fromHistory) {
            this.item = item;
            this.collidedWith = collidedWith;
            this.fromHistory = fromHistory;
        }

        public ContentItem getItem() { return item; }
        public String getCollidedWith() { return collidedWith; }
        public boolean isFromHistory() { return fromHistory; }
    }
}
