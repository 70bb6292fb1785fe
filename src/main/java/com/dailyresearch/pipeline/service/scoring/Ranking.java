package com.dailyresearch.pipeline.service.scoring;

import com.dailyresearch.pipeline.model.ContentItem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Final ordering of scored items. */
public final class Ranking {

    /**
     * Score descending, then newer {@code publishedAt} first (a known date beats
     * an unknown one). Items equal on both keep their input order, since
     * {@link List#sort} is stable.
     */
    public static final Comparator<ContentItem> BY_SCORE_THEN_RECENCY = (a, b) -> {
        int c = Double.compare(scoreOf(b), scoreOf(a));
        if (c != 0) return c;
        Instant pa = a.getPublishedAt();
        Instant pb = b.getPublishedAt();
        if (pa == null && pb == null) return 0;
        if (pa == null) return 1;
        if (pb == null) return -1;
        return pb.compareTo(pa);
    };

    private Ranking() {}

    public static List<ContentItem> rank(List<ContentItem> items) {
        List<ContentItem> out = new ArrayList<>(items);
        out.sort(BY_SCORE_THEN_RECENCY);
        return out;
    }

    private static double scoreOf(ContentItem item) {
        return item.getScore() == null ? 0.0 : item.getScore();
    }
}
