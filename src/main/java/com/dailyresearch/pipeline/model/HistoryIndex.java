package com.dailyresearch.pipeline.model;

import java.util.Map;
import java.util.Set;

/**
 * Fingerprints of everything already written to the note corpus, with the note
 * each one was first found in. Built fresh on every run and never persisted:
 * the corpus is the source of truth.
 */
public final class HistoryIndex {
    private final FingerprintSet seen;
    private final int notesScanned;
    private final int notesSkipped;

    public HistoryIndex(FingerprintSet seen, int notesScanned, int notesSkipped) {
        this.seen = seen;
        this.notesScanned = notesScanned;
        this.notesSkipped = notesSkipped;
    }

    public static HistoryIndex empty(double titleSimilarityThreshold) {
        return new HistoryIndex(new FingerprintSet(titleSimilarityThreshold), 0, 0);
    }

    public boolean contains(Fingerprint fp) {
        return seen.matches(fp);
    }

    /** Note path the fingerprint collides with, or null. */
    public String provenanceOf(Fingerprint fp) {
        return seen.originOf(fp);
    }

    public Set<String> urls() { return seen.urls(); }
    public Set<String> titles() { return seen.titles(); }
    public Map<String, String> urlProvenance() { return seen.urlOrigins(); }
    public Map<String, String> titleProvenance() { return seen.titleOrigins(); }
    public int getNotesScanned() { return notesScanned; }
    public int getNotesSkipped() { return notesSkipped; }
    public double getTitleSimilarityThreshold() { return seen.getTitleSimilarityThreshold(); }

    public int size() {
        return seen.urls().size() + seen.titles().size();
    }
}
