package com.dailyresearch.pipeline.service.dedup;

import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.model.FingerprintSet;
import com.dailyresearch.pipeline.model.HistoryIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops items already present in the history index or already accepted
 * earlier in the same run. First occurrence wins, so batches must be fed in
 * the configured topic order with the must-follow track last.
 */
public class CrossDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(CrossDeduplicator.class);

    /** Single-batch convenience: a fresh session fed once. */
    public DedupResult filter(List<ContentItem> items, HistoryIndex history) {
        return session(history).accept("batch", items);
    }

    public Session session(HistoryIndex history) {
        return new Session(history);
    }

    /** Accepted-so-far state for one run. Not thread-safe; feed batches sequentially. */
    public static final class Session {
        private final HistoryIndex history;
        private final FingerprintSet accepted;

        private Session(HistoryIndex history) {
            this.history = history;
            this.accepted = new FingerprintSet(history.getTitleSimilarityThreshold());
        }

        public DedupResult accept(String batchLabel, List<ContentItem> items) {
            List<ContentItem> survivors = new ArrayList<>();
            List<DedupResult.Duplicate> duplicates = new ArrayList<>();
            for (ContentItem item : items) {
                String seenIn = history.provenanceOf(item.getFingerprint());
                if (seenIn != null) {
                    duplicates.add(new DedupResult.Duplicate(item, seenIn, true));
                    continue;
                }
                String acceptedFrom = accepted.originOf(item.getFingerprint());
                if (acceptedFrom != null) {
                    duplicates.add(new DedupResult.Duplicate(item, acceptedFrom, false));
                    continue;
                }
                accepted.add(item.getFingerprint(), batchLabel);
                survivors.add(item);
            }
            if (!duplicates.isEmpty()) {
                log.info("Dedup {}: kept={} duplicates={}", batchLabel, survivors.size(), duplicates.size());
            }
            return new DedupResult(survivors, duplicates);
        }
    }
}
