package com.dailyresearch.pipeline.service.history;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.corpus.CorpusStore;
import com.dailyresearch.pipeline.corpus.NoteFormat;
import com.dailyresearch.pipeline.corpus.NoteHandle;
import com.dailyresearch.pipeline.corpus.NoteReference;
import com.dailyresearch.pipeline.exception.CorpusUnavailableException;
import com.dailyresearch.pipeline.exception.PipelineStage;
import com.dailyresearch.pipeline.model.Fingerprint;
import com.dailyresearch.pipeline.model.FingerprintSet;
import com.dailyresearch.pipeline.model.HistoryIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scans the configured corpus folders and fingerprints every link, bare URL and
 * heading found. Read-only.
 *
 * <p>Notes are visited in path order and a fingerprint keeps the first note it
 * was seen in, so an unchanged corpus always yields the same index.
 */
public class HistoryIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(HistoryIndexBuilder.class);

    private final CorpusStore corpus;
    private final NoteFormat format;
    private final PipelineConfig config;

    public HistoryIndexBuilder(CorpusStore corpus, NoteFormat format, PipelineConfig config) {
        this.corpus = corpus;
        this.format = format;
        this.config = config;
    }

    /**
     * @throws CorpusUnavailableException when the corpus cannot be listed; never
     *         degrades to an empty index
     */
    public HistoryIndex build() {
        if (!corpus.isAvailable()) {
            throw new CorpusUnavailableException("Corpus root is not reachable");
        }
        Set<NoteHandle> notes = new TreeSet<>();
        for (String folder : config.getIndexFolders()) {
            notes.addAll(corpus.listNotes(folder));
        }

        FingerprintSet seen = new FingerprintSet(config.getTitleSimilarityThreshold());
        int scanned = 0;
        int skipped = 0;
        for (NoteHandle note : notes) {
            try {
                String text = corpus.read(note);
                List<NoteReference> refs = format.extractReferences(text);
                for (NoteReference ref : refs) {
                    Fingerprint fp = Fingerprint.of(ref.getUrl(), ref.getTitle());
                    if (fp.hasUrl() || fp.hasTitle()) {
                        seen.add(fp, note.getPath());
                    }
                }
                scanned++;
            } catch (CorpusUnavailableException e) {
                throw e;
            } catch (Exception e) {
                skipped++;
                log.warn("Skipping unreadable note {}: {}", note.getPath(), e.toString());
            }
        }
        if (scanned == 0 && skipped > 0) {
            throw new CorpusUnavailableException(PipelineStage.HISTORY_INDEX,
                    "No note in the corpus could be read (" + skipped + " failed)", null);
        }
        log.info("History index built: notes={} skipped={} urls={} titles={}",
                scanned, skipped, seen.urls().size(), seen.titles().size());
        return new HistoryIndex(seen, scanned, skipped);
    }
}
