package com.dailyresearch.pipeline.service.promotion;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.corpus.CorpusStore;
import com.dailyresearch.pipeline.corpus.NoteHandle;
import com.dailyresearch.pipeline.exception.PipelineException;
import com.dailyresearch.pipeline.exception.PipelineStage;
import com.dailyresearch.pipeline.util.TitleUtils;
import com.dailyresearch.pipeline.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Creates the standalone library note for a promoted item, or finds the one
 * that already exists for the same URL.
 */
public class LibraryNoteWriter {
    private static final Logger log = LoggerFactory.getLogger(LibraryNoteWriter.class);
    private static final Pattern URL_FIELD = Pattern.compile("(?m)^url:\\s*(\\S+)\\s*$");
    private static final int MAX_SUFFIX = 1000;

    private final CorpusStore corpus;
    private final PipelineConfig config;
    private final Clock clock;

    public LibraryNoteWriter(CorpusStore corpus, PipelineConfig config, Clock clock) {
        this.corpus = corpus;
        this.config = config;
        this.clock = clock;
    }

    /** Item being promoted, as parsed from the tagged line. */
    public static final class Entry {
        final String title;
        final String url;
        final String summary;
        final String topicSlug;
        final String dateFound;

        public Entry(String title, String url, String summary, String topicSlug, String dateFound) {
            this.title = title;
            this.url = url;
            this.summary = summary == null ? "" : summary;
            this.topicSlug = topicSlug;
            this.dateFound = dateFound == null ? "" : dateFound;
        }
    }

    /**
     * @return corpus path of the library note for the entry
     * @throws PipelineException when no note could be created
     */
    public String ensure(Entry entry) {
        Optional<String> existing = findByUrl(entry.url);
        if (existing.isPresent()) {
            log.info("Library note already exists for {}: {}", entry.url, existing.get());
            return existing.get();
        }
        String base = config.getLibraryFolder() + "/" + TitleUtils.slugify(entry.title);
        String content = render(entry);
        for (int i = 1; i <= MAX_SUFFIX; i++) {
            String path = i == 1 ? base + ".md" : base + "-" + i + ".md";
            if (corpus.exists(path)) continue;
            if (corpus.create(path, content)) {
                log.info("Created library note {}", path);
                return path;
            }
        }
        throw new PipelineException(PipelineStage.PROMOTION, "Could not create a library note for " + entry.url);
    }

    Optional<String> findByUrl(String url) {
        String wanted = UrlUtils.normalize(url);
        if (wanted.isEmpty()) return Optional.empty();
        for (NoteHandle note : corpus.listNotes(config.getLibraryFolder())) {
            try {
                Matcher m = URL_FIELD.matcher(corpus.read(note));
                if (m.find() && UrlUtils.normalize(m.group(1)).equals(wanted)) {
                    return Optional.of(note.getPath());
                }
            } catch (IOException e) {
                log.warn("Skipping unreadable library note {}: {}", note.getPath(), e.toString());
            }
        }
        return Optional.empty();
    }

    String render(Entry entry) {
        String today = LocalDate.now(clock).toString();
        return String.join("\n",
                "---",
                "type: research-note",
                "url: " + entry.url,
                "date_found: " + entry.dateFound,
                "date_saved: " + today,
                "tags: [" + entry.topicSlug + "]",
                "status: unread",
                "---",
                "",
                "# " + entry.title,
                "",
                "> **Link**: [" + entry.title + "](" + entry.url + ")",
                "> **Found**: " + entry.dateFound,
                "",
                "## Summary",
                "",
                entry.summary,
                "",
                "## My Notes",
                "",
                "");
    }
}
