package com.dailyresearch.pipeline.service.promotion;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.corpus.CorpusStore;
import com.dailyresearch.pipeline.corpus.NoteFormat;
import com.dailyresearch.pipeline.corpus.NoteHandle;
import com.dailyresearch.pipeline.corpus.TaggedLine;
import com.dailyresearch.pipeline.exception.RewriteConflictException;
import com.dailyresearch.pipeline.model.FeedbackRecord;
import com.dailyresearch.pipeline.model.Fingerprint;
import com.dailyresearch.pipeline.model.PromotionRecord;
import com.dailyresearch.pipeline.model.TopicConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves user tags in prior daily notes:
 * {@code #keep → #kept} (promotion), {@code #good → #good-noted} and
 * {@code #bad → #bad-noted} (feedback).
 *
 * <p>Each tag goes through three steps: compute the record, rewrite the line,
 * finalize the record. A rewrite that fails discards the record; a finalize
 * that fails puts the original line back. Either way the tag stays pending and
 * the next sweep retries it.
 */
public class PromotionTracker {
    private static final Logger log = LoggerFactory.getLogger(PromotionTracker.class);
    static final String GENERAL_TOPIC = "general";

    private final CorpusStore corpus;
    private final NoteFormat format;
    private final PipelineConfig config;
    private final LibraryNoteWriter libraryWriter;
    private final PromotionLedger ledger;
    private final FeedbackLog feedbackLog;
    private final Clock clock;

    public PromotionTracker(CorpusStore corpus, NoteFormat format, PipelineConfig config,
                            LibraryNoteWriter libraryWriter, PromotionLedger ledger,
                            FeedbackLog feedbackLog, Clock clock) {
        this.corpus = corpus;
        this.format = format;
        this.config = config;
        this.libraryWriter = libraryWriter;
        this.ledger = ledger;
        this.feedbackLog = feedbackLog;
        this.clock = clock;
    }

    public SweepResult sweep() {
        List<PromotionRecord> promotions = new ArrayList<>();
        List<FeedbackRecord> feedback = new ArrayList<>();
        List<String> conflicts = new ArrayList<>();
        int alreadyPromoted = 0;
        List<String> pendingTags = List.of(config.getKeepTag(), config.getGoodTag(), config.getBadTag());

        List<NoteHandle> notes = corpus.listNotes(config.getDailiesFolder());
        for (NoteHandle note : notes) {
            String text;
            try {
                text = corpus.read(note);
            } catch (IOException e) {
                log.warn("Skipping unreadable note {}: {}", note.getPath(), e.toString());
                continue;
            }
            Map<Integer, String> current = new HashMap<>();
            for (TaggedLine tagged : format.parseTaggedLines(text, pendingTags)) {
                String line = current.getOrDefault(tagged.getLineNumber(), tagged.getRawLine());
                try {
                    if (tagged.getTag().equals(config.getKeepTag())) {
                        if (!tagged.hasLink()) {
                            log.debug("Ignoring #{} without a link at {}:{}", tagged.getTag(), note.getPath(), tagged.getLineNumber());
                            continue;
                        }
                        Transition<PromotionRecord> t = promote(note, tagged, line);
                        if (t.record == null) alreadyPromoted++;
                        else promotions.add(t.record);
                        current.put(tagged.getLineNumber(), t.newLine);
                    } else {
                        Transition<FeedbackRecord> t = noteFeedback(note, tagged, line);
                        feedback.add(t.record);
                        current.put(tagged.getLineNumber(), t.newLine);
                    }
                } catch (RewriteConflictException e) {
                    log.warn("Discarded #{} at {}:{}: {}", tagged.getTag(), e.getNotePath(), e.getLineNumber(), e.getMessage());
                    conflicts.add(e.getNotePath() + ":" + e.getLineNumber() + " #" + tagged.getTag());
                }
            }
        }
        log.info("Promotion sweep: notes={} promoted={} alreadyPromoted={} feedback={} conflicts={}",
                notes.size(), promotions.size(), alreadyPromoted, feedback.size(), conflicts.size());
        return new SweepResult(promotions, feedback, conflicts, alreadyPromoted, notes.size());
    }

    private Transition<PromotionRecord> promote(NoteHandle note, TaggedLine tagged, String line) {
        String key = Fingerprint.of(tagged.getUrl(), tagged.getTitle()).key();
        String newLine = format.replaceTag(line, config.getKeepTag(), config.getKeptTag());
        if (ledger.contains(key)) {
            commit(note, tagged.getLineNumber(), line, newLine, () -> { });
            return new Transition<>(null, newLine);
        }

        String topic = topicOf(tagged);
        String libraryPath;
        try {
            libraryPath = libraryWriter.ensure(new LibraryNoteWriter.Entry(tagged.getTitle(), tagged.getUrl(),
                    tagged.getSummary(), topic, note.dateInPath()));
        } catch (RuntimeException e) {
            throw new RewriteConflictException(note.getPath(), tagged.getLineNumber(),
                    "library note could not be prepared: " + e.getMessage(), e);
        }
        PromotionRecord record = new PromotionRecord(key, topic, Instant.now(clock));
        record.setTitle(tagged.getTitle());
        record.setUrl(tagged.getUrl());
        record.setLibraryPath(libraryPath);
        record.setSourceNote(note.getPath());

        commit(note, tagged.getLineNumber(), line, newLine, () -> ledger.append(record));
        return new Transition<>(record, newLine);
    }

    private Transition<FeedbackRecord> noteFeedback(NoteHandle note, TaggedLine tagged, String line) {
        boolean good = tagged.getTag().equals(config.getGoodTag());
        String resolved = (good ? config.getGoodTag() : config.getBadTag()) + config.getProcessedSuffix();
        String newLine = format.replaceTag(line, tagged.getTag(), resolved);
        String title = tagged.hasLink() ? tagged.getTitle() : plainText(line);
        FeedbackRecord record = new FeedbackRecord(title, tagged.getUrl(), good ? FeedbackRecord.GOOD : FeedbackRecord.BAD,
                Instant.now(clock), note.dateInPath(), note.getPath());

        commit(note, tagged.getLineNumber(), line, newLine, () -> feedbackLog.append(record));
        return new Transition<>(record, newLine);
    }

    /**
     * Rewrites the line, then runs {@code finalizeRecord}. If finalizing fails the
     * original line is written back.
     *
     * @throws RewriteConflictException when either step fails
     */
    private void commit(NoteHandle note, int lineNumber, String expected, String replacement, Runnable finalizeRecord) {
        if (expected.equals(replacement)) {
            throw new RewriteConflictException(note.getPath(), lineNumber, "tag not found in line");
        }
        boolean written;
        try {
            written = corpus.rewriteLine(note, lineNumber, expected, replacement);
        } catch (RuntimeException e) {
            throw new RewriteConflictException(note.getPath(), lineNumber, "rewrite failed: " + e, e);
        }
        if (!written) {
            throw new RewriteConflictException(note.getPath(), lineNumber, "line changed or could not be written");
        }
        try {
            finalizeRecord.run();
        } catch (RuntimeException e) {
            boolean reverted = corpus.rewriteLine(note, lineNumber, replacement, expected);
            if (!reverted) {
                log.error("Could not revert {}:{} after a failed finalize; line now reads '{}'",
                        note.getPath(), lineNumber, replacement);
            }
            throw new RewriteConflictException(note.getPath(), lineNumber, "record could not be finalized: " + e.getMessage(), e);
        }
    }

    /** First hashtag on the line naming a configured topic, else "general". */
    String topicOf(TaggedLine tagged) {
        for (String tag : tagged.getHashtags()) {
            for (TopicConfig t : config.getTopics()) {
                if (t.getSlug().equalsIgnoreCase(tag)) return t.getSlug();
            }
        }
        return GENERAL_TOPIC;
    }

    private static String plainText(String line) {
        return line.replaceAll("(?<![\\w/#-])#[A-Za-z][\\w-]*", "")
                .replaceFirst("^\\s*[-*]\\s*(\\[[ xX]\\]\\s*)?", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static final class Transition<R> {
        final R record;
        final String newLine;

        Transition(R record, String newLine) {
            this.record = record;
            this.newLine = newLine;
        }
    }
}
