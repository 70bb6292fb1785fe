package com.dailyresearch.pipeline.service.promotion;

import com.dailyresearch.pipeline.exception.PipelineException;
import com.dailyresearch.pipeline.exception.PipelineStage;
import com.dailyresearch.pipeline.model.FeedbackRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Feedback log as one JSON document: {@code good} and {@code bad} lists plus
 * lifetime stats. Each append rewrites the file through a temp file and an
 * atomic move.
 */
public class JsonFeedbackLog implements FeedbackLog {
    private static final Logger log = LoggerFactory.getLogger(JsonFeedbackLog.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFeedbackLog(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized void append(FeedbackRecord record) {
        Document doc = load();
        if (FeedbackRecord.BAD.equals(record.getTag())) {
            doc.bad.add(record);
            doc.stats.totalBad++;
        } else {
            doc.good.add(record);
            doc.stats.totalGood++;
        }
        doc.stats.lastProcessed = record.getNotedAt();
        save(doc);
    }

    @Override
    public synchronized List<FeedbackRecord> all() {
        Document doc = load();
        List<FeedbackRecord> out = new ArrayList<>(doc.good);
        out.addAll(doc.bad);
        return out;
    }

    public synchronized Stats stats() {
        return load().stats;
    }

    private Document load() {
        if (!Files.exists(file)) return new Document();
        try {
            Document doc = mapper.readValue(file.toFile(), Document.class);
            return doc == null ? new Document() : doc;
        } catch (IOException e) {
            throw new PipelineException(PipelineStage.PROMOTION, "Feedback log " + file + " is unreadable", e);
        }
    }

    private void save(Document doc) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), doc);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("Failed to write feedback log {}: {}", file, e.toString());
            throw new PipelineException(PipelineStage.PROMOTION, "Feedback log " + file + " could not be written", e);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Document {
        public List<FeedbackRecord> good = new ArrayList<>();
        public List<FeedbackRecord> bad = new ArrayList<>();
        public Stats stats = new Stats();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Stats {
        public int totalGood;
        public int totalBad;
        public Instant lastProcessed;
    }
}
