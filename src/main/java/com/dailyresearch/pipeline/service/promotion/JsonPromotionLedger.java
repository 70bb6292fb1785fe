package com.dailyresearch.pipeline.service.promotion;

import com.dailyresearch.pipeline.exception.PipelineException;
import com.dailyresearch.pipeline.exception.PipelineStage;
import com.dailyresearch.pipeline.model.PromotionRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/** Promotion ledger kept as a JSON array on disk. */
public class JsonPromotionLedger implements PromotionLedger {
    private final Path file;
    private final ObjectMapper mapper;

    public JsonPromotionLedger(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized boolean contains(String fingerprintKey) {
        if (fingerprintKey == null || fingerprintKey.isEmpty()) return false;
        for (PromotionRecord r : load()) {
            if (fingerprintKey.equals(r.getFingerprint())) return true;
        }
        return false;
    }

    @Override
    public synchronized void append(PromotionRecord record) {
        List<PromotionRecord> records = load();
        records.add(record);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), records);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PipelineException(PipelineStage.PROMOTION, "Promotion ledger " + file + " could not be written", e);
        }
    }

    @Override
    public synchronized List<PromotionRecord> all() {
        return load();
    }

    private List<PromotionRecord> load() {
        if (!Files.exists(file)) return new ArrayList<>();
        try {
            List<PromotionRecord> records = mapper.readValue(file.toFile(), new TypeReference<List<PromotionRecord>>() {});
            return records == null ? new ArrayList<>() : new ArrayList<>(records);
        } catch (IOException e) {
            throw new PipelineException(PipelineStage.PROMOTION, "Promotion ledger " + file + " is unreadable", e);
        }
    }
}
