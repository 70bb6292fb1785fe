package com.dailyresearch.pipeline.admin;

import com.dailyresearch.pipeline.dto.RunDtos;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory view of the runs started since boot; run history on disk keeps the rest. */
@Component
public class RunRegistry {
    private final Map<String, Entry> runs = new ConcurrentHashMap<>();

    private static final class Entry {
        final RunDtos.RunReport report;
        final Instant updatedAt;

        Entry(RunDtos.RunReport report, Instant updatedAt) {
            this.report = report;
            this.updatedAt = updatedAt;
        }
    }

    public void put(RunDtos.RunReport report) {
        if (report != null && report.getRun_id() != null) {
            runs.put(report.getRun_id(), new Entry(report, Instant.now()));
        }
    }

    public RunDtos.RunReport get(String runId) {
        Entry e = runs.get(runId);
        return e == null ? null : e.report;
    }

    public RunDtos.RunReport latestOfMode(String mode) {
        return runs.values().stream()
                .filter(e -> mode == null || mode.equals(e.report.getMode()))
                .max(Comparator.comparing((Entry e) -> e.updatedAt))
                .map(e -> e.report)
                .orElse(null);
    }
}
