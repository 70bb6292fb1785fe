package com.dailyresearch.pipeline.controller;

import com.dailyresearch.pipeline.dto.RunDtos;
import com.dailyresearch.pipeline.model.HistoryIndex;
import com.dailyresearch.pipeline.service.history.HistoryIndexBuilder;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.TreeMap;

/** Debug view of what the next run would treat as already seen. */
@RestController
public class DedupController {
    private final HistoryIndexBuilder historyIndexBuilder;

    public DedupController(HistoryIndexBuilder historyIndexBuilder) {
        this.historyIndexBuilder = historyIndexBuilder;
    }

    @GetMapping(value = "/dedup", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<RunDtos.DedupDump> dump() {
        return Mono.fromCallable(historyIndexBuilder::build)
                .subscribeOn(Schedulers.boundedElastic())
                .map(DedupController::toDump);
    }

    static RunDtos.DedupDump toDump(HistoryIndex index) {
        RunDtos.DedupDump dump = new RunDtos.DedupDump();
        dump.setNotes_scanned(index.getNotesScanned());
        dump.setNotes_skipped(index.getNotesSkipped());
        dump.setUrls(new TreeMap<>(index.urlProvenance()));
        dump.setTitles(new TreeMap<>(index.titleProvenance()));
        return dump;
    }
}
