package com.dailyresearch.pipeline.controller;

import com.dailyresearch.pipeline.corpus.CorpusStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
public class HealthController {
    private final CorpusStore corpus;

    public HealthController(CorpusStore corpus) { this.corpus = corpus; }

    @GetMapping("/healthz")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(corpus::isAvailable)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ok -> ok
                        ? ResponseEntity.ok(Map.<String, Object>of("ok", Boolean.TRUE))
                        : ResponseEntity.status(503).body(Map.<String, Object>of("ok", Boolean.FALSE, "reason", "corpus unavailable")))
                .onErrorReturn(ResponseEntity.status(500).body(Map.<String, Object>of("ok", Boolean.FALSE)));
    }
}
