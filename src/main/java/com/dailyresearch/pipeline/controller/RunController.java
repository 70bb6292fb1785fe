package com.dailyresearch.pipeline.controller;

import com.dailyresearch.pipeline.admin.RunRegistry;
import com.dailyresearch.pipeline.config.ResearchProperties;
import com.dailyresearch.pipeline.dto.RunDtos;
import com.dailyresearch.pipeline.service.RunCoordinator;
import com.dailyresearch.pipeline.service.RunMode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/runs")
public class RunController {
    private final RunCoordinator coordinator;
    private final RunRegistry registry;
    private final ResearchProperties properties;

    public RunController(RunCoordinator coordinator, RunRegistry registry, ResearchProperties properties) {
        this.coordinator = coordinator;
        this.registry = registry;
        this.properties = properties;
    }

    @PostMapping(value = "/full", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<RunDtos.RunReport>> runFull(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey) {
        return start(adminKey, RunMode.FULL, null);
    }

    @PostMapping(value = "/topic/{slug}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<RunDtos.RunReport>> runTopic(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable("slug") String slug) {
        return start(adminKey, RunMode.SINGLE_TOPIC, slug);
    }

    /** Runs every stage but leaves the corpus untouched; the rendered note comes back in {@code preview}. */
    @PostMapping(value = "/preview", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<RunDtos.RunReport>> runPreview(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey) {
        return start(adminKey, RunMode.PREVIEW, null);
    }

    @PostMapping(value = "/promote", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<RunDtos.RunReport>> runPromote(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey) {
        return start(adminKey, RunMode.PROMOTE_ONLY, null);
    }

    @GetMapping(value = "/latest", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RunDtos.RunReport> latest(@RequestParam(value = "mode", required = false) String mode) {
        RunDtos.RunReport report = registry.latestOfMode(mode);
        return report == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(report);
    }

    @GetMapping(value = "/{runId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RunDtos.RunReport> byId(@PathVariable("runId") String runId) {
        RunDtos.RunReport report = registry.get(runId);
        return report == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(report);
    }

    private Mono<ResponseEntity<RunDtos.RunReport>> start(String adminKey, RunMode mode, String slug) {
        String expected = properties.getAdminKey();
        if (adminKey == null || expected == null || !adminKey.equals(expected)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return coordinator.run(mode, slug).map(ResponseEntity::ok);
    }
}
