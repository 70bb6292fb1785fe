package com.dailyresearch.pipeline.service;

import com.dailyresearch.pipeline.admin.RunRegistry;
import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.dto.RunDtos;
import com.dailyresearch.pipeline.exception.ConfigValidationException;
import com.dailyresearch.pipeline.exception.FetchFailureException;
import com.dailyresearch.pipeline.exception.PipelineException;
import com.dailyresearch.pipeline.exception.RunInProgressException;
import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.model.DropReason;
import com.dailyresearch.pipeline.model.HistoryIndex;
import com.dailyresearch.pipeline.model.TopicConfig;
import com.dailyresearch.pipeline.service.dedup.CrossDeduplicator;
import com.dailyresearch.pipeline.service.dedup.DedupResult;
import com.dailyresearch.pipeline.service.history.HistoryIndexBuilder;
import com.dailyresearch.pipeline.service.note.DailyNoteWriter;
import com.dailyresearch.pipeline.service.promotion.PromotionTracker;
import com.dailyresearch.pipeline.service.promotion.SweepResult;
import com.dailyresearch.pipeline.service.scoring.Ranking;
import com.dailyresearch.pipeline.service.synthesis.ReadingList;
import com.dailyresearch.pipeline.service.synthesis.Synthesis;
import com.dailyresearch.pipeline.service.synthesis.Synthesizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sequences one pipeline invocation: promotion sweep, history index, topic
 * tracks, cross-topic dedup, reading list, synthesis, note write.
 *
 * <p>The sweep finishes before the index is read, and every track finishes
 * before dedup starts. Only one run may be in flight at a time; a second
 * request fails with {@link RunInProgressException}.
 */
public class RunCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    private final PipelineConfig config;
    private final PromotionTracker promotionTracker;
    private final HistoryIndexBuilder historyIndexBuilder;
    private final TopicOrchestrator orchestrator;
    private final CrossDeduplicator deduplicator;
    private final Synthesizer synthesizer;
    private final DailyNoteWriter noteWriter;
    private final RunRegistry registry;
    private final ObjectMapper mapper;
    private final Path runHistoryDir;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RunCoordinator(PipelineConfig config, PromotionTracker promotionTracker,
                          HistoryIndexBuilder historyIndexBuilder, TopicOrchestrator orchestrator,
                          CrossDeduplicator deduplicator, Synthesizer synthesizer, DailyNoteWriter noteWriter,
                          RunRegistry registry, ObjectMapper mapper, Path runHistoryDir, Clock clock) {
        this.config = config;
        this.promotionTracker = promotionTracker;
        this.historyIndexBuilder = historyIndexBuilder;
        this.orchestrator = orchestrator;
        this.deduplicator = deduplicator;
        this.synthesizer = synthesizer;
        this.noteWriter = noteWriter;
        this.registry = registry;
        this.mapper = mapper;
        this.runHistoryDir = runHistoryDir;
        this.clock = clock;
    }

    /**
     * @param topicSlug required for {@link RunMode#SINGLE_TOPIC}, ignored otherwise
     * @return the completed report; a fatal failure is signalled as an error
     *         after the failed report has been recorded
     */
    public Mono<RunDtos.RunReport> run(RunMode mode, String topicSlug) {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                return Mono.error(new RunInProgressException("A run is already in progress"));
            }
            RunDtos.RunReport report = new RunDtos.RunReport();
            report.setRun_id(UUID.randomUUID().toString());
            report.setMode(mode.getKey());
            report.setStatus("running");
            report.setStarted_at(Instant.now(clock));
            registry.put(report);
            log.info("Run {} started: mode={} topic={}", report.getRun_id(), mode.getKey(), topicSlug);

            return Mono.defer(() -> execute(mode, topicSlug, report))
                    .map(r -> {
                        r.setStatus("completed");
                        return r;
                    })
                    .onErrorResume(e -> {
                        report.setStatus("failed");
                        String stage = e instanceof PipelineException pe ? pe.getStage().getKey() : null;
                        report.setError(new RunDtos.RunError(e.getClass().getSimpleName(), e.getMessage(), stage));
                        log.error("Run {} failed at stage {}: {}", report.getRun_id(), stage, e.toString());
                        return finish(report).then(Mono.error(e));
                    })
                    .flatMap(r -> finish(r).thenReturn(r))
                    .doFinally(signal -> running.set(false));
        });
    }

    private Mono<RunDtos.RunReport> execute(RunMode mode, String topicSlug, RunDtos.RunReport report) {
        List<TopicConfig> topics = selectTopics(mode, topicSlug);
        Mono<Void> sweep = mode.sweeps()
                ? Mono.fromCallable(promotionTracker::sweep)
                        .subscribeOn(Schedulers.boundedElastic())
                        .doOnNext(result -> applySweep(report, result))
                        .then()
                : Mono.empty();
        if (mode == RunMode.PROMOTE_ONLY) {
            return sweep.thenReturn(report);
        }
        return sweep
                .then(Mono.fromCallable(historyIndexBuilder::build).subscribeOn(Schedulers.boundedElastic()))
                .flatMap(history -> {
                    report.setHistory_notes_scanned(history.getNotesScanned());
                    report.setHistory_notes_skipped(history.getNotesSkipped());
                    return orchestrator.runAll(topics, mode != RunMode.SINGLE_TOPIC)
                            .map(results -> assemble(results, history, topics, report));
                })
                .flatMap(readingList -> synthesizer.summarize(readingList)
                        .onErrorResume(e -> Mono.just(Synthesis.failed(e.toString())))
                        .flatMap(synthesis -> {
                            if (synthesis.isDegraded()) report.setSynthesis_error(synthesis.getError());
                            LocalDate today = LocalDate.now(clock);
                            if (mode.writesNote()) {
                                return Mono.fromCallable(() -> noteWriter.write(readingList, synthesis, today))
                                        .subscribeOn(Schedulers.boundedElastic())
                                        .map(path -> {
                                            report.setNote_path(path);
                                            return report;
                                        });
                            }
                            report.setPreview(noteWriter.render(readingList, synthesis, today));
                            return Mono.just(report);
                        }));
    }

    private List<TopicConfig> selectTopics(RunMode mode, String topicSlug) {
        if (mode != RunMode.SINGLE_TOPIC) {
            return config.getTopics();
        }
        return config.topicBySlug(topicSlug)
                .map(List::of)
                .orElseThrow(() -> new ConfigValidationException(List.of("unknown topic '" + topicSlug + "'")));
    }

    /**
     * Strict sequential barrier: dedup in configured topic order, must-follow
     * last, then rank and cap.
     */
    ReadingList assemble(List<TopicResult> results, HistoryIndex history, List<TopicConfig> topics,
                         RunDtos.RunReport report) {
        boolean anyAttempted = results.stream().anyMatch(r -> r.getFetchCalls() > 0 || r.isFailed());
        if (anyAttempted && results.stream().allMatch(TopicResult::isFailed)) {
            throw new FetchFailureException("Every topic and the must-follow track failed to fetch");
        }

        CrossDeduplicator.Session session = deduplicator.session(history);
        List<ContentItem> topicItems = new ArrayList<>();
        List<ContentItem> mustFollowItems = new ArrayList<>();
        List<RunDtos.TopicReport> topicReports = new ArrayList<>();
        Map<String, Integer> droppedTotal = new LinkedHashMap<>();
        for (DropReason reason : DropReason.values()) droppedTotal.put(reason.getKey(), 0);

        for (TopicResult result : results) {
            DedupResult dedup = session.accept(result.getSlug(), result.getItems());
            List<ContentItem> survivors = dedup.getSurvivors();
            if (result.isMustFollow()) {
                mustFollowItems.addAll(survivors);
            } else if (survivors.size() > config.getItemsPerTopic()) {
                topicItems.addAll(survivors.subList(0, config.getItemsPerTopic()));
            } else {
                topicItems.addAll(survivors);
            }

            RunDtos.TopicReport tr = toReport(result, survivors.size(), dedup.getDuplicates().size());
            tr.getDropped().forEach((k, v) -> droppedTotal.merge(k, v, Integer::sum));
            if (result.isMustFollow()) report.setMust_follow(tr);
            else topicReports.add(tr);
        }

        ReadingList list = ReadingList.of(Ranking.rank(topicItems), mustFollowItems, topics, config);
        report.setTopics(topicReports);
        report.setDropped_total(droppedTotal);
        report.setReading_list_count(list.getItems().size());
        report.setMust_follow_count(mustFollowItems.size());
        log.info("Run {}: readingList={} mustFollow={} dropped={}", report.getRun_id(),
                list.getItems().size(), mustFollowItems.size(), droppedTotal);
        return list;
    }

    private static RunDtos.TopicReport toReport(TopicResult result, int kept, int duplicates) {
        RunDtos.TopicReport tr = new RunDtos.TopicReport();
        tr.setSlug(result.getSlug());
        tr.setFetched(result.getFetched());
        tr.setKept(kept);
        tr.getDropped().put(DropReason.SPAM.getKey(), result.getSpamDropped());
        tr.getDropped().put(DropReason.ENGAGEMENT_FLOOR.getKey(), result.getFloorDropped());
        tr.getDropped().put(DropReason.DUPLICATE.getKey(), duplicates);
        if (!result.getSpamReasons().isEmpty()) tr.setSpam_reasons(result.getSpamReasons());
        if (!result.getFetchErrors().isEmpty()) tr.setFetch_errors(result.getFetchErrors());
        tr.setFailed(result.isFailed());
        return tr;
    }

    private static void applySweep(RunDtos.RunReport report, SweepResult result) {
        report.setPromotions(result.getPromotions().size());
        report.setFeedback(result.getFeedback().size());
        if (!result.getConflicts().isEmpty()) report.setRewrite_conflicts(result.getConflicts());
    }

    private Mono<Void> finish(RunDtos.RunReport report) {
        report.setEnded_at(Instant.now(clock));
        registry.put(report);
        return persistReport(report);
    }

    private Mono<Void> persistReport(RunDtos.RunReport report) {
        if (runHistoryDir == null) {
            return Mono.empty();
        }
        return Mono.fromRunnable(() -> {
            try {
                Files.createDirectories(runHistoryDir);
                String ts = ZonedDateTime.now(clock).format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmssXXX"));
                Path out = runHistoryDir.resolve("run_" + report.getMode() + "_" + ts.replace(":", "-") + ".json");
                mapper.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), report);
                log.info("Saved run report to {}", out.toAbsolutePath());
            } catch (Exception e) {
                log.warn("Failed to persist run report: {}", e.toString());
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }
}
