package com.dailyresearch.pipeline.service;

import com.dailyresearch.pipeline.admin.RunRegistry;
import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.corpus.InMemoryCorpusStore;
import com.dailyresearch.pipeline.corpus.MarkdownNoteFormat;
import com.dailyresearch.pipeline.dto.RunDtos;
import com.dailyresearch.pipeline.exception.ConfigValidationException;
import com.dailyresearch.pipeline.exception.FetchFailureException;
import com.dailyresearch.pipeline.exception.RunInProgressException;
import com.dailyresearch.pipeline.model.AccountConfig;
import com.dailyresearch.pipeline.model.Source;
import com.dailyresearch.pipeline.model.TopicConfig;
import com.dailyresearch.pipeline.service.dedup.CrossDeduplicator;
import com.dailyresearch.pipeline.service.filter.SpamFilter;
import com.dailyresearch.pipeline.service.history.HistoryIndexBuilder;
import com.dailyresearch.pipeline.service.note.DailyNoteWriter;
import com.dailyresearch.pipeline.service.promotion.JsonFeedbackLog;
import com.dailyresearch.pipeline.service.promotion.JsonPromotionLedger;
import com.dailyresearch.pipeline.service.promotion.LibraryNoteWriter;
import com.dailyresearch.pipeline.service.promotion.PromotionTracker;
import com.dailyresearch.pipeline.service.scoring.Classifier;
import com.dailyresearch.pipeline.service.scoring.QualityScorer;
import com.dailyresearch.pipeline.service.synthesis.Synthesis;
import com.dailyresearch.pipeline.service.synthesis.Synthesizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.dailyresearch.pipeline.service.StubFetcher.raw;
import static org.junit.jupiter.api.Assertions.*;

public class RunCoordinatorTest {
    static final String OLD_NOTE = "Research/Dailies/2025/03/2025-03-01.md";
    static final String TODAY_NOTE = "Research/Dailies/2025/03/2025-03-10.md";

    @TempDir
    Path dir;

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-10T12:00:00Z"), ZoneOffset.UTC);
    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final PipelineConfig config = PipelineConfig.builder()
            .topic(new TopicConfig("agents", "Agents", 1.2, List.of("AI agent")))
            .topic(new TopicConfig("rag", "RAG", 0.9, List.of("RAG pipeline")))
            .mustFollow(new AccountConfig("karpathy", "Andrej Karpathy", "Researchers", true))
            .build();

    private InMemoryCorpusStore corpus;
    private RunRegistry registry;
    private StubFetcher reddit;
    private StubFetcher x;

    @BeforeEach
    public void setUp() {
        corpus = new InMemoryCorpusStore().put(OLD_NOTE, String.join("\n",
                "# Daily Research 2025-03-01",
                "- [ ] [Old news story](https://example.com/old) — r/ai #agents",
                "- [ ] [Context windows keep growing](https://example.com/ctx) — r/ai #models #keep",
                ""));
        registry = new RunRegistry();
        reddit = new StubFetcher(Source.REDDIT)
                .answer("AI agent",
                        raw(Source.REDDIT, "https://example.com/shared", "Shared agent RAG writeup", "u1", 300),
                        raw(Source.REDDIT, "https://example.com/old", "Fresh take on yesterday", "u2", 80),
                        raw(Source.REDDIT, "https://example.com/memory", "Agent memory patterns explained", "u3", 120))
                .answer("RAG pipeline",
                        raw(Source.REDDIT, "https://example.com/shared", "Retrieval stack teardown notes", "u4", 90),
                        raw(Source.REDDIT, "https://example.com/hybrid", "Hybrid retrieval benchmarks compared", "u5", 60));
        x = new StubFetcher(Source.X)
                .answer("from:@karpathy",
                        raw(Source.X, "https://x.com/karpathy/status/1", "Tokenizers are weird again", "karpathy", 3));
    }

    private RunCoordinator coordinator(Synthesizer synthesizer, StubFetcher... fetchers) {
        QualityScorer scorer = new QualityScorer(config, clock);
        TopicOrchestrator orchestrator = new TopicOrchestrator(config, List.of(fetchers),
                new SpamFilter(config), scorer, new Classifier(scorer));
        PromotionTracker tracker = new PromotionTracker(corpus, new MarkdownNoteFormat(), config,
                new LibraryNoteWriter(corpus, config, clock),
                new JsonPromotionLedger(dir.resolve("promotions.json"), mapper),
                new JsonFeedbackLog(dir.resolve("feedback.json"), mapper), clock);
        return new RunCoordinator(config, tracker, new HistoryIndexBuilder(corpus, new MarkdownNoteFormat(), config),
                orchestrator, new CrossDeduplicator(), synthesizer, new DailyNoteWriter(corpus, config),
                registry, mapper, dir.resolve("runs"), clock);
    }

    private List<String> linesWith(String path, String url) {
        return Arrays.stream(corpus.text(path).split("\n"))
                .filter(l -> l.contains("(" + url + ")"))
                .collect(Collectors.toList());
    }

    @Test
    public void fullRunDedupsAcrossTopicsAndHistoryAndWritesNote() throws Exception {
        RunDtos.RunReport report = coordinator(Synthesizer.none(), reddit, x).run(RunMode.FULL, null).block();

        assertNotNull(report);
        assertEquals("completed", report.getStatus());
        assertEquals(TODAY_NOTE, report.getNote_path());
        assertEquals(1, report.getPromotions());

        RunDtos.TopicReport agents = report.getTopics().get(0);
        RunDtos.TopicReport rag = report.getTopics().get(1);
        assertEquals("agents", agents.getSlug());
        assertEquals(2, agents.getKept());
        assertEquals(1, agents.getDropped().get("duplicate"));
        assertEquals("rag", rag.getSlug());
        assertEquals(1, rag.getKept());
        assertEquals(1, rag.getDropped().get("duplicate"));
        assertEquals(2, report.getDropped_total().get("duplicate"));
        assertEquals(3, report.getReading_list_count());
        assertEquals(1, report.getMust_follow_count());

        List<String> shared = linesWith(TODAY_NOTE, "https://example.com/shared");
        assertFalse(shared.isEmpty());
        for (String line : shared) {
            assertFalse(line.contains("#rag"), line);
        }
        assertTrue(shared.stream().anyMatch(l -> l.startsWith("- [ ] ") && l.contains("#agents")));
        assertTrue(linesWith(TODAY_NOTE, "https://example.com/old").isEmpty());
        assertFalse(linesWith(TODAY_NOTE, "https://x.com/karpathy/status/1").isEmpty());

        try (Stream<Path> saved = Files.list(dir.resolve("runs"))) {
            assertEquals(1, saved.count());
        }
        assertSame(report, registry.latestOfMode("full"));
    }

    @Test
    public void previewIsRepeatableAndWritesNothing() {
        RunCoordinator coordinator = coordinator(Synthesizer.none(), reddit, x);
        Set<String> before = Set.copyOf(corpus.paths());
        String original = corpus.text(OLD_NOTE);

        RunDtos.RunReport first = coordinator.run(RunMode.PREVIEW, null).block();
        RunDtos.RunReport second = coordinator.run(RunMode.PREVIEW, null).block();

        assertNotNull(first);
        assertNotNull(second);
        assertNotNull(first.getPreview());
        assertEquals(first.getPreview(), second.getPreview());
        assertNull(first.getNote_path());
        assertEquals(0, first.getPromotions());
        assertEquals(before, Set.copyOf(corpus.paths()));
        assertEquals(original, corpus.text(OLD_NOTE));
    }

    @Test
    public void everyTrackFailingFailsTheRun() {
        reddit.failEverything();
        x.failEverything();
        RunCoordinator coordinator = coordinator(Synthesizer.none(), reddit, x);

        assertThrows(FetchFailureException.class, () -> coordinator.run(RunMode.FULL, null).block());

        RunDtos.RunReport failed = registry.latestOfMode("full");
        assertNotNull(failed);
        assertEquals("failed", failed.getStatus());
        assertEquals("FetchFailureException", failed.getError().getException());
        assertFalse(corpus.paths().contains(TODAY_NOTE));
    }

    @Test
    public void singleTopicRunSkipsOtherTopicsAndMustFollow() {
        RunDtos.RunReport report = coordinator(Synthesizer.none(), reddit, x).run(RunMode.SINGLE_TOPIC, "rag").block();

        assertNotNull(report);
        assertEquals(1, report.getTopics().size());
        assertEquals("rag", report.getTopics().get(0).getSlug());
        assertEquals(2, report.getTopics().get(0).getKept());
        assertNull(report.getMust_follow());
        assertTrue(x.getQueries().stream().noneMatch(q -> q.startsWith("from:")));
    }

    @Test
    public void unknownTopicIsRejected() {
        RunCoordinator coordinator = coordinator(Synthesizer.none(), reddit, x);

        assertThrows(ConfigValidationException.class, () -> coordinator.run(RunMode.SINGLE_TOPIC, "nope").block());
        assertTrue(reddit.getQueries().isEmpty());
    }

    @Test
    public void promoteOnlyRunsTheSweepAndNothingElse() {
        RunDtos.RunReport report = coordinator(Synthesizer.none(), reddit, x).run(RunMode.PROMOTE_ONLY, null).block();

        assertNotNull(report);
        assertEquals(1, report.getPromotions());
        assertNull(report.getReading_list_count());
        assertTrue(reddit.getQueries().isEmpty());
        assertTrue(corpus.text(OLD_NOTE).contains("#kept"));
    }

    @Test
    public void failedSynthesisStillWritesTheNote() {
        Synthesizer broken = readingList -> Mono.error(new IllegalStateException("LLM down"));

        RunDtos.RunReport report = coordinator(broken, reddit, x).run(RunMode.FULL, null).block();

        assertNotNull(report);
        assertEquals("completed", report.getStatus());
        assertEquals(TODAY_NOTE, report.getNote_path());
        assertNotNull(report.getSynthesis_error());
        assertTrue(report.getSynthesis_error().contains("LLM down"));
    }

    @Test
    public void secondRunIsRejectedWhileOneIsInFlight() throws Exception {
        Sinks.One<Synthesis> gate = Sinks.one();
        CountDownLatch synthesizing = new CountDownLatch(1);
        Synthesizer slow = readingList -> {
            synthesizing.countDown();
            return gate.asMono();
        };
        RunCoordinator coordinator = coordinator(slow, reddit, x);

        CompletableFuture<RunDtos.RunReport> first = coordinator.run(RunMode.PREVIEW, null).toFuture();
        assertTrue(synthesizing.await(5, TimeUnit.SECONDS));

        assertThrows(RunInProgressException.class, () -> coordinator.run(RunMode.PREVIEW, null).block());

        gate.tryEmitValue(Synthesis.empty());
        assertEquals("completed", first.get(5, TimeUnit.SECONDS).getStatus());
    }
}
