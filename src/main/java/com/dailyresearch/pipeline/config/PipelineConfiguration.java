package com.dailyresearch.pipeline.config;

import com.dailyresearch.pipeline.admin.RunRegistry;
import com.dailyresearch.pipeline.corpus.CorpusStore;
import com.dailyresearch.pipeline.corpus.FileSystemCorpusStore;
import com.dailyresearch.pipeline.corpus.MarkdownNoteFormat;
import com.dailyresearch.pipeline.corpus.NoteFormat;
import com.dailyresearch.pipeline.exception.ConfigValidationException;
import com.dailyresearch.pipeline.service.RunCoordinator;
import com.dailyresearch.pipeline.service.TopicOrchestrator;
import com.dailyresearch.pipeline.service.dedup.CrossDeduplicator;
import com.dailyresearch.pipeline.service.fetch.ContentFetcher;
import com.dailyresearch.pipeline.service.fetch.RedditSearchFetcher;
import com.dailyresearch.pipeline.service.fetch.XSearchFetcher;
import com.dailyresearch.pipeline.service.filter.SpamFilter;
import com.dailyresearch.pipeline.service.history.HistoryIndexBuilder;
import com.dailyresearch.pipeline.service.note.DailyNoteWriter;
import com.dailyresearch.pipeline.service.promotion.JsonFeedbackLog;
import com.dailyresearch.pipeline.service.promotion.JsonPromotionLedger;
import com.dailyresearch.pipeline.service.promotion.LibraryNoteWriter;
import com.dailyresearch.pipeline.service.promotion.PromotionTracker;
import com.dailyresearch.pipeline.service.scoring.Classifier;
import com.dailyresearch.pipeline.service.scoring.QualityScorer;
import com.dailyresearch.pipeline.service.synthesis.OpenAiSynthesizer;
import com.dailyresearch.pipeline.service.synthesis.Synthesizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;

/**
 * Wires the pipeline. The bound properties are validated and snapshotted once
 * into {@link PipelineConfig}; components only ever see the snapshot.
 */
@Configuration
public class PipelineConfiguration {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PipelineConfig pipelineConfig(ResearchProperties props) {
        PipelineConfig config = PipelineConfig.from(props);
        log.info("Research config loaded: topics={} mustFollow={} itemsPerTopic={} readingListMax={}",
                config.getTopics(), config.getMustFollowAccounts().size(),
                config.getItemsPerTopic(), config.getReadingListMax());
        return config;
    }

    @Bean
    public CorpusStore corpusStore(ResearchProperties props) {
        String path = props.getCorpus().getPath();
        if (path == null || path.isBlank()) {
            throw new ConfigValidationException(List.of("research.corpus.path is required"));
        }
        return new FileSystemCorpusStore(Paths.get(path));
    }

    @Bean
    public NoteFormat noteFormat() {
        return new MarkdownNoteFormat();
    }

    @Bean
    public HistoryIndexBuilder historyIndexBuilder(CorpusStore corpus, NoteFormat format, PipelineConfig config) {
        return new HistoryIndexBuilder(corpus, format, config);
    }

    @Bean
    public QualityScorer qualityScorer(PipelineConfig config, Clock clock) {
        return new QualityScorer(config, clock);
    }

    @Bean
    public TopicOrchestrator topicOrchestrator(PipelineConfig config, ResearchProperties props, ObjectMapper mapper,
                                               QualityScorer scorer, Clock clock,
                                               @Qualifier("redditClient") WebClient redditClient,
                                               @Qualifier("xClient") WebClient xClient) {
        ResearchProperties.Endpoint x = props.getFetch().getX();
        List<ContentFetcher> fetchers = List.of(
                new RedditSearchFetcher(redditClient, props.getFetch().getReddit().isEnabled()),
                new XSearchFetcher(xClient, mapper, x.getApiKey(), x.getModel(), x.isEnabled(), clock));
        for (ContentFetcher f : fetchers) {
            if (!f.isEnabled()) log.info("Fetcher {} is disabled", f.source().getSlug());
        }
        return new TopicOrchestrator(config, fetchers, new SpamFilter(config), scorer, new Classifier(scorer));
    }

    @Bean
    public PromotionTracker promotionTracker(CorpusStore corpus, NoteFormat format, PipelineConfig config,
                                             ResearchProperties props, ObjectMapper mapper, Clock clock) {
        ResearchProperties.Run run = props.getRun();
        return new PromotionTracker(corpus, format, config,
                new LibraryNoteWriter(corpus, config, clock),
                new JsonPromotionLedger(Paths.get(run.getPromotionLedgerPath()), mapper),
                new JsonFeedbackLog(Paths.get(run.getFeedbackLogPath()), mapper),
                clock);
    }

    @Bean
    public Synthesizer synthesizer(ResearchProperties props, ObjectMapper mapper, Clock clock,
                                   @Qualifier("openAiClient") WebClient openAiClient) {
        ResearchProperties.Synthesis s = props.getSynthesis();
        if (s.getApiKey() == null || s.getApiKey().isBlank()) {
            log.info("No synthesis API key configured; daily notes will carry item lists only");
            return Synthesizer.none();
        }
        return new OpenAiSynthesizer(openAiClient, mapper, s.getModel(), s.getTimeout(), clock);
    }

    @Bean
    public RunCoordinator runCoordinator(PipelineConfig config, PromotionTracker promotionTracker,
                                         HistoryIndexBuilder historyIndexBuilder, TopicOrchestrator orchestrator,
                                         Synthesizer synthesizer, CorpusStore corpus, RunRegistry registry,
                                         ResearchProperties props, ObjectMapper mapper, Clock clock) {
        String dir = props.getRun().getRunHistoryDir();
        Path historyDir = Paths.get(dir == null || dir.isBlank() ? "tmp/run-history" : dir);
        return new RunCoordinator(config, promotionTracker, historyIndexBuilder, orchestrator,
                new CrossDeduplicator(), synthesizer, new DailyNoteWriter(corpus, config),
                registry, mapper, historyDir, clock);
    }
}
