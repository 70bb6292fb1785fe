package com.dailyresearch.pipeline.service;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.exception.FetchFailureException;
import com.dailyresearch.pipeline.model.AccountConfig;
import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.model.RawItem;
import com.dailyresearch.pipeline.model.Source;
import com.dailyresearch.pipeline.model.TopicConfig;
import com.dailyresearch.pipeline.service.fetch.ContentFetcher;
import com.dailyresearch.pipeline.service.filter.SpamFilter;
import com.dailyresearch.pipeline.service.filter.SpamVerdict;
import com.dailyresearch.pipeline.service.scoring.Classifier;
import com.dailyresearch.pipeline.service.scoring.QualityScorer;
import com.dailyresearch.pipeline.service.scoring.Ranking;
import com.dailyresearch.pipeline.util.TitleUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Fetch → spam filter → engagement floor + score → classify, per topic.
 *
 * <p>Tracks are fetched concurrently (bounded by the configured parallelism)
 * and returned in configured order, must-follow last. A fetch call that fails
 * or times out contributes zero items; the rest of the track carries on.
 */
public class TopicOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(TopicOrchestrator.class);
    static final double MUST_FOLLOW_WEIGHT = 1.0;

    private final PipelineConfig config;
    private final List<ContentFetcher> fetchers;
    private final SpamFilter spamFilter;
    private final QualityScorer scorer;
    private final Classifier classifier;

    public TopicOrchestrator(PipelineConfig config, List<ContentFetcher> fetchers,
                             SpamFilter spamFilter, QualityScorer scorer, Classifier classifier) {
        this.config = config;
        this.fetchers = List.copyOf(fetchers);
        this.spamFilter = spamFilter;
        this.scorer = scorer;
        this.classifier = classifier;
    }

    /**
     * Runs the given topics and, when asked, the must-follow track. Results come
     * back in topic order with must-follow last, whatever order the fetches
     * finished in.
     */
    public Mono<List<TopicResult>> runAll(List<TopicConfig> topics, boolean includeMustFollow) {
        List<Mono<TopicResult>> tracks = new ArrayList<>();
        for (TopicConfig topic : topics) {
            tracks.add(runTopic(topic));
        }
        if (includeMustFollow && !config.getMustFollowAccounts().isEmpty()) {
            tracks.add(runMustFollow());
        }
        int parallelism = Math.max(1, config.getFetchParallelism());
        return Flux.fromIterable(tracks)
                .flatMapSequential(track -> track.subscribeOn(Schedulers.boundedElastic()), parallelism)
                .collectList();
    }

    public Mono<TopicResult> runTopic(TopicConfig topic) {
        List<Call> calls = new ArrayList<>();
        for (ContentFetcher fetcher : fetchers) {
            if (!fetcher.isEnabled()) continue;
            for (String query : topic.effectiveQueries()) {
                calls.add(new Call(fetcher, query));
            }
        }
        return fetchAll(topic.getSlug(), calls)
                .map(batch -> filterAndScore(topic, batch))
                .onErrorResume(e -> {
                    log.warn("Topic {} failed: {}", topic.getSlug(), e.toString());
                    return Mono.just(TopicResult.failed(topic.getSlug(), topic.getDisplayName(), e.toString()));
                });
    }

    /**
     * Every configured account, unfiltered: no spam check and no engagement
     * floor. Solo accounts get their own query; the others are batched per group.
     */
    public Mono<TopicResult> runMustFollow() {
        List<Call> calls = new ArrayList<>();
        for (ContentFetcher fetcher : fetchers) {
            if (!fetcher.isEnabled() || fetcher.source() != Source.X) continue;
            for (String query : mustFollowQueries(config.getMustFollowAccounts())) {
                calls.add(new Call(fetcher, query));
            }
        }
        return fetchAll(TopicResult.MUST_FOLLOW, calls)
                .map(this::scoreMustFollow)
                .onErrorResume(e -> {
                    log.warn("Must-follow track failed: {}", e.toString());
                    return Mono.just(TopicResult.failed(TopicResult.MUST_FOLLOW, "Must-follow", e.toString()));
                });
    }

    static List<String> mustFollowQueries(List<AccountConfig> accounts) {
        List<String> queries = new ArrayList<>();
        Map<String, List<String>> batched = new LinkedHashMap<>();
        for (AccountConfig a : accounts) {
            if (a.isSolo()) {
                queries.add(a.fromQuery());
            } else {
                batched.computeIfAbsent(a.getGroupLabel(), k -> new ArrayList<>()).add(a.fromQuery());
            }
        }
        for (List<String> group : batched.values()) {
            queries.add(String.join(" OR ", group));
        }
        return queries;
    }

    private Mono<FetchBatch> fetchAll(String slug, List<Call> calls) {
        if (calls.isEmpty()) {
            return Mono.just(new FetchBatch(List.of(), 0, List.of()));
        }
        return Flux.fromIterable(calls)
                .concatMap(call -> Mono.defer(() -> call.fetcher.search(call.query, config.getItemsPerTopic()))
                        .timeout(config.getFetchTimeout())
                        .map(CallOutcome::ok)
                        .onErrorResume(e -> {
                            FetchFailureException failure = asFetchFailure(call, e);
                            log.warn("Fetch failed for {} ({} '{}'): {}", slug, call.fetcher.source().getSlug(),
                                    call.query, failure.getMessage());
                            return Mono.just(CallOutcome.failed(failure.getMessage()));
                        }))
                .collectList()
                .map(outcomes -> {
                    List<RawItem> items = new ArrayList<>();
                    List<String> errors = new ArrayList<>();
                    for (CallOutcome o : outcomes) {
                        if (o.error != null) errors.add(o.error);
                        else items.addAll(o.items);
                    }
                    return new FetchBatch(items, calls.size(), errors);
                });
    }

    private static FetchFailureException asFetchFailure(Call call, Throwable e) {
        String what = call.fetcher.source().getSlug() + " '" + call.query + "'";
        if (e instanceof TimeoutException) {
            return new FetchFailureException(what + " timed out", e);
        }
        return new FetchFailureException(what + ": " + e, e);
    }

    private TopicResult filterAndScore(TopicConfig topic, FetchBatch batch) {
        Map<String, Integer> spamReasons = new LinkedHashMap<>();
        int floorDropped = 0;
        List<ContentItem> kept = new ArrayList<>();
        for (RawItem raw : batch.items) {
            ContentItem item = toContentItem(raw, topic.getSlug());
            SpamVerdict verdict = spamFilter.classify(item);
            if (verdict.isSpam()) {
                spamReasons.merge(reasonKey(verdict.getReason()), 1, Integer::sum);
                log.debug("Spam dropped in {}: {} ({})", topic.getSlug(), item.getUrl(), verdict.getReason());
                continue;
            }
            Optional<ContentItem> scored = scorer.apply(item.withSpamFlag(false), topic.getWeight());
            if (scored.isEmpty()) {
                floorDropped++;
                continue;
            }
            kept.add(classifier.apply(scored.get()));
        }
        boolean failed = batch.calls > 0 && batch.errors.size() == batch.calls;
        log.info("Topic {}: fetched={} kept={} spam={} floor={} fetchErrors={}",
                topic.getSlug(), batch.items.size(), kept.size(), spamReasons.values().stream().mapToInt(i -> i).sum(),
                floorDropped, batch.errors.size());
        return new TopicResult(topic.getSlug(), topic.getDisplayName(), Ranking.rank(kept), batch.items.size(),
                batch.calls, spamReasons, floorDropped, batch.errors, failed);
    }

    private TopicResult scoreMustFollow(FetchBatch batch) {
        List<ContentItem> kept = new ArrayList<>();
        for (RawItem raw : batch.items) {
            ContentItem item = toContentItem(raw, "");
            kept.add(classifier.apply(scorer.scoreUnfiltered(item, MUST_FOLLOW_WEIGHT)));
        }
        boolean failed = batch.calls > 0 && batch.errors.size() == batch.calls;
        log.info("Must-follow: fetched={} fetchErrors={}", batch.items.size(), batch.errors.size());
        return new TopicResult(TopicResult.MUST_FOLLOW, "Must-follow", Ranking.rank(kept), batch.items.size(),
                batch.calls, Map.of(), 0, batch.errors, failed);
    }

    /** Spam reasons carry detail after the rule name; counters group by rule. */
    private static String reasonKey(String reason) {
        int colon = reason.indexOf(':');
        return colon > 0 ? reason.substring(0, colon) : reason;
    }

    ContentItem toContentItem(RawItem raw, String topicSlug) {
        Source source = raw.getSource() == null ? Source.WEB : raw.getSource();
        String author = raw.getAuthor() == null ? "" : raw.getAuthor().trim().toLowerCase(Locale.ROOT);
        if (author.startsWith("@")) author = author.substring(1);
        String community = raw.getCommunity() == null ? "" : raw.getCommunity().trim().toLowerCase(Locale.ROOT);

        boolean priority = (source == Source.X && config.getPriorityXHandles().contains(author))
                || (source == Source.REDDIT && config.getPrioritySubreddits().contains(community));
        boolean lab = !author.isEmpty() && config.getLabHandles().contains(author);

        return ContentItem.builder()
                .source(source)
                .url(raw.getUrl())
                .title(TitleUtils.sanitizeTitle(raw.getTitle()))
                .author(raw.getAuthor())
                .community(raw.getCommunity())
                .publishedAt(raw.getPublishedAt())
                .engagement(raw.getEngagement())
                .bodyLength(raw.getText() == null ? 0 : raw.getText().length())
                .topicSlug(topicSlug)
                .priorityAccount(priority)
                .labAccount(lab)
                .build();
    }

    private static final class Call {
        final ContentFetcher fetcher;
        final String query;

        Call(ContentFetcher fetcher, String query) {
            this.fetcher = fetcher;
            this.query = query;
        }
    }

    private static final class CallOutcome {
        final List<RawItem> items;
        final String error;

        private CallOutcome(List<RawItem> items, String error) {
            this.items = items;
            this.error = error;
        }

        static CallOutcome ok(List<RawItem> items) {
            return new CallOutcome(items == null ? List.of() : items, null);
        }

        static CallOutcome failed(String error) {
            return new CallOutcome(List.of(), error);
        }
    }

    private static final class FetchBatch {
        final List<RawItem> items;
        final int calls;
        final List<String> errors;

        FetchBatch(List<RawItem> items, int calls, List<String> errors) {
            this.items = items;
            this.calls = calls;
            this.errors = errors;
        }
    }
}
