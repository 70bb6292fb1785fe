package com.dailyresearch.pipeline.service.synthesis;

import reactor.core.publisher.Mono;

/**
 * Turns the final reading list into prose. Implementations should not fail
 * the run: errors come back as a degraded {@link Synthesis}.
 */
public interface Synthesizer {

    Mono<Synthesis> summarize(ReadingList readingList);

    /** Used when no LLM is configured: no prose, the note carries the lists only. */
    static Synthesizer none() {
        return readingList -> Mono.just(Synthesis.empty());
    }
}
