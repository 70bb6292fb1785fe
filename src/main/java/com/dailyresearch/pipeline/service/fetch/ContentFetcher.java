package com.dailyresearch.pipeline.service.fetch;

import com.dailyresearch.pipeline.model.RawItem;
import com.dailyresearch.pipeline.model.Source;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Search collaborator for one platform.
 *
 * <p>Implementations report only the metrics the platform returned; a metric
 * that is missing from the response is left out of the item, never set to 0.
 * Failures surface as an error signal on the returned {@link Mono}.
 */
public interface ContentFetcher {

    Source source();

    /** False when the fetcher is switched off or lacks credentials. */
    boolean isEnabled();

    Mono<List<RawItem>> search(String query, int limit);
}
