package com.dailyresearch.pipeline.service.fetch;

import com.dailyresearch.pipeline.model.RawItem;
import com.dailyresearch.pipeline.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reddit public search ({@code /search.json}), newest day, sorted by relevance.
 */
public class RedditSearchFetcher implements ContentFetcher {
    private static final Logger log = LoggerFactory.getLogger(RedditSearchFetcher.class);
    private static final String REDDIT_HOST = "https://www.reddit.com";

    private final WebClient http;
    private final boolean enabled;

    public RedditSearchFetcher(WebClient http, boolean enabled) {
        this.http = http;
        this.enabled = enabled;
    }

    @Override
    public Source source() {
        return Source.REDDIT;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Mono<List<RawItem>> search(String query, int limit) {
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/search.json")
                        .queryParam("q", query)
                        .queryParam("sort", "relevance")
                        .queryParam("t", "day")
                        .queryParam("limit", limit)
                        .queryParam("raw_json", 1)
                        .build())
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .map(json -> {
                    List<RawItem> items = parseListing(json);
                    log.info("Reddit search '{}' → {} items", query, items.size());
                    return items.size() > limit ? items.subList(0, limit) : items;
                });
    }

    /** Maps a listing response ({@code data.children[].data}) to raw items. */
    static List<RawItem> parseListing(Map<String, Object> json) {
        List<RawItem> out = new ArrayList<>();
        if (!(json.get("data") instanceof Map<?, ?> data)) return out;
        if (!(data.get("children") instanceof List<?> children)) return out;
        for (Object child : children) {
            if (!(child instanceof Map<?, ?> c) || !(c.get("data") instanceof Map<?, ?> post)) continue;
            Object permalink = post.get("permalink");
            Object title = post.get("title");
            if (permalink == null || title == null) continue;

            RawItem item = new RawItem(Source.REDDIT, REDDIT_HOST + permalink, String.valueOf(title));
            item.setAuthor(asString(post.get("author")));
            item.setCommunity(asString(post.get("subreddit")));
            item.setText(asString(post.get("selftext")));
            if (post.get("created_utc") instanceof Number created) {
                item.setPublishedAt(Instant.ofEpochSecond(created.longValue()));
            }
            item.putMetric("score", asInt(post.get("score")));
            item.putMetric("comments", asInt(post.get("num_comments")));
            out.add(item);
        }
        return out;
    }

    private static String asString(Object o) {
        return o == null ? null : String.valueOf(o);
    }

    private static Integer asInt(Object o) {
        return o instanceof Number n ? n.intValue() : null;
    }
}
