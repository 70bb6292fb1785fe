package com.dailyresearch.pipeline.service.fetch;

import com.dailyresearch.pipeline.model.RawItem;
import com.dailyresearch.pipeline.model.Source;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class RedditSearchFetcherTest {
    private static final String LISTING = "{\"data\":{\"children\":["
            + "{\"kind\":\"t3\",\"data\":{\"title\":\"MCP servers compared\",\"permalink\":\"/r/LocalLLaMA/comments/abc/mcp/\","
            + "\"author\":\"alice\",\"subreddit\":\"LocalLLaMA\",\"selftext\":\"long body\",\"score\":412,\"num_comments\":37,"
            + "\"created_utc\":1741600000.0}},"
            + "{\"kind\":\"t3\",\"data\":{\"title\":\"No score reported\",\"permalink\":\"/r/x/comments/def/y/\"}},"
            + "{\"kind\":\"t3\",\"data\":{\"title\":\"Missing permalink\"}}"
            + "]}}";

    @Test
    public void parsesListingAndLeavesUnreportedMetricsAbsent() {
        List<RawItem> items = RedditSearchFetcher.parseListing(Map.of("data", Map.of("children", List.of(
                Map.of("data", Map.of("title", "MCP servers compared", "permalink", "/r/LocalLLaMA/comments/abc/mcp/",
                        "subreddit", "LocalLLaMA", "score", 412, "num_comments", 37, "created_utc", 1741600000.0)),
                Map.of("data", Map.of("title", "No score reported", "permalink", "/r/x/comments/def/y/")),
                Map.of("data", Map.of("title", "Missing permalink"))))));

        assertEquals(2, items.size());
        RawItem first = items.get(0);
        assertEquals(Source.REDDIT, first.getSource());
        assertEquals("https://www.reddit.com/r/LocalLLaMA/comments/abc/mcp/", first.getUrl());
        assertEquals("LocalLLaMA", first.getCommunity());
        assertEquals(Map.of("score", 412, "comments", 37), first.getEngagement());
        assertEquals(Instant.ofEpochSecond(1741600000L), first.getPublishedAt());
        assertTrue(items.get(1).getEngagement().isEmpty());
    }

    @Test
    public void malformedListingYieldsNothing() {
        assertTrue(RedditSearchFetcher.parseListing(Map.of("error", 429)).isEmpty());
        assertTrue(RedditSearchFetcher.parseListing(Map.of("data", "nope")).isEmpty());
    }

    @Test
    public void searchCallsSearchEndpointAndCapsResults() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        WebClient http = WebClient.builder()
                .baseUrl("https://www.reddit.com")
                .exchangeFunction(request -> {
                    seen.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(LISTING)
                            .build());
                })
                .build();

        List<RawItem> items = new RedditSearchFetcher(http, true).search("MCP server", 1).block();

        assertNotNull(items);
        assertEquals(1, items.size());
        assertEquals("MCP servers compared", items.get(0).getTitle());
        String query = seen.get().url().getQuery();
        assertEquals("/search.json", seen.get().url().getPath());
        assertTrue(query.contains("q=MCP server"), query);
        assertTrue(query.contains("t=day"), query);
        assertTrue(query.contains("limit=1"), query);
    }
}
