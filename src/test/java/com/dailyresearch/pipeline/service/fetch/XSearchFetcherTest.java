package com.dailyresearch.pipeline.service.fetch;

import com.dailyresearch.pipeline.model.RawItem;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class XSearchFetcherTest {
    private final ObjectMapper mapper = new ObjectMapper();

    private static final String ITEMS = "Here you go:\n```json\n{\"items\": ["
            + "{\"text\": \"Shipping subagents today\\nMore details inside\", \"url\": \"https://x.com/alice/status/1\","
            + " \"author_handle\": \"@alice\", \"date\": \"2025-03-09\","
            + " \"engagement\": {\"likes\": 1200, \"reposts\": 80, \"replies\": null, \"quotes\": null}},"
            + "{\"text\": \"no url here\", \"url\": \"\"},"
            + "{\"text\": \"Bad date\", \"url\": \"https://x.com/bob/status/2\", \"date\": \"yesterday\"}"
            + "]}\n```";

    @Test
    public void parsesItemsFromOutputText() {
        List<RawItem> items = XSearchFetcher.parseResponse(Map.of("output_text", ITEMS), mapper);

        assertEquals(2, items.size());
        RawItem first = items.get(0);
        assertEquals("Shipping subagents today", first.getTitle());
        assertEquals("alice", first.getAuthor());
        assertEquals(Instant.parse("2025-03-09T00:00:00Z"), first.getPublishedAt());
        assertEquals(Map.of("likes", 1200, "reposts", 80), first.getEngagement());
        assertNull(items.get(1).getPublishedAt());
        assertTrue(items.get(1).getEngagement().isEmpty());
    }

    @Test
    public void readsMessageContentWhenNoOutputText() {
        Map<String, Object> resp = Map.of("output", List.of(
                Map.of("type", "x_search_call"),
                Map.of("type", "message", "content", List.of(Map.of("type", "output_text", "text", ITEMS)))));
        assertEquals(2, XSearchFetcher.parseResponse(resp, mapper).size());
    }

    @Test
    public void errorsAndGarbageYieldNothing() {
        assertTrue(XSearchFetcher.parseResponse(Map.of("error", "rate limited"), mapper).isEmpty());
        assertTrue(XSearchFetcher.parseResponse(Map.of("output_text", "sorry, nothing found"), mapper).isEmpty());
        assertTrue(XSearchFetcher.parseResponse(Map.of("output_text", "{\"items\": [broken"), mapper).isEmpty());
    }

    @Test
    public void extractsHandlesFromQuery() {
        assertEquals(List.of("AnthropicAI", "OpenAI"), XSearchFetcher.handlesIn("from:@AnthropicAI OR from:@OpenAI"));
        assertTrue(XSearchFetcher.handlesIn("agent frameworks").isEmpty());
    }

    @Test
    public void disabledWithoutApiKey() {
        WebClient http = WebClient.create();
        assertFalse(new XSearchFetcher(http, mapper, "", null, true, Clock.systemUTC()).isEnabled());
        assertFalse(new XSearchFetcher(http, mapper, "key", null, false, Clock.systemUTC()).isEnabled());
        assertTrue(new XSearchFetcher(http, mapper, "key", null, true, Clock.systemUTC()).isEnabled());
    }
}
