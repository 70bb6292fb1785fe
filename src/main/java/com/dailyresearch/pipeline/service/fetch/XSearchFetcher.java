package com.dailyresearch.pipeline.service.fetch;

import com.dailyresearch.pipeline.model.RawItem;
import com.dailyresearch.pipeline.model.Source;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * X search through an xAI-compatible responses endpoint with the
 * {@code x_search} tool. Queries of the form {@code from:@a OR from:@b} are
 * restricted to those handles at the API level.
 */
public class XSearchFetcher implements ContentFetcher {
    private static final Logger log = LoggerFactory.getLogger(XSearchFetcher.class);
    private static final Pattern FROM_HANDLE = Pattern.compile("from:@([A-Za-z0-9_]+)");
    private static final Pattern ITEMS_JSON = Pattern.compile("\\{[\\s\\S]*\"items\"[\\s\\S]*\\}");
    /** The x_search tool accepts at most this many handles. */
    private static final int MAX_ALLOWED_HANDLES = 10;
    private static final int TITLE_MAX_CHARS = 120;

    private final WebClient http;
    private final ObjectMapper mapper;
    private final String apiKey;
    private final String model;
    private final boolean enabled;
    private final Clock clock;

    public XSearchFetcher(WebClient http, ObjectMapper mapper, String apiKey, String model, boolean enabled, Clock clock) {
        this.http = http;
        this.mapper = mapper;
        this.apiKey = apiKey;
        this.model = (model == null || model.isBlank()) ? "grok-4-1-fast" : model;
        this.enabled = enabled;
        this.clock = clock;
    }

    @Override
    public Source source() {
        return Source.X;
    }

    @Override
    public boolean isEnabled() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<List<RawItem>> search(String query, int limit) {
        LocalDate to = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate from = to.minusDays(1);
        List<String> handles = handlesIn(query);

        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("type", "x_search");
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("from_date", from.toString());
        params.put("to_date", to.toString());
        if (!handles.isEmpty()) {
            params.put("allowed_x_handles", handles.subList(0, Math.min(MAX_ALLOWED_HANDLES, handles.size())));
        }
        tool.put("x_search", params);

        Map<String, Object> req = new LinkedHashMap<>();
        req.put("model", model);
        req.put("tools", List.of(tool));
        req.put("input", List.of(Map.of("role", "user", "content", buildPrompt(query, handles, from, to, limit))));

        return http.post()
                .uri("/v1/responses")
                .header("Authorization", "Bearer " + apiKey)
                .bodyValue(req)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .map(resp -> {
                    List<RawItem> items = parseResponse(resp, mapper);
                    log.info("X search '{}' → {} items", query, items.size());
                    return items.size() > limit ? items.subList(0, limit) : items;
                });
    }

    static List<String> handlesIn(String query) {
        List<String> out = new ArrayList<>();
        Matcher m = FROM_HANDLE.matcher(query == null ? "" : query);
        while (m.find()) out.add(m.group(1));
        return out;
    }

    private static String buildPrompt(String query, List<String> handles, LocalDate from, LocalDate to, int limit) {
        String scope = handles.isEmpty()
                ? "Search for posts about: " + query + "."
                : "Find ORIGINAL posts authored by exactly these accounts: @" + String.join(", @", handles)
                  + ". No replies, no reposts, no posts by others that mention them.";
        return "You have access to real-time X data. " + scope + "\n"
                + "Date range: " + from + " to " + to + ". Return at most " + limit + " posts.\n"
                + "Return ONLY JSON: {\"items\": [{\"text\": \"...\", \"url\": \"https://x.com/user/status/...\", "
                + "\"author_handle\": \"user\", \"date\": \"YYYY-MM-DD or null\", "
                + "\"engagement\": {\"likes\": 0, \"reposts\": 0, \"replies\": 0, \"quotes\": 0}}]}\n"
                + "Rules: url MUST be the real post URL from the search results, never invented. "
                + "Use null for any engagement number you do not know.";
    }

    /**
     * Pulls the model's text output out of a responses payload and parses the
     * {@code items} JSON embedded in it.
     */
    @SuppressWarnings("unchecked")
    static List<RawItem> parseResponse(Map<String, Object> resp, ObjectMapper mapper) {
        List<RawItem> out = new ArrayList<>();
        if (resp.get("error") != null) {
            log.warn("xAI API error: {}", resp.get("error"));
            return out;
        }
        String text = outputText(resp);
        Matcher m = ITEMS_JSON.matcher(text);
        if (!m.find()) return out;
        Map<String, Object> data;
        try {
            data = mapper.readValue(m.group(), new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.warn("Unparseable X search output: {}", e.toString());
            return out;
        }
        if (!(data.get("items") instanceof List<?> items)) return out;
        for (Object o : items) {
            if (!(o instanceof Map<?, ?> raw)) continue;
            Map<String, Object> it = (Map<String, Object>) raw;
            String url = it.get("url") == null ? "" : String.valueOf(it.get("url")).trim();
            if (url.isEmpty()) continue;
            String body = it.get("text") == null ? "" : String.valueOf(it.get("text")).trim();

            RawItem item = new RawItem(Source.X, url, titleFrom(body));
            item.setText(body);
            if (it.get("author_handle") != null) {
                String h = String.valueOf(it.get("author_handle")).trim();
                item.setAuthor(h.startsWith("@") ? h.substring(1) : h);
            }
            item.setPublishedAt(parseDate(it.get("date")));
            if (it.get("engagement") instanceof Map<?, ?> eng) {
                for (String metric : List.of("likes", "reposts", "replies", "quotes")) {
                    if (eng.get(metric) instanceof Number n) {
                        item.putMetric(metric, n.intValue());
                    }
                }
            }
            out.add(item);
        }
        return out;
    }

    private static String outputText(Map<String, Object> resp) {
        if (resp.get("output_text") instanceof String s) return s;
        StringBuilder sb = new StringBuilder();
        if (resp.get("output") instanceof List<?> output) {
            for (Object o : output) {
                if (!(o instanceof Map<?, ?> msg) || !"message".equals(msg.get("type"))) continue;
                if (!(msg.get("content") instanceof List<?> parts)) continue;
                for (Object p : parts) {
                    if (p instanceof Map<?, ?> part && part.get("text") instanceof String t) {
                        sb.append(t);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static String titleFrom(String body) {
        String firstLine = body.split("\\r?\\n", 2)[0].trim();
        return firstLine.length() > TITLE_MAX_CHARS ? firstLine.substring(0, TITLE_MAX_CHARS) + "..." : firstLine;
    }

    private static Instant parseDate(Object date) {
        if (date == null) return null;
        try {
            return LocalDate.parse(String.valueOf(date).trim()).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
