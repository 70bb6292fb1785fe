package com.dailyresearch.pipeline.service.synthesis;

import com.dailyresearch.pipeline.model.Category;
import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.model.Source;
import com.dailyresearch.pipeline.util.TitleUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily briefing through the OpenAI chat-completions API in JSON mode.
 * Any failure, including a timeout or unparseable content, yields
 * {@link Synthesis#failed(String)}.
 */
public class OpenAiSynthesizer implements Synthesizer {
    private static final Logger log = LoggerFactory.getLogger(OpenAiSynthesizer.class);

    private final WebClient http;
    private final ObjectMapper mapper;
    private final String model;
    private final Duration timeout;
    private final Clock clock;

    public OpenAiSynthesizer(WebClient http, ObjectMapper mapper, String model, Duration timeout, Clock clock) {
        this.http = http;
        this.mapper = mapper;
        this.model = (model == null || model.isBlank()) ? "gpt-4o-mini" : model;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public Mono<Synthesis> summarize(ReadingList readingList) {
        if (readingList.isEmpty()) {
            return Mono.just(Synthesis.empty());
        }
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("model", model);
        req.put("temperature", 0.5);
        req.put("response_format", Map.of("type", "json_object"));
        req.put("messages", List.of(
                Map.of("role", "system", "content", "You are a research analyst writing a daily morning briefing. Reply STRICT JSON per schema."),
                Map.of("role", "user", "content", buildPrompt(readingList))));

        log.info("Synthesis request → model={} items={}", model, readingList.getItems().size());
        return http.post()
                .uri("/v1/chat/completions")
                .bodyValue(req)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .timeout(timeout)
                .map(this::parse)
                .onErrorResume(e -> {
                    log.warn("Synthesis failed: {}", e.toString());
                    return Mono.just(Synthesis.failed(e.getMessage() == null ? e.toString() : e.getMessage()));
                });
    }

    Synthesis parse(Map<String, Object> resp) {
        if (!(resp.get("choices") instanceof List<?> choices) || choices.isEmpty()) {
            return Synthesis.failed("no choices in response");
        }
        if (!(choices.get(0) instanceof Map<?, ?> choice) || !(choice.get("message") instanceof Map<?, ?> msg)) {
            return Synthesis.failed("malformed choice");
        }
        Map<String, Object> out;
        try {
            out = mapper.readValue(String.valueOf(msg.get("content")), new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            return Synthesis.failed("unparseable content: " + e.getMessage());
        }
        List<Synthesis.TopicSummary> topics = new ArrayList<>();
        if (out.get("topics") instanceof List<?> list) {
            for (Object o : list) {
                if (!(o instanceof Map<?, ?> t) || t.get("slug") == null) continue;
                List<String> points = new ArrayList<>();
                if (t.get("key_points") instanceof List<?> kp) {
                    for (Object p : kp) points.add(String.valueOf(p));
                }
                topics.add(new Synthesis.TopicSummary(String.valueOf(t.get("slug")),
                        t.get("headline") == null ? "" : String.valueOf(t.get("headline")), points));
            }
        }
        return new Synthesis(str(out.get("briefing")), str(out.get("lab_pulse_summary")), topics, null);
    }

    private String buildPrompt(ReadingList list) {
        LocalDate today = LocalDate.now(clock);
        StringBuilder sources = new StringBuilder();
        for (String slug : list.topicSlugs()) {
            sources.append("### ").append(list.topicName(slug)).append(" (").append(slug).append(")\n");
            List<ContentItem> items = list.itemsOfTopic(slug);
            if (items.isEmpty()) {
                sources.append("(No new results)\n");
            }
            for (ContentItem i : items) {
                sources.append("- ").append(describe(i)).append('\n');
            }
        }
        List<ContentItem> labs = new ArrayList<>();
        list.getByCategory().getOrDefault(Category.LAB_PULSE, Map.of()).values().forEach(labs::addAll);
        list.getMustFollow().values().forEach(items -> items.stream().filter(ContentItem::isLabAccount).forEach(labs::add));
        if (!labs.isEmpty()) {
            sources.append("### Lab accounts\n");
            for (ContentItem i : labs) sources.append("- ").append(describe(i)).append('\n');
        }

        return "DATE: " + today + "\n\n## SOURCE DATA\n" + sources + "\n"
                + "Produce a JSON daily briefing:\n"
                + "{\"briefing\": \"4-6 sentences on the biggest happenings today, most impactful story first\", "
                + "\"lab_pulse_summary\": \"2-3 sentences on what the model providers said or shipped today, or say it was quiet\", "
                + "\"topics\": [{\"slug\": \"topic-slug\", \"headline\": \"one sentence\", \"key_points\": [\"1-3 short points\"]}]}\n"
                + "Rules: this is a DAILY briefing; use only the source data above; "
                + "for a topic with no results say \"Quiet day for this topic\". Output ONLY valid JSON.";
    }

    private static String describe(ContentItem i) {
        StringBuilder sb = new StringBuilder(TitleUtils.truncate(i.getTitle(), 160));
        if (i.getAuthor() != null && !i.getAuthor().isBlank()) sb.append(i.getSource() == Source.REDDIT ? " (u/" : " (@").append(i.getAuthor()).append(')');
        if (i.getCommunity() != null && !i.getCommunity().isBlank()) sb.append(" [r/").append(i.getCommunity()).append(']');
        sb.append(' ').append(i.getUrl());
        return sb.toString();
    }

    private static String str(Object o) {
        return o == null ? "" : String.valueOf(o);
    }
}
