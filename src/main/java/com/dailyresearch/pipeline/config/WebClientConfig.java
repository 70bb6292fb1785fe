package com.dailyresearch.pipeline.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {
    private static final String DEFAULT_USER_AGENT = "daily-research/0.1 (research digest bot)";

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean(name = "redditClient")
    public WebClient redditClient(ResearchProperties props) {
        ResearchProperties.Endpoint reddit = props.getFetch().getReddit();
        String userAgent = reddit.getUserAgent() == null || reddit.getUserAgent().isBlank()
                ? DEFAULT_USER_AGENT : reddit.getUserAgent();
        return WebClient.builder()
                .baseUrl(orDefault(reddit.getBaseUrl(), "https://www.reddit.com"))
                .exchangeStrategies(strategies())
                .defaultHeader("User-Agent", userAgent)
                .defaultHeaders(headers -> headers.setAccept(MediaType.parseMediaTypes("application/json")))
                .build();
    }

    @Bean(name = "xClient")
    public WebClient xClient(ResearchProperties props) {
        return WebClient.builder()
                .baseUrl(orDefault(props.getFetch().getX().getBaseUrl(), "https://api.x.ai"))
                .exchangeStrategies(strategies())
                .defaultHeaders(headers -> headers.setAccept(MediaType.parseMediaTypes("application/json")))
                .build();
    }

    @Bean(name = "openAiClient")
    public WebClient openAiClient(ResearchProperties props) {
        ResearchProperties.Synthesis synthesis = props.getSynthesis();
        return WebClient.builder()
                .baseUrl(orDefault(synthesis.getBaseUrl(), "https://api.openai.com"))
                .exchangeStrategies(strategies())
                .defaultHeader("Authorization", "Bearer " + synthesis.getApiKey())
                .defaultHeaders(headers -> headers.setAccept(MediaType.parseMediaTypes("application/json")))
                .build();
    }

    private static ExchangeStrategies strategies() {
        return ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
