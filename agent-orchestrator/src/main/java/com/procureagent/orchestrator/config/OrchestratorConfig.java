package com.procureagent.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.procureagent.common.decision.DecisionValidator;
import com.procureagent.common.llm.GeminiTextGenerationClient;
import com.procureagent.common.llm.ResilientTextGeneration;
import com.procureagent.common.llm.TextGenerationClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    @Value("${services.history.base-url}")
    private String historyUrl;

    @Value("${text-generation.base-url:https://generativelanguage.googleapis.com}")
    private String textGenerationUrl;

    @Value("${text-generation.api-key:}")
    private String apiKey;

    @Value("${text-generation.model:gemini-1.5-flash}")
    private String model;

    @Value("${text-generation.temperature:0.3}")
    private double temperature;

    @Value("${text-generation.max-output-tokens:4096}")
    private int maxOutputTokens;

    @Value("${text-generation.timeout:PT30S}")
    private Duration timeout;

    @Value("${text-generation.max-retries:3}")
    private int maxRetries;

    @Value("${text-generation.initial-backoff:PT1S}")
    private Duration initialBackoff;

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.baseUrl(notificationUrl).build();
    }

    @Bean
    public WebClient historyClient(WebClient.Builder builder) {
        return builder.baseUrl(historyUrl).build();
    }

    @Bean
    public TextGenerationClient textGenerationClient(WebClient.Builder builder, ObjectMapper objectMapper) {
        WebClient gemini = builder.baseUrl(textGenerationUrl).build();
        return new ResilientTextGeneration(
            new GeminiTextGenerationClient(gemini, objectMapper, apiKey, model, temperature, maxOutputTokens),
            timeout, maxRetries, initialBackoff);
    }

    @Bean
    public DecisionValidator decisionValidator(ObjectMapper objectMapper) {
        return new DecisionValidator(objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
