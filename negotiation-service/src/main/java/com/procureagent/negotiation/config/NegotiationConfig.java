package com.procureagent.negotiation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.procureagent.common.evaluation.EvaluationSettings;
import com.procureagent.common.evaluation.EvaluationWeights;
import com.procureagent.common.llm.GeminiTextGenerationClient;
import com.procureagent.common.llm.ResilientTextGeneration;
import com.procureagent.common.llm.TextGenerationClient;
import com.procureagent.negotiation.client.HistoryNegotiationArchive;
import com.procureagent.negotiation.client.NegotiationArchive;
import com.procureagent.negotiation.service.NegotiationSessionManager;
import com.procureagent.negotiation.service.NegotiationSessionStore;
import com.procureagent.negotiation.service.VendorDirectory;
import com.procureagent.negotiation.service.VendorResponder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class NegotiationConfig {

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

    @Value("${text-generation.max-output-tokens:2048}")
    private int maxOutputTokens;

    @Value("${text-generation.timeout:PT30S}")
    private Duration timeout;

    @Value("${text-generation.max-retries:3}")
    private int maxRetries;

    @Value("${text-generation.initial-backoff:PT1S}")
    private Duration initialBackoff;

    @Value("${negotiation.max-rounds:6}")
    private int maxRounds;

    @Value("${negotiation.price-tolerance:0.05}")
    private double priceTolerance;

    @Value("${negotiation.idle-timeout:PT30M}")
    private Duration idleTimeout;

    @Value("${evaluation.weights.price:0.4}")
    private double priceWeight;

    @Value("${evaluation.weights.delivery:0.25}")
    private double deliveryWeight;

    @Value("${evaluation.weights.reliability:0.2}")
    private double reliabilityWeight;

    @Value("${evaluation.weights.past-performance:0.15}")
    private double pastPerformanceWeight;

    @Value("${evaluation.reference-price:10000}")
    private double referencePrice;

    @Value("${evaluation.reference-delivery-days:30}")
    private double referenceDeliveryDays;

    @Value("${evaluation.score-scale:5.0}")
    private double scoreScale;

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

    /** Validated at startup so a bad weight set fails the boot, not the first request. */
    @Bean
    public EvaluationSettings evaluationSettings() {
        return new EvaluationSettings(
            new EvaluationWeights(priceWeight, deliveryWeight, reliabilityWeight, pastPerformanceWeight),
            referencePrice, referenceDeliveryDays, scoreScale).validate();
    }

    @Bean
    public NegotiationSettings negotiationSettings() {
        return new NegotiationSettings(maxRounds, priceTolerance, idleTimeout);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VendorDirectory vendorDirectory() {
        return VendorDirectory.builtIn();
    }

    @Bean
    public NegotiationArchive negotiationArchive(WebClient historyClient) {
        return new HistoryNegotiationArchive(historyClient);
    }

    @Bean
    public NegotiationSessionManager negotiationSessionManager(VendorDirectory vendorDirectory,
                                                               TextGenerationClient textGenerationClient,
                                                               NegotiationArchive negotiationArchive,
                                                               NegotiationSettings negotiationSettings,
                                                               EvaluationSettings evaluationSettings,
                                                               Clock clock) {
        return new NegotiationSessionManager(new NegotiationSessionStore(), vendorDirectory,
            new VendorResponder(textGenerationClient), negotiationArchive,
            negotiationSettings, evaluationSettings, clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
