package com.procureagent.common.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TextGenerationClient} backed by the Gemini {@code generateContent} REST endpoint.
 *
 * <p>The supplied {@link WebClient} must already carry the base URL. HTTP failures are
 * mapped to {@link TextGenerationException.Kind}: 429 rate limited, 401/403 unauthorized,
 * 5xx server error, other 4xx invalid request, connection problems transport. A blank API key fails fast as
 * unauthorized without any network call.
 */
public class GeminiTextGenerationClient implements TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiTextGenerationClient.class);

    static final String API_KEY_HEADER = "x-goog-api-key";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxOutputTokens;

    public GeminiTextGenerationClient(WebClient webClient, ObjectMapper objectMapper, String apiKey,
                                      String model, double temperature, int maxOutputTokens) {
        this.webClient       = webClient;
        this.objectMapper    = objectMapper;
        this.apiKey          = apiKey;
        this.model           = model;
        this.temperature     = temperature;
        this.maxOutputTokens = maxOutputTokens;
    }

    @Override
    public Mono<String> generate(String prompt, String systemInstruction) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new TextGenerationException(
                TextGenerationException.Kind.UNAUTHORIZED, "No API key configured"));
        }

        return webClient.post()
            .uri("/v1beta/models/{model}:generateContent", model)
            .header(API_KEY_HEADER, apiKey)
            .bodyValue(requestBody(prompt, systemInstruction))
            .exchangeToMono(response -> {
                HttpStatusCode status = response.statusCode();
                if (status.is2xxSuccessful()) {
                    return response.bodyToMono(String.class);
                }
                return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(body -> Mono.error(mapStatus(status, body)));
            })
            .onErrorMap(WebClientRequestException.class,
                e -> new TextGenerationException(TextGenerationException.Kind.TRANSPORT, e.getMessage(), e))
            .map(this::extractText)
            .doOnSuccess(text -> log.debug("[TextGeneration] Response received. model={} chars={}",
                                           model, text == null ? 0 : text.length()));
    }

    Map<String, Object> requestBody(String prompt, String systemInstruction) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", prompt)))));
        if (systemInstruction != null && !systemInstruction.isBlank()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", systemInstruction))));
        }
        body.put("generationConfig", Map.of("temperature", temperature, "maxOutputTokens", maxOutputTokens));
        return body;
    }

    String extractText(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new TextGenerationException(TextGenerationException.Kind.EMPTY_RESPONSE,
                                              "Unreadable response body", e);
        }
        JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (!text.isTextual() || text.asText().isBlank()) {
            throw new TextGenerationException(TextGenerationException.Kind.EMPTY_RESPONSE,
                                              "Response carried no candidate text");
        }
        return text.asText();
    }

    static TextGenerationException mapStatus(HttpStatusCode status, String body) {
        int code = status.value();
        String detail = "HTTP " + code + (body.isBlank() ? "" : " " + abbreviate(body));
        if (code == 429) {
            return new TextGenerationException(TextGenerationException.Kind.RATE_LIMITED, detail);
        }
        if (code == 401 || code == 403) {
            return new TextGenerationException(TextGenerationException.Kind.UNAUTHORIZED, detail);
        }
        if (status.is5xxServerError()) {
            return new TextGenerationException(TextGenerationException.Kind.SERVER_ERROR, detail);
        }
        return new TextGenerationException(TextGenerationException.Kind.INVALID_REQUEST, detail);
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
