package com.procureagent.common.llm;

import com.procureagent.common.exception.ExternalServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Timeout and bounded exponential-backoff retries around a {@link TextGenerationClient}.
 *
 * <p>Each attempt is bounded by {@code timeout}. Transient failures (rate limiting,
 * server errors, timeouts, transport errors) are retried up to {@code maxRetries} times
 * with backoff starting at {@code initialBackoff}. Whatever finally fails surfaces as an
 * {@link ExternalServiceException} carrying the last cause, so callers deal with one type.
 */
public class ResilientTextGeneration implements TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientTextGeneration.class);

    private final TextGenerationClient delegate;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration initialBackoff;

    public ResilientTextGeneration(TextGenerationClient delegate, Duration timeout,
                                   int maxRetries, Duration initialBackoff) {
        this.delegate       = delegate;
        this.timeout        = timeout;
        this.maxRetries     = Math.max(0, maxRetries);
        this.initialBackoff = initialBackoff;
    }

    @Override
    public Mono<String> generate(String prompt, String systemInstruction) {
        return Mono.defer(() -> delegate.generate(prompt, systemInstruction))
            .timeout(timeout)
            .onErrorMap(TimeoutException.class,
                e -> new TextGenerationException(TextGenerationException.Kind.TIMEOUT,
                                                 "No response within " + timeout, e))
            .switchIfEmpty(Mono.error(() -> new TextGenerationException(
                TextGenerationException.Kind.EMPTY_RESPONSE, "Collaborator completed without text")))
            .retryWhen(Retry.backoff(maxRetries, initialBackoff)
                .filter(ResilientTextGeneration::isTransient)
                .doBeforeRetry(signal -> log.warn(
                    "[TextGeneration] Transient failure, retrying. attempt={} maxRetries={} reason={}",
                    signal.totalRetries() + 1, maxRetries, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> new ExternalServiceException(
                    "TextGeneration",
                    "Retry budget exhausted after " + signal.totalRetries() + " retries: "
                        + signal.failure().getMessage(),
                    signal.failure())))
            .onErrorMap(e -> !(e instanceof ExternalServiceException),
                e -> new ExternalServiceException("TextGeneration", "Non-retryable failure: " + e.getMessage(), e))
            .doOnError(e -> log.error("[TextGeneration] Call failed. reason={}", e.getMessage()));
    }

    static boolean isTransient(Throwable t) {
        return t instanceof TextGenerationException tge && tge.isTransient();
    }
}
