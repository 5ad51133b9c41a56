package com.procureagent.common.llm;

import reactor.core.publisher.Mono;

/**
 * Contract of the external text-generation collaborator.
 *
 * <p>Implementations signal failures as {@link TextGenerationException} with a
 * {@link TextGenerationException.Kind}. The returned text is free-form: callers that asked
 * for JSON must still tolerate prose, fenced blocks or garbage.
 */
@FunctionalInterface
public interface TextGenerationClient {

    /**
     * @param prompt            user prompt
     * @param systemInstruction persona or role instruction; may be {@code null}
     * @return generated text; an empty {@code Mono} is never emitted
     */
    Mono<String> generate(String prompt, String systemInstruction);
}
