package com.conduit.client;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Calls the OpenAI Chat Completions API with a native payload.
 */
public interface OpenAIChatClient {

    boolean isConfigured();

    Mono<JsonNode> createChatCompletion(JsonNode payload);

    /**
     * Stream a completion. Emits the JSON of each SSE data frame, ending before {@code [DONE]}.
     */
    Flux<JsonNode> streamChatCompletion(JsonNode payload);
}
