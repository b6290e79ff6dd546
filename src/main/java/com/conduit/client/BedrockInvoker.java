package com.conduit.client;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Invokes a Bedrock model with a provider-shaped JSON body.
 * Failures are raised as {@link com.conduit.exception.ApiClientException} subtypes.
 */
public interface BedrockInvoker {

    boolean isConfigured();

    /**
     * Blocking-shaped invocation.
     *
     * @param modelId concrete Bedrock model id
     * @param body    provider-shaped request body
     * @return the provider's JSON response
     */
    Mono<JsonNode> invoke(String modelId, JsonNode body);

    /**
     * Streaming invocation. Each element is one decoded JSON event; cancelling the
     * subscription closes the provider stream.
     */
    Flux<JsonNode> invokeStream(String modelId, JsonNode body);
}
