package com.conduit.service.enhancement;

import com.conduit.model.ChatCompletionRequest;
import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Knowledge-base collaborator. May add retrieved context to a request, or answer it outright.
 */
public interface KnowledgeBaseEnhancer {

    /**
     * @param request canonical request
     * @param rawBody original request body, for extension fields not carried by the request
     * @return the request to dispatch, or a complete response that bypasses dispatch
     */
    Mono<KnowledgeBaseOutcome> enhance(ChatCompletionRequest request, JsonNode rawBody);
}
