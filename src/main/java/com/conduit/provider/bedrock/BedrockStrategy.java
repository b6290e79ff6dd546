package com.conduit.provider.bedrock;

import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.ModelFamily;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Wire protocol of one Bedrock model family: payload construction, response parsing
 * and stream event translation.
 */
public interface BedrockStrategy {

    /**
     * @return the concrete Bedrock model id this strategy was built for
     */
    String getModelId();

    ModelFamily getFamily();

    /**
     * Build the provider payload. System messages are merged, unset sampling parameters
     * take the configured defaults, and tools against a family without tool support fail
     * with {@link com.conduit.exception.UnsupportedFeatureException} before anything is built.
     *
     * @param request canonical request
     * @return provider-shaped JSON body
     */
    ObjectNode prepareRequestPayload(ChatCompletionRequest request);

    /**
     * Convert a provider response into a canonical response.
     *
     * @throws com.conduit.exception.ApiRequestException when the result container is empty or malformed
     */
    ChatCompletionResponse parseResponse(JsonNode providerResponse, ChatCompletionRequest request);

    /**
     * Translate one provider stream event. Metadata-only events yield a chunk with no choices.
     *
     * @param event    decoded provider event
     * @param request  canonical request being streamed
     * @param streamId id shared by every chunk of the stream
     * @param created  creation timestamp shared by every chunk of the stream
     */
    ChatCompletionChunk handleStreamChunk(JsonNode event, ChatCompletionRequest request, String streamId, long created);
}
