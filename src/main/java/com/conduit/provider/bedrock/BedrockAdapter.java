package com.conduit.provider.bedrock;

import com.conduit.client.BedrockInvoker;
import com.conduit.exception.ApiRequestException;
import com.conduit.exception.ConfigurationException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.provider.ChatAdapter;
import com.conduit.provider.GenerationDefaultsProvider;
import com.conduit.provider.StreamTermination;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * Adapter for every Bedrock model family. The wire protocol is delegated to the
 * {@link BedrockStrategy} resolved from the model id.
 */
@Slf4j
public class BedrockAdapter implements ChatAdapter {

    private final String modelId;
    private final BedrockStrategy strategy;
    private final BedrockInvoker invoker;

    public BedrockAdapter(String modelId, BedrockInvoker invoker, GenerationDefaultsProvider defaults,
                          ObjectMapper objectMapper) {
        if (!invoker.isConfigured()) {
            throw new ConfigurationException("Bedrock client is not configured; set conduit.bedrock.region "
                    + "(AWS_REGION) and AWS credentials");
        }
        String resolvedId = BedrockModelCatalog.resolve(modelId);
        this.modelId = resolvedId;
        this.strategy = StrategyFactory.create(resolvedId, defaults, objectMapper);
        this.invoker = invoker;
        log.info("BedrockAdapter initialized for model {} with {}", resolvedId,
                strategy.getClass().getSimpleName());
    }

    @Override
    public String getName() {
        return "bedrock";
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    BedrockStrategy getStrategy() {
        return strategy;
    }

    @Override
    public Mono<ChatCompletionResponse> chatCompletion(ChatCompletionRequest request) {
        if (request.isStreaming()) {
            return Mono.error(new ApiRequestException(
                    "chatCompletion called with stream=true; use streamChatCompletion for streaming"));
        }
        return Mono.defer(() -> {
            ObjectNode payload = strategy.prepareRequestPayload(request);
            log.info("Invoking Bedrock model {} ({})", modelId, strategy.getFamily());
            return invoker.invoke(modelId, payload)
                    .map(response -> strategy.parseResponse(response, request));
        });
    }

    /**
     * Payload preparation runs on the calling thread, so validation and unsupported
     * feature errors are thrown here rather than inside the returned stream.
     */
    @Override
    public Flux<ChatCompletionChunk> streamChatCompletion(ChatCompletionRequest request) {
        ChatCompletionRequest streaming = request.withStream(true);
        ObjectNode payload = strategy.prepareRequestPayload(streaming);
        String streamId = "br-" + strategy.getFamily().configKey() + "-" + UUID.randomUUID();
        long created = Instant.now().getEpochSecond();

        Flux<ChatCompletionChunk> chunks = Flux.defer(() -> {
            log.info("Streaming from Bedrock model {} ({}), stream {}", modelId, strategy.getFamily(), streamId);
            return invoker.invokeStream(modelId, payload)
                    .map(event -> strategy.handleStreamChunk(event, streaming, streamId, created))
                    .filter(ChatCompletionChunk::carriesPayload);
        });
        return StreamTermination.endOnce(chunks, streamId, created, modelId)
                .doOnComplete(() -> log.debug("Bedrock stream {} completed", streamId));
    }
}
