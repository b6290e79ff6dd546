package com.conduit.provider.reverse;

import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.RequestFormat;
import com.conduit.model.bedrock.BedrockClaudeRequest;
import com.conduit.model.bedrock.BedrockClaudeResponse;
import com.conduit.model.bedrock.BedrockTitanRequest;
import com.conduit.model.bedrock.BedrockTitanResponse;
import com.conduit.model.bedrock.BedrockTitanStreamChunk;
import com.conduit.provider.ChatAdapter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Supplier;

/**
 * Serves Bedrock-shaped callers from a canonical backend. Requests are converted to the
 * canonical model, executed by the delegate adapter, and converted back to Claude or Titan shape.
 * The delegate is looked up on first use, so re-shaping works without a configured backend.
 */
@Slf4j
public class BedrockToOpenAIAdapter implements ChatAdapter {

    private final String modelId;
    private final Supplier<ChatAdapter> delegate;
    private final BedrockFormatConverter converter;

    public BedrockToOpenAIAdapter(String modelId, Supplier<ChatAdapter> delegate, BedrockFormatConverter converter) {
        this.modelId = modelId;
        this.delegate = delegate;
        this.converter = converter;
        log.info("BedrockToOpenAIAdapter initialized for model: {}", modelId);
    }

    @Override
    public String getName() {
        return "bedrock-to-openai";
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    @Override
    public Mono<ChatCompletionResponse> chatCompletion(ChatCompletionRequest request) {
        return Mono.defer(() -> delegate.get().chatCompletion(request));
    }

    @Override
    public Flux<ChatCompletionChunk> streamChatCompletion(ChatCompletionRequest request) {
        return delegate.get().streamChatCompletion(request);
    }

    public ChatCompletionRequest toCanonical(BedrockClaudeRequest request) {
        return converter.fromClaude(request, modelId);
    }

    public ChatCompletionRequest toCanonical(BedrockTitanRequest request) {
        return converter.fromTitan(request, modelId);
    }

    public Mono<BedrockClaudeResponse> chatCompletionClaude(BedrockClaudeRequest request) {
        return Mono.defer(() -> chatCompletion(toCanonical(request).withStream(false)))
                .map(converter::toClaudeResponse);
    }

    public Mono<BedrockTitanResponse> chatCompletionTitan(BedrockTitanRequest request) {
        return Mono.defer(() -> chatCompletion(toCanonical(request).withStream(false)))
                .map(converter::toTitanResponse);
    }

    /**
     * Stream a canonical request and emit Bedrock-shaped events in the given format.
     */
    public Flux<Object> streamChatCompletionBedrock(ChatCompletionRequest request, RequestFormat format) {
        return streamChatCompletion(request).concatMapIterable(chunk -> toBedrockStreamEvents(chunk, format));
    }

    /**
     * Re-shape a canonical response. The OpenAI format returns the response unchanged.
     */
    public Object toBedrockResponse(ChatCompletionResponse response, RequestFormat format) {
        return switch (format) {
            case BEDROCK_CLAUDE -> converter.toClaudeResponse(response);
            case BEDROCK_TITAN -> converter.toTitanResponse(response);
            case OPENAI -> response;
        };
    }

    /**
     * Re-shape one canonical chunk into zero or more events of the given format.
     */
    public List<Object> toBedrockStreamEvents(ChatCompletionChunk chunk, RequestFormat format) {
        return switch (format) {
            case BEDROCK_CLAUDE -> List.copyOf(converter.toClaudeStreamEvents(chunk));
            case BEDROCK_TITAN -> {
                BedrockTitanStreamChunk titan = converter.toTitanStreamChunk(chunk);
                yield titan != null ? List.of(titan) : List.of();
            }
            case OPENAI -> chunk.hasChoices() ? List.of(chunk) : List.of();
        };
    }
}
