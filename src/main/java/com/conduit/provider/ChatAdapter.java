package com.conduit.provider;

import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Interface for chat completion adapters.
 * Implementations translate the canonical request into a backend protocol, call the
 * backend and normalize its response or stream back into canonical form.
 */
public interface ChatAdapter {

    /**
     * Get adapter name (e.g., "openai", "bedrock").
     *
     * @return adapter name
     */
    String getName();

    /**
     * Model id this adapter instance was built for.
     *
     * @return resolved model id
     */
    String getModelId();

    /**
     * Complete a chat request.
     *
     * @param request canonical request; must not ask for streaming
     * @return canonical response
     */
    Mono<ChatCompletionResponse> chatCompletion(ChatCompletionRequest request);

    /**
     * Stream a chat completion. Every emitted chunk shares one id and created timestamp,
     * and exactly one chunk, the last, carries a finish reason.
     *
     * @param request canonical request; the stream flag is forced on
     * @return canonical chunks in provider order
     */
    Flux<ChatCompletionChunk> streamChatCompletion(ChatCompletionRequest request);
}
