package com.conduit.service;

import com.conduit.config.ConduitProperties;
import com.conduit.exception.GatewayException;
import com.conduit.exception.StreamingException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.Choice;
import com.conduit.model.Delta;
import com.conduit.model.ErrorResponse;
import com.conduit.model.FinishReason;
import com.conduit.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * SSE framing for streamed responses, and deterministic replay of a complete response
 * as a chunk sequence.
 */
@Slf4j
@Service
public class StreamingService {

    static final String DONE_FRAME = "data: [DONE]\n\n";

    // Characters per replayed content chunk
    private static final int CHUNK_SIZE = 8;

    private final ConduitProperties properties;
    private final ObjectMapper objectMapper;

    public StreamingService(ConduitProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Serialize events as SSE frames. A failure ends the stream with one error frame;
     * the {@code [DONE]} sentinel follows only a clean completion, and only when enabled.
     */
    public Flux<String> toSse(Flux<?> events) {
        Flux<String> frames = events.map(this::formatAsSSE);
        if (properties.getStreaming().isDoneSentinel()) {
            frames = frames.concatWith(Flux.just(DONE_FRAME));
        }
        return frames.onErrorResume(error -> Flux.just(errorFrame(error)));
    }

    /**
     * Final frame for a stream that failed after it started.
     */
    public String errorFrame(Throwable error) {
        GatewayException failure = error instanceof GatewayException
                ? (GatewayException) error
                : new StreamingException(error.getMessage(), error);
        log.error("Streaming failed: {}", failure.getMessage(), error);
        ErrorResponse body = ErrorResponse.of("Streaming error: " + failure.getMessage(),
                failure.getErrorType(), failure.getErrorCode());
        return formatAsSSE(body);
    }

    /**
     * Chunk a complete response into streaming chunks: a role chunk, content split at
     * word boundaries, and a final chunk with the finish reason. Same input, same chunks.
     */
    public Flux<ChatCompletionChunk> chunkResponse(ChatCompletionResponse response) {
        List<ChatCompletionChunk> chunks = new ArrayList<>();
        Choice choice = response.firstChoice();
        if (choice == null) {
            chunks.add(chunk(response, Delta.empty(), FinishReason.STOP.value()));
            return Flux.fromIterable(chunks);
        }

        Message message = choice.getMessage();
        String role = message != null ? message.getRole() : Message.ROLE_ASSISTANT;
        chunks.add(chunk(response, Delta.builder().role(role).build(), null));

        String content = message != null ? message.textContent() : "";
        for (String part : splitContentDeterministically(content)) {
            chunks.add(chunk(response, Delta.builder().content(part).build(), null));
        }
        if (message != null && message.hasToolCalls()) {
            chunks.add(chunk(response, Delta.builder().toolCalls(message.getToolCalls()).build(), null));
        }

        String finishReason = choice.getFinishReason() != null ? choice.getFinishReason() : FinishReason.STOP.value();
        chunks.add(chunk(response, Delta.empty(), finishReason));
        log.debug("Replaying response {} as {} chunks", response.getId(), chunks.size());
        return Flux.fromIterable(chunks);
    }

    /**
     * Split content into chunks, extending a chunk to a nearby word boundary when one is close.
     * A chunk never ends between the two halves of a surrogate pair.
     */
    static List<String> splitContentDeterministically(String content) {
        List<String> chunks = new ArrayList<>();
        int pos = 0;
        while (pos < content.length()) {
            int endPos = Math.min(pos + CHUNK_SIZE, content.length());
            if (endPos < content.length()) {
                for (int i = endPos; i < Math.min(endPos + 3, content.length()); i++) {
                    if (Character.isWhitespace(content.charAt(i))) {
                        endPos = i + 1;
                        break;
                    }
                }
            }
            if (endPos < content.length() && endPos > pos + 1
                    && Character.isHighSurrogate(content.charAt(endPos - 1))) {
                endPos--;
            }
            chunks.add(content.substring(pos, endPos));
            pos = endPos;
        }
        return chunks;
    }

    private static ChatCompletionChunk chunk(ChatCompletionResponse response, Delta delta, String finishReason) {
        return ChatCompletionChunk.builder()
                .id(response.getId())
                .created(response.getCreated())
                .model(response.getModel())
                .systemFingerprint(response.getSystemFingerprint())
                .choices(List.of(ChatCompletionChunk.ChunkChoice.builder()
                        .index(0)
                        .delta(delta)
                        .finishReason(finishReason)
                        .build()))
                .build();
    }

    /**
     * Format an event as an SSE message.
     */
    String formatAsSSE(Object event) {
        try {
            return "data: " + objectMapper.writeValueAsString(event) + "\n\n";
        } catch (JsonProcessingException e) {
            throw new StreamingException("Could not serialize stream event", e);
        }
    }
}
