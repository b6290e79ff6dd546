package com.conduit.provider;

import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.Delta;
import com.conduit.model.FinishReason;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Gives a canonical chunk stream exactly one terminal chunk: anything after the first
 * finish reason is dropped, and a {@code stop} chunk is appended when none arrived.
 */
public final class StreamTermination {

    private StreamTermination() {
    }

    /**
     * @param chunks  canonical chunks in provider order
     * @param id      stream id for a synthetic terminal chunk when nothing was emitted
     * @param created created timestamp for that chunk
     * @param model   model for that chunk
     */
    public static Flux<ChatCompletionChunk> endOnce(Flux<ChatCompletionChunk> chunks, String id, long created,
                                                    String model) {
        return Flux.defer(() -> {
            AtomicReference<ChatCompletionChunk> last = new AtomicReference<>();
            return chunks
                    .takeUntil(ChatCompletionChunk::isTerminal)
                    .doOnNext(last::set)
                    .concatWith(Mono.fromSupplier(() -> {
                        ChatCompletionChunk seen = last.get();
                        if (seen != null && seen.isTerminal()) {
                            return null;
                        }
                        return seen != null
                                ? stop(seen.getId(), seen.getCreated(), seen.getModel())
                                : stop(id, created, model);
                    }));
        });
    }

    static ChatCompletionChunk stop(String id, long created, String model) {
        return ChatCompletionChunk.builder()
                .id(id)
                .created(created)
                .model(model)
                .choices(List.of(ChatCompletionChunk.ChunkChoice.builder()
                        .index(0)
                        .delta(Delta.empty())
                        .finishReason(FinishReason.STOP.value())
                        .build()))
                .build();
    }
}
