package com.conduit.service;

import com.conduit.exception.ModelNotFoundException;
import com.conduit.exception.RequestValidationException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.RequestFormat;
import com.conduit.model.bedrock.BedrockClaudeRequest;
import com.conduit.model.bedrock.BedrockTitanRequest;
import com.conduit.provider.ChatAdapter;
import com.conduit.provider.reverse.BedrockToOpenAIAdapter;
import com.conduit.service.compatibility.RequestFormatDetector;
import com.conduit.service.enhancement.KnowledgeBaseOutcome;
import com.conduit.service.enhancement.RequestEnhancer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Unified chat completion entry point. Detects the body format, parses it into the
 * canonical request, routes it to an adapter, optionally enhances it, and answers with
 * either a complete response or an SSE stream in the requested output format.
 */
@Slf4j
@Service
public class ChatCompletionService {

    private final RequestFormatDetector detector;
    private final ProviderResolver resolver;
    private final AdapterRegistry registry;
    private final RequestEnhancer enhancer;
    private final StreamingService streamingService;
    private final ObjectMapper objectMapper;

    public ChatCompletionService(
            RequestFormatDetector detector,
            ProviderResolver resolver,
            AdapterRegistry registry,
            RequestEnhancer enhancer,
            StreamingService streamingService,
            ObjectMapper objectMapper) {
        this.detector = detector;
        this.resolver = resolver;
        this.registry = registry;
        this.enhancer = enhancer;
        this.streamingService = streamingService;
        this.objectMapper = objectMapper;
    }

    /**
     * Handle one chat completion call.
     *
     * @param body           raw request body in any supported format
     * @param outputSelector response shape selector (openai, bedrock-claude, bedrock-titan); null for openai
     * @return the response body, an SSE body of {@code Flux<String>}, or an error body with its status
     */
    public Mono<ResponseEntity<Object>> handle(JsonNode body, String outputSelector) {
        return Mono.defer(() -> {
            RequestFormat inputFormat = detector.detect(body);
            ChatCompletionRequest request = parse(body, inputFormat);
            ModelProvider provider = resolver.resolve(request.getModel());
            RequestFormat outputFormat = RequestFormat.fromSelector(outputSelector);
            log.info("Routing model '{}' to {} (input {}, output {}, stream={})",
                    request.getModel(), provider, inputFormat, outputFormat, request.isStreaming());

            return enhancer.enhance(request, body)
                    .flatMap(outcome -> dispatch(outcome, request, inputFormat, provider, outputFormat));
        }).onErrorResume(error -> {
            log.error("Chat completion failed: {}", error.getMessage());
            return Mono.just(ErrorResponses.toEntity(error));
        });
    }

    // ---- PARSE ----

    ChatCompletionRequest parse(JsonNode body, RequestFormat format) {
        if (body == null || !body.isObject()) {
            throw new RequestValidationException("Request body must be a JSON object");
        }
        String model = requestedModel(body, format);
        try {
            return switch (format) {
                case BEDROCK_CLAUDE -> registry.getReverseAdapter(model)
                        .toCanonical(objectMapper.treeToValue(body, BedrockClaudeRequest.class));
                case BEDROCK_TITAN -> registry.getReverseAdapter(model)
                        .toCanonical(objectMapper.treeToValue(body, BedrockTitanRequest.class));
                case OPENAI -> objectMapper.treeToValue(body, ChatCompletionRequest.class);
            };
        } catch (JsonProcessingException e) {
            throw new RequestValidationException("Invalid " + format + " request: " + rootMessage(e), e);
        } catch (IllegalArgumentException e) {
            throw new RequestValidationException("Invalid " + format + " request: " + e.getMessage(), e);
        }
    }

    private static String requestedModel(JsonNode body, RequestFormat format) {
        JsonNode model = body.get("model");
        if ((model == null || model.isNull()) && format == RequestFormat.BEDROCK_CLAUDE) {
            model = body.get("model_id");
        }
        if (model == null || !model.isTextual() || model.asText().isBlank()) {
            throw new ModelNotFoundException("Request does not name a model");
        }
        return model.asText();
    }

    private static String rootMessage(JsonProcessingException e) {
        Throwable cause = e.getCause();
        if (cause instanceof IllegalArgumentException && cause.getMessage() != null) {
            return cause.getMessage();
        }
        return e.getOriginalMessage();
    }

    // ---- DISPATCH ----

    private Mono<ResponseEntity<Object>> dispatch(KnowledgeBaseOutcome outcome, ChatCompletionRequest original,
                                                  RequestFormat inputFormat, ModelProvider provider,
                                                  RequestFormat outputFormat) {
        if (outcome.isDirect()) {
            ChatCompletionResponse direct = outcome.getDirectResponse();
            if (original.isStreaming()) {
                return Mono.just(sse(relay(streamingService.chunkResponse(direct), outputFormat,
                        original.getModel())));
            }
            return Mono.just(ok(reshape(direct, outputFormat, original.getModel())));
        }

        ChatCompletionRequest request = outcome.getRequest();
        ChatAdapter adapter = selectAdapter(inputFormat, provider, request.getModel());
        if (request.isStreaming()) {
            Flux<ChatCompletionChunk> chunks = adapter.streamChatCompletion(request);
            return Mono.just(sse(relay(chunks, outputFormat, adapter.getModelId())));
        }
        return adapter.chatCompletion(request)
                .map(response -> ok(reshape(response, outputFormat, adapter.getModelId())));
    }

    /**
     * Bedrock-shaped callers of an OpenAI model go through the reverse adapter.
     */
    private ChatAdapter selectAdapter(RequestFormat inputFormat, ModelProvider provider, String model) {
        if (inputFormat != RequestFormat.OPENAI && provider == ModelProvider.OPENAI) {
            return registry.getReverseAdapter(model);
        }
        return registry.getAdapter(provider, model);
    }

    private Object reshape(ChatCompletionResponse response, RequestFormat outputFormat, String fallbackModel) {
        if (outputFormat == RequestFormat.OPENAI) {
            return response;
        }
        String model = response.getModel() != null ? response.getModel() : fallbackModel;
        return registry.getReverseAdapter(model).toBedrockResponse(response, outputFormat);
    }

    // ---- STREAM_RESPOND ----

    /**
     * Re-shape chunks into the output format and frame them as SSE. When the first chunk
     * names a different model than the one routed on, re-shaping switches to that model's
     * reverse adapter for the rest of the stream.
     */
    Flux<String> relay(Flux<ChatCompletionChunk> chunks, RequestFormat outputFormat, String routedModel) {
        if (outputFormat == RequestFormat.OPENAI) {
            return streamingService.toSse(chunks);
        }
        Flux<Object> events = Flux.defer(() -> {
            AtomicReference<BedrockToOpenAIAdapter> shaper =
                    new AtomicReference<>(registry.getReverseAdapter(routedModel));
            AtomicBoolean first = new AtomicBoolean(true);
            return chunks.concatMapIterable(chunk -> {
                if (first.compareAndSet(true, false) && chunk.getModel() != null
                        && !chunk.getModel().equals(shaper.get().getModelId())) {
                    log.info("Stream resolved model {} (routed as {}); switching adapter", chunk.getModel(),
                            routedModel);
                    shaper.set(registry.getReverseAdapter(chunk.getModel()));
                }
                return shaper.get().toBedrockStreamEvents(chunk, outputFormat);
            });
        });
        return streamingService.toSse(events);
    }

    private static ResponseEntity<Object> ok(Object body) {
        return ResponseEntity.ok(body);
    }

    private static ResponseEntity<Object> sse(Flux<String> frames) {
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(frames);
    }
}
