package com.conduit.provider.openai;

import com.conduit.client.OpenAIChatClient;
import com.conduit.config.PropertiesGenerationDefaults;
import com.conduit.exception.ApiRequestException;
import com.conduit.exception.ConfigurationException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.Message;
import com.conduit.model.Tool;
import com.conduit.model.ToolCall;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for OpenAIAdapter.
 */
class OpenAIAdapterTest {

    private OpenAIChatClient client;
    private ObjectMapper objectMapper;
    private OpenAIAdapter adapter;

    @BeforeEach
    void setUp() {
        client = mock(OpenAIChatClient.class);
        when(client.isConfigured()).thenReturn(true);
        objectMapper = new ObjectMapper();
        adapter = new OpenAIAdapter("gpt-4o", client, PropertiesGenerationDefaults::builtIn, objectMapper);
    }

    private JsonNode json(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void testUnconfiguredClientIsRejected() {
        when(client.isConfigured()).thenReturn(false);

        assertThrows(ConfigurationException.class,
                () -> new OpenAIAdapter("gpt-4o", client, PropertiesGenerationDefaults::builtIn, objectMapper));
    }

    @Test
    void testPayloadAppliesDefaultsAndOmitsUnsetFields() {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model("gpt-4o")
                .messages(List.of(Message.user("Hi")))
                .build();

        ObjectNode payload = adapter.buildPayload(request, false);

        assertEquals("gpt-4o", payload.get("model").asText());
        assertEquals(0.7, payload.get("temperature").asDouble());
        assertEquals(1024, payload.get("max_tokens").asInt());
        assertEquals("Hi", payload.get("messages").get(0).get("content").asText());
        assertFalse(payload.has("top_p"));
        assertFalse(payload.has("tools"));
        assertFalse(payload.has("stream"));
        assertFalse(payload.has("file_ids"));
    }

    @Test
    void testPayloadCarriesOptionalFields() {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model("gpt-4o")
                .messages(List.of(Message.user("Hi")))
                .temperature(0.1)
                .maxTokens(20)
                .stop(List.of("END"))
                .presencePenalty(0.5)
                .user("u-1")
                .tools(List.of(Tool.function("lookup", "Look up", objectMapper.createObjectNode())))
                .toolChoice(objectMapper.getNodeFactory().textNode("required"))
                .build();

        ObjectNode payload = adapter.buildPayload(request, true);

        assertEquals(0.1, payload.get("temperature").asDouble());
        assertEquals(20, payload.get("max_tokens").asInt());
        assertEquals("END", payload.get("stop").get(0).asText());
        assertEquals(0.5, payload.get("presence_penalty").asDouble());
        assertEquals("u-1", payload.get("user").asText());
        assertEquals("lookup", payload.get("tools").get(0).get("function").get("name").asText());
        assertEquals("required", payload.get("tool_choice").asText());
        assertTrue(payload.get("stream").asBoolean());
    }

    @Test
    void testChatCompletionNormalizesResponse() {
        when(client.createChatCompletion(any())).thenReturn(Mono.just(json("{\"id\":\"chatcmpl-1\",\"created\":10,"
                + "\"model\":\"gpt-4o-2024\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\","
                + "\"content\":null,\"tool_calls\":[{\"id\":\"call_1\",\"type\":\"function\",\"function\":"
                + "{\"name\":\"lookup\",\"arguments\":\"{}\"}}]},\"finish_reason\":\"tool_calls\"}],"
                + "\"usage\":{\"prompt_tokens\":5,\"completion_tokens\":2,\"total_tokens\":7}}")));
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model("gpt-4o")
                .messages(List.of(Message.user("Hi")))
                .build();

        StepVerifier.create(adapter.chatCompletion(request))
                .assertNext(response -> {
                    assertEquals("chatcmpl-1", response.getId());
                    assertEquals("gpt-4o-2024", response.getModel());
                    Message message = response.getChoices().get(0).getMessage();
                    assertEquals("", message.textContent());
                    assertEquals("call_1", message.getToolCalls().get(0).getId());
                    assertEquals("tool_calls", response.getChoices().get(0).getFinishReason());
                    assertEquals(7, response.getUsage().getTotalTokens());
                })
                .verifyComplete();
    }

    @Test
    void testResponseWithoutChoicesFails() {
        assertThrows(ApiRequestException.class, () -> adapter.toResponse(json("{\"id\":\"x\",\"choices\":[]}")));
    }

    @Test
    void testToolCallDeltasAreReassembled() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();

        ChatCompletionChunk first = adapter.toChunk(json("{\"id\":\"c\",\"choices\":[{\"index\":0,\"delta\":{"
                + "\"tool_calls\":[{\"index\":0,\"id\":\"call_1\",\"type\":\"function\","
                + "\"function\":{\"name\":\"lookup\",\"arguments\":\"\"}}]}}]}"), accumulator, "s", 1L);
        ChatCompletionChunk second = adapter.toChunk(json("{\"id\":\"c\",\"choices\":[{\"index\":0,\"delta\":{"
                + "\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"{\\\"q\\\":\"}}]}}]}"), accumulator, "s", 1L);
        adapter.toChunk(json("{\"id\":\"c\",\"choices\":[{\"index\":0,\"delta\":{"
                + "\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"\\\"x\\\"}\"}}]}}]}"), accumulator, "s", 1L);

        ToolCall opening = first.firstChoice().getDelta().getToolCalls().get(0);
        assertEquals("call_1", opening.getId());
        assertEquals("function", opening.getType());
        assertEquals("lookup", opening.getFunction().getName());

        ToolCall fragment = second.firstChoice().getDelta().getToolCalls().get(0);
        assertEquals(Integer.valueOf(0), fragment.getIndex());
        assertNull(fragment.getId());
        assertNull(fragment.getType());
        assertNull(fragment.getFunction().getName());
        assertEquals("{\"q\":", fragment.getFunction().getArguments());

        List<ToolCall> assembled = accumulator.assembled();
        assertEquals(1, assembled.size());
        assertEquals("call_1", assembled.get(0).getId());
        assertEquals("lookup", assembled.get(0).getFunction().getName());
        assertEquals("{\"q\":\"x\"}", assembled.get(0).getFunction().getArguments());
    }

    @Test
    void testClientJoiningDeltasByIndexSeesEachFieldOnce() {
        when(client.streamChatCompletion(any())).thenReturn(Flux.just(
                json("{\"id\":\"c\",\"choices\":[{\"index\":0,\"delta\":{\"tool_calls\":[{\"index\":0,"
                        + "\"id\":\"call_1\",\"type\":\"function\",\"function\":{\"name\":\"lookup\",\"arguments\":\"\"}}]}}]}"),
                json("{\"id\":\"c\",\"choices\":[{\"index\":0,\"delta\":{\"tool_calls\":[{\"index\":0,"
                        + "\"id\":\"call_1\",\"function\":{\"name\":\"lookup\",\"arguments\":\"{\\\"q\\\":\"}}]}}]}"),
                json("{\"id\":\"c\",\"choices\":[{\"index\":0,\"delta\":{\"tool_calls\":[{\"index\":0,"
                        + "\"function\":{\"arguments\":\"1}\"}}]},\"finish_reason\":\"tool_calls\"}]}")));
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model("gpt-4o")
                .messages(List.of(Message.user("Look it up")))
                .stream(true)
                .build();

        List<ChatCompletionChunk> chunks = adapter.streamChatCompletion(request).collectList().block();

        assertNotNull(chunks);
        StringBuilder id = new StringBuilder();
        StringBuilder name = new StringBuilder();
        StringBuilder arguments = new StringBuilder();
        for (ChatCompletionChunk chunk : chunks) {
            List<ToolCall> calls = chunk.firstChoice().getDelta().getToolCalls();
            if (calls == null) {
                continue;
            }
            ToolCall call = calls.get(0);
            if (call.getId() != null) {
                id.append(call.getId());
            }
            if (call.getFunction() != null && call.getFunction().getName() != null) {
                name.append(call.getFunction().getName());
            }
            if (call.getFunction() != null && call.getFunction().getArguments() != null) {
                arguments.append(call.getFunction().getArguments());
            }
        }
        assertEquals("call_1", id.toString());
        assertEquals("lookup", name.toString());
        assertEquals("{\"q\":1}", arguments.toString());
    }

    @Test
    void testChunksWithoutUpstreamIdShareOneStreamId() {
        when(client.streamChatCompletion(any())).thenReturn(Flux.just(
                json("{\"model\":\"gpt-4o\",\"choices\":[{\"index\":0,\"delta\":{\"content\":\"Hi\"}}]}"),
                json("{\"model\":\"gpt-4o\",\"choices\":[{\"index\":0,\"delta\":{\"content\":\" there\"}}]}")));
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model("gpt-4o")
                .messages(List.of(Message.user("Hi")))
                .build();

        List<ChatCompletionChunk> chunks = adapter.streamChatCompletion(request).collectList().block();

        assertNotNull(chunks);
        assertEquals(3, chunks.size());
        String id = chunks.get(0).getId();
        assertNotNull(id);
        assertTrue(id.startsWith("chatcmpl-"));
        chunks.forEach(chunk -> {
            assertEquals(id, chunk.getId());
            assertTrue(chunk.getCreated() > 0);
        });
    }

    @Test
    void testStreamDropsUsageOnlyEventsAndEndsOnce() {
        when(client.streamChatCompletion(any())).thenReturn(Flux.just(
                json("{\"id\":\"c\",\"created\":1,\"model\":\"gpt-4o\",\"choices\":[{\"index\":0,"
                        + "\"delta\":{\"role\":\"assistant\",\"content\":\"Hi\"},\"finish_reason\":null}]}"),
                json("{\"id\":\"c\",\"created\":1,\"model\":\"gpt-4o\",\"choices\":[{\"index\":0,"
                        + "\"delta\":{},\"finish_reason\":\"stop\"}]}"),
                json("{\"id\":\"c\",\"created\":1,\"model\":\"gpt-4o\",\"choices\":[],"
                        + "\"usage\":{\"prompt_tokens\":1,\"completion_tokens\":1,\"total_tokens\":2}}")));
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model("gpt-4o")
                .messages(List.of(Message.user("Hi")))
                .stream(true)
                .build();

        StepVerifier.create(adapter.streamChatCompletion(request))
                .assertNext(chunk -> assertEquals("Hi", chunk.firstChoice().getDelta().getContent()))
                .assertNext(chunk -> assertEquals("stop", chunk.firstChoice().getFinishReason()))
                .verifyComplete();
    }

    @Test
    void testStreamWithoutFinishReasonGetsSyntheticStop() {
        when(client.streamChatCompletion(any())).thenReturn(Flux.just(
                json("{\"id\":\"c\",\"created\":3,\"model\":\"gpt-4o\",\"choices\":[{\"index\":0,"
                        + "\"delta\":{\"content\":\"Hi\"}}]}")));
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model("gpt-4o")
                .messages(List.of(Message.user("Hi")))
                .build();

        StepVerifier.create(adapter.streamChatCompletion(request))
                .expectNextCount(1)
                .assertNext(chunk -> {
                    assertEquals("c", chunk.getId());
                    assertEquals(3, chunk.getCreated());
                    assertEquals("stop", chunk.firstChoice().getFinishReason());
                })
                .verifyComplete();
    }
}
