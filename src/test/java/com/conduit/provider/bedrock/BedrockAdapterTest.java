package com.conduit.provider.bedrock;

import com.conduit.client.BedrockInvoker;
import com.conduit.config.PropertiesGenerationDefaults;
import com.conduit.exception.ApiRequestException;
import com.conduit.exception.ConfigurationException;
import com.conduit.exception.RateLimitException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.Message;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for BedrockAdapter request flow and stream termination.
 */
class BedrockAdapterTest {

    private static final String CLAUDE = "anthropic.claude-3-sonnet-20240229-v1:0";

    private BedrockInvoker invoker;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        invoker = mock(BedrockInvoker.class);
        when(invoker.isConfigured()).thenReturn(true);
        objectMapper = new ObjectMapper();
    }

    private BedrockAdapter adapter(String model) {
        return new BedrockAdapter(model, invoker, PropertiesGenerationDefaults::builtIn, objectMapper);
    }

    private static ChatCompletionRequest request(String model) {
        return ChatCompletionRequest.builder()
                .model(model)
                .messages(List.of(Message.user("Hi")))
                .build();
    }

    private Flux<JsonNode> events(String... json) {
        return Flux.fromArray(json).map(text -> {
            try {
                return objectMapper.readTree(text);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
    }

    @Test
    void testUnconfiguredInvokerIsRejected() {
        when(invoker.isConfigured()).thenReturn(false);

        assertThrows(ConfigurationException.class, () -> adapter(CLAUDE));
    }

    @Test
    void testAliasResolvesToFullModelId() {
        BedrockAdapter adapter = adapter("claude-3-haiku");

        assertEquals("anthropic.claude-3-haiku-20240307-v1:0", adapter.getModelId());
        assertInstanceOf(ClaudeStrategy.class, adapter.getStrategy());
        assertEquals("bedrock", adapter.getName());
    }

    @Test
    void testChatCompletionInvokesAndParses() throws Exception {
        JsonNode response = objectMapper.readTree("{\"content\":[{\"type\":\"text\",\"text\":\"Hello\"}],"
                + "\"stop_reason\":\"end_turn\",\"usage\":{\"input_tokens\":3,\"output_tokens\":1}}");
        when(invoker.invoke(eq(CLAUDE), any())).thenReturn(Mono.just(response));

        StepVerifier.create(adapter(CLAUDE).chatCompletion(request(CLAUDE)))
                .assertNext(result -> {
                    assertEquals("Hello", result.getChoices().get(0).getMessage().textContent());
                    assertEquals("stop", result.getChoices().get(0).getFinishReason());
                })
                .verifyComplete();

        ArgumentCaptor<JsonNode> payload = ArgumentCaptor.forClass(JsonNode.class);
        verify(invoker).invoke(eq(CLAUDE), payload.capture());
        assertEquals("bedrock-2023-05-31", payload.getValue().get("anthropic_version").asText());
    }

    @Test
    void testChatCompletionRejectsStreamingRequest() {
        StepVerifier.create(adapter(CLAUDE).chatCompletion(request(CLAUDE).withStream(true)))
                .expectError(ApiRequestException.class)
                .verify();
        verify(invoker, never()).invoke(any(), any());
    }

    @Test
    void testClaudeStreamYieldsTextThenOneTerminalChunk() {
        when(invoker.invokeStream(eq(CLAUDE), any())).thenReturn(events(
                "{\"type\":\"message_start\",\"message\":{\"id\":\"msg_1\"}}",
                "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Hel\"}}",
                "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"lo\"}}",
                "{\"type\":\"content_block_stop\",\"index\":0}",
                "{\"type\":\"message_delta\",\"delta\":{\"stop_reason\":\"end_turn\"}}",
                "{\"type\":\"message_stop\"}"));

        List<ChatCompletionChunk> chunks = adapter(CLAUDE).streamChatCompletion(request(CLAUDE))
                .collectList()
                .block();

        assertNotNull(chunks);
        assertEquals(3, chunks.size());
        String text = chunks.stream()
                .map(chunk -> chunk.firstChoice().getDelta().getContent())
                .filter(content -> content != null)
                .collect(Collectors.joining());
        assertEquals("Hello", text);
        assertNull(chunks.get(0).firstChoice().getFinishReason());
        assertNull(chunks.get(1).firstChoice().getFinishReason());
        assertEquals("stop", chunks.get(2).firstChoice().getFinishReason());
        assertTrue(chunks.stream().allMatch(chunk -> chunk.getId().equals(chunks.get(0).getId())));
        assertTrue(chunks.get(0).getId().startsWith("br-claude-"));
    }

    @Test
    void testStreamWithoutFinishReasonGetsSyntheticStop() {
        String model = "meta.llama3-8b-instruct-v1:0";
        when(invoker.invokeStream(eq(model), any())).thenReturn(events(
                "{\"generation\":\"Hi\"}",
                "{\"generation\":\" there\"}"));

        StepVerifier.create(adapter(model).streamChatCompletion(request(model)))
                .assertNext(chunk -> assertEquals("Hi", chunk.firstChoice().getDelta().getContent()))
                .assertNext(chunk -> assertEquals(" there", chunk.firstChoice().getDelta().getContent()))
                .assertNext(chunk -> assertEquals("stop", chunk.firstChoice().getFinishReason()))
                .verifyComplete();
    }

    @Test
    void testEmptyStreamStillTerminates() {
        String model = "amazon.titan-text-express-v1";
        when(invoker.invokeStream(eq(model), any())).thenReturn(Flux.empty());

        StepVerifier.create(adapter(model).streamChatCompletion(request(model)))
                .assertNext(chunk -> {
                    assertEquals("stop", chunk.firstChoice().getFinishReason());
                    assertEquals(model, chunk.getModel());
                })
                .verifyComplete();
    }

    @Test
    void testChunksAfterTerminalAreDropped() {
        String model = "amazon.titan-text-express-v1";
        when(invoker.invokeStream(eq(model), any())).thenReturn(events(
                "{\"outputText\":\"Hi\",\"completionReason\":\"FINISH\"}",
                "{\"outputText\":\"extra\",\"completionReason\":\"LENGTH\"}"));

        StepVerifier.create(adapter(model).streamChatCompletion(request(model)))
                .assertNext(chunk -> {
                    assertEquals("Hi", chunk.firstChoice().getDelta().getContent());
                    assertEquals("stop", chunk.firstChoice().getFinishReason());
                })
                .verifyComplete();
    }

    @Test
    void testStreamErrorPropagates() {
        when(invoker.invokeStream(eq(CLAUDE), any())).thenReturn(Flux.error(new RateLimitException("slow down")));

        StepVerifier.create(adapter(CLAUDE).streamChatCompletion(request(CLAUDE)))
                .expectError(RateLimitException.class)
                .verify();
    }
}
