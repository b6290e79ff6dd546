package com.conduit.provider.bedrock;

import com.conduit.config.PropertiesGenerationDefaults;
import com.conduit.exception.ApiRequestException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.ImageBlock;
import com.conduit.model.Message;
import com.conduit.model.MessageContent;
import com.conduit.model.ModelFamily;
import com.conduit.model.TextBlock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NovaStrategy.
 */
class NovaStrategyTest {

    private static final String MODEL = "amazon.nova-pro-v1:0";

    private ObjectMapper objectMapper;
    private NovaStrategy strategy;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        strategy = new NovaStrategy(MODEL, PropertiesGenerationDefaults.builtIn(ModelFamily.NOVA), objectMapper);
    }

    @Test
    void testPayloadShape() {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(MODEL)
                .messages(List.of(Message.system("Be brief"), Message.user("Hi")))
                .topP(0.9)
                .topK(40)
                .build();

        ObjectNode payload = strategy.prepareRequestPayload(request);

        assertEquals("messages-v1", payload.get("schemaVersion").asText());
        assertEquals("Be brief", payload.get("system").get(0).get("text").asText());
        assertEquals("user", payload.get("messages").get(0).get("role").asText());
        assertEquals("Hi", payload.get("messages").get(0).get("content").get(0).get("text").asText());
        JsonNode config = payload.get("inferenceConfig");
        assertEquals(4096, config.get("maxTokens").asInt());
        assertEquals(0.9, config.get("topP").asDouble());
        assertEquals(40, config.get("topK").asInt());
    }

    @Test
    void testImageBlocksUseBytesSource() {
        Message message = Message.builder()
                .role("user")
                .content(MessageContent.blocks(List.of(new TextBlock("What is this?"),
                        ImageBlock.fromBase64("image/png", "AAAA"))))
                .build();
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(MODEL)
                .messages(List.of(message))
                .build();

        JsonNode content = strategy.prepareRequestPayload(request).get("messages").get(0).get("content");

        assertEquals("What is this?", content.get(0).get("text").asText());
        assertEquals("png", content.get(1).get("image").get("format").asText());
        assertEquals("AAAA", content.get(1).get("image").get("source").get("bytes").asText());
    }

    @Test
    void testToolMessagesBecomeUserTurns() {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(MODEL)
                .messages(List.of(Message.user("Hi"), Message.builder().role("tool").text("42").build()))
                .build();

        JsonNode toolTurn = strategy.prepareRequestPayload(request).get("messages").get(1);

        assertEquals("user", toolTurn.get("role").asText());
        assertEquals("Tool Response: 42", toolTurn.get("content").get(0).get("text").asText());
    }

    @Test
    void testParseResponse() throws Exception {
        JsonNode response = objectMapper.readTree("{\"output\":{\"message\":{\"role\":\"assistant\","
                + "\"content\":[{\"text\":\"Hello\"},{\"text\":\" there\"}]}},\"stopReason\":\"max_tokens\","
                + "\"usage\":{\"inputTokens\":4,\"outputTokens\":2}}");

        ChatCompletionResponse parsed = strategy.parseResponse(response, null);

        assertEquals("Hello there", parsed.getChoices().get(0).getMessage().textContent());
        assertEquals("length", parsed.getChoices().get(0).getFinishReason());
        assertEquals(6, parsed.getUsage().getTotalTokens());
    }

    @Test
    void testParseResponseWithoutOutputFails() throws Exception {
        assertThrows(ApiRequestException.class,
                () -> strategy.parseResponse(objectMapper.readTree("{\"usage\":{}}"), null));
    }

    @Test
    void testStreamEventsInBothShapes() throws Exception {
        ChatCompletionChunk keyed = strategy.handleStreamChunk(
                objectMapper.readTree("{\"contentBlockDelta\":{\"delta\":{\"text\":\"Hi\"},\"contentBlockIndex\":0}}"),
                null, "s", 1L);
        ChatCompletionChunk tagged = strategy.handleStreamChunk(
                objectMapper.readTree("{\"type\":\"contentBlockDelta\",\"delta\":{\"text\":\"!\"}}"), null, "s", 1L);
        ChatCompletionChunk stop = strategy.handleStreamChunk(
                objectMapper.readTree("{\"messageStop\":{\"stopReason\":\"end_turn\"}}"), null, "s", 1L);
        ChatCompletionChunk metadata = strategy.handleStreamChunk(
                objectMapper.readTree("{\"metadata\":{\"usage\":{\"inputTokens\":3}}}"), null, "s", 1L);

        assertEquals("Hi", keyed.firstChoice().getDelta().getContent());
        assertEquals("!", tagged.firstChoice().getDelta().getContent());
        assertEquals("stop", stop.firstChoice().getFinishReason());
        assertFalse(metadata.hasChoices());
    }
}
