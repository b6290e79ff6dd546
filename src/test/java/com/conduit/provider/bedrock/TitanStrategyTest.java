package com.conduit.provider.bedrock;

import com.conduit.config.PropertiesGenerationDefaults;
import com.conduit.exception.ApiRequestException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.Message;
import com.conduit.model.ModelFamily;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TitanStrategy.
 */
class TitanStrategyTest {

    private static final String MODEL = "amazon.titan-text-express-v1";

    private ObjectMapper objectMapper;
    private TitanStrategy strategy;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        strategy = new TitanStrategy(MODEL, PropertiesGenerationDefaults.builtIn(ModelFamily.TITAN), objectMapper);
    }

    @Test
    void testPayloadRendersUserBotPrompt() {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(MODEL)
                .messages(List.of(Message.user("Capital of France?")))
                .maxTokens(10)
                .build();

        ObjectNode payload = strategy.prepareRequestPayload(request);

        assertEquals("User: Capital of France?\nBot:", payload.get("inputText").asText());
        assertEquals(10, payload.get("textGenerationConfig").get("maxTokenCount").asInt());
        assertEquals(0.7, payload.get("textGenerationConfig").get("temperature").asDouble());
        assertFalse(payload.get("textGenerationConfig").has("stopSequences"));
    }

    @Test
    void testPayloadIncludesSystemAndHistory() {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(MODEL)
                .messages(List.of(Message.system("Be brief"), Message.user("Hi"), Message.assistant("Hello"),
                        Message.user("Bye")))
                .stop(List.of("User:"))
                .build();

        ObjectNode payload = strategy.prepareRequestPayload(request);

        assertEquals("System: Be brief\nUser: Hi\nBot: Hello\nUser: Bye\nBot:", payload.get("inputText").asText());
        assertEquals(512, payload.get("textGenerationConfig").get("maxTokenCount").asInt());
        assertEquals("User:", payload.get("textGenerationConfig").get("stopSequences").get(0).asText());
    }

    @Test
    void testParseResponse() throws Exception {
        JsonNode response = objectMapper.readTree("{\"inputTextTokenCount\":5,\"results\":"
                + "[{\"tokenCount\":3,\"outputText\":\"Paris.\",\"completionReason\":\"FINISH\"}]}");

        ChatCompletionResponse parsed = strategy.parseResponse(response, null);

        assertEquals("Paris.", parsed.getChoices().get(0).getMessage().textContent());
        assertEquals("stop", parsed.getChoices().get(0).getFinishReason());
        assertEquals(5, parsed.getUsage().getPromptTokens());
        assertEquals(3, parsed.getUsage().getCompletionTokens());
        assertEquals(8, parsed.getUsage().getTotalTokens());
        assertEquals(MODEL, parsed.getModel());
        assertTrue(parsed.getId().startsWith("bedrock-titan-"));
    }

    @Test
    void testParseResponseMapsLengthAndContentFilter() throws Exception {
        JsonNode length = objectMapper.readTree("{\"results\":[{\"outputText\":\"x\",\"completionReason\":\"LENGTH\"}]}");
        JsonNode filtered = objectMapper.readTree(
                "{\"results\":[{\"outputText\":\"\",\"completionReason\":\"CONTENT_FILTERED\"}]}");

        assertEquals("length", strategy.parseResponse(length, null).getChoices().get(0).getFinishReason());
        assertEquals("content_filter", strategy.parseResponse(filtered, null).getChoices().get(0).getFinishReason());
    }

    @Test
    void testParseResponseWithNoResultsFails() throws Exception {
        JsonNode response = objectMapper.readTree("{\"results\":[]}");

        assertThrows(ApiRequestException.class, () -> strategy.parseResponse(response, null));
    }

    @Test
    void testStreamChunks() throws Exception {
        ChatCompletionChunk text = strategy.handleStreamChunk(
                objectMapper.readTree("{\"outputText\":\"Par\",\"index\":0}"), null, "s", 2L);
        ChatCompletionChunk last = strategy.handleStreamChunk(
                objectMapper.readTree("{\"outputText\":\"\",\"completionReason\":\"FINISH\"}"), null, "s", 2L);
        ChatCompletionChunk metrics = strategy.handleStreamChunk(
                objectMapper.readTree("{\"amazon-bedrock-invocationMetrics\":{\"inputTokenCount\":5}}"), null, "s", 2L);

        assertEquals("Par", text.firstChoice().getDelta().getContent());
        assertEquals("stop", last.firstChoice().getFinishReason());
        assertFalse(metrics.hasChoices());
    }
}
