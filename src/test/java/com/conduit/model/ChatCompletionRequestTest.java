package com.conduit.model;

import com.conduit.config.JacksonConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChatCompletionRequest validation and parsing.
 */
class ChatCompletionRequestTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.configure(new ObjectMapper());
    }

    @Test
    void testRequiresMessages() {
        assertThrows(IllegalArgumentException.class, () -> ChatCompletionRequest.builder()
                .model("gpt-4o")
                .messages(List.of())
                .build());
    }

    @Test
    void testTemperatureBounds() {
        assertThrows(IllegalArgumentException.class, () -> request().temperature(2.5).build());
        assertThrows(IllegalArgumentException.class, () -> request().temperature(-0.1).build());
        assertEquals(2.0, request().temperature(2.0).build().getTemperature());
    }

    @Test
    void testMaxTokensMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> request().maxTokens(0).build());
    }

    @Test
    void testIncompleteToolIsRejected() {
        Tool noDescription = Tool.function("lookup", null, objectMapper.createObjectNode());

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> request().tools(List.of(noDescription)).build());
        assertTrue(error.getMessage().contains("tools[0]"));
    }

    @Test
    void testCitationFormatIsValidated() {
        assertThrows(IllegalArgumentException.class, () -> request().citationFormat("mla").build());
        assertEquals("bedrock", request().citationFormat("bedrock").build().getCitationFormat());
    }

    @Test
    void testParsesExtensionFieldsAndStopAlias() throws Exception {
        String json = "{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}],"
                + "\"stop_sequences\":\"END\",\"file_ids\":[\"f1\",\"f2\"],\"knowledge_base_id\":\"kb-1\","
                + "\"auto_kb\":true,\"retrieval_config\":{\"top_k\":3},\"stream\":true}";

        ChatCompletionRequest request = objectMapper.readValue(json, ChatCompletionRequest.class);

        assertEquals(List.of("END"), request.getStop());
        assertEquals(List.of("f1", "f2"), request.getFileIds());
        assertEquals("kb-1", request.getKnowledgeBaseId());
        assertTrue(request.getAutoKb());
        assertEquals(3, request.getRetrievalConfig().path("top_k").asInt());
        assertTrue(request.isStreaming());
    }

    @Test
    void testToolUseRequested() {
        assertFalse(request().build().isToolUseRequested());
        assertTrue(request().toolChoice(objectMapper.getNodeFactory().textNode("auto")).build().isToolUseRequested());
        assertTrue(request()
                .tools(List.of(Tool.function("lookup", "Look up", objectMapper.createObjectNode())))
                .build()
                .isToolUseRequested());
    }

    @Test
    void testWithStreamCopiesRequest() {
        ChatCompletionRequest original = request().temperature(0.3).build();

        ChatCompletionRequest streaming = original.withStream(true);

        assertTrue(streaming.isStreaming());
        assertFalse(original.isStreaming());
        assertEquals(0.3, streaming.getTemperature());
    }

    private static ChatCompletionRequest.ChatCompletionRequestBuilder request() {
        return ChatCompletionRequest.builder()
                .model("gpt-4o")
                .messages(List.of(Message.user("hi")));
    }
}
