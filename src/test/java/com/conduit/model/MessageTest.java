package com.conduit.model;

import com.conduit.config.JacksonConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Message construction and content handling.
 */
class MessageTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.configure(new ObjectMapper());
    }

    @Test
    void testRejectsUnknownRole() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> Message.builder().role("narrator").text("hi").build());
        assertTrue(error.getMessage().contains("narrator"));
    }

    @Test
    void testNonToolMessageNeedsContentOrToolCalls() {
        assertThrows(IllegalArgumentException.class, () -> Message.builder().role("user").build());

        Message toolMessage = Message.builder().role("tool").toolCallId("call_1").build();
        assertEquals("", toolMessage.textContent());
    }

    @Test
    void testToolCallWithoutArgumentsIsRejected() {
        ToolCall incomplete = ToolCall.builder()
                .id("call_1")
                .type("function")
                .function(new FunctionCall("lookup", null))
                .build();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> Message.builder().role("assistant").toolCalls(List.of(incomplete)).build());
        assertTrue(error.getMessage().contains("tool_calls[0]"));
    }

    @Test
    void testToolCallWithoutArgumentsIsRejectedWhenParsed() {
        String json = "{\"role\":\"assistant\",\"tool_calls\":[{\"id\":\"call_1\",\"type\":\"function\","
                + "\"function\":{\"name\":\"lookup\"}}]}";

        assertThrows(JsonMappingException.class, () -> objectMapper.readValue(json, Message.class));
    }

    @Test
    void testAssistantWithOnlyToolCallsIsValid() {
        Message message = Message.builder()
                .role("assistant")
                .toolCalls(List.of(ToolCall.function("call_1", "lookup", "{\"q\":\"x\"}")))
                .build();

        assertTrue(message.hasToolCalls());
        assertNull(message.getContent());
    }

    @Test
    void testStringContentDeserializesAsText() throws Exception {
        Message message = objectMapper.readValue("{\"role\":\"user\",\"content\":\"Hello\"}", Message.class);

        assertTrue(message.getContent().isText());
        assertEquals("Hello", message.textContent());
    }

    @Test
    void testBlockContentDeserializesAsBlocks() throws Exception {
        String json = "{\"role\":\"user\",\"content\":["
                + "{\"type\":\"text\",\"text\":\"What is\"},"
                + "{\"type\":\"image_url\",\"image_url\":{\"url\":\"data:image/png;base64,AAAA\"}},"
                + "{\"type\":\"text\",\"text\":\"this?\"}]}";

        Message message = objectMapper.readValue(json, Message.class);

        assertFalse(message.getContent().isText());
        List<ContentBlock> blocks = message.getContent().asBlocks();
        assertEquals(3, blocks.size());
        assertInstanceOf(ImageBlock.class, blocks.get(1));
        assertEquals("image/png", ((ImageBlock) blocks.get(1)).mediaType());
        assertEquals("AAAA", ((ImageBlock) blocks.get(1)).base64Data());
        assertEquals("What is this?", message.textContent());
    }

    @Test
    void testSerializesTextContentAsString() throws Exception {
        JsonNode json = objectMapper.valueToTree(Message.user("Hi"));

        assertEquals("user", json.get("role").asText());
        assertTrue(json.get("content").isTextual());
        assertEquals("Hi", json.get("content").asText());
        assertFalse(json.has("tool_calls"));
    }

    @Test
    void testSerializesBlocksWithTypeTags() throws Exception {
        Message message = Message.builder()
                .role("user")
                .content(MessageContent.blocks(List.of(new TextBlock("look"),
                        ImageBlock.fromBase64("image/jpeg", "BBBB"))))
                .build();

        String json = objectMapper.writeValueAsString(message);

        assertTrue(json.contains("{\"type\":\"text\",\"text\":\"look\"}"));
        assertTrue(json.contains("\"type\":\"image_url\""));
        assertTrue(json.contains("data:image/jpeg;base64,BBBB"));
    }
}
