package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Message content: either plain text or an ordered list of content blocks.
 * Serializes to a JSON string or a JSON array respectively.
 */
@JsonDeserialize(using = MessageContentDeserializer.class)
public interface MessageContent {

    static MessageContent text(String text) {
        return new Text(text);
    }

    static MessageContent blocks(List<ContentBlock> blocks) {
        return new Blocks(blocks);
    }

    boolean isText();

    /**
     * Flatten to text. Text blocks are joined with a single space; other blocks are skipped.
     */
    String asText();

    /**
     * View as blocks. Plain text becomes a single text block.
     */
    List<ContentBlock> asBlocks();

    @Value
    class Text implements MessageContent {

        @JsonValue
        String value;

        public Text(String value) {
            this.value = Objects.requireNonNull(value, "text content must not be null");
        }

        @Override
        public boolean isText() {
            return true;
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public List<ContentBlock> asBlocks() {
            return List.of(new TextBlock(value));
        }
    }

    @Value
    class Blocks implements MessageContent {

        @JsonValue
        List<ContentBlock> value;

        public Blocks(List<ContentBlock> value) {
            this.value = List.copyOf(value);
        }

        @Override
        public boolean isText() {
            return false;
        }

        @Override
        public String asText() {
            return value.stream()
                    .filter(TextBlock.class::isInstance)
                    .map(block -> ((TextBlock) block).getText())
                    .collect(Collectors.joining(" "));
        }

        @Override
        public List<ContentBlock> asBlocks() {
            return value;
        }
    }
}
