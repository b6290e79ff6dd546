package com.conduit.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.util.List;

/**
 * Reads {@code content} as either a JSON string or an array of typed blocks.
 */
public class MessageContentDeserializer extends JsonDeserializer<MessageContent> {

    @Override
    public MessageContent deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            return MessageContent.text(parser.getText());
        }
        if (token == JsonToken.START_ARRAY) {
            JavaType blockList = context.getTypeFactory().constructCollectionType(List.class, ContentBlock.class);
            List<ContentBlock> blocks = context.readValue(parser, blockList);
            return MessageContent.blocks(blocks);
        }
        return (MessageContent) context.handleUnexpectedToken(MessageContent.class, parser);
    }
}
