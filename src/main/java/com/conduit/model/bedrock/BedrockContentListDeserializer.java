package com.conduit.model.bedrock;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.util.List;

/**
 * Claude accepts message content as a bare string or a block list; both read as a block list.
 */
public class BedrockContentListDeserializer extends JsonDeserializer<List<BedrockContentBlock>> {

    @Override
    public List<BedrockContentBlock> deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken() == JsonToken.VALUE_STRING) {
            return List.of(BedrockContentBlock.text(parser.getText()));
        }
        JavaType blockList = context.getTypeFactory().constructCollectionType(List.class, BedrockContentBlock.class);
        return context.readValue(parser, blockList);
    }
}
