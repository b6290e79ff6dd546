package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Bedrock Claude Messages request as a Bedrock-native caller sends it. The {@code model}
 * (or {@code model_id}) field is a gateway addition used for routing.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BedrockClaudeRequest {

    public static final String DEFAULT_ANTHROPIC_VERSION = "bedrock-2023-05-31";

    @JsonProperty("model")
    String model;

    @JsonProperty("anthropic_version")
    String anthropicVersion;

    @JsonProperty("max_tokens")
    int maxTokens;

    @JsonProperty("messages")
    List<BedrockClaudeMessage> messages;

    @JsonProperty("system")
    String system;

    @JsonProperty("temperature")
    Double temperature;

    @JsonProperty("top_p")
    Double topP;

    @JsonProperty("top_k")
    Integer topK;

    @JsonProperty("stop_sequences")
    List<String> stopSequences;

    @JsonProperty("tools")
    List<BedrockTool> tools;

    @JsonProperty("tool_choice")
    BedrockToolChoice toolChoice;

    @JsonProperty("stream")
    Boolean stream;

    @Builder
    @JsonCreator
    public BedrockClaudeRequest(
            @JsonProperty("model") @JsonAlias("model_id") String model,
            @JsonProperty("anthropic_version") String anthropicVersion,
            @JsonProperty("max_tokens") Integer maxTokens,
            @JsonProperty("messages") List<BedrockClaudeMessage> messages,
            @JsonProperty("system") JsonNode system,
            @JsonProperty("temperature") Double temperature,
            @JsonProperty("top_p") Double topP,
            @JsonProperty("top_k") Integer topK,
            @JsonProperty("stop_sequences") List<String> stopSequences,
            @JsonProperty("tools") List<BedrockTool> tools,
            @JsonProperty("tool_choice") BedrockToolChoice toolChoice,
            @JsonProperty("stream") Boolean stream) {
        if (maxTokens == null || maxTokens <= 0) {
            throw new IllegalArgumentException("max_tokens is required and must be greater than 0");
        }
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("messages must contain at least one message");
        }
        checkUnitRange("temperature", temperature);
        checkUnitRange("top_p", topP);
        if (topK != null && topK < 0) {
            throw new IllegalArgumentException("top_k must not be negative, got " + topK);
        }
        this.model = model;
        this.anthropicVersion = anthropicVersion != null ? anthropicVersion : DEFAULT_ANTHROPIC_VERSION;
        this.maxTokens = maxTokens;
        this.messages = List.copyOf(messages);
        this.system = systemText(system);
        this.temperature = temperature;
        this.topP = topP;
        this.topK = topK;
        this.stopSequences = stopSequences == null ? null : List.copyOf(stopSequences);
        this.tools = tools == null ? null : List.copyOf(tools);
        this.toolChoice = toolChoice;
        this.stream = stream;
    }

    private static void checkUnitRange(String field, Double value) {
        if (value != null && (value < 0.0 || value > 1.0)) {
            throw new IllegalArgumentException(field + " must be between 0 and 1, got " + value);
        }
    }

    // system may be a string or a list of text blocks
    private static String systemText(JsonNode system) {
        if (system == null || system.isNull()) {
            return null;
        }
        if (system.isTextual()) {
            return system.asText();
        }
        if (system.isArray()) {
            StringBuilder text = new StringBuilder();
            for (JsonNode block : system) {
                if (block.hasNonNull("text")) {
                    if (text.length() > 0) {
                        text.append('\n');
                    }
                    text.append(block.get("text").asText());
                }
            }
            return text.toString();
        }
        throw new IllegalArgumentException("system must be a string or a list of text blocks");
    }
}
