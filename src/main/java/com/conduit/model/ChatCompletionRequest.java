package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * OpenAI-compatible chat completion request, the canonical form every adapter consumes.
 * The {@code file_ids}, {@code knowledge_base_id}, {@code auto_kb}, {@code retrieval_config}
 * and {@code citation_format} extensions are read only by request enhancement.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatCompletionRequest {

    @JsonProperty("model")
    String model;

    @JsonProperty("messages")
    List<Message> messages;

    @JsonProperty("temperature")
    Double temperature;

    @JsonProperty("max_tokens")
    Integer maxTokens;

    @JsonProperty("stream")
    Boolean stream;

    @JsonProperty("top_p")
    Double topP;

    @JsonProperty("top_k")
    Integer topK;

    @JsonProperty("stop")
    List<String> stop;

    @JsonProperty("presence_penalty")
    Double presencePenalty;

    @JsonProperty("frequency_penalty")
    Double frequencyPenalty;

    @JsonProperty("user")
    String user;

    @JsonProperty("tools")
    List<Tool> tools;

    @JsonProperty("tool_choice")
    JsonNode toolChoice;

    @JsonProperty("file_ids")
    List<String> fileIds;

    @JsonProperty("knowledge_base_id")
    String knowledgeBaseId;

    @JsonProperty("auto_kb")
    Boolean autoKb;

    @JsonProperty("retrieval_config")
    JsonNode retrievalConfig;

    @JsonProperty("citation_format")
    String citationFormat;

    @Builder(toBuilder = true)
    @JsonCreator
    public ChatCompletionRequest(
            @JsonProperty("model") String model,
            @JsonProperty("messages") List<Message> messages,
            @JsonProperty("temperature") Double temperature,
            @JsonProperty("max_tokens") Integer maxTokens,
            @JsonProperty("stream") Boolean stream,
            @JsonProperty("top_p") Double topP,
            @JsonProperty("top_k") Integer topK,
            @JsonProperty("stop") @JsonAlias("stop_sequences")
            @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> stop,
            @JsonProperty("presence_penalty") Double presencePenalty,
            @JsonProperty("frequency_penalty") Double frequencyPenalty,
            @JsonProperty("user") String user,
            @JsonProperty("tools") List<Tool> tools,
            @JsonProperty("tool_choice") JsonNode toolChoice,
            @JsonProperty("file_ids") List<String> fileIds,
            @JsonProperty("knowledge_base_id") String knowledgeBaseId,
            @JsonProperty("auto_kb") Boolean autoKb,
            @JsonProperty("retrieval_config") JsonNode retrievalConfig,
            @JsonProperty("citation_format") String citationFormat) {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model is required");
        }
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("messages must contain at least one message");
        }
        if (temperature != null && (temperature < 0.0 || temperature > 2.0)) {
            throw new IllegalArgumentException("temperature must be between 0 and 2, got " + temperature);
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("max_tokens must be greater than 0, got " + maxTokens);
        }
        if (tools != null) {
            for (int i = 0; i < tools.size(); i++) {
                Tool tool = tools.get(i);
                if (tool == null || !tool.isComplete()) {
                    throw new IllegalArgumentException("tools[" + i
                            + "] must have type and function with name, description and parameters");
                }
            }
        }
        if (citationFormat != null && !"openai".equals(citationFormat) && !"bedrock".equals(citationFormat)) {
            throw new IllegalArgumentException("citation_format must be 'openai' or 'bedrock', got " + citationFormat);
        }

        this.model = model;
        this.messages = List.copyOf(messages);
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.stream = stream;
        this.topP = topP;
        this.topK = topK;
        this.stop = stop == null ? null : List.copyOf(stop);
        this.presencePenalty = presencePenalty;
        this.frequencyPenalty = frequencyPenalty;
        this.user = user;
        this.tools = tools == null ? null : List.copyOf(tools);
        this.toolChoice = toolChoice == null || toolChoice.isNull() ? null : toolChoice;
        this.fileIds = fileIds == null ? null : List.copyOf(fileIds);
        this.knowledgeBaseId = knowledgeBaseId;
        this.autoKb = autoKb;
        this.retrievalConfig = retrievalConfig == null || retrievalConfig.isNull() ? null : retrievalConfig;
        this.citationFormat = citationFormat;
    }

    @JsonIgnore
    public boolean isStreaming() {
        return Boolean.TRUE.equals(stream);
    }

    /**
     * @return true when tools or a tool choice were requested
     */
    @JsonIgnore
    public boolean isToolUseRequested() {
        return (tools != null && !tools.isEmpty()) || toolChoice != null;
    }

    /**
     * Copy of this request with the stream flag forced to the given value.
     */
    public ChatCompletionRequest withStream(boolean streaming) {
        return toBuilder().stream(streaming).build();
    }

    public ChatCompletionRequest withMessages(List<Message> replacement) {
        return toBuilder().messages(replacement).build();
    }
}
