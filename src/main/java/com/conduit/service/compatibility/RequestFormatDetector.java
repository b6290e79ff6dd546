package com.conduit.service.compatibility;

import com.conduit.model.RequestFormat;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Detects the wire format of an inbound request body.
 *
 * Priority (first match wins):
 * 1. BEDROCK_CLAUDE - anthropic_version with Claude-shaped messages, or max_tokens and
 *    Claude-shaped messages together with a Claude-only field
 * 2. BEDROCK_TITAN - inputText with a textGenerationConfig object
 * 3. OPENAI - default
 *
 * Malformed bodies fall through to OPENAI and fail canonical validation.
 */
@Slf4j
@Service
public class RequestFormatDetector {

    private static final Set<String> CLAUDE_ROLES = Set.of("user", "assistant");
    private static final Set<String> CLAUDE_TOOL_CHOICE_TYPES = Set.of("auto", "any", "tool");

    /**
     * Detect request format from the body structure. Pure; never throws.
     *
     * @param body raw request body
     * @return detected format
     */
    public RequestFormat detect(JsonNode body) {
        if (body == null || !body.isObject()) {
            log.debug("Detected OPENAI format (body is not a JSON object)");
            return RequestFormat.OPENAI;
        }
        if (isBedrockClaude(body)) {
            log.debug("Detected BEDROCK_CLAUDE format");
            return RequestFormat.BEDROCK_CLAUDE;
        }
        if (isBedrockTitan(body)) {
            log.debug("Detected BEDROCK_TITAN format");
            return RequestFormat.BEDROCK_TITAN;
        }
        log.debug("Detected OPENAI format (default)");
        return RequestFormat.OPENAI;
    }

    boolean isBedrockClaude(JsonNode body) {
        if (!hasClaudeMessages(body.get("messages"))) {
            return false;
        }
        if (body.has("anthropic_version")) {
            return true;
        }
        return body.has("max_tokens") && hasClaudeOnlyField(body);
    }

    boolean isBedrockTitan(JsonNode body) {
        JsonNode config = body.get("textGenerationConfig");
        return body.has("inputText") && config != null && config.isObject();
    }

    private static boolean hasClaudeMessages(JsonNode messages) {
        if (messages == null || !messages.isArray() || messages.isEmpty()) {
            return false;
        }
        for (JsonNode message : messages) {
            if (!message.isObject() || !CLAUDE_ROLES.contains(message.path("role").asText())) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasClaudeOnlyField(JsonNode body) {
        JsonNode system = body.get("system");
        if (system != null && (system.isTextual() || system.isArray())) {
            return true;
        }
        if (body.has("top_k") || body.has("stop_sequences")) {
            return true;
        }
        JsonNode tools = body.get("tools");
        if (tools != null && tools.isArray()) {
            for (JsonNode tool : tools) {
                if (tool.has("input_schema")) {
                    return true;
                }
            }
        }
        JsonNode toolChoice = body.get("tool_choice");
        return toolChoice != null && toolChoice.isObject()
                && CLAUDE_TOOL_CHOICE_TYPES.contains(toolChoice.path("type").asText());
    }
}
