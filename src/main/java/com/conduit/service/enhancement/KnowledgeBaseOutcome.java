package com.conduit.service.enhancement;

import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import lombok.Value;

/**
 * Result of knowledge-base enhancement: exactly one of a request to dispatch or a direct response.
 */
@Value
public class KnowledgeBaseOutcome {

    ChatCompletionRequest request;
    ChatCompletionResponse directResponse;

    public static KnowledgeBaseOutcome proceed(ChatCompletionRequest request) {
        return new KnowledgeBaseOutcome(request, null);
    }

    public static KnowledgeBaseOutcome respond(ChatCompletionResponse response) {
        return new KnowledgeBaseOutcome(null, response);
    }

    public boolean isDirect() {
        return directResponse != null;
    }
}
