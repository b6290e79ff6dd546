package com.conduit.service.enhancement;

import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ContentBlock;
import com.conduit.model.Message;
import com.conduit.model.MessageContent;
import com.conduit.model.TextBlock;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies file context and knowledge-base enhancement before dispatch. A failing
 * collaborator is logged and the request continues without that enhancement.
 */
@Slf4j
@Service
public class RequestEnhancer {

    private final KnowledgeBaseEnhancer knowledgeBase;
    private final FileContextProvider fileContext;

    public RequestEnhancer(KnowledgeBaseEnhancer knowledgeBase, FileContextProvider fileContext) {
        this.knowledgeBase = knowledgeBase;
        this.fileContext = fileContext;
    }

    public Mono<KnowledgeBaseOutcome> enhance(ChatCompletionRequest request, JsonNode rawBody) {
        return withFileContext(request)
                .flatMap(withFiles -> withKnowledgeBase(withFiles, rawBody));
    }

    private Mono<ChatCompletionRequest> withFileContext(ChatCompletionRequest request) {
        List<String> fileIds = request.getFileIds();
        if (fileIds == null || fileIds.isEmpty()) {
            return Mono.just(request);
        }
        return Mono.defer(() -> fileContext.fileContext(fileIds))
                .filter(context -> !context.isBlank())
                .map(context -> {
                    log.info("Adding context from {} files to request for {}", fileIds.size(), request.getModel());
                    return request.withMessages(spliceContext(request.getMessages(), context));
                })
                .defaultIfEmpty(request)
                .onErrorResume(error -> {
                    log.warn("File context failed for {}; continuing without it: {}",
                            fileIds, error.getMessage());
                    return Mono.just(request);
                });
    }

    private Mono<KnowledgeBaseOutcome> withKnowledgeBase(ChatCompletionRequest request, JsonNode rawBody) {
        boolean requested = request.getKnowledgeBaseId() != null || Boolean.TRUE.equals(request.getAutoKb());
        if (!requested) {
            return Mono.just(KnowledgeBaseOutcome.proceed(request));
        }
        return Mono.defer(() -> knowledgeBase.enhance(request, rawBody))
                .defaultIfEmpty(KnowledgeBaseOutcome.proceed(request))
                .doOnNext(outcome -> {
                    if (outcome.isDirect()) {
                        log.info("Knowledge base answered request for {} directly", request.getModel());
                    }
                })
                .onErrorResume(error -> {
                    log.warn("Knowledge-base enhancement failed for {}; continuing without it: {}",
                            request.getKnowledgeBaseId(), error.getMessage());
                    return Mono.just(KnowledgeBaseOutcome.proceed(request));
                });
    }

    /**
     * Prepend the context to the first user message, or add it as a leading system
     * message when there is no user message.
     */
    static List<Message> spliceContext(List<Message> messages, String context) {
        List<Message> result = new ArrayList<>(messages);
        for (int i = 0; i < result.size(); i++) {
            Message message = result.get(i);
            if (Message.ROLE_USER.equals(message.getRole())) {
                result.set(i, message.toBuilder().content(prepend(message.getContent(), context)).build());
                return result;
            }
        }
        result.add(0, Message.system(context));
        return result;
    }

    private static MessageContent prepend(MessageContent content, String context) {
        if (content == null) {
            return MessageContent.text(context);
        }
        if (content.isText()) {
            return MessageContent.text(context + "\n\n" + content.asText());
        }
        List<ContentBlock> blocks = new ArrayList<>();
        blocks.add(new TextBlock(context));
        blocks.addAll(content.asBlocks());
        return MessageContent.blocks(blocks);
    }
}
