package com.conduit.service.enhancement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;

/**
 * Pass-through collaborators used when no knowledge-base or file service is wired in.
 */
@Slf4j
@Configuration
public class EnhancementConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public KnowledgeBaseEnhancer knowledgeBaseEnhancer() {
        return (request, rawBody) -> {
            log.debug("No knowledge-base service configured; request {} passes through", request.getModel());
            return Mono.just(KnowledgeBaseOutcome.proceed(request));
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public FileContextProvider fileContextProvider() {
        return fileIds -> {
            log.debug("No file service configured; ignoring {} file ids", fileIds.size());
            return Mono.empty();
        };
    }
}
