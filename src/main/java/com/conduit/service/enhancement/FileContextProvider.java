package com.conduit.service.enhancement;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * File-context collaborator: turns uploaded file ids into a text blob for the prompt.
 */
public interface FileContextProvider {

    /**
     * @param fileIds ids from the request's {@code file_ids}
     * @return context text, or empty when there is nothing to add
     */
    Mono<String> fileContext(List<String> fileIds);
}
