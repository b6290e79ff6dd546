package com.conduit.client;

import com.conduit.config.ConduitProperties;
import com.conduit.exception.ApiClientException;
import com.conduit.exception.ApiRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Abstract base class for provider clients with common retry and JSON handling.
 */
@Slf4j
public abstract class AbstractProviderClient {

    protected final ConduitProperties properties;
    protected final ObjectMapper objectMapper;

    protected AbstractProviderClient(ConduitProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Get provider name (e.g., "openai", "bedrock").
     */
    public abstract String getName();

    /**
     * Check if the client has what it needs to make calls.
     */
    public abstract boolean isConfigured();

    /**
     * Execute request with retry logic. The original failure is rethrown once retries run out.
     */
    protected <T> Mono<T> executeWithRetry(Mono<T> request) {
        return request
                .retryWhen(Retry.backoff(properties.getProxy().getMaxRetries(), Duration.ofSeconds(1))
                        .maxBackoff(Duration.ofSeconds(10))
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Retrying {} call (attempt {}): {}",
                                getName(), signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnSuccess(response -> log.debug("Request succeeded for provider: {}", getName()))
                .doOnError(error -> log.error("Request failed for provider: {}", getName(), error));
    }

    /**
     * Check if an error is retryable.
     */
    protected boolean isRetryable(Throwable throwable) {
        return throwable instanceof ApiClientException && ((ApiClientException) throwable).isRetryable();
    }

    protected JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ApiRequestException(getName() + " returned a body that is not valid JSON", e);
        }
    }
}
