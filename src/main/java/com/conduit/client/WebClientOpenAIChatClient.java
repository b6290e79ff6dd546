package com.conduit.client;

import com.conduit.config.ConduitProperties;
import com.conduit.exception.ApiConnectionException;
import com.conduit.exception.ApiRequestException;
import com.conduit.exception.ApiServerException;
import com.conduit.exception.AuthenticationException;
import com.conduit.exception.RateLimitException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * OpenAI Chat Completions client over Spring WebClient.
 */
@Slf4j
@Component
public class WebClientOpenAIChatClient extends AbstractProviderClient implements OpenAIChatClient {

    private static final String DONE = "[DONE]";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;

    public WebClientOpenAIChatClient(WebClient webClient, ConduitProperties properties, ObjectMapper objectMapper) {
        super(properties, objectMapper);
        this.webClient = webClient;
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    public boolean isConfigured() {
        String apiKey = properties.getOpenai().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<JsonNode> createChatCompletion(JsonNode payload) {
        log.info("Forwarding request to OpenAI: model={}", payload.path("model").asText());

        Mono<JsonNode> responseMono = webClient.post()
                .uri(endpoint())
                .headers(this::applyHeaders)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toException)
                .bodyToMono(JsonNode.class)
                .onErrorMap(WebClientRequestException.class,
                        e -> new ApiConnectionException("Could not reach OpenAI: " + e.getMessage(), e));

        return executeWithRetry(responseMono);
    }

    @Override
    public Flux<JsonNode> streamChatCompletion(JsonNode payload) {
        log.info("Opening OpenAI stream: model={}", payload.path("model").asText());

        return webClient.post()
                .uri(endpoint())
                .headers(this::applyHeaders)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toException)
                .bodyToFlux(SSE_TYPE)
                .mapNotNull(ServerSentEvent::data)
                .takeWhile(data -> !DONE.equals(data.trim()))
                .filter(data -> !data.isBlank())
                .map(this::readJson)
                .onErrorMap(WebClientRequestException.class,
                        e -> new ApiConnectionException("Could not reach OpenAI: " + e.getMessage(), e));
    }

    private String endpoint() {
        return properties.getOpenai().getBaseUrl() + "/chat/completions";
    }

    private void applyHeaders(HttpHeaders headers) {
        headers.setBearerAuth(properties.getOpenai().getApiKey());
        String organization = properties.getOpenai().getOrganization();
        if (organization != null && !organization.isBlank()) {
            headers.set("OpenAI-Organization", organization);
        }
    }

    private Mono<Throwable> toException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> translate(status, errorMessage(body)));
    }

    static Throwable translate(int status, String message) {
        if (status == 401 || status == 403) {
            return new AuthenticationException("OpenAI authentication failed: " + message);
        }
        if (status == 429) {
            return new RateLimitException("OpenAI rate limit exceeded: " + message);
        }
        if (status >= 500) {
            return new ApiServerException("OpenAI server error (" + status + "): " + message);
        }
        return new ApiRequestException("OpenAI request error (" + status + "): " + message);
    }

    // OpenAI error bodies look like {"error":{"message":...}}
    private String errorMessage(String body) {
        if (body.isBlank()) {
            return "no response body";
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.hasNonNull("message")) {
                return error.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("OpenAI error body is not JSON: {}", body);
        }
        return body;
    }
}
