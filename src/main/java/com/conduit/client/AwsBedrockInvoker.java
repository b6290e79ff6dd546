package com.conduit.client;

import com.conduit.config.ConduitProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.async.SdkPublisher;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClientBuilder;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelWithResponseStreamRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelWithResponseStreamResponseHandler;
import software.amazon.awssdk.services.bedrockruntime.model.PayloadPart;
import software.amazon.awssdk.services.bedrockruntime.model.ResponseStream;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Bedrock Runtime invoker backed by the AWS SDK async client.
 */
@Slf4j
@Component
public class AwsBedrockInvoker extends AbstractProviderClient implements BedrockInvoker {

    private static final String APPLICATION_JSON = "application/json";

    private BedrockRuntimeAsyncClient bedrockClient;

    public AwsBedrockInvoker(ConduitProperties properties, ObjectMapper objectMapper) {
        super(properties, objectMapper);
        initializeBedrockClient();
    }

    /**
     * Initialize Bedrock async client. Static keys are used when configured, otherwise
     * the default AWS credential chain.
     */
    private void initializeBedrockClient() {
        ConduitProperties.BedrockConfig config = properties.getBedrock();
        if (isBlank(config.getRegion())) {
            log.info("No Bedrock region configured, Bedrock models are unavailable");
            return;
        }

        try {
            BedrockRuntimeAsyncClientBuilder builder = BedrockRuntimeAsyncClient.builder()
                    .region(Region.of(config.getRegion()))
                    .credentialsProvider(credentialsProvider(config));

            if (!isBlank(config.getEndpointOverride())) {
                builder.endpointOverride(URI.create(config.getEndpointOverride()));
            }

            bedrockClient = builder.build();
            log.info("Bedrock client initialized for region: {}", config.getRegion());

        } catch (RuntimeException e) {
            log.error("Failed to initialize Bedrock client", e);
        }
    }

    private AwsCredentialsProvider credentialsProvider(ConduitProperties.BedrockConfig config) {
        if (isBlank(config.getAccessKeyId()) || isBlank(config.getSecretAccessKey())) {
            log.debug("Using default AWS credential chain for Bedrock");
            return DefaultCredentialsProvider.create();
        }
        AwsCredentials credentials = isBlank(config.getSessionToken())
                ? AwsBasicCredentials.create(config.getAccessKeyId(), config.getSecretAccessKey())
                : AwsSessionCredentials.create(config.getAccessKeyId(), config.getSecretAccessKey(),
                        config.getSessionToken());
        return StaticCredentialsProvider.create(credentials);
    }

    @Override
    public String getName() {
        return "bedrock";
    }

    @Override
    public boolean isConfigured() {
        return bedrockClient != null;
    }

    @Override
    public Mono<JsonNode> invoke(String modelId, JsonNode body) {
        log.info("Forwarding request to Bedrock: model={}", modelId);

        InvokeModelRequest invokeRequest = InvokeModelRequest.builder()
                .modelId(modelId)
                .contentType(APPLICATION_JSON)
                .accept(APPLICATION_JSON)
                .body(SdkBytes.fromUtf8String(body.toString()))
                .build();

        Mono<JsonNode> call = Mono.defer(() -> Mono.fromFuture(bedrockClient.invokeModel(invokeRequest)))
                .map(response -> readJson(response.body().asUtf8String()))
                .onErrorMap(BedrockErrorTranslator::translate);

        return executeWithRetry(call);
    }

    @Override
    public Flux<JsonNode> invokeStream(String modelId, JsonNode body) {
        log.info("Opening Bedrock stream: model={}", modelId);

        InvokeModelWithResponseStreamRequest streamRequest = InvokeModelWithResponseStreamRequest.builder()
                .modelId(modelId)
                .contentType(APPLICATION_JSON)
                .accept(APPLICATION_JSON)
                .body(SdkBytes.fromUtf8String(body.toString()))
                .build();

        return Flux.defer(() -> {
            Sinks.One<SdkPublisher<ResponseStream>> eventStream = Sinks.one();
            InvokeModelWithResponseStreamResponseHandler handler = InvokeModelWithResponseStreamResponseHandler.builder()
                    .onEventStream(eventStream::tryEmitValue)
                    .onError(eventStream::tryEmitError)
                    .build();

            CompletableFuture<Void> call = bedrockClient.invokeModelWithResponseStream(streamRequest, handler);

            return eventStream.asMono()
                    .flatMapMany(Flux::from)
                    .ofType(PayloadPart.class)
                    .map(part -> readJson(part.bytes().asUtf8String()))
                    .doOnCancel(() -> {
                        log.debug("Bedrock stream cancelled: model={}", modelId);
                        call.cancel(true);
                    });
        }).onErrorMap(BedrockErrorTranslator::translate);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
