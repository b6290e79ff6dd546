package com.conduit.service;

import com.conduit.client.BedrockInvoker;
import com.conduit.client.OpenAIChatClient;
import com.conduit.config.ConduitProperties;
import com.conduit.provider.ChatAdapter;
import com.conduit.provider.GenerationDefaultsProvider;
import com.conduit.provider.bedrock.BedrockAdapter;
import com.conduit.provider.openai.OpenAIAdapter;
import com.conduit.provider.reverse.BedrockFormatConverter;
import com.conduit.provider.reverse.BedrockToOpenAIAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.util.TreeMap;

/**
 * Process-wide cache of adapter instances keyed by adapter kind, model id and a fingerprint
 * of the configuration the adapter was built with. Adapters are immutable once built;
 * construction on a miss happens at most once per key at a time.
 */
@Slf4j
@Service
public class AdapterRegistry {

    private final Cache<AdapterKey, ChatAdapter> cache;
    private final OpenAIChatClient openAIClient;
    private final BedrockInvoker bedrockInvoker;
    private final GenerationDefaultsProvider defaults;
    private final ObjectMapper objectMapper;
    private final ConduitProperties properties;
    private final BedrockFormatConverter converter;

    public AdapterRegistry(
            Cache<AdapterKey, ChatAdapter> cache,
            OpenAIChatClient openAIClient,
            BedrockInvoker bedrockInvoker,
            GenerationDefaultsProvider defaults,
            ObjectMapper objectMapper,
            ConduitProperties properties) {
        this.cache = cache;
        this.openAIClient = openAIClient;
        this.bedrockInvoker = bedrockInvoker;
        this.defaults = defaults;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.converter = new BedrockFormatConverter(objectMapper);
    }

    /**
     * Adapter serving the model on the given provider.
     */
    public ChatAdapter getAdapter(ModelProvider provider, String modelId) {
        return provider == ModelProvider.BEDROCK ? getBedrockAdapter(modelId) : getOpenAIAdapter(modelId);
    }

    public ChatAdapter getOpenAIAdapter(String modelId) {
        return lookup(AdapterKind.OPENAI, modelId);
    }

    public ChatAdapter getBedrockAdapter(String modelId) {
        return lookup(AdapterKind.BEDROCK, modelId);
    }

    /**
     * Reverse adapter for Bedrock-shaped callers. The OpenAI delegate is resolved on first
     * use, so the adapter can re-shape responses even when OpenAI is not configured.
     */
    public BedrockToOpenAIAdapter getReverseAdapter(String modelId) {
        return (BedrockToOpenAIAdapter) lookup(AdapterKind.BEDROCK_TO_OPENAI, modelId);
    }

    /**
     * Drop every cached adapter.
     */
    public void clear() {
        log.info("Clearing adapter registry ({} entries)", cache.estimatedSize());
        cache.invalidateAll();
    }

    public long size() {
        return cache.estimatedSize();
    }

    private ChatAdapter lookup(AdapterKind kind, String modelId) {
        AdapterKey key = new AdapterKey(kind, modelId, fingerprint());
        return cache.get(key, this::create);
    }

    private ChatAdapter create(AdapterKey key) {
        log.info("Creating {} adapter for model {}", key.getKind(), key.getModelId());
        return switch (key.getKind()) {
            case OPENAI -> new OpenAIAdapter(key.getModelId(), openAIClient, defaults, objectMapper);
            case BEDROCK -> new BedrockAdapter(key.getModelId(), bedrockInvoker, defaults, objectMapper);
            case BEDROCK_TO_OPENAI -> new BedrockToOpenAIAdapter(key.getModelId(),
                    () -> getOpenAIAdapter(key.getModelId()), converter);
        };
    }

    /**
     * Hash of the settings adapters are built from. A configuration change produces new keys.
     */
    String fingerprint() {
        ConduitProperties.OpenAIConfig openai = properties.getOpenai();
        ConduitProperties.BedrockConfig bedrock = properties.getBedrock();
        String material = String.join("|",
                String.valueOf(openai.getBaseUrl()),
                String.valueOf(openai.getOrganization()),
                DigestUtils.sha256Hex(String.valueOf(openai.getApiKey())),
                String.valueOf(bedrock.getRegion()),
                String.valueOf(bedrock.getEndpointOverride()),
                String.valueOf(bedrock.getAccessKeyId()),
                String.valueOf(new TreeMap<>(properties.getDefaults())));
        return DigestUtils.sha256Hex(material);
    }

    public enum AdapterKind {
        OPENAI,
        BEDROCK,
        BEDROCK_TO_OPENAI
    }

    @Value
    public static class AdapterKey {
        AdapterKind kind;
        String modelId;
        String fingerprint;
    }
}
