package com.conduit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Conduit.
 */
@Data
@Component
@ConfigurationProperties(prefix = "conduit")
public class ConduitProperties {

    private OpenAIConfig openai = new OpenAIConfig();
    private BedrockConfig bedrock = new BedrockConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private AdapterCacheConfig adapterCache = new AdapterCacheConfig();
    private StreamingConfig streaming = new StreamingConfig();

    /**
     * Generation defaults keyed by model family name (openai, claude, titan, ...).
     */
    private Map<String, DefaultsConfig> defaults = new HashMap<>();

    @Data
    public static class OpenAIConfig {
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private String organization;
    }

    @Data
    public static class BedrockConfig {
        private String region;
        private String accessKeyId;
        private String secretAccessKey;
        private String sessionToken;
        private String endpointOverride;
    }

    @Data
    public static class ProxyConfig {
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 3;
    }

    @Data
    public static class AdapterCacheConfig {
        private int maxSize = 256;
    }

    @Data
    public static class StreamingConfig {
        private boolean doneSentinel = false;
    }

    @Data
    public static class DefaultsConfig {
        private Integer maxTokens;
        private Double temperature;
        private Double topP;
        private Integer topK;
        private List<String> stopSequences = new ArrayList<>();
    }
}
