package com.conduit.service;

import com.conduit.client.BedrockInvoker;
import com.conduit.client.OpenAIChatClient;
import com.conduit.config.ConduitProperties;
import com.conduit.config.PropertiesGenerationDefaults;
import com.conduit.exception.ConfigurationException;
import com.conduit.provider.ChatAdapter;
import com.conduit.provider.bedrock.BedrockAdapter;
import com.conduit.provider.openai.OpenAIAdapter;
import com.conduit.provider.reverse.BedrockToOpenAIAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for AdapterRegistry caching.
 */
class AdapterRegistryTest {

    private OpenAIChatClient openAIClient;
    private BedrockInvoker bedrockInvoker;
    private ConduitProperties properties;
    private AdapterRegistry registry;

    @BeforeEach
    void setUp() {
        openAIClient = mock(OpenAIChatClient.class);
        bedrockInvoker = mock(BedrockInvoker.class);
        when(openAIClient.isConfigured()).thenReturn(true);
        when(bedrockInvoker.isConfigured()).thenReturn(true);
        properties = new ConduitProperties();
        properties.getOpenai().setApiKey("sk-test");
        properties.getBedrock().setRegion("us-east-1");
        registry = new AdapterRegistry(Caffeine.newBuilder().maximumSize(16).build(), openAIClient, bedrockInvoker,
                new PropertiesGenerationDefaults(properties), new ObjectMapper(), properties);
    }

    @Test
    void testSameKeyReturnsSameInstance() {
        ChatAdapter first = registry.getAdapter(ModelProvider.OPENAI, "gpt-4o");
        ChatAdapter second = registry.getAdapter(ModelProvider.OPENAI, "gpt-4o");

        assertSame(first, second);
        assertInstanceOf(OpenAIAdapter.class, first);
        assertEquals(1, registry.size());
    }

    @Test
    void testKindsAndModelsAreCachedSeparately() {
        ChatAdapter openai = registry.getOpenAIAdapter("gpt-4o");
        ChatAdapter bedrock = registry.getAdapter(ModelProvider.BEDROCK, "anthropic.claude-3-haiku-20240307-v1:0");
        BedrockToOpenAIAdapter reverse = registry.getReverseAdapter("gpt-4o");

        assertInstanceOf(BedrockAdapter.class, bedrock);
        assertNotSame(openai, reverse);
        assertNotSame(openai, registry.getOpenAIAdapter("gpt-4o-mini"));
        assertEquals(4, registry.size());
    }

    @Test
    void testConfigurationChangeProducesNewAdapter() {
        String before = registry.fingerprint();
        ChatAdapter first = registry.getOpenAIAdapter("gpt-4o");

        properties.getOpenai().setApiKey("sk-rotated");

        assertNotEquals(before, registry.fingerprint());
        assertNotSame(first, registry.getOpenAIAdapter("gpt-4o"));
    }

    @Test
    void testFingerprintDoesNotContainApiKey() {
        assertFalse(registry.fingerprint().contains("sk-test"));
        assertEquals(64, registry.fingerprint().length());
    }

    @Test
    void testReverseAdapterDoesNotNeedOpenAIUntilUsed() {
        when(openAIClient.isConfigured()).thenReturn(false);

        BedrockToOpenAIAdapter reverse = registry.getReverseAdapter("gpt-4o");

        assertNotNull(reverse);
        assertThrows(ConfigurationException.class, () -> reverse.streamChatCompletion(null));
    }

    @Test
    void testUnconfiguredProviderFailsAndIsNotCached() {
        when(bedrockInvoker.isConfigured()).thenReturn(false);

        assertThrows(ConfigurationException.class, () -> registry.getBedrockAdapter("amazon.nova-lite-v1:0"));
        assertEquals(0, registry.size());
    }

    @Test
    void testClear() {
        registry.getOpenAIAdapter("gpt-4o");
        registry.clear();

        assertEquals(0, registry.size());
    }
}
