package com.conduit.provider.bedrock;

import com.conduit.config.PropertiesGenerationDefaults;
import com.conduit.exception.ModelNotFoundException;
import com.conduit.model.ModelFamily;
import com.conduit.provider.GenerationDefaultsProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StrategyFactory model id dispatch.
 */
class StrategyFactoryTest {

    private GenerationDefaultsProvider defaults;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        defaults = PropertiesGenerationDefaults::builtIn;
        objectMapper = new ObjectMapper();
    }

    @ParameterizedTest
    @CsvSource({
            "anthropic.claude-3-sonnet-20240229-v1:0, CLAUDE",
            "amazon.titan-text-express-v1, TITAN",
            "amazon.nova-pro-v1:0, NOVA",
            "ai21.jamba-1-5-large-v1:0, AI21",
            "cohere.command-r-plus-v1:0, COHERE",
            "meta.llama3-70b-instruct-v1:0, META",
            "mistral.mixtral-8x7b-instruct-v0:1, MISTRAL",
            "stability.sd3-5-large-v1:0, STABILITY",
            "writer.palmyra-x5-v1:0, WRITER"
    })
    void testEveryFamilyPrefixDispatches(String modelId, ModelFamily family) {
        BedrockStrategy strategy = StrategyFactory.create(modelId, defaults, objectMapper);

        assertEquals(family, strategy.getFamily());
        assertEquals(modelId, strategy.getModelId());
    }

    @Test
    void testRegionPrefixIsIgnoredForDispatch() {
        BedrockStrategy strategy = StrategyFactory.create("us.anthropic.claude-3-5-sonnet-20241022-v2:0",
                defaults, objectMapper);

        assertInstanceOf(ClaudeStrategy.class, strategy);
        assertEquals("us.anthropic.claude-3-5-sonnet-20241022-v2:0", strategy.getModelId());
        assertEquals(ModelFamily.NOVA, StrategyFactory.familyOf("apac.amazon.nova-lite-v1:0"));
        assertEquals(ModelFamily.META, StrategyFactory.familyOf("global.meta.llama3-2-90b-instruct-v1:0"));
    }

    @Test
    void testDispatchIsCaseInsensitive() {
        assertEquals(ModelFamily.CLAUDE, StrategyFactory.familyOf("Anthropic.Claude-v2"));
    }

    @Test
    void testUnknownModelListsSupportedFamilies() {
        ModelNotFoundException error = assertThrows(ModelNotFoundException.class,
                () -> StrategyFactory.create("acme.rocket-v1", defaults, objectMapper));

        assertTrue(error.getMessage().contains("acme.rocket-v1"));
        assertTrue(error.getMessage().contains("anthropic.claude"));
        assertTrue(error.getMessage().contains("writer."));
    }

    @Test
    void testBlankModelIsRejected() {
        assertThrows(ModelNotFoundException.class, () -> StrategyFactory.create(" ", defaults, objectMapper));
        assertThrows(ModelNotFoundException.class, () -> StrategyFactory.create(null, defaults, objectMapper));
    }

    @Test
    void testTitanEmbeddingModelCannotChat() {
        assertThrows(ModelNotFoundException.class,
                () -> StrategyFactory.create("amazon.titan-embed-text-v2:0", defaults, objectMapper));
    }

    @Test
    void testIsSupportedAndRegionHelpers() {
        assertTrue(StrategyFactory.isSupported("eu.mistral.pixtral-large-2502-v1:0"));
        assertFalse(StrategyFactory.isSupported("gpt-4o"));
        assertTrue(StrategyFactory.hasRegionPrefix("US.amazon.nova-micro-v1:0"));
        assertFalse(StrategyFactory.hasRegionPrefix("amazon.nova-micro-v1:0"));
        assertEquals("amazon.nova-micro-v1:0", StrategyFactory.dispatchId("us.amazon.nova-micro-v1:0"));
    }
}
