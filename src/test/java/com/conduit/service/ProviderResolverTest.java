package com.conduit.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProviderResolver.
 */
class ProviderResolverTest {

    private ProviderResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ProviderResolver();
    }

    @ParameterizedTest
    @ValueSource(strings = {"gpt-4o", "gpt-3.5-turbo", "text-davinci-003", "dall-e-3", "my-openai-finetune",
            "some-unknown-model"})
    void testResolvesToOpenAI(String model) {
        assertEquals(ModelProvider.OPENAI, resolver.resolve(model));
    }

    @ParameterizedTest
    @ValueSource(strings = {"anthropic.claude-3-sonnet-20240229-v1:0", "amazon.nova-pro-v1:0",
            "us.meta.llama3-2-90b-instruct-v1:0", "eu.anything", "custom-bedrock-model", "claude-3-haiku",
            "palmyra-x5", "Mistral.mistral-large-2407-v1:0"})
    void testResolvesToBedrock(String model) {
        assertEquals(ModelProvider.BEDROCK, resolver.resolve(model));
    }
}
