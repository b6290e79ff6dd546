package com.conduit.provider.bedrock;

import com.conduit.client.BedrockInvoker;
import com.conduit.config.PropertiesGenerationDefaults;
import com.conduit.exception.UnsupportedFeatureException;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.Message;
import com.conduit.model.Tool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Families without native tool support reject tools before anything reaches Bedrock.
 */
class UnsupportedToolsTest {

    private BedrockInvoker invoker;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        invoker = mock(BedrockInvoker.class);
        when(invoker.isConfigured()).thenReturn(true);
        objectMapper = new ObjectMapper();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "amazon.titan-text-express-v1",
            "amazon.nova-lite-v1:0",
            "ai21.jamba-1-5-mini-v1:0",
            "cohere.command-text-v14",
            "meta.llama3-8b-instruct-v1:0",
            "mistral.mistral-7b-instruct-v0:2",
            "stability.sd3-5-large-v1:0",
            "writer.palmyra-x4-v1:0"
    })
    void testToolsAreRejectedWithoutInvokingBedrock(String modelId) {
        BedrockAdapter adapter = new BedrockAdapter(modelId, invoker, PropertiesGenerationDefaults::builtIn,
                objectMapper);
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(modelId)
                .messages(List.of(Message.user("Weather?")))
                .tools(List.of(Tool.function("get_weather", "Current weather", objectMapper.createObjectNode())))
                .build();

        StepVerifier.create(adapter.chatCompletion(request))
                .expectError(UnsupportedFeatureException.class)
                .verify();
        assertThrows(UnsupportedFeatureException.class, () -> adapter.streamChatCompletion(request));

        verify(invoker, never()).invoke(anyString(), any());
        verify(invoker, never()).invokeStream(anyString(), any());
    }

    @ParameterizedTest
    @ValueSource(strings = {"amazon.titan-text-express-v1", "meta.llama3-8b-instruct-v1:0"})
    void testToolChoiceAloneIsRejected(String modelId) {
        BedrockStrategy strategy = StrategyFactory.create(modelId, PropertiesGenerationDefaults::builtIn,
                objectMapper);
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(modelId)
                .messages(List.of(Message.user("hi")))
                .toolChoice(objectMapper.getNodeFactory().textNode("auto"))
                .build();

        UnsupportedFeatureException error = assertThrows(UnsupportedFeatureException.class,
                () -> strategy.prepareRequestPayload(request));
        assertTrue(error.getMessage().contains(modelId));
    }
}
