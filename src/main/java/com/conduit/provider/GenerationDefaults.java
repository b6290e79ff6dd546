package com.conduit.provider;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Sampling parameters applied when a request leaves them unset.
 */
@Value
@Builder
public class GenerationDefaults {

    int maxTokens;

    double temperature;

    Double topP;

    Integer topK;

    @Builder.Default
    List<String> stopSequences = List.of();
}
