package com.conduit.service;

import com.conduit.provider.bedrock.BedrockModelCatalog;
import com.conduit.provider.bedrock.StrategyFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Decides which backend serves a model id from the shape of the id.
 */
@Slf4j
@Service
public class ProviderResolver {

    private static final List<String> OPENAI_PREFIXES = List.of("gpt-", "text-", "dall-e");

    private static final List<String> BEDROCK_PREFIXES = List.of(
            "anthropic.", "amazon.", "ai21.", "cohere.", "meta.", "mistral.", "stability.", "writer.");

    public ModelProvider resolve(String model) {
        String lower = model.toLowerCase(Locale.ROOT);

        if (OPENAI_PREFIXES.stream().anyMatch(lower::startsWith) || lower.contains("openai")) {
            log.debug("Model {} resolved to OpenAI", model);
            return ModelProvider.OPENAI;
        }

        String dispatchId = StrategyFactory.dispatchId(lower);
        if (BEDROCK_PREFIXES.stream().anyMatch(dispatchId::startsWith)
                || StrategyFactory.hasRegionPrefix(lower)
                || lower.contains("bedrock")
                || BedrockModelCatalog.isAlias(model)) {
            log.debug("Model {} resolved to Bedrock", model);
            return ModelProvider.BEDROCK;
        }

        log.warn("Could not infer provider for model {}; defaulting to OpenAI", model);
        return ModelProvider.OPENAI;
    }
}
