package com.conduit.provider.bedrock;

import com.conduit.exception.ModelNotFoundException;
import com.conduit.model.ModelFamily;
import com.conduit.provider.GenerationDefaults;
import com.conduit.provider.GenerationDefaultsProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Resolves a Bedrock model id to the strategy that speaks its wire protocol.
 * Dispatch is by longest matching prefix; cross-region inference prefixes are ignored.
 */
@Slf4j
public final class StrategyFactory {

    private static final List<String> REGION_PREFIXES = List.of("us.", "eu.", "apac.", "global.");

    private static final List<Route> ROUTES = List.of(
            new Route("anthropic.claude", ModelFamily.CLAUDE, ClaudeStrategy::new),
            new Route("amazon.titan", ModelFamily.TITAN, TitanStrategy::new),
            new Route("amazon.nova", ModelFamily.NOVA, NovaStrategy::new),
            new Route("ai21.", ModelFamily.AI21, AI21Strategy::new),
            new Route("cohere.", ModelFamily.COHERE, CohereStrategy::new),
            new Route("meta.", ModelFamily.META, MetaStrategy::new),
            new Route("mistral.", ModelFamily.MISTRAL, MistralStrategy::new),
            new Route("stability.", ModelFamily.STABILITY, StabilityStrategy::new),
            new Route("writer.", ModelFamily.WRITER, WriterStrategy::new)
    ).stream()
            .sorted(Comparator.comparingInt((Route route) -> route.prefix.length()).reversed())
            .collect(Collectors.toUnmodifiableList());

    private StrategyFactory() {
    }

    /**
     * Build the strategy for a concrete model id.
     *
     * @throws ModelNotFoundException when no supported family matches the id
     */
    public static BedrockStrategy create(String modelId, GenerationDefaultsProvider defaults,
                                         ObjectMapper objectMapper) {
        Route route = route(modelId);
        log.debug("Resolved Bedrock model {} to {} strategy", modelId, route.family);
        return route.constructor.create(modelId, defaults.defaultsFor(route.family), objectMapper);
    }

    /**
     * Family a model id belongs to, without building a strategy.
     */
    public static ModelFamily familyOf(String modelId) {
        return route(modelId).family;
    }

    /**
     * @return true when the id (after any region prefix) matches a known family prefix
     */
    public static boolean isSupported(String modelId) {
        String dispatchId = dispatchId(modelId);
        return ROUTES.stream().anyMatch(route -> dispatchId.startsWith(route.prefix));
    }

    /**
     * Strip a cross-region inference prefix such as {@code us.} from a model id.
     */
    public static String dispatchId(String modelId) {
        String lower = modelId.toLowerCase(Locale.ROOT);
        for (String prefix : REGION_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return lower.substring(prefix.length());
            }
        }
        return lower;
    }

    public static boolean hasRegionPrefix(String modelId) {
        String lower = modelId.toLowerCase(Locale.ROOT);
        return REGION_PREFIXES.stream().anyMatch(lower::startsWith);
    }

    private static Route route(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            throw new ModelNotFoundException("Bedrock model ID is required");
        }
        String dispatchId = dispatchId(modelId);
        return ROUTES.stream()
                .filter(route -> dispatchId.startsWith(route.prefix))
                .findFirst()
                .orElseThrow(() -> new ModelNotFoundException("No strategy found for Bedrock model ID: "
                        + modelId + ". Supported model families: " + supportedPrefixes()));
    }

    private static String supportedPrefixes() {
        return ROUTES.stream()
                .map(route -> route.prefix)
                .sorted()
                .collect(Collectors.joining(", "));
    }

    @FunctionalInterface
    private interface StrategyConstructor {
        BedrockStrategy create(String modelId, GenerationDefaults defaults, ObjectMapper objectMapper);
    }

    private static final class Route {
        private final String prefix;
        private final ModelFamily family;
        private final StrategyConstructor constructor;

        private Route(String prefix, ModelFamily family, StrategyConstructor constructor) {
            this.prefix = prefix;
            this.family = family;
            this.constructor = constructor;
        }
    }
}
