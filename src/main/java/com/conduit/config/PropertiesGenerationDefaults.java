package com.conduit.config;

import com.conduit.model.ModelFamily;
import com.conduit.provider.GenerationDefaults;
import com.conduit.provider.GenerationDefaultsProvider;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Generation defaults from {@code conduit.defaults.<family>}, falling back to the
 * family's built-in values for anything not configured.
 */
@Component
public class PropertiesGenerationDefaults implements GenerationDefaultsProvider {

    private final ConduitProperties properties;

    public PropertiesGenerationDefaults(ConduitProperties properties) {
        this.properties = properties;
    }

    @Override
    public GenerationDefaults defaultsFor(ModelFamily family) {
        ConduitProperties.DefaultsConfig config = properties.getDefaults().get(family.configKey());
        if (config == null) {
            return builtIn(family);
        }
        return GenerationDefaults.builder()
                .maxTokens(config.getMaxTokens() != null ? config.getMaxTokens() : family.defaultMaxTokens())
                .temperature(config.getTemperature() != null ? config.getTemperature() : ModelFamily.DEFAULT_TEMPERATURE)
                .topP(config.getTopP())
                .topK(config.getTopK())
                .stopSequences(config.getStopSequences() != null ? config.getStopSequences() : List.of())
                .build();
    }

    public static GenerationDefaults builtIn(ModelFamily family) {
        return GenerationDefaults.builder()
                .maxTokens(family.defaultMaxTokens())
                .temperature(ModelFamily.DEFAULT_TEMPERATURE)
                .build();
    }
}
