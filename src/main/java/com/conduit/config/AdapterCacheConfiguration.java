package com.conduit.config;

import com.conduit.provider.ChatAdapter;
import com.conduit.service.AdapterRegistry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine cache backing the adapter registry.
 */
@Configuration
public class AdapterCacheConfiguration {

    private final ConduitProperties properties;

    public AdapterCacheConfiguration(ConduitProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Cache<AdapterRegistry.AdapterKey, ChatAdapter> adapterCache() {
        return Caffeine.newBuilder()
                .maximumSize(properties.getAdapterCache().getMaxSize())
                .recordStats()
                .build();
    }
}
