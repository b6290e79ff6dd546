package com.conduit.provider;

import com.conduit.model.ModelFamily;

/**
 * Supplies per-family generation defaults to adapters and strategies at construction.
 */
public interface GenerationDefaultsProvider {

    GenerationDefaults defaultsFor(ModelFamily family);
}
