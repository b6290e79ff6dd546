package com.conduit.service;

/**
 * Backend that serves a model id.
 */
public enum ModelProvider {
    OPENAI,
    BEDROCK
}
