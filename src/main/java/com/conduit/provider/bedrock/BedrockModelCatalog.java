package com.conduit.provider.bedrock;

import java.util.Map;
import java.util.Optional;

/**
 * Short model aliases accepted in place of full Bedrock model ids.
 */
public final class BedrockModelCatalog {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("claude-3-sonnet", "anthropic.claude-3-sonnet-20240229-v1:0"),
            Map.entry("claude-3-haiku", "anthropic.claude-3-haiku-20240307-v1:0"),
            Map.entry("claude-3-opus", "anthropic.claude-3-opus-20240229-v1:0"),
            Map.entry("claude-3-5-sonnet", "anthropic.claude-3-5-sonnet-20240620-v1:0"),
            Map.entry("titan-text-express", "amazon.titan-text-express-v1"),
            Map.entry("titan-text-lite", "amazon.titan-text-lite-v1"),
            Map.entry("nova-micro", "amazon.nova-micro-v1:0"),
            Map.entry("nova-lite", "amazon.nova-lite-v1:0"),
            Map.entry("nova-pro", "amazon.nova-pro-v1:0"),
            Map.entry("nova-premier", "amazon.nova-premier-v1:0"),
            Map.entry("jamba-large", "ai21.jamba-1-5-large-v1:0"),
            Map.entry("jamba-mini", "ai21.jamba-1-5-mini-v1:0"),
            Map.entry("command", "cohere.command-text-v14"),
            Map.entry("command-light", "cohere.command-light-text-v14"),
            Map.entry("llama2-13b-chat", "meta.llama2-13b-chat-v1"),
            Map.entry("llama2-70b-chat", "meta.llama2-70b-chat-v1"),
            Map.entry("mistral-7b", "mistral.mistral-7b-instruct-v0:2"),
            Map.entry("mixtral-8x7b", "mistral.mixtral-8x7b-instruct-v0:1"),
            Map.entry("mistral-large-2402", "mistral.mistral-large-2402-v1:0"),
            Map.entry("mistral-large-2407", "mistral.mistral-large-2407-v1:0"),
            Map.entry("mistral-small-2402", "mistral.mistral-small-2402-v1:0"),
            Map.entry("pixtral-large", "mistral.pixtral-large-2502-v1:0"),
            Map.entry("sd3-5-large", "stability.sd3-5-large-v1:0"),
            Map.entry("palmyra-x4", "writer.palmyra-x4-v1:0"),
            Map.entry("palmyra-x5", "writer.palmyra-x5-v1:0")
    );

    private BedrockModelCatalog() {
    }

    public static Optional<String> lookup(String alias) {
        return Optional.ofNullable(alias).map(ALIASES::get);
    }

    public static boolean isAlias(String model) {
        return model != null && ALIASES.containsKey(model);
    }

    /**
     * Full model id for an alias; any other value is returned unchanged.
     */
    public static String resolve(String model) {
        return lookup(model).orElse(model);
    }
}
