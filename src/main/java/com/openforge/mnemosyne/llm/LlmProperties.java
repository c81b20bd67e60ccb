package com.openforge.mnemosyne.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised LLM provider configuration for summarization calls.
 *
 * Reads from application.yml under the "mnemosyne.llm" prefix:
 *
 * mnemosyne:
 *   llm:
 *     primary:
 *       name: gpt-4o-mini
 *       base-url: https://api.openai.com/v1
 *       api-key: sk-...
 *       model: gpt-4o-mini
 *       timeout-seconds: 120
 *     fallback:            # optional
 *       name: deepseek-chat
 *       base-url: https://api.deepseek.com/v1
 *       api-key: sk-...
 *       model: deepseek-chat
 */
@ConfigurationProperties(prefix = "mnemosyne.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120") int timeoutSeconds
    ) {}

    public boolean hasFallback() {
        return fallback != null && fallback.baseUrl() != null && !fallback.baseUrl().isBlank();
    }
}
