package com.openforge.mnemosyne.embedding;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Selects and probes the embedding provider.
 *
 * Bad configuration (unknown service, missing model or key, non-positive
 * dimension) aborts startup. A provider that is configured correctly but
 * fails its connection probe is replaced by a {@link DisabledEmbeddingProvider},
 * which turns memory retrieval and summarization off.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfig {

    @Bean
    public EmbeddingProvider embeddingProvider(HttpClient httpClient,
                                               ObjectMapper objectMapper,
                                               EmbeddingProperties props) {
        EmbeddingProvider provider = create(httpClient, objectMapper, props);
        return props.testOnStartup() ? probe(provider) : provider;
    }

    static EmbeddingProvider create(HttpClient httpClient, ObjectMapper objectMapper, EmbeddingProperties props) {
        if (props.dimensions() <= 0) {
            throw new IllegalStateException(
                    "mnemosyne.embedding.dimensions must be a positive integer, got " + props.dimensions());
        }
        List<String> missing = new ArrayList<>();
        if (props.model() == null || props.model().isBlank())   missing.add("model");
        if (props.apiKey() == null || props.apiKey().isBlank()) missing.add("api-key");
        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Cannot initialize embedding service; missing mnemosyne.embedding." + String.join(", ", missing));
        }

        String service = props.service() == null ? "" : props.service().strip().toLowerCase(Locale.ROOT);
        return switch (service) {
            case "openai" -> new OpenAiEmbeddingClient(httpClient, objectMapper, props);
            case "gemini" -> new GeminiEmbeddingClient(httpClient, objectMapper, props);
            default -> throw new IllegalStateException(
                    "Unsupported embedding service '%s'; choose 'openai' or 'gemini'".formatted(props.service()));
        };
    }

    static EmbeddingProvider probe(EmbeddingProvider provider) {
        if (!(provider instanceof ConnectionTestable testable)) {
            log.debug("[Embed] {} has no connection test; assuming available", provider.modelId());
            return provider;
        }
        try {
            testable.testConnection();
            log.info("[Embed] Connection test passed for {}", provider.modelId());
            return provider;
        } catch (RuntimeException e) {
            log.error("[Embed] Connection test failed for {} — memory features DISABLED. Cause: {}",
                    provider.modelId(), e.getMessage());
            return new DisabledEmbeddingProvider("connection test failed");
        }
    }
}
