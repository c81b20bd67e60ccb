package com.openforge.mnemosyne.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the text embedding endpoint.
 *
 * application.yml:
 *
 * mnemosyne:
 *   embedding:
 *     service: openai            # openai | gemini
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:}
 *     model: text-embedding-3-small
 *     dimensions: 1536
 *     timeout-seconds: 30
 *
 * Dimension reference:
 *   text-embedding-3-small  → 1536  (cost-effective, good quality)
 *   text-embedding-3-large  → 3072  (best quality, higher cost)
 *   text-embedding-004      → 768   (Gemini)
 *
 * The dimension is fixed into the collection schema at creation time;
 * changing it later requires a new collection.
 */
@ConfigurationProperties(prefix = "mnemosyne.embedding")
public record EmbeddingProperties(
        @DefaultValue("openai")                 String  service,
        String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String  model,
        @DefaultValue("1536")                   int     dimensions,
        @DefaultValue("30")                     int     timeoutSeconds,
        @DefaultValue("true")                   boolean testOnStartup
) {}
