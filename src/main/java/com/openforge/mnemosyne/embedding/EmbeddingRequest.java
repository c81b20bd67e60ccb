package com.openforge.mnemosyne.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Request body for POST /v1/embeddings (OpenAI-compatible).
 *
 * Wire format:
 * {
 *   "input": ["first text", "second text"],
 *   "model": "text-embedding-3-small",
 *   "dimensions": 1536   // optional; only supported by text-embedding-3-*
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
        List<String> input,
        String model,
        Integer dimensions
) {
    public static EmbeddingRequest of(List<String> input, String model, int dimensions) {
        Integer dims = model != null && model.startsWith("text-embedding-3") ? dimensions : null;
        return new EmbeddingRequest(input, model, dims);
    }
}
