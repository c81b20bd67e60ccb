package com.openforge.mnemosyne.vector;

import java.util.Map;

/**
 * Vector index parameters, e.g. metric L2 with AUTOINDEX, or IP with HNSW
 * and {@code {M: 16, efConstruction: 256}}.
 */
public record IndexSpec(
        String metricType,
        String indexType,
        Map<String, Object> params
) {

    public IndexSpec {
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}
