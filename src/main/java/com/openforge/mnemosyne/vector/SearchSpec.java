package com.openforge.mnemosyne.vector;

import java.util.Map;

/** Search-time parameters; the metric must match the index metric. */
public record SearchSpec(
        String metricType,
        Map<String, Object> params
) {

    public SearchSpec {
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}
