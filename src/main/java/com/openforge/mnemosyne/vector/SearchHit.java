package com.openforge.mnemosyne.vector;

import java.util.Map;

/**
 * One ANN result. {@code score} is a distance for L2 (smaller is closer) and
 * a similarity for IP / COSINE.
 */
public record SearchHit(
        Object id,
        float score,
        Map<String, Object> entity
) {}
