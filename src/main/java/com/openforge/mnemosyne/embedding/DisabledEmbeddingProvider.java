package com.openforge.mnemosyne.embedding;

import java.util.List;

/** Stand-in used when the configured provider failed its startup probe. */
public class DisabledEmbeddingProvider implements EmbeddingProvider {

    private final String reason;

    public DisabledEmbeddingProvider(String reason) {
        this.reason = reason;
    }

    @Override
    public List<List<Float>> getEmbeddings(List<String> texts) {
        return List.of();
    }

    @Override
    public int getDim() {
        return 0;
    }

    @Override
    public String modelId() {
        return "none (" + reason + ")";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
