package com.openforge.mnemosyne.embedding;

import java.util.List;

/**
 * Text → vector.
 */
public interface EmbeddingProvider {

    /**
     * Embeds each text; the result has one vector per input, in input order.
     *
     * @throws EmbeddingException on transport or protocol failure
     */
    List<List<Float>> getEmbeddings(List<String> texts);

    int getDim();

    /** Human-readable "service:model" label. */
    String modelId();

    default boolean isAvailable() {
        return true;
    }

    class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }
}
