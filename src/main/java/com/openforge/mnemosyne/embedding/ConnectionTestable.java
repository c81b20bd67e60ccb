package com.openforge.mnemosyne.embedding;

/**
 * Optional capability of an {@link EmbeddingProvider}: a cheap round trip
 * proving that credentials and endpoint work.
 */
public interface ConnectionTestable {

    /** @throws EmbeddingProvider.EmbeddingException when the endpoint is unusable */
    void testConnection();
}
