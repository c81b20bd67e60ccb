package com.openforge.mnemosyne.config;

import com.openforge.mnemosyne.embedding.EmbeddingProperties;
import com.openforge.mnemosyne.embedding.EmbeddingProvider;
import com.openforge.mnemosyne.llm.LlmProperties;
import com.openforge.mnemosyne.retrieval.RetrievalProperties;
import com.openforge.mnemosyne.session.MessageCounterStore;
import com.openforge.mnemosyne.summary.SummaryProperties;
import com.openforge.mnemosyne.vector.VectorStore;
import com.openforge.mnemosyne.vector.VectorStoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Reported:
 *   - Counter store: SQLite file and whether it opened
 *   - Vector store: backend, connection state, collection
 *   - Embedding: service + model + dimensions, and whether the probe passed
 *   - LLM providers: primary + fallback config (API key is masked)
 *   - Summary triggers and retrieval settings
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final MessageCounterStore   counterStore;
    private final VectorStore           vectorStore;
    private final VectorStoreProperties vectorProperties;
    private final EmbeddingProvider     embeddingProvider;
    private final EmbeddingProperties   embeddingProperties;
    private final LlmProperties         llmProperties;
    private final SummaryProperties     summaryProperties;
    private final RetrievalProperties   retrievalProperties;

    @Override
    public void run(ApplicationArguments args) {
        LlmProperties.ProviderConfig primary  = llmProperties.primary();
        LlmProperties.ProviderConfig fallback = llmProperties.hasFallback() ? llmProperties.fallback() : null;

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║             Mnemosyne  —  Startup Summary                ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Runtime                                                 ║
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Counter Store (SQLite)                                  ║
                ║    {}  path={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Vector Store                                            ║
                ║    {}  {}
                ║    Collection     : {}  metric={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    {}  {}  dim={}  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Memory                                                  ║
                ║    Summary        : every {} turns, idle {}, sweep {}s
                ║    Retrieval      : top-k={}  via {}  persona-filter={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                System.getProperty("java.version"),

                status(counterStore.isAvailable()), counterStore.dbPath(),

                status(vectorStore.isConnected()), vectorStore.describe(),
                vectorProperties.collectionName(), vectorProperties.indexSpec().metricType(),

                status(embeddingProvider.isAvailable()), embeddingProvider.modelId(),
                embeddingProperties.dimensions(), maskKey(embeddingProperties.apiKey()),

                primary == null ? "(not set)" : primary.name(),
                primary == null ? "-" : primary.model(),
                primary == null ? "(not set)" : maskKey(primary.apiKey()),
                fallback == null ? "(none)"
                        : "%s  [%s]  key=%s".formatted(fallback.name(), fallback.model(), maskKey(fallback.apiKey())),

                summaryProperties.numPairs(),
                summaryProperties.timeTriggerEnabled() ? summaryProperties.timeThresholdSeconds() + "s" : "disabled",
                summaryProperties.checkIntervalSeconds(),
                retrievalProperties.topK(), retrievalProperties.method().configValue(),
                retrievalProperties.usePersonalityFiltering()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String status(boolean ok) {
        return ok ? "✔ ready " : "✘ DOWN  ";
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
