package com.openforge.mnemosyne.summary;

import com.openforge.mnemosyne.embedding.EmbeddingProvider;
import com.openforge.mnemosyne.llm.LlmCompletion;
import com.openforge.mnemosyne.llm.LlmProvider;
import com.openforge.mnemosyne.vector.InsertResult;
import com.openforge.mnemosyne.vector.MemorySchema;
import com.openforge.mnemosyne.vector.VectorStore;
import com.openforge.mnemosyne.vector.VectorStoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Dialogue span → one stored memory.
 *
 *   preconditions → LLM summary → trim → embed → insert → (flush)
 *
 * Every stage failure ends the run with a logged {@link SummaryOutcome};
 * nothing is thrown to the caller and nothing is written before the insert.
 */
@Slf4j
@Service
@EnableConfigurationProperties(SummaryProperties.class)
public class SummarizationPipeline {

    private final VectorStore           vectorStore;
    private final EmbeddingProvider     embeddingProvider;
    private final LlmProvider           llmProvider;
    private final VectorStoreProperties vectorProps;
    private final SummaryProperties     summaryProps;
    private final Clock                 clock;
    private final Executor              executor;

    public SummarizationPipeline(VectorStore vectorStore,
                                 EmbeddingProvider embeddingProvider,
                                 LlmProvider llmProvider,
                                 VectorStoreProperties vectorProps,
                                 SummaryProperties summaryProps,
                                 Clock clock,
                                 @Qualifier("memoryTaskExecutor") Executor executor) {
        this.vectorStore       = vectorStore;
        this.embeddingProvider = embeddingProvider;
        this.llmProvider       = llmProvider;
        this.vectorProps       = vectorProps;
        this.summaryProps      = summaryProps;
        this.clock             = clock;
        this.executor          = executor;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Runs {@link #summarize} on the memory executor and returns at once.
     * The future is informational; trigger paths never wait on it.
     */
    public CompletableFuture<SummaryOutcome> launch(String sessionId, @Nullable String personaId, String dialogue) {
        try {
            return CompletableFuture.supplyAsync(() -> summarize(sessionId, personaId, dialogue), executor);
        } catch (RejectedExecutionException e) {
            log.error("[Summary] Executor rejected summary for session {}: {}", sessionId, e.getMessage());
            return CompletableFuture.completedFuture(SummaryOutcome.REJECTED);
        }
    }

    public SummaryOutcome summarize(String sessionId, @Nullable String personaId, String dialogue) {
        if (!vectorStore.isConnected()) {
            log.debug("[Summary] Skipped for session {} — vector store not connected.", sessionId);
            return SummaryOutcome.SKIPPED_PRECONDITION;
        }
        if (!embeddingProvider.isAvailable()) {
            log.debug("[Summary] Skipped for session {} — embedding provider unavailable.", sessionId);
            return SummaryOutcome.SKIPPED_PRECONDITION;
        }
        if (dialogue == null || dialogue.isBlank()) {
            log.debug("[Summary] Skipped for session {} — nothing to summarize.", sessionId);
            return SummaryOutcome.SKIPPED_PRECONDITION;
        }

        String summary;
        try {
            LlmCompletion completion = llmProvider.chat(
                    dialogue, summaryProps.longMemoryPrompt(), summaryProps.effectiveLlmParams());
            summary = completion == null ? null : completion.completionText();
        } catch (RuntimeException e) {
            log.error("[Summary] LLM call failed for session {}: {}", sessionId, e.getMessage());
            return SummaryOutcome.LLM_FAILED;
        }
        if (summary == null || summary.isBlank()) {
            log.warn("[Summary] LLM returned an empty summary for session {}; nothing stored.", sessionId);
            return SummaryOutcome.EMPTY_SUMMARY;
        }
        summary = summary.strip();

        Optional<List<Float>> vector = embed(sessionId, summary);
        if (vector.isEmpty()) return SummaryOutcome.EMBEDDING_FAILED;

        Map<String, Object> row = toRow(sessionId, personaId, summary, vector.get());
        String collection = vectorProps.collectionName();
        Optional<InsertResult> inserted = vectorStore.insert(collection, List.of(row));
        if (inserted.isEmpty() || inserted.get().insertedCount() <= 0) {
            log.error("[Summary] Failed to store memory for session {} in '{}'.", sessionId, collection);
            return SummaryOutcome.STORE_FAILED;
        }
        log.info("[Summary] Stored memory for session {} (persona={}, ids={})",
                sessionId, row.get(MemorySchema.PERSONALITY_FIELD), inserted.get().ids());

        if (vectorProps.flushAfterInsert() && !vectorStore.flush(List.of(collection))) {
            log.warn("[Summary] Flush after insert failed for '{}'; memory becomes visible later.", collection);
        }
        return SummaryOutcome.STORED;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Optional<List<Float>> embed(String sessionId, String summary) {
        try {
            List<List<Float>> vectors = embeddingProvider.getEmbeddings(List.of(summary));
            if (vectors == null || vectors.isEmpty() || vectors.get(0) == null || vectors.get(0).isEmpty()) {
                log.error("[Summary] Embedding returned no vector for session {}.", sessionId);
                return Optional.empty();
            }
            return Optional.of(vectors.get(0));
        } catch (RuntimeException e) {
            log.error("[Summary] Embedding failed for session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private Map<String, Object> toRow(String sessionId, @Nullable String personaId,
                                      String summary, List<Float> vector) {
        String persona = personaId == null || personaId.isBlank() ? summaryProps.defaultPersona() : personaId;
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(MemorySchema.PERSONALITY_FIELD, persona);
        row.put(MemorySchema.SESSION_FIELD,     sessionId);
        row.put(MemorySchema.CONTENT_FIELD,     truncate(summary, MemorySchema.CONTENT_MAX_LENGTH));
        row.put(MemorySchema.VECTOR_FIELD,      vector);
        row.put(MemorySchema.CREATE_TIME_FIELD, clock.millis() / 1000L);
        return row;
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
