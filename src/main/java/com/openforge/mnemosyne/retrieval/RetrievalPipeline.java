package com.openforge.mnemosyne.retrieval;

import com.openforge.mnemosyne.embedding.EmbeddingProvider;
import com.openforge.mnemosyne.host.PersonaResolver;
import com.openforge.mnemosyne.host.RequestOrigin;
import com.openforge.mnemosyne.prompt.ContextCleaner;
import com.openforge.mnemosyne.prompt.InjectionMethod;
import com.openforge.mnemosyne.prompt.MemoryMarker;
import com.openforge.mnemosyne.prompt.PromptRequest;
import com.openforge.mnemosyne.session.SessionStateService;
import com.openforge.mnemosyne.session.TurnRole;
import com.openforge.mnemosyne.summary.SummaryProperties;
import com.openforge.mnemosyne.vector.MemorySchema;
import com.openforge.mnemosyne.vector.SearchHit;
import com.openforge.mnemosyne.vector.VectorStore;
import com.openforge.mnemosyne.vector.VectorStoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Finds memories relevant to the outgoing user turn and injects them.
 *
 * Per request:
 *   1. preconditions (vector store, embedding, counter store)
 *   2. persona
 *   3. track the session
 *   4. strip blocks injected on earlier turns
 *   5. record the user turn and count it
 *   6. embed the prompt
 *   7. session (+ persona) filter
 *   8. top-K search, bounded by the search timeout
 *   9. normalize hits
 *  10. format and inject
 *
 * Any failure ends the run early with a log line; the request is then
 * forwarded with whatever cleanup already happened.
 */
@Slf4j
@Service
@EnableConfigurationProperties(RetrievalProperties.class)
public class RetrievalPipeline {

    private final VectorStore           vectorStore;
    private final EmbeddingProvider     embeddingProvider;
    private final SessionStateService   sessions;
    private final PersonaResolver       personas;
    private final RetrievalProperties   props;
    private final VectorStoreProperties vectorProps;
    private final SummaryProperties     summaryProps;
    private final Executor              executor;
    private final MemoryMarker          marker;
    private final InjectionMethod       method;
    private final MemoryInjector        injector;

    public RetrievalPipeline(VectorStore vectorStore,
                             EmbeddingProvider embeddingProvider,
                             SessionStateService sessions,
                             PersonaResolver personas,
                             RetrievalProperties props,
                             VectorStoreProperties vectorProps,
                             SummaryProperties summaryProps,
                             Clock clock,
                             @Qualifier("memorySearchExecutor") Executor executor) {
        this.vectorStore       = vectorStore;
        this.embeddingProvider = embeddingProvider;
        this.sessions          = sessions;
        this.personas          = personas;
        this.props             = props;
        this.vectorProps       = vectorProps;
        this.summaryProps      = summaryProps;
        this.executor          = executor;
        this.marker            = props.marker();
        this.method            = props.method();
        this.injector          = new MemoryInjector(marker, props.entryFormat(), clock.getZone());
    }

    /**
     * @return number of memories injected into {@code request}
     */
    public int retrieve(RequestOrigin origin, PromptRequest request) {
        if (!vectorStore.isConnected() || !embeddingProvider.isAvailable() || !sessions.isReady()) {
            log.debug("[Retrieval] Skipped — memory backends not ready.");
            return 0;
        }
        Optional<String> resolvedSession = personas.sessionId(origin);
        if (resolvedSession.isEmpty()) {
            log.debug("[Retrieval] Skipped — no session for origin {}.", origin == null ? null : origin.originId());
            return 0;
        }
        String sessionId = resolvedSession.get();
        Optional<String> personaId = resolvePersona(origin);

        sessions.ensureSession(sessionId, request.getContexts(), origin);
        ContextCleaner.clean(request, method, marker, props.contextsMemoryLen());

        String query = request.getPrompt() == null ? "" : request.getPrompt();
        sessions.addMessage(sessionId, TurnRole.USER, query, origin);
        sessions.incrementCount(sessionId);
        if (query.isBlank()) {
            log.debug("[Retrieval] Session {} sent an empty prompt; nothing to look up.", sessionId);
            return 0;
        }

        Optional<List<Float>> vector = embed(sessionId, query);
        if (vector.isEmpty()) return 0;

        String filter = buildFilter(sessionId, personaId);
        Optional<List<List<SearchHit>>> hits = search(sessionId, vector.get(), filter);
        if (hits.isEmpty()) return 0;

        List<Map<String, Object>> memories = normalize(hits.get());
        if (memories.isEmpty()) {
            log.debug("[Retrieval] No memories found for session {}.", sessionId);
            return 0;
        }

        injector.inject(request, method, injector.buildBlock(memories));
        log.info("[Retrieval] Injected {} memories into session {} via {}.",
                memories.size(), sessionId, method.configValue());
        return memories.size();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Optional<String> resolvePersona(RequestOrigin origin) {
        Optional<String> persona = personas.resolve(origin);
        if (persona.isPresent() || !props.usePersonalityFiltering()) return persona;
        return Optional.of(summaryProps.defaultPersona());
    }

    String buildFilter(String sessionId, Optional<String> personaId) {
        String filter = MemorySchema.eq(MemorySchema.SESSION_FIELD, sessionId);
        if (props.usePersonalityFiltering() && personaId.isPresent()) {
            filter += " and " + MemorySchema.eq(MemorySchema.PERSONALITY_FIELD, personaId.get());
        }
        return filter;
    }

    private Optional<List<Float>> embed(String sessionId, String query) {
        try {
            List<List<Float>> vectors = embeddingProvider.getEmbeddings(List.of(query));
            if (vectors == null || vectors.isEmpty() || vectors.get(0) == null || vectors.get(0).isEmpty()) {
                log.error("[Retrieval] Embedding returned no vector for session {}.", sessionId);
                return Optional.empty();
            }
            return Optional.of(vectors.get(0));
        } catch (RuntimeException e) {
            log.error("[Retrieval] Embedding failed for session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<List<List<SearchHit>>> search(String sessionId, List<Float> vector, String filter) {
        CompletableFuture<Optional<List<List<SearchHit>>>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> vectorStore.search(
                    vectorProps.collectionName(),
                    List.of(vector),
                    MemorySchema.VECTOR_FIELD,
                    vectorProps.searchSpec(),
                    props.topK(),
                    filter,
                    vectorProps.effectiveOutputFields()), executor);
        } catch (RejectedExecutionException e) {
            log.error("[Retrieval] Search rejected for session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }

        try {
            Optional<List<List<SearchHit>>> result = future.get(props.searchTimeoutSeconds(), TimeUnit.SECONDS);
            if (result == null || result.isEmpty()) {
                log.error("[Retrieval] Vector search failed for session {}.", sessionId);
                return Optional.empty();
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("[Retrieval] Vector search timed out after {}s for session {}.",
                    props.searchTimeoutSeconds(), sessionId);
            return Optional.empty();
        } catch (ExecutionException e) {
            log.error("[Retrieval] Vector search failed for session {}: {}",
                    sessionId, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Optional.empty();
        }
    }

    /** Flattens hits of the single query vector into field maps; malformed hits are dropped. */
    List<Map<String, Object>> normalize(List<List<SearchHit>> hitsPerQuery) {
        List<Map<String, Object>> memories = new ArrayList<>();
        if (hitsPerQuery.isEmpty() || hitsPerQuery.get(0) == null) return memories;
        for (SearchHit hit : hitsPerQuery.get(0)) {
            if (hit == null || hit.entity() == null) {
                log.warn("[Retrieval] Skipping search hit without entity.");
                continue;
            }
            Map<String, Object> entity = hit.entity();
            Object content = entity.get(MemorySchema.CONTENT_FIELD);
            if (!(content instanceof String text) || text.isBlank()) {
                log.warn("[Retrieval] Skipping search hit {} without content.", hit.id());
                continue;
            }
            Map<String, Object> memory = new LinkedHashMap<>();
            memory.put(MemorySchema.PRIMARY_FIELD, entity.getOrDefault(MemorySchema.PRIMARY_FIELD, hit.id()));
            memory.put(MemorySchema.CONTENT_FIELD, text);
            memory.put(MemorySchema.CREATE_TIME_FIELD, entity.get(MemorySchema.CREATE_TIME_FIELD));
            memory.put(MemorySchema.SESSION_FIELD, entity.get(MemorySchema.SESSION_FIELD));
            memory.put(MemorySchema.PERSONALITY_FIELD, entity.get(MemorySchema.PERSONALITY_FIELD));
            memories.add(memory);
        }
        return memories;
    }
}
