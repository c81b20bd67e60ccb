package com.openforge.mnemosyne.vector;

import com.openforge.mnemosyne.embedding.EmbeddingProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Makes the active memory collection usable at startup.
 *
 *   1. Collection exists → compare its schema with the expected one and warn
 *      about every difference (the collection is used as is).
 *      Collection missing → create it; failure aborts startup.
 *   2. Ensure the vector field is indexed.
 *   3. Load the collection for search.
 */
@Slf4j
@Component
public class CollectionBootstrapper {

    private final VectorStore           store;
    private final VectorStoreProperties vectorProps;
    private final EmbeddingProperties   embeddingProps;

    public CollectionBootstrapper(VectorStore store,
                                  VectorStoreProperties vectorProps,
                                  EmbeddingProperties embeddingProps) {
        this.store          = store;
        this.vectorProps    = vectorProps;
        this.embeddingProps = embeddingProps;
    }

    @PostConstruct
    public void bootstrap() {
        if (!store.isConnected()) {
            log.warn("[Bootstrap] Vector store not connected; skipping collection setup.");
            return;
        }
        String name = vectorProps.collectionName();
        CollectionSchema expected = MemorySchema.build(
                name, embeddingProps.dimensions(), vectorProps.enableDynamicField());

        if (store.hasCollection(name)) {
            log.info("[Bootstrap] Collection '{}' exists; checking schema.", name);
            Optional<CollectionSchema> actual = store.describeCollection(name);
            if (actual.isEmpty()) {
                log.warn("[Bootstrap] Could not describe collection '{}'; schema not verified.", name);
            } else {
                List<String> problems = compare(expected, actual.get());
                problems.forEach(p -> log.warn("[Bootstrap] Collection '{}' schema mismatch: {}", name, p));
                if (problems.isEmpty()) log.info("[Bootstrap] Collection '{}' schema OK.", name);
            }
        } else {
            log.info("[Bootstrap] Creating collection '{}' (dim={})…", name, embeddingProps.dimensions());
            if (!store.createCollection(name, expected)) {
                throw new IllegalStateException("Failed to create memory collection '" + name + "'");
            }
        }

        ensureIndex(name);

        if (store.loadCollection(name)) {
            log.info("[Bootstrap] Collection '{}' loaded.", name);
        } else {
            log.error("[Bootstrap] Failed to load collection '{}'; searches may fail.", name);
        }
    }

    private void ensureIndex(String name) {
        if (store.hasIndex(name, MemorySchema.VECTOR_FIELD)) return;
        IndexSpec spec = vectorProps.indexSpec();
        Duration timeout = Duration.ofSeconds(vectorProps.createIndexTimeoutSeconds());
        log.info("[Bootstrap] Creating {} index on '{}.{}' (metric={}, timeout={}s)",
                spec.indexType(), name, MemorySchema.VECTOR_FIELD, spec.metricType(), timeout.toSeconds());
        if (!store.createIndex(name, MemorySchema.VECTOR_FIELD, spec, timeout)) {
            log.error("[Bootstrap] Index creation failed for '{}.{}'.", name, MemorySchema.VECTOR_FIELD);
        }
    }

    /**
     * Lists every way {@code actual} falls short of {@code expected}.
     * Longer VARCHAR fields are fine; shorter ones are reported.
     */
    static List<String> compare(CollectionSchema expected, CollectionSchema actual) {
        List<String> problems = new ArrayList<>();
        for (FieldDescriptor want : expected.fields()) {
            Optional<FieldDescriptor> found = actual.field(want.name());
            if (found.isEmpty()) {
                problems.add("missing field '" + want.name() + "'");
                continue;
            }
            FieldDescriptor have = found.get();
            if (have.kind() != want.kind()) {
                problems.add("field '%s' has type %s, expected %s".formatted(want.name(), have.kind(), want.kind()));
                continue;
            }
            if (want.kind().isVector() && !Objects.equals(have.dimension(), want.dimension())) {
                problems.add("vector field '%s' has dimension %s, expected %s"
                        .formatted(want.name(), have.dimension(), want.dimension()));
            }
            if (want.maxLength() != null && have.maxLength() != null && have.maxLength() < want.maxLength()) {
                problems.add("field '%s' max_length %d is shorter than %d"
                        .formatted(want.name(), have.maxLength(), want.maxLength()));
            }
            if (have.primaryKey() != want.primaryKey() || have.autoId() != want.autoId()) {
                problems.add("field '%s' primary=%s auto_id=%s, expected primary=%s auto_id=%s"
                        .formatted(want.name(), have.primaryKey(), have.autoId(), want.primaryKey(), want.autoId()));
            }
        }
        if (!expected.enableDynamicField()) {
            for (FieldDescriptor have : actual.fields()) {
                if (expected.field(have.name()).isEmpty()) {
                    problems.add("unexpected field '" + have.name() + "'");
                }
            }
        }
        return problems;
    }
}
