package com.openforge.mnemosyne.vector;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage backend for memory records, addressed by collection name.
 *
 * Failure contract: operations never throw. A failed call returns
 * {@code false} or {@link Optional#empty()}, which callers must keep apart
 * from a successful empty result ({@code Optional.of(List.of())}).
 *
 * Filter expressions use the boolean expression subset both backends accept:
 * {@code field op literal} clauses joined by {@code and}, for example
 * {@code session_id == "abc" and personality_id == "tutor"}.
 */
public interface VectorStore {

    // ── Connection ───────────────────────────────────────────────────────────

    boolean connect();

    boolean isConnected();

    void disconnect();

    /** One-line description for the startup summary. */
    String describe();

    // ── Collections ──────────────────────────────────────────────────────────

    boolean hasCollection(String collection);

    boolean createCollection(String collection, CollectionSchema schema);

    Optional<CollectionSchema> describeCollection(String collection);

    boolean dropCollection(String collection);

    Optional<List<String>> listCollections();

    boolean hasIndex(String collection, String field);

    boolean createIndex(String collection, String field, IndexSpec index, Duration timeout);

    boolean loadCollection(String collection);

    // ── Data ─────────────────────────────────────────────────────────────────

    Optional<InsertResult> insert(String collection, List<Map<String, Object>> rows);

    Optional<List<Map<String, Object>>> query(String collection,
                                              String filter,
                                              List<String> outputFields,
                                              int limit);

    /**
     * @return one hit list per query vector, best first
     */
    Optional<List<List<SearchHit>>> search(String collection,
                                           List<List<Float>> vectors,
                                           String vectorField,
                                           SearchSpec params,
                                           int limit,
                                           String filter,
                                           List<String> outputFields);

    Optional<DeleteResult> delete(String collection, String filter);

    boolean flush(List<String> collections);
}
