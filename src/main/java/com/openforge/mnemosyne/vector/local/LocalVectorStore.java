package com.openforge.mnemosyne.vector.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mnemosyne.vector.CollectionSchema;
import com.openforge.mnemosyne.vector.DeleteResult;
import com.openforge.mnemosyne.vector.FieldDescriptor;
import com.openforge.mnemosyne.vector.IndexSpec;
import com.openforge.mnemosyne.vector.InsertResult;
import com.openforge.mnemosyne.vector.SearchHit;
import com.openforge.mnemosyne.vector.SearchSpec;
import com.openforge.mnemosyne.vector.VectorStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * In-process vector store with a flat (exhaustive) index.
 *
 * Meant for single-node deployments without a Milvus server. Each collection
 * lives in memory and is written to {@code <dataPath>/<collection>.json} on
 * flush and on disconnect, and read back on connect.
 *
 * Supported metrics: L2 (squared distance, ascending), IP and COSINE
 * (similarity, descending).
 */
@Slf4j
public class LocalVectorStore implements VectorStore {

    private static final String FILE_SUFFIX = ".json";

    private final Path dataPath;
    private final ObjectMapper objectMapper;
    private final Map<String, LocalCollection> collections = new LinkedHashMap<>();
    private boolean connected;

    public LocalVectorStore(Path dataPath, ObjectMapper objectMapper) {
        this.dataPath     = dataPath;
        this.objectMapper = objectMapper;
    }

    // ── Connection ───────────────────────────────────────────────────────────

    @Override
    public synchronized boolean connect() {
        try {
            Files.createDirectories(dataPath);
            try (Stream<Path> files = Files.list(dataPath)) {
                for (Path file : files.filter(p -> p.getFileName().toString().endsWith(FILE_SUFFIX)).toList()) {
                    String name = file.getFileName().toString();
                    name = name.substring(0, name.length() - FILE_SUFFIX.length());
                    StoredCollection stored = objectMapper.readValue(file.toFile(), StoredCollection.class);
                    collections.put(name, LocalCollection.restore(stored));
                }
            }
            connected = true;
            log.info("[LocalVector] Opened store at {} ({} collections)", dataPath, collections.size());
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("[LocalVector] Failed to open store at {} — long-term memory will be DISABLED. Cause: {}",
                    dataPath, e.getMessage());
            collections.clear();
            connected = false;
            return false;
        }
    }

    @Override
    public synchronized boolean isConnected() {
        return connected;
    }

    @Override
    public synchronized void disconnect() {
        if (!connected) return;
        persist(new ArrayList<>(collections.keySet()));
        collections.clear();
        connected = false;
        log.info("[LocalVector] Store at {} closed.", dataPath);
    }

    @Override
    public String describe() {
        return "local " + dataPath.toAbsolutePath();
    }

    // ── Collections ──────────────────────────────────────────────────────────

    @Override
    public synchronized boolean hasCollection(String collection) {
        return connected && collections.containsKey(collection);
    }

    @Override
    public synchronized boolean createCollection(String collection, CollectionSchema schema) {
        if (!connected) return false;
        if (collections.containsKey(collection)) {
            log.warn("[LocalVector] Collection '{}' already exists", collection);
            return false;
        }
        collections.put(collection, new LocalCollection(schema));
        persist(List.of(collection));
        log.info("[LocalVector] Collection '{}' created.", collection);
        return true;
    }

    @Override
    public synchronized Optional<CollectionSchema> describeCollection(String collection) {
        LocalCollection c = connected ? collections.get(collection) : null;
        return c == null ? Optional.empty() : Optional.of(c.schema);
    }

    @Override
    public synchronized boolean dropCollection(String collection) {
        if (!connected || collections.remove(collection) == null) return false;
        try {
            Files.deleteIfExists(fileOf(collection));
        } catch (IOException e) {
            log.error("[LocalVector] Dropped '{}' but could not delete its file: {}", collection, e.getMessage());
            return false;
        }
        log.info("[LocalVector] Collection '{}' dropped.", collection);
        return true;
    }

    @Override
    public synchronized Optional<List<String>> listCollections() {
        if (!connected) return Optional.empty();
        return Optional.of(List.copyOf(collections.keySet()));
    }

    @Override
    public synchronized boolean hasIndex(String collection, String field) {
        LocalCollection c = connected ? collections.get(collection) : null;
        return c != null && c.index != null && field.equals(c.indexedField());
    }

    @Override
    public synchronized boolean createIndex(String collection, String field, IndexSpec index, Duration timeout) {
        LocalCollection c = connected ? collections.get(collection) : null;
        if (c == null) return false;
        Optional<FieldDescriptor> vectorField = c.schema.vectorField();
        if (vectorField.isEmpty() || !vectorField.get().name().equals(field)) {
            log.error("[LocalVector] '{}' is not the vector field of '{}'", field, collection);
            return false;
        }
        try {
            Metric.of(index.metricType());
        } catch (IllegalArgumentException e) {
            log.error("[LocalVector] {}", e.getMessage());
            return false;
        }
        c.index = index;
        persist(List.of(collection));
        return true;
    }

    @Override
    public synchronized boolean loadCollection(String collection) {
        return hasCollection(collection);
    }

    // ── Data ─────────────────────────────────────────────────────────────────

    @Override
    public synchronized Optional<InsertResult> insert(String collection, List<Map<String, Object>> rows) {
        LocalCollection c = connected ? collections.get(collection) : null;
        if (c == null) {
            log.error("[LocalVector] Insert into unknown collection '{}'", collection);
            return Optional.empty();
        }
        List<Map<String, Object>> accepted = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            String problem = c.validate(row);
            if (problem != null) {
                log.error("[LocalVector] Insert into '{}' rejected: {}", collection, problem);
                return Optional.empty();
            }
            accepted.add(new LinkedHashMap<>(row));
        }
        List<Object> ids = new ArrayList<>(accepted.size());
        for (Map<String, Object> row : accepted) {
            ids.add(c.add(row));
        }
        return Optional.of(new InsertResult(ids.size(), ids));
    }

    @Override
    public synchronized Optional<List<Map<String, Object>>> query(String collection, String filter,
                                                                  List<String> outputFields, int limit) {
        LocalCollection c = connected ? collections.get(collection) : null;
        if (c == null) return Optional.empty();
        FilterExpression predicate;
        try {
            predicate = FilterExpression.parse(filter);
        } catch (IllegalArgumentException e) {
            log.error("[LocalVector] Query on '{}' failed: {}", collection, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(c.rows.stream()
                .filter(predicate)
                .limit(Math.max(0, limit))
                .map(r -> c.project(r, outputFields))
                .toList());
    }

    @Override
    public synchronized Optional<List<List<SearchHit>>> search(String collection, List<List<Float>> vectors,
                                                               String vectorField, SearchSpec params, int limit,
                                                               String filter, List<String> outputFields) {
        LocalCollection c = connected ? collections.get(collection) : null;
        if (c == null) return Optional.empty();
        FilterExpression predicate;
        Metric metric;
        try {
            predicate = FilterExpression.parse(filter);
            metric = Metric.of(params.metricType() != null ? params.metricType()
                    : c.index != null ? c.index.metricType() : "L2");
        } catch (IllegalArgumentException e) {
            log.error("[LocalVector] Search on '{}' failed: {}", collection, e.getMessage());
            return Optional.empty();
        }

        List<List<SearchHit>> results = new ArrayList<>(vectors.size());
        for (List<Float> query : vectors) {
            Comparator<SearchHit> order = Comparator.comparingDouble(SearchHit::score);
            if (!metric.ascending) order = order.reversed();
            List<SearchHit> hits = c.rows.stream()
                    .filter(predicate)
                    .filter(r -> r.get(vectorField) instanceof List<?> v && v.size() == query.size())
                    .map(r -> new SearchHit(
                            r.get(c.schema.primaryField().name()),
                            metric.score(query, (List<?>) r.get(vectorField)),
                            c.project(r, outputFields)))
                    .sorted(order)
                    .limit(Math.max(0, limit))
                    .toList();
            results.add(hits);
        }
        return Optional.of(results);
    }

    @Override
    public synchronized Optional<DeleteResult> delete(String collection, String filter) {
        LocalCollection c = connected ? collections.get(collection) : null;
        if (c == null) return Optional.empty();
        try {
            FilterExpression predicate = FilterExpression.parse(filter);
            int before = c.rows.size();
            c.rows.removeIf(predicate);
            return Optional.of(new DeleteResult(before - c.rows.size()));
        } catch (IllegalArgumentException e) {
            log.error("[LocalVector] Delete on '{}' failed: {}", collection, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized boolean flush(List<String> names) {
        if (!connected) return false;
        return persist(names);
    }

    // ── Persistence ──────────────────────────────────────────────────────────

    private boolean persist(List<String> names) {
        boolean ok = true;
        for (String name : names) {
            LocalCollection c = collections.get(name);
            if (c == null) continue;
            Path target = fileOf(name);
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), c.toStored());
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                log.error("[LocalVector] Failed to persist collection '{}': {}", name, e.getMessage());
                ok = false;
            }
        }
        return ok;
    }

    private Path fileOf(String collection) {
        return dataPath.resolve(collection + FILE_SUFFIX);
    }

    // ── Internals ────────────────────────────────────────────────────────────

    /** On-disk form of a collection. */
    record StoredCollection(
            CollectionSchema schema,
            IndexSpec index,
            long nextId,
            List<Map<String, Object>> rows
    ) {}

    private static final class LocalCollection {

        final CollectionSchema schema;
        final List<Map<String, Object>> rows = new ArrayList<>();
        IndexSpec index;
        long nextId = 1;

        LocalCollection(CollectionSchema schema) {
            this.schema = schema;
        }

        static LocalCollection restore(StoredCollection stored) {
            LocalCollection c = new LocalCollection(stored.schema());
            c.index  = stored.index();
            c.nextId = Math.max(1, stored.nextId());
            if (stored.rows() != null) c.rows.addAll(stored.rows());
            return c;
        }

        StoredCollection toStored() {
            return new StoredCollection(schema, index, nextId, List.copyOf(rows));
        }

        String indexedField() {
            return schema.vectorField().map(FieldDescriptor::name).orElse(null);
        }

        /** Returns a reason the row is unacceptable, or null. */
        String validate(Map<String, Object> row) {
            for (FieldDescriptor f : schema.fields()) {
                Object value = row.get(f.name());
                if (f.primaryKey() && f.autoId()) {
                    if (value != null) return "primary key '%s' is auto-assigned".formatted(f.name());
                    continue;
                }
                if (value == null) return "missing field '%s'".formatted(f.name());
                switch (f.kind()) {
                    case VARCHAR -> {
                        if (f.maxLength() != null && value.toString().length() > f.maxLength())
                            return "field '%s' exceeds max length %d".formatted(f.name(), f.maxLength());
                    }
                    case FLOAT_VECTOR -> {
                        if (!(value instanceof List<?> v) || v.size() != f.dimension())
                            return "field '%s' must be a vector of dim %d".formatted(f.name(), f.dimension());
                    }
                    case INT64, FLOAT -> {
                        if (!(value instanceof Number))
                            return "field '%s' must be numeric".formatted(f.name());
                    }
                }
            }
            if (!schema.enableDynamicField()) {
                for (String key : row.keySet()) {
                    if (schema.field(key).isEmpty()) return "unknown field '%s'".formatted(key);
                }
            }
            return null;
        }

        Object add(Map<String, Object> row) {
            FieldDescriptor pk = schema.primaryField();
            if (pk.autoId()) row.put(pk.name(), nextId++);
            rows.add(row);
            return row.get(pk.name());
        }

        Map<String, Object> project(Map<String, Object> row, List<String> outputFields) {
            Map<String, Object> out = new LinkedHashMap<>();
            String pk = schema.primaryField().name();
            out.put(pk, row.get(pk));
            if (outputFields != null) {
                for (String f : outputFields) {
                    if (row.containsKey(f)) out.put(f, row.get(f));
                }
            }
            return out;
        }
    }

    private enum Metric {
        L2(true), IP(false), COSINE(false);

        final boolean ascending;

        Metric(boolean ascending) {
            this.ascending = ascending;
        }

        static Metric of(String name) {
            try {
                return valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new IllegalArgumentException("Unsupported metric type: " + name);
            }
        }

        float score(List<Float> query, List<?> stored) {
            double dot = 0, normA = 0, normB = 0, l2 = 0;
            for (int i = 0; i < query.size(); i++) {
                double a = query.get(i);
                double b = ((Number) stored.get(i)).doubleValue();
                dot += a * b;
                normA += a * a;
                normB += b * b;
                l2 += (a - b) * (a - b);
            }
            return switch (this) {
                case L2 -> (float) l2;
                case IP -> (float) dot;
                case COSINE -> normA == 0 || normB == 0 ? 0f : (float) (dot / (Math.sqrt(normA) * Math.sqrt(normB)));
            };
        }
    }
}
