package com.openforge.mnemosyne.vector.milvus;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.openforge.mnemosyne.vector.CollectionSchema;
import com.openforge.mnemosyne.vector.DeleteResult;
import com.openforge.mnemosyne.vector.FieldDescriptor;
import com.openforge.mnemosyne.vector.FieldKind;
import com.openforge.mnemosyne.vector.IndexSpec;
import com.openforge.mnemosyne.vector.InsertResult;
import com.openforge.mnemosyne.vector.SearchHit;
import com.openforge.mnemosyne.vector.SearchSpec;
import com.openforge.mnemosyne.vector.VectorStore;
import com.openforge.mnemosyne.vector.VectorStoreProperties;
import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.DescribeCollectionReq;
import io.milvus.v2.service.collection.request.DropCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import io.milvus.v2.service.collection.request.LoadCollectionReq;
import io.milvus.v2.service.collection.response.DescribeCollectionResp;
import io.milvus.v2.service.index.request.CreateIndexReq;
import io.milvus.v2.service.index.request.ListIndexesReq;
import io.milvus.v2.service.utility.request.FlushReq;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.InsertReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.data.BaseVector;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.DeleteResp;
import io.milvus.v2.service.vector.response.InsertResp;
import io.milvus.v2.service.vector.response.QueryResp;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link VectorStore} on top of the Milvus Java SDK v2.
 *
 * Every SDK call is wrapped so that exceptions become the interface's
 * failure values; the client itself is created lazily by {@link #connect()}.
 */
@Slf4j
public class MilvusVectorStore implements VectorStore {

    private final VectorStoreProperties.Milvus props;
    private volatile MilvusClientV2 client;

    public MilvusVectorStore(VectorStoreProperties.Milvus props) {
        this.props = props;
    }

    // ── Connection ───────────────────────────────────────────────────────────

    @Override
    public boolean connect() {
        log.info("[Milvus] Connecting to {}...", props.uri());
        try {
            var config = ConnectConfig.builder()
                    .uri(props.uri())
                    .connectTimeoutMs(props.connectTimeoutMs());
            if (props.token() != null && !props.token().isBlank()) config.token(props.token());
            if (props.dbName() != null && !props.dbName().isBlank()) config.dbName(props.dbName());
            client = new MilvusClientV2(config.build());
            log.info("[Milvus] Connected successfully.");
            return true;
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed — long-term memory will be DISABLED. Cause: {}. " +
                     "If using FRP, ensure the Milvus port uses [type = tcp] not [type = http].",
                    e.getMessage());
            client = null;
            return false;
        }
    }

    @Override
    public boolean isConnected() {
        return client != null;
    }

    @Override
    public void disconnect() {
        MilvusClientV2 c = client;
        client = null;
        if (c == null) return;
        try {
            c.close();
            log.info("[Milvus] Disconnected.");
        } catch (Exception e) {
            log.warn("[Milvus] Error while closing client: {}", e.getMessage());
        }
    }

    @Override
    public String describe() {
        return "milvus " + props.uri() + (props.dbName() == null ? "" : " db=" + props.dbName());
    }

    // ── Collections ──────────────────────────────────────────────────────────

    @Override
    public boolean hasCollection(String collection) {
        if (unavailable("hasCollection")) return false;
        try {
            return Boolean.TRUE.equals(client.hasCollection(
                    HasCollectionReq.builder().collectionName(collection).build()));
        } catch (Exception e) {
            log.error("[Milvus] hasCollection('{}') failed: {}", collection, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean createCollection(String collection, CollectionSchema schema) {
        if (unavailable("createCollection")) return false;
        try {
            CreateCollectionReq.CollectionSchema milvusSchema = CreateCollectionReq.CollectionSchema.builder()
                    .enableDynamicField(schema.enableDynamicField())
                    .build();
            for (FieldDescriptor f : schema.fields()) {
                milvusSchema.addField(toAddField(f));
            }
            client.createCollection(CreateCollectionReq.builder()
                    .collectionName(collection)
                    .description(schema.description())
                    .collectionSchema(milvusSchema)
                    .build());
            log.info("[Milvus] Collection '{}' created.", collection);
            return true;
        } catch (Exception e) {
            log.error("[Milvus] Failed to create collection '{}': {}", collection, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public Optional<CollectionSchema> describeCollection(String collection) {
        if (unavailable("describeCollection")) return Optional.empty();
        try {
            DescribeCollectionResp resp = client.describeCollection(
                    DescribeCollectionReq.builder().collectionName(collection).build());
            List<FieldDescriptor> fields = new ArrayList<>();
            for (CreateCollectionReq.FieldSchema f : resp.getCollectionSchema().getFieldSchemaList()) {
                FieldKind kind = fromDataType(f.getDataType());
                if (kind == null) {
                    log.debug("[Milvus] Ignoring field '{}' of unsupported type {}", f.getName(), f.getDataType());
                    continue;
                }
                fields.add(new FieldDescriptor(
                        f.getName(),
                        kind,
                        Boolean.TRUE.equals(f.getIsPrimaryKey()),
                        Boolean.TRUE.equals(f.getAutoID()),
                        kind == FieldKind.VARCHAR ? f.getMaxLength() : null,
                        kind.isVector() ? f.getDimension() : null,
                        f.getDescription()));
            }
            return Optional.of(new CollectionSchema(fields, resp.getDescription(),
                    Boolean.TRUE.equals(resp.getEnableDynamicField())));
        } catch (Exception e) {
            log.error("[Milvus] describeCollection('{}') failed: {}", collection, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean dropCollection(String collection) {
        if (unavailable("dropCollection")) return false;
        try {
            client.dropCollection(DropCollectionReq.builder().collectionName(collection).build());
            log.info("[Milvus] Collection '{}' dropped.", collection);
            return true;
        } catch (Exception e) {
            log.error("[Milvus] Failed to drop collection '{}': {}", collection, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<List<String>> listCollections() {
        if (unavailable("listCollections")) return Optional.empty();
        try {
            return Optional.of(List.copyOf(client.listCollections().getCollectionNames()));
        } catch (Exception e) {
            log.error("[Milvus] listCollections failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean hasIndex(String collection, String field) {
        if (unavailable("hasIndex")) return false;
        try {
            List<String> indexes = client.listIndexes(ListIndexesReq.builder()
                    .collectionName(collection)
                    .fieldName(field)
                    .build());
            return indexes != null && !indexes.isEmpty();
        } catch (Exception e) {
            log.error("[Milvus] listIndexes('{}', '{}') failed: {}", collection, field, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean createIndex(String collection, String field, IndexSpec index, Duration timeout) {
        if (unavailable("createIndex")) return false;
        IndexParam param = IndexParam.builder()
                .fieldName(field)
                .indexType(IndexParam.IndexType.valueOf(index.indexType()))
                .metricType(IndexParam.MetricType.valueOf(index.metricType()))
                .extraParams(new HashMap<>(index.params()))
                .build();
        CompletableFuture<Void> call = CompletableFuture.runAsync(() -> client.createIndex(CreateIndexReq.builder()
                .collectionName(collection)
                .indexParams(List.of(param))
                .build()));
        try {
            call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Milvus] Index {} ({}) created on '{}.{}'.",
                    index.indexType(), index.metricType(), collection, field);
            return true;
        } catch (TimeoutException e) {
            log.error("[Milvus] Index creation on '{}.{}' did not finish within {}s",
                    collection, field, timeout.toSeconds());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.error("[Milvus] Failed to create index on '{}.{}': {}",
                    collection, field, e.getCause().getMessage());
            return false;
        }
    }

    @Override
    public boolean loadCollection(String collection) {
        if (unavailable("loadCollection")) return false;
        try {
            client.loadCollection(LoadCollectionReq.builder().collectionName(collection).build());
            return true;
        } catch (Exception e) {
            log.error("[Milvus] Failed to load collection '{}': {}", collection, e.getMessage());
            return false;
        }
    }

    // ── Data ─────────────────────────────────────────────────────────────────

    @Override
    public Optional<InsertResult> insert(String collection, List<Map<String, Object>> rows) {
        if (unavailable("insert")) return Optional.empty();
        try {
            List<JsonObject> data = rows.stream().map(MilvusVectorStore::toJsonRow).toList();
            InsertResp resp = client.insert(InsertReq.builder()
                    .collectionName(collection)
                    .data(data)
                    .build());
            List<Object> ids = resp.getPrimaryKeys() == null ? List.of() : List.copyOf(resp.getPrimaryKeys());
            log.debug("[Milvus] Inserted {} rows into '{}'", resp.getInsertCnt(), collection);
            return Optional.of(new InsertResult(resp.getInsertCnt(), ids));
        } catch (Exception e) {
            log.error("[Milvus] Insert into '{}' failed: {}", collection, e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public Optional<List<Map<String, Object>>> query(String collection, String filter,
                                                     List<String> outputFields, int limit) {
        if (unavailable("query")) return Optional.empty();
        try {
            var builder = QueryReq.builder()
                    .collectionName(collection)
                    .outputFields(outputFields)
                    .limit(limit);
            if (filter != null && !filter.isBlank()) builder.filter(filter);

            QueryResp resp = client.query(builder.build());
            List<Map<String, Object>> rows = new ArrayList<>();
            for (QueryResp.QueryResult r : resp.getQueryResults()) {
                rows.add(new LinkedHashMap<>(r.getEntity()));
            }
            return Optional.of(rows);
        } catch (Exception e) {
            log.error("[Milvus] Query on '{}' (filter={}) failed: {}", collection, filter, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<List<List<SearchHit>>> search(String collection, List<List<Float>> vectors,
                                                  String vectorField, SearchSpec params, int limit,
                                                  String filter, List<String> outputFields) {
        if (unavailable("search")) return Optional.empty();
        try {
            List<BaseVector> data = new ArrayList<>(vectors.size());
            for (List<Float> v : vectors) data.add(new FloatVec(v));

            Map<String, Object> searchParams = new HashMap<>(params.params());
            searchParams.put("metric_type", params.metricType());

            var builder = SearchReq.builder()
                    .collectionName(collection)
                    .data(data)
                    .annsField(vectorField)
                    .topK(limit)
                    .searchParams(searchParams)
                    .outputFields(outputFields);
            if (filter != null && !filter.isBlank()) builder.filter(filter);

            SearchResp resp = client.search(builder.build());
            List<List<SearchHit>> out = new ArrayList<>();
            for (List<SearchResp.SearchResult> perQuery : resp.getSearchResults()) {
                List<SearchHit> hits = new ArrayList<>(perQuery.size());
                for (SearchResp.SearchResult hit : perQuery) {
                    Float score = hit.getScore();
                    Map<String, Object> entity = hit.getEntity() == null ? Map.of() : hit.getEntity();
                    hits.add(new SearchHit(hit.getId(), score == null ? 0f : score, entity));
                }
                out.add(hits);
            }
            return Optional.of(out);
        } catch (Exception e) {
            log.error("[Milvus] Search on '{}' failed: {}", collection, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<DeleteResult> delete(String collection, String filter) {
        if (unavailable("delete")) return Optional.empty();
        try {
            DeleteResp resp = client.delete(DeleteReq.builder()
                    .collectionName(collection)
                    .filter(filter)
                    .build());
            return Optional.of(new DeleteResult(resp.getDeleteCnt()));
        } catch (Exception e) {
            log.error("[Milvus] Delete on '{}' (filter={}) failed: {}", collection, filter, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean flush(List<String> collections) {
        if (unavailable("flush")) return false;
        try {
            client.flush(FlushReq.builder().collectionNames(collections).build());
            return true;
        } catch (Exception e) {
            log.error("[Milvus] Flush of {} failed: {}", collections, e.getMessage());
            return false;
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private boolean unavailable(String op) {
        if (client == null) {
            log.debug("[Milvus] {} skipped — not connected.", op);
            return true;
        }
        return false;
    }

    private static AddFieldReq toAddField(FieldDescriptor f) {
        var b = AddFieldReq.builder()
                .fieldName(f.name())
                .dataType(toDataType(f.kind()))
                .isPrimaryKey(f.primaryKey())
                .autoID(f.autoId());
        if (f.description() != null) b.description(f.description());
        if (f.maxLength() != null) b.maxLength(f.maxLength());
        if (f.dimension() != null) b.dimension(f.dimension());
        return b.build();
    }

    private static DataType toDataType(FieldKind kind) {
        return switch (kind) {
            case INT64        -> DataType.Int64;
            case FLOAT        -> DataType.Float;
            case VARCHAR      -> DataType.VarChar;
            case FLOAT_VECTOR -> DataType.FloatVector;
        };
    }

    private static FieldKind fromDataType(DataType type) {
        if (type == null) return null;
        return switch (type) {
            case Int64       -> FieldKind.INT64;
            case Float       -> FieldKind.FLOAT;
            case VarChar     -> FieldKind.VARCHAR;
            case FloatVector -> FieldKind.FLOAT_VECTOR;
            default          -> null;
        };
    }

    static JsonObject toJsonRow(Map<String, Object> row) {
        JsonObject json = new JsonObject();
        row.forEach((key, value) -> {
            if (value == null) return;
            if (value instanceof Number n) {
                json.addProperty(key, n);
            } else if (value instanceof Boolean b) {
                json.addProperty(key, b);
            } else if (value instanceof List<?> list) {
                JsonArray array = new JsonArray();
                for (Object o : list) array.add(((Number) o).floatValue());
                json.add(key, array);
            } else {
                json.addProperty(key, value.toString());
            }
        });
        return json;
    }
}
