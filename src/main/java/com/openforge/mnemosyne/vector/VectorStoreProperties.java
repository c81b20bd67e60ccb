package com.openforge.mnemosyne.vector;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

/**
 * Vector database selection and collection parameters.
 *
 * application.yml:
 *
 * mnemosyne:
 *   vector:
 *     backend: milvus            # milvus | local
 *     collection-name: mnemosyne_default_memory
 *     index:
 *       metric-type: L2
 *       index-type: AUTOINDEX
 *     search:
 *       params: { nprobe: 10 }
 *     flush-after-insert: false
 *     milvus:
 *       uri: http://localhost:19530
 *       token: ${MILVUS_TOKEN:}
 *     local:
 *       data-path: mnemosyne_data/vectors
 */
@ConfigurationProperties(prefix = "mnemosyne.vector")
public record VectorStoreProperties(
        @DefaultValue("milvus")                   String  backend,
        @DefaultValue("mnemosyne_default_memory") String  collectionName,
        @DefaultValue("false")                    boolean enableDynamicField,
        @DefaultValue                             Index   index,
        @DefaultValue                             Search  search,
        List<String> outputFields,
        @DefaultValue("600")                      int     createIndexTimeoutSeconds,
        @DefaultValue("false")                    boolean flushAfterInsert,
        @DefaultValue                             Milvus  milvus,
        @DefaultValue                             Local   local
) {

    public record Index(
            @DefaultValue("L2")        String metricType,
            @DefaultValue("AUTOINDEX") String indexType,
            Map<String, Object> params
    ) {}

    /** A null metric follows the index metric. */
    public record Search(
            String metricType,
            Map<String, Object> params
    ) {}

    public record Milvus(
            @DefaultValue("http://localhost:19530") String uri,
            String token,
            String dbName,
            @DefaultValue("15000") long connectTimeoutMs
    ) {}

    public record Local(
            @DefaultValue("mnemosyne_data/vectors") String dataPath
    ) {}

    public IndexSpec indexSpec() {
        return new IndexSpec(index.metricType(), index.indexType(), index.params());
    }

    public SearchSpec searchSpec() {
        String metric = search.metricType() == null || search.metricType().isBlank()
                ? index.metricType()
                : search.metricType();
        Map<String, Object> params = search.params() == null ? Map.of("nprobe", 10) : search.params();
        return new SearchSpec(metric, params);
    }

    public List<String> effectiveOutputFields() {
        return outputFields == null || outputFields.isEmpty() ? MemorySchema.DEFAULT_OUTPUT_FIELDS : outputFields;
    }
}
