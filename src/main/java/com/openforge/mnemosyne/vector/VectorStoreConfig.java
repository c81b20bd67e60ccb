package com.openforge.mnemosyne.vector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mnemosyne.vector.local.LocalVectorStore;
import com.openforge.mnemosyne.vector.milvus.MilvusVectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Vector store bean selection.
 *
 * An unknown backend name aborts startup. A known backend that cannot
 * connect is still registered; memory features then stay off because every
 * pipeline checks {@link VectorStore#isConnected()} first.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(VectorStoreProperties.class)
public class VectorStoreConfig {

    @Bean(destroyMethod = "disconnect")
    public VectorStore vectorStore(VectorStoreProperties props, ObjectMapper objectMapper) {
        VectorStore store = create(props, objectMapper);
        log.info("[Bootstrap] Connecting vector store {}…", store.describe());
        if (store.connect()) {
            log.info("[Bootstrap] Vector store connected.");
        } else {
            log.warn("[Bootstrap] Vector store connection failed — long-term memory will be DISABLED.");
        }
        return store;
    }

    static VectorStore create(VectorStoreProperties props, ObjectMapper objectMapper) {
        String backend = props.backend() == null ? "" : props.backend().strip().toLowerCase(Locale.ROOT);
        return switch (backend) {
            case "milvus" -> new MilvusVectorStore(props.milvus());
            case "local"  -> new LocalVectorStore(Path.of(props.local().dataPath()), objectMapper);
            default -> throw new IllegalStateException(
                    "Unsupported vector backend '%s'; choose 'milvus' or 'local'".formatted(props.backend()));
        };
    }
}
