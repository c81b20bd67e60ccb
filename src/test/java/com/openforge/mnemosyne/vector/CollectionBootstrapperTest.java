package com.openforge.mnemosyne.vector;

import com.openforge.mnemosyne.TestProperties;
import com.openforge.mnemosyne.config.AppConfig;
import com.openforge.mnemosyne.embedding.EmbeddingProperties;
import com.openforge.mnemosyne.vector.local.LocalVectorStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CollectionBootstrapperTest {

    private static final String COLLECTION = TestProperties.COLLECTION;

    @TempDir
    Path tempDir;

    private static EmbeddingProperties embedding(int dimensions) {
        return new EmbeddingProperties("openai", null, "sk-test", "text-embedding-3-small", dimensions, 30, false);
    }

    @Test
    void shouldCreateIndexAndLoadMissingCollection() {
        var store = new LocalVectorStore(tempDir, new AppConfig().objectMapper());
        assertTrue(store.connect());

        new CollectionBootstrapper(store, TestProperties.vector(false), embedding(8)).bootstrap();

        assertTrue(store.hasCollection(COLLECTION));
        assertTrue(store.hasIndex(COLLECTION, MemorySchema.VECTOR_FIELD));
        var schema = store.describeCollection(COLLECTION).orElseThrow();
        assertEquals(8, schema.vectorField().orElseThrow().dimension());
        assertTrue(CollectionBootstrapper.compare(MemorySchema.build(COLLECTION, 8, false), schema).isEmpty());
    }

    @Test
    void shouldReuseExistingCollection() {
        VectorStore store = mock(VectorStore.class);
        when(store.isConnected()).thenReturn(true);
        when(store.hasCollection(COLLECTION)).thenReturn(true);
        when(store.describeCollection(COLLECTION))
                .thenReturn(java.util.Optional.of(MemorySchema.build(COLLECTION, 4, false)));
        when(store.hasIndex(COLLECTION, MemorySchema.VECTOR_FIELD)).thenReturn(true);
        when(store.loadCollection(COLLECTION)).thenReturn(true);

        new CollectionBootstrapper(store, TestProperties.vector(false), embedding(1536)).bootstrap();

        verify(store, never()).createCollection(any(), any());
        verify(store, never()).createIndex(any(), any(), any(), any());
        verify(store).loadCollection(COLLECTION);
    }

    @Test
    void shouldFailStartupWhenCreateFails() {
        VectorStore store = mock(VectorStore.class);
        when(store.isConnected()).thenReturn(true);
        when(store.hasCollection(COLLECTION)).thenReturn(false);
        when(store.createCollection(eq(COLLECTION), any())).thenReturn(false);

        var bootstrapper = new CollectionBootstrapper(store, TestProperties.vector(false), embedding(1536));

        assertThrows(IllegalStateException.class, bootstrapper::bootstrap);
    }

    @Test
    void shouldSkipWhenStoreIsDown() {
        VectorStore store = mock(VectorStore.class);
        when(store.isConnected()).thenReturn(false);

        new CollectionBootstrapper(store, TestProperties.vector(false), embedding(1536)).bootstrap();

        verify(store).isConnected();
        verifyNoMoreInteractions(store);
    }

    @Test
    void shouldReportEverySchemaDifference() {
        CollectionSchema expected = MemorySchema.build(COLLECTION, 1536, false);
        List<FieldDescriptor> fields = new ArrayList<>();
        fields.add(FieldDescriptor.primaryKey(MemorySchema.PRIMARY_FIELD, false, "id"));
        fields.add(FieldDescriptor.varchar(MemorySchema.PERSONALITY_FIELD, 1024, "longer is fine"));
        fields.add(FieldDescriptor.varchar(MemorySchema.SESSION_FIELD, 32, "too short"));
        fields.add(FieldDescriptor.int64(MemorySchema.CONTENT_FIELD, "wrong type"));
        fields.add(FieldDescriptor.floatVector(MemorySchema.VECTOR_FIELD, 768, "wrong dim"));
        fields.add(FieldDescriptor.varchar("extra", 10, "unexpected"));
        CollectionSchema actual = new CollectionSchema(fields, "legacy", false);

        List<String> problems = CollectionBootstrapper.compare(expected, actual);

        assertEquals(6, problems.size(), problems::toString);
        assertTrue(problems.stream().anyMatch(p -> p.contains("missing field 'create_time'")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("'content' has type INT64")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("dimension 768")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("'session_id' max_length 32")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("auto_id=false")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("unexpected field 'extra'")));
    }

    @Test
    void shouldIgnoreExtraFieldsWhenDynamicFieldsAreOn() {
        List<FieldDescriptor> fields = new ArrayList<>(MemorySchema.build(COLLECTION, 4, true).fields());
        fields.add(FieldDescriptor.varchar("mood", 16, "dynamic"));

        assertTrue(CollectionBootstrapper.compare(
                MemorySchema.build(COLLECTION, 4, true), new CollectionSchema(fields, "x", true)).isEmpty());
    }
}
