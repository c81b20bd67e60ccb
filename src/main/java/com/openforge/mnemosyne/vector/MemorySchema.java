package com.openforge.mnemosyne.vector;

import java.util.List;

/**
 * Layout of a memory collection.
 *
 * ┌────────────────┬────────────────┬──────────────────────────────────────┐
 * │ Field          │ Type           │ Notes                                │
 * ├────────────────┼────────────────┼──────────────────────────────────────┤
 * │ memory_id      │ INT64 PK       │ auto_id = true                       │
 * │ personality_id │ VARCHAR(256)   │ persona the memory belongs to        │
 * │ session_id     │ VARCHAR(72)    │ session that produced it             │
 * │ content        │ VARCHAR(4096)  │ the summary text                     │
 * │ vector         │ FLOAT_VECTOR   │ dim fixed at creation                │
 * │ create_time    │ INT64          │ unix seconds                         │
 * └────────────────┴────────────────┴──────────────────────────────────────┘
 */
public final class MemorySchema {

    public static final String PRIMARY_FIELD     = "memory_id";
    public static final String PERSONALITY_FIELD = "personality_id";
    public static final String SESSION_FIELD     = "session_id";
    public static final String CONTENT_FIELD     = "content";
    public static final String VECTOR_FIELD      = "vector";
    public static final String CREATE_TIME_FIELD = "create_time";

    public static final int PERSONALITY_MAX_LENGTH = 256;
    public static final int SESSION_MAX_LENGTH     = 72;
    public static final int CONTENT_MAX_LENGTH     = 4096;

    public static final List<String> DEFAULT_OUTPUT_FIELDS = List.of(
            CONTENT_FIELD, CREATE_TIME_FIELD, SESSION_FIELD, PERSONALITY_FIELD, PRIMARY_FIELD);

    private MemorySchema() {}

    public static CollectionSchema build(String collectionName, int dimension, boolean enableDynamicField) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be a positive integer, got " + dimension);
        }
        return new CollectionSchema(List.of(
                FieldDescriptor.primaryKey(PRIMARY_FIELD, true, "Unique memory id"),
                FieldDescriptor.varchar(PERSONALITY_FIELD, PERSONALITY_MAX_LENGTH, "Persona the memory belongs to"),
                FieldDescriptor.varchar(SESSION_FIELD, SESSION_MAX_LENGTH, "Session that produced the memory"),
                FieldDescriptor.varchar(CONTENT_FIELD, CONTENT_MAX_LENGTH, "Summary text"),
                FieldDescriptor.floatVector(VECTOR_FIELD, dimension, "Embedding of the summary text"),
                FieldDescriptor.int64(CREATE_TIME_FIELD, "Creation time, unix seconds")
        ), "Mnemosyne long-term memory: " + collectionName, enableDynamicField);
    }

    /** Quotes a string literal for use in a filter expression. */
    public static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    public static String eq(String field, String value) {
        return field + " == " + quote(value);
    }
}
