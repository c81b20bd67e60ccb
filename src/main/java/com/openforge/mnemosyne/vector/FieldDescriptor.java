package com.openforge.mnemosyne.vector;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Backend-neutral description of one collection field.
 *
 * {@code maxLength} applies to VARCHAR fields and {@code dimension} to vector
 * fields; both are null otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldDescriptor(
        String name,
        FieldKind kind,
        boolean primaryKey,
        boolean autoId,
        Integer maxLength,
        Integer dimension,
        String description
) {

    public static FieldDescriptor primaryKey(String name, boolean autoId, String description) {
        return new FieldDescriptor(name, FieldKind.INT64, true, autoId, null, null, description);
    }

    public static FieldDescriptor varchar(String name, int maxLength, String description) {
        return new FieldDescriptor(name, FieldKind.VARCHAR, false, false, maxLength, null, description);
    }

    public static FieldDescriptor int64(String name, String description) {
        return new FieldDescriptor(name, FieldKind.INT64, false, false, null, null, description);
    }

    public static FieldDescriptor floatVector(String name, int dimension, String description) {
        return new FieldDescriptor(name, FieldKind.FLOAT_VECTOR, false, false, null, dimension, description);
    }
}
