package com.openforge.mnemosyne.vector;

import java.util.List;
import java.util.Optional;

/**
 * Backend-neutral collection schema: an ordered field list plus flags.
 */
public record CollectionSchema(
        List<FieldDescriptor> fields,
        String description,
        boolean enableDynamicField
) {

    public CollectionSchema {
        fields = List.copyOf(fields);
        long primaries = fields.stream().filter(FieldDescriptor::primaryKey).count();
        if (primaries != 1) {
            throw new IllegalArgumentException("Schema needs exactly one primary key field, found " + primaries);
        }
    }

    public Optional<FieldDescriptor> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public FieldDescriptor primaryField() {
        return fields.stream().filter(FieldDescriptor::primaryKey).findFirst().orElseThrow();
    }

    public Optional<FieldDescriptor> vectorField() {
        return fields.stream().filter(f -> f.kind().isVector()).findFirst();
    }
}
