package com.rainmaker.schema.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Model-level persistence hints: indexes, table name and database schema.
 */
@Value
@Builder(toBuilder = true)
public class ModelMetadata {

    @NonNull
    @Singular
    List<IndexDefinition> indexes;

    /**
     * Table name, emitted as {@code @@map}.
     */
    String map;

    /**
     * Database schema, emitted as {@code @@schema} unless it is the default one.
     */
    String schema;
}
