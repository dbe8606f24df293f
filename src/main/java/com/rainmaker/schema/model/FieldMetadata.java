package com.rainmaker.schema.model;

import lombok.Builder;
import lombok.Value;

/**
 * Persistence hints for a single field. The node vocabulary itself has no
 * notion of keys or relations, so these travel beside the node in a
 * {@link MetadataTable}.
 */
@Value
@Builder(toBuilder = true)
public class FieldMetadata {

    boolean unique;

    /**
     * Default value; function calls such as {@code now()} are emitted verbatim.
     */
    String defaultValue;

    /**
     * Database-generated UUID primary key.
     */
    boolean id;

    boolean updatedAt;

    boolean index;

    /**
     * Relation name shared by both sides of a relation.
     */
    String relation;

    /**
     * Explicit relation target model; checked against the model map when
     * relations are validated.
     */
    String references;

    /**
     * Column name in the database.
     */
    String map;

    DbMetadata db;

    public static FieldMetadata relation(String name) {
        return FieldMetadata.builder().relation(name).build();
    }

    @Value
    @Builder
    public static class DbMetadata {
        /**
         * Native database type, emitted as {@code @db.<type>}.
         */
        String type;
        String name;
    }
}
