package com.rainmaker.schema.codegen.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Canonical internal representation of one emitted model block.
 *
 * Pure structure only (no validation, no generation logic).
 */
@Value
@Builder(toBuilder = true)
public class ModelDefinition {

    @NonNull
    String name;

    /**
     * Field lines in emission order.
     */
    @NonNull
    @Singular
    List<FieldDefinition> fields;

    /**
     * Rendered model-level attributes ({@code @@index}, {@code @@map}, {@code @@schema}).
     */
    @NonNull
    @Singular
    List<String> modelAttributes;

    public Optional<FieldDefinition> findField(String fieldName) {
        return fields.stream().filter(field -> field.getName().equals(fieldName)).findFirst();
    }

    public boolean hasField(String fieldName) {
        return findField(fieldName).isPresent();
    }

    public boolean hasRelation(String relationName, String relatedModel) {
        return fields.stream().anyMatch(field -> relationName.equals(field.getRelationName())
                && relatedModel.equals(field.getRelatedModel()));
    }
}
