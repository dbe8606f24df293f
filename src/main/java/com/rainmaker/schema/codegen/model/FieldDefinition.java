package com.rainmaker.schema.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One emitted field line: name, DSL type (with {@code ?} / {@code []}
 * suffixes) and attributes.
 */
@Value
@Builder(toBuilder = true)
public class FieldDefinition {

    @NonNull
    String name;

    @NonNull
    String dslType;

    @NonNull
    @Singular
    List<String> attributes;

    /**
     * Relation name when this field is the model side of a relation.
     */
    String relationName;

    /**
     * Related model when this field is a relation field.
     */
    String relatedModel;

    public boolean isId() {
        return attributes.stream().anyMatch(attribute -> attribute.equals("@id"));
    }

    public boolean isRelation() {
        return relationName != null;
    }

    public String render() {
        StringBuilder sb = new StringBuilder(name).append(' ').append(dslType);
        for (String attribute : attributes) {
            sb.append(' ').append(attribute);
        }
        return sb.toString();
    }
}
