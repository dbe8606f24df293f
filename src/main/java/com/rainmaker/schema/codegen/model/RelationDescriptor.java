package com.rainmaker.schema.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A cross-model reference found during discovery.
 */
@Value
@Builder
public class RelationDescriptor {

    @NonNull
    String fromModel;

    @NonNull
    String toModel;

    @NonNull
    String fieldName;

    @NonNull
    String relationName;

    @NonNull
    Cardinality cardinality;

    boolean optional;

    public boolean isToMany() {
        return cardinality == Cardinality.MANY;
    }

    /**
     * Whether the other descriptor is the opposite side of the same relation.
     */
    public boolean pairsWith(RelationDescriptor other) {
        return relationName.equals(other.relationName)
                && fromModel.equals(other.toModel)
                && toModel.equals(other.fromModel);
    }

    @Override
    public String toString() {
        return fromModel + "." + fieldName + " -> " + toModel
                + " [" + relationName + ", " + cardinality + (optional ? ", optional" : "") + "]";
    }
}
