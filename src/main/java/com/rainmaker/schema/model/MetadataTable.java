package com.rainmaker.schema.model;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Side table of field and model metadata keyed by {@link NodeHandle}.
 *
 * Populated while the schemas are authored and read-only afterwards.
 */
public final class MetadataTable {

    private final Map<NodeHandle, FieldMetadata> fieldMetadata = new HashMap<>();
    private final Map<NodeHandle, ModelMetadata> modelMetadata = new HashMap<>();

    public MetadataTable field(SchemaNode node, FieldMetadata metadata) {
        fieldMetadata.put(node.getHandle(), metadata);
        return this;
    }

    public MetadataTable model(ObjectNode node, ModelMetadata metadata) {
        modelMetadata.put(node.getHandle(), metadata);
        return this;
    }

    /**
     * Metadata attached directly to this node.
     */
    public Optional<FieldMetadata> fieldOf(SchemaNode node) {
        return Optional.ofNullable(fieldMetadata.get(node.getHandle()));
    }

    /**
     * Metadata for a field, searched from the outermost node inward through
     * Optional, Nullable, Lazy and Array layers. The first hit wins.
     */
    public Optional<FieldMetadata> resolveField(SchemaNode node) {
        Set<NodeHandle> seen = new HashSet<>();
        SchemaNode current = node;
        while (current != null && seen.add(current.getHandle())) {
            FieldMetadata metadata = fieldMetadata.get(current.getHandle());
            if (metadata != null) {
                return Optional.of(metadata);
            }
            current = innerOf(current);
        }
        return Optional.empty();
    }

    public Optional<ModelMetadata> modelOf(SchemaNode node) {
        return Optional.ofNullable(modelMetadata.get(node.getHandle()));
    }

    public boolean isEmpty() {
        return fieldMetadata.isEmpty() && modelMetadata.isEmpty();
    }

    private static SchemaNode innerOf(SchemaNode node) {
        if (node instanceof OptionalNode optional) {
            return optional.getInner();
        }
        if (node instanceof NullableNode nullable) {
            return nullable.getInner();
        }
        if (node instanceof LazyNode lazy) {
            return lazy.resolve();
        }
        if (node instanceof ArrayNode array) {
            return array.getElement();
        }
        return null;
    }
}
