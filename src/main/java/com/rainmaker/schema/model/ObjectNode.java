package com.rainmaker.schema.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import lombok.Getter;

/**
 * An object with an ordered set of named fields. Field order is preserved in
 * the generated models.
 */
@Getter
public final class ObjectNode extends SchemaNode {

    private final Map<String, SchemaNode> fields;

    ObjectNode(Map<String, SchemaNode> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public SchemaNode getField(String name) {
        return fields.get(name);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.OBJECT;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitObject(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, SchemaNode> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder field(String name, SchemaNode schema) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(schema, "schema");
            if (fields.putIfAbsent(name, schema) != null) {
                throw new IllegalArgumentException("Duplicate field '" + name + "' in object schema");
            }
            return this;
        }

        public ObjectNode build() {
            return new ObjectNode(fields);
        }
    }
}
