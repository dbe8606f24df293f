package com.rainmaker.schema.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import lombok.Getter;

/**
 * Compiler input: top-level schemas in caller order together with the
 * metadata attached to their nodes.
 */
@Getter
public final class SchemaSet {

    private final Map<String, SchemaNode> schemas;
    private final MetadataTable metadata;

    public SchemaSet(Map<String, ? extends SchemaNode> schemas, MetadataTable metadata) {
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public static SchemaSet of(Map<String, ? extends SchemaNode> schemas) {
        return new SchemaSet(schemas, new MetadataTable());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, SchemaNode> schemas = new LinkedHashMap<>();
        private final MetadataTable metadata = new MetadataTable();

        private Builder() {
        }

        public Builder model(String name, SchemaNode schema) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(schema, "schema");
            if (schemas.putIfAbsent(name, schema) != null) {
                throw new IllegalArgumentException("Duplicate model name '" + name + "'");
            }
            return this;
        }

        public Builder model(String name, ObjectNode schema, ModelMetadata modelMetadata) {
            model(name, schema);
            metadata.model(schema, modelMetadata);
            return this;
        }

        public Builder field(SchemaNode node, FieldMetadata fieldMetadata) {
            metadata.field(node, fieldMetadata);
            return this;
        }

        public SchemaSet build() {
            return new SchemaSet(schemas, metadata);
        }
    }
}
