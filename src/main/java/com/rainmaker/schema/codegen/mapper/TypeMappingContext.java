package com.rainmaker.schema.codegen.mapper;

import java.util.Map;
import java.util.Optional;

import com.rainmaker.schema.codegen.discovery.DiscoveryResult;
import com.rainmaker.schema.model.MetadataTable;
import com.rainmaker.schema.model.NodeHandle;
import com.rainmaker.schema.model.SchemaNode;

/**
 * Read-only lookup tables the type mapper consults: discovered model names and
 * the field metadata side table.
 */
public record TypeMappingContext(Map<NodeHandle, String> modelNames, MetadataTable metadata) {

    public static TypeMappingContext of(DiscoveryResult discovery, MetadataTable metadata) {
        return new TypeMappingContext(discovery.getModelNames(), metadata);
    }

    public Optional<String> modelNameOf(SchemaNode node) {
        return Optional.ofNullable(modelNames.get(node.getHandle()));
    }
}
