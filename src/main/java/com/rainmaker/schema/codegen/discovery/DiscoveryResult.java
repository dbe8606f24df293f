package com.rainmaker.schema.codegen.discovery;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.rainmaker.schema.codegen.model.EnumDefinition;
import com.rainmaker.schema.codegen.model.RelationDescriptor;
import com.rainmaker.schema.model.NodeHandle;
import com.rainmaker.schema.model.ObjectNode;
import com.rainmaker.schema.model.SchemaNode;

import lombok.Getter;

/**
 * Every model and enum reachable from the top-level schemas, plus the
 * relations between models.
 */
@Getter
public final class DiscoveryResult {

    /**
     * Top-level models in caller order, then nested models in discovery order.
     */
    private final Map<String, ObjectNode> models;

    private final Map<NodeHandle, String> modelNames;

    private final Map<String, EnumDefinition> enums;

    private final List<RelationDescriptor> relations;

    private final int topLevelModelCount;

    DiscoveryResult(Map<String, ObjectNode> models,
                    Map<NodeHandle, String> modelNames,
                    Map<String, EnumDefinition> enums,
                    List<RelationDescriptor> relations,
                    int topLevelModelCount) {
        this.models = Collections.unmodifiableMap(models);
        this.modelNames = Collections.unmodifiableMap(modelNames);
        this.enums = Collections.unmodifiableMap(enums);
        this.relations = List.copyOf(relations);
        this.topLevelModelCount = topLevelModelCount;
    }

    /**
     * Name of the model registered for this object node, if any.
     */
    public Optional<String> modelNameOf(SchemaNode node) {
        return Optional.ofNullable(modelNames.get(node.getHandle()));
    }

    public Optional<RelationDescriptor> findRelation(String fromModel, String fieldName) {
        return relations.stream()
                .filter(r -> r.getFromModel().equals(fromModel) && r.getFieldName().equals(fieldName))
                .findFirst();
    }

    /**
     * The explicitly declared opposite side of a relation, if the target model
     * declares one.
     */
    public Optional<RelationDescriptor> findPair(RelationDescriptor relation) {
        return relations.stream().filter(relation::pairsWith).findFirst();
    }
}
