package com.rainmaker.schema.codegen.discovery;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rainmaker.schema.codegen.exception.SchemaGenerationException;
import com.rainmaker.schema.codegen.exception.SchemaValidationException;
import com.rainmaker.schema.codegen.model.Cardinality;
import com.rainmaker.schema.codegen.model.EnumDefinition;
import com.rainmaker.schema.codegen.model.RelationDescriptor;
import com.rainmaker.schema.codegen.util.NamingUtil;
import com.rainmaker.schema.model.ArrayNode;
import com.rainmaker.schema.model.FieldMetadata;
import com.rainmaker.schema.model.MetadataTable;
import com.rainmaker.schema.model.NodeHandle;
import com.rainmaker.schema.model.ObjectNode;
import com.rainmaker.schema.model.SchemaNode;
import com.rainmaker.schema.model.SchemaNodes;
import com.rainmaker.schema.model.UnionNode;

/**
 * Finds every model and enum reachable from the top-level schemas.
 *
 * Design:
 * - Objects held by a field become models named {@code Parent + Field}; objects
 *   held by an array field become {@code Parent + Field + "Item"}.
 * - An object that already has a name (top-level or discovered earlier) keeps it.
 * - Only unions built as enumerations become enums; plain literal unions,
 *   records and other unions are Json columns and are not descended into.
 * - A visited set keyed by node handle makes lazy and cyclic graphs terminate.
 */
public class ModelDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(ModelDiscoveryService.class);

    public DiscoveryResult discover(Map<String, ? extends SchemaNode> schemas, MetadataTable metadata) {
        Run run = new Run();

        for (Map.Entry<String, ? extends SchemaNode> entry : schemas.entrySet()) {
            SchemaNode root = SchemaNodes.unwrap(entry.getValue());
            if (!(root instanceof ObjectNode object)) {
                throw new SchemaGenerationException(
                        "Top-level schema must be an object schema, got " + root.getKind(), null, entry.getKey());
            }
            run.register(entry.getKey(), object, null);
        }

        for (Map.Entry<String, ObjectNode> entry : new ArrayList<>(run.models.entrySet())) {
            run.collect(entry.getValue(), entry.getKey());
        }

        List<RelationDescriptor> relations = collectRelations(run.models, run.modelNames, metadata);
        checkRelationNames(relations);

        log.debug("Discovered {} models ({} nested), {} enums, {} relations",
                run.models.size(), run.models.size() - schemas.size(), run.enums.size(), relations.size());
        return new DiscoveryResult(run.models, run.modelNames, run.enums, relations, schemas.size());
    }

    /**
     * Mutable state of a single discovery call.
     */
    private static final class Run {

        private final Map<String, ObjectNode> models = new LinkedHashMap<>();
        private final Map<NodeHandle, String> modelNames = new HashMap<>();
        private final Map<String, EnumDefinition> enums = new LinkedHashMap<>();
        private final Set<NodeHandle> visited = new HashSet<>();

        private void collect(ObjectNode object, String modelName) {
            if (!visited.add(object.getHandle())) {
                return;
            }
            for (Map.Entry<String, SchemaNode> entry : object.getFields().entrySet()) {
                String fieldName = entry.getKey();
                SchemaNode field = SchemaNodes.unwrap(entry.getValue());

                if (field instanceof UnionNode union && union.isEnumeration()) {
                    registerEnum(NamingUtil.enumName(modelName, fieldName), union, fieldName, modelName);
                } else if (field instanceof ObjectNode nested) {
                    String nestedName = nameOrRegister(nested, NamingUtil.nestedModelName(modelName, fieldName),
                            fieldName);
                    collect(nested, nestedName);
                } else if (field instanceof ArrayNode array) {
                    SchemaNode element = SchemaNodes.unwrap(array.getElement());
                    if (element instanceof ObjectNode item) {
                        String itemName = nameOrRegister(item, NamingUtil.arrayItemModelName(modelName, fieldName),
                                fieldName);
                        collect(item, itemName);
                    } else if (element instanceof UnionNode union && union.isEnumeration()) {
                        registerEnum(NamingUtil.enumName(modelName, fieldName), union, fieldName, modelName);
                    }
                }
            }
        }

        private String nameOrRegister(ObjectNode object, String candidate, String fieldName) {
            String existing = modelNames.get(object.getHandle());
            if (existing != null) {
                return existing;
            }
            register(candidate, object, fieldName);
            log.debug("Discovered nested model: {}", candidate);
            return candidate;
        }

        private void register(String name, ObjectNode object, String fieldName) {
            ObjectNode previous = models.putIfAbsent(name, object);
            if (previous != null && previous != object) {
                throw new SchemaGenerationException(
                        "Model name '" + name + "' is already used by another schema", fieldName, name);
            }
            modelNames.putIfAbsent(object.getHandle(), name);
        }

        private void registerEnum(String enumName, UnionNode union, String fieldName, String modelName) {
            EnumDefinition definition = EnumDefinition.builder()
                    .name(enumName)
                    .values(union.getEnumValues())
                    .build();
            EnumDefinition previous = enums.putIfAbsent(enumName, definition);
            if (previous != null && !previous.getValues().equals(definition.getValues())) {
                throw new SchemaGenerationException(
                        "Enum name '" + enumName + "' is already used with different values", fieldName, modelName);
            }
            log.debug("Discovered enum: {}", enumName);
        }
    }

    private List<RelationDescriptor> collectRelations(Map<String, ObjectNode> models,
                                                      Map<NodeHandle, String> modelNames,
                                                      MetadataTable metadata) {
        List<RelationDescriptor> relations = new ArrayList<>();
        for (Map.Entry<String, ObjectNode> model : models.entrySet()) {
            for (Map.Entry<String, SchemaNode> field : model.getValue().getFields().entrySet()) {
                RelationShape shape = RelationShape.of(field.getValue());
                if (shape == null) {
                    continue;
                }
                String target = modelNames.get(shape.target().getHandle());
                if (target == null || target.equals(model.getKey())) {
                    continue;
                }
                String relationName = metadata.resolveField(field.getValue())
                        .map(FieldMetadata::getRelation)
                        .orElse(NamingUtil.defaultRelationName(model.getKey(), target));
                relations.add(RelationDescriptor.builder()
                        .fromModel(model.getKey())
                        .toModel(target)
                        .fieldName(field.getKey())
                        .relationName(relationName)
                        .cardinality(shape.cardinality())
                        .optional(shape.cardinality() == Cardinality.ONE && SchemaNodes.isOptional(field.getValue()))
                        .build());
            }
        }
        return relations;
    }

    /**
     * A relation name may appear at most once per direction between the same
     * two models; otherwise the inverse sides cannot be told apart.
     */
    private void checkRelationNames(List<RelationDescriptor> relations) {
        Map<String, RelationDescriptor> seen = new HashMap<>();
        for (RelationDescriptor relation : relations) {
            String key = relation.getFromModel() + "->" + relation.getToModel() + "#" + relation.getRelationName();
            RelationDescriptor previous = seen.putIfAbsent(key, relation);
            if (previous != null) {
                throw new SchemaValidationException(
                        "Relation name '" + relation.getRelationName() + "' is used by both '"
                                + previous.getFieldName() + "' and '" + relation.getFieldName()
                                + "' towards '" + relation.getToModel()
                                + "'; give each relation between these models a distinct name",
                        relation.getFieldName(), relation.getFromModel());
            }
        }
    }
}
