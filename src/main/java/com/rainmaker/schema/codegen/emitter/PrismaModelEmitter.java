package com.rainmaker.schema.codegen.emitter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rainmaker.schema.codegen.discovery.DiscoveryResult;
import com.rainmaker.schema.codegen.exception.SchemaGenerationException;
import com.rainmaker.schema.codegen.mapper.MappedField;
import com.rainmaker.schema.codegen.mapper.SchemaToDslTypeMapper;
import com.rainmaker.schema.codegen.mapper.TypeMappingContext;
import com.rainmaker.schema.codegen.model.Cardinality;
import com.rainmaker.schema.codegen.model.EnumDefinition;
import com.rainmaker.schema.codegen.model.FieldDefinition;
import com.rainmaker.schema.codegen.model.ModelDefinition;
import com.rainmaker.schema.codegen.model.RelationDescriptor;
import com.rainmaker.schema.codegen.util.NamingUtil;
import com.rainmaker.schema.model.FieldMetadata;
import com.rainmaker.schema.model.IndexDefinition;
import com.rainmaker.schema.model.MetadataTable;
import com.rainmaker.schema.model.ModelMetadata;
import com.rainmaker.schema.model.NumberNode;
import com.rainmaker.schema.model.ObjectNode;
import com.rainmaker.schema.model.SchemaNode;
import com.rainmaker.schema.model.SchemaNodes;

/**
 * Builds the model and enum blocks from a discovery result and renders them
 * as relational model DSL text.
 *
 * Model building runs in two passes: every model is assembled from its own
 * fields first, then the inverse side of each relation the target model does
 * not declare itself is injected into the target block.
 */
public class PrismaModelEmitter {

    private static final Logger log = LoggerFactory.getLogger(PrismaModelEmitter.class);

    static final String DEFAULT_ID_TYPE = "String";
    private static final String INDENT = "  ";

    private final SchemaToDslTypeMapper typeMapper;

    public PrismaModelEmitter() {
        this(new SchemaToDslTypeMapper());
    }

    public PrismaModelEmitter(SchemaToDslTypeMapper typeMapper) {
        this.typeMapper = typeMapper;
    }

    /**
     * Builds one {@link ModelDefinition} per discovered model, in discovery
     * order, with inverse relation fields already injected.
     *
     * @param discovery     discovered models, enums and relations
     * @param metadata      field and model metadata
     * @param defaultSchema database schema that needs no {@code @@schema}; may be null
     */
    public List<ModelDefinition> buildModels(DiscoveryResult discovery, MetadataTable metadata, String defaultSchema) {
        TypeMappingContext context = TypeMappingContext.of(discovery, metadata);
        List<InverseObligation> obligations = new ArrayList<>();

        Map<String, ModelDefinition> models = new LinkedHashMap<>();
        for (Map.Entry<String, ObjectNode> entry : discovery.getModels().entrySet()) {
            ModelDefinition model = buildModel(entry.getKey(), entry.getValue(), discovery, context, obligations);
            models.put(model.getName(), withModelAttributes(model, entry.getValue(), metadata, defaultSchema));
        }

        injectInverses(models, obligations, discovery, metadata);
        return new ArrayList<>(models.values());
    }

    /**
     * Renders enum blocks followed by model blocks, separated by a blank line.
     */
    public String render(List<EnumDefinition> enums, List<ModelDefinition> models) {
        List<String> blocks = new ArrayList<>();
        for (EnumDefinition enumDefinition : enums) {
            blocks.add(renderEnum(enumDefinition));
        }
        for (ModelDefinition model : models) {
            blocks.add(renderModel(model));
        }
        if (blocks.isEmpty()) {
            return "";
        }
        return String.join("\n\n", blocks) + "\n";
    }

    static String renderEnum(EnumDefinition enumDefinition) {
        StringBuilder sb = new StringBuilder("enum ").append(enumDefinition.getName()).append(" {\n");
        for (String value : enumDefinition.getValues()) {
            sb.append(INDENT).append(value).append('\n');
        }
        return sb.append('}').toString();
    }

    static String renderModel(ModelDefinition model) {
        StringBuilder sb = new StringBuilder("model ").append(model.getName()).append(" {\n");
        for (FieldDefinition field : model.getFields()) {
            sb.append(INDENT).append(field.render()).append('\n');
        }
        for (String attribute : model.getModelAttributes()) {
            sb.append(INDENT).append(attribute).append('\n');
        }
        return sb.append('}').toString();
    }

    private ModelDefinition buildModel(String modelName,
                                       ObjectNode object,
                                       DiscoveryResult discovery,
                                       TypeMappingContext context,
                                       List<InverseObligation> obligations) {
        log.debug("Emitting model {}", modelName);
        List<FieldDefinition> fields = new ArrayList<>();

        for (Map.Entry<String, SchemaNode> entry : object.getFields().entrySet()) {
            String fieldName = entry.getKey();
            Optional<RelationDescriptor> relation = discovery.findRelation(modelName, fieldName);
            if (relation.isPresent()) {
                addRelationFields(fields, object, entry.getValue(), relation.get(), discovery, context.metadata(),
                        obligations);
            } else {
                MappedField mapped = typeMapper.mapField(entry.getValue(), fieldName, modelName, context);
                fields.add(FieldDefinition.builder()
                        .name(fieldName)
                        .dslType(mapped.getDslType())
                        .attributes(mapped.getAttributes())
                        .build());
            }
        }

        return ModelDefinition.builder()
                .name(modelName)
                .fields(ensureSingleId(modelName, fields))
                .build();
    }

    private void addRelationFields(List<FieldDefinition> fields,
                                   ObjectNode object,
                                   SchemaNode fieldNode,
                                   RelationDescriptor relation,
                                   DiscoveryResult discovery,
                                   MetadataTable metadata,
                                   List<InverseObligation> obligations) {
        Optional<RelationDescriptor> pair = discovery.findPair(relation);
        Optional<FieldMetadata> fieldMetadata = metadata.resolveField(fieldNode);

        if (relation.isToMany()) {
            rejectColumnMetadata(fieldMetadata, relation);
            fields.add(FieldDefinition.builder()
                    .name(relation.getFieldName())
                    .dslType(relation.getToModel() + "[]")
                    .attribute("@relation(\"" + relation.getRelationName() + "\")")
                    .relationName(relation.getRelationName())
                    .relatedModel(relation.getToModel())
                    .build());
            if (pair.isEmpty()) {
                obligations.add(new InverseObligation(relation, false));
            }
            return;
        }

        String suffix = relation.isOptional() ? "?" : "";
        if (pair.isPresent() && pair.get().getCardinality() == Cardinality.ONE
                && !holdsForeignKey(relation, pair.get(), discovery)) {
            // One-to-one declared on both sides: the other side holds the key.
            rejectColumnMetadata(fieldMetadata, relation);
            fields.add(FieldDefinition.builder()
                    .name(relation.getFieldName())
                    .dslType(relation.getToModel() + "?")
                    .attribute("@relation(\"" + relation.getRelationName() + "\")")
                    .relationName(relation.getRelationName())
                    .relatedModel(relation.getToModel())
                    .build());
            return;
        }

        IdField targetId = idFieldOf(discovery.getModels().get(relation.getToModel()), metadata);
        String foreignKey = NamingUtil.foreignKeyName(relation.getFieldName());
        boolean unique = pair.map(p -> p.getCardinality() == Cardinality.ONE).orElse(!relation.isOptional())
                || fieldMetadata.map(FieldMetadata::isUnique).orElse(false);

        if (!object.hasField(foreignKey)) {
            FieldDefinition.FieldDefinitionBuilder fk = FieldDefinition.builder()
                    .name(foreignKey)
                    .dslType(targetId.type() + suffix);
            if (unique) {
                fk.attribute("@unique");
            }
            fieldMetadata.ifPresent(meta -> fk.attributes(foreignKeyAttributes(meta, relation)));
            fields.add(fk.build());
        } else if (fieldMetadata.map(PrismaModelEmitter::hasColumnMetadata).orElse(false)) {
            throw new SchemaGenerationException("Column metadata on relation field '" + relation.getFieldName()
                    + "' conflicts with the declared foreign key field '" + foreignKey + "'",
                    relation.getFieldName(), relation.getFromModel());
        }
        fields.add(FieldDefinition.builder()
                .name(relation.getFieldName())
                .dslType(relation.getToModel() + suffix)
                .attribute(relationAttribute(relation.getRelationName(), foreignKey, targetId.name()))
                .relationName(relation.getRelationName())
                .relatedModel(relation.getToModel())
                .build());

        if (pair.isEmpty()) {
            obligations.add(new InverseObligation(relation, unique));
        }
    }

    /**
     * Column metadata of a to-one relation field lands on its foreign key.
     * Defaults, ids and update stamps have no meaning there.
     */
    private static List<String> foreignKeyAttributes(FieldMetadata meta, RelationDescriptor relation) {
        if (meta.isId() || meta.getDefaultValue() != null || meta.isUpdatedAt()) {
            throw new SchemaGenerationException(
                    "id, default and updatedAt cannot be applied to relation field '" + relation.getFieldName() + "'",
                    relation.getFieldName(), relation.getFromModel());
        }
        List<String> attributes = new ArrayList<>();
        if (meta.isIndex()) {
            attributes.add("@index");
        }
        if (meta.getMap() != null) {
            attributes.add("@map(\"" + SchemaToDslTypeMapper.escape(meta.getMap()) + "\")");
        }
        if (meta.getDb() != null && meta.getDb().getType() != null) {
            attributes.add("@db." + meta.getDb().getType());
        }
        return attributes;
    }

    private static void rejectColumnMetadata(Optional<FieldMetadata> fieldMetadata, RelationDescriptor relation) {
        if (fieldMetadata.map(PrismaModelEmitter::hasColumnMetadata).orElse(false)) {
            throw new SchemaGenerationException("Relation field '" + relation.getFieldName()
                    + "' has no foreign key column for its column metadata", relation.getFieldName(),
                    relation.getFromModel());
        }
    }

    private static boolean hasColumnMetadata(FieldMetadata meta) {
        return meta.isUnique() || meta.isId() || meta.isIndex() || meta.isUpdatedAt()
                || meta.getDefaultValue() != null || meta.getMap() != null || meta.getDb() != null;
    }

    /**
     * Of two one-to-one sides, the one discovered first holds the foreign key.
     */
    private static boolean holdsForeignKey(RelationDescriptor relation, RelationDescriptor pair, DiscoveryResult discovery) {
        List<RelationDescriptor> relations = discovery.getRelations();
        return relations.indexOf(relation) < relations.indexOf(pair);
    }

    private static String relationAttribute(String relationName, String foreignKey, String reference) {
        return "@relation(\"" + relationName + "\", fields: [" + foreignKey + "], references: [" + reference + "])";
    }

    private static List<FieldDefinition> ensureSingleId(String modelName, List<FieldDefinition> fields) {
        long ids = fields.stream().filter(FieldDefinition::isId).count();
        if (ids > 1) {
            throw new SchemaGenerationException("Model declares more than one @id field", null, modelName);
        }
        if (ids == 1) {
            return fields;
        }
        if (fields.stream().anyMatch(field -> field.getName().equals("id"))) {
            throw new SchemaGenerationException(
                    "Field 'id' must be a scalar to serve as the primary key", "id", modelName);
        }
        List<FieldDefinition> withId = new ArrayList<>();
        withId.add(FieldDefinition.builder()
                .name("id")
                .dslType(DEFAULT_ID_TYPE)
                .attribute("@id")
                .attribute("@default(uuid())")
                .build());
        withId.addAll(fields);
        return withId;
    }

    private void injectInverses(Map<String, ModelDefinition> models,
                                List<InverseObligation> obligations,
                                DiscoveryResult discovery,
                                MetadataTable metadata) {
        Set<String> injected = new HashSet<>();
        for (InverseObligation obligation : obligations) {
            RelationDescriptor relation = obligation.relation();
            String origin = relation.getFromModel();
            ModelDefinition target = models.get(relation.getToModel());
            String fieldName = NamingUtil.inverseFieldName(origin);

            if (!injected.add(target.getName() + "." + fieldName)
                    || target.hasField(fieldName)
                    || target.hasRelation(relation.getRelationName(), origin)) {
                log.debug("Skipping inverse {}.{} for {}", target.getName(), fieldName, relation);
                continue;
            }

            ModelDefinition.ModelDefinitionBuilder builder = target.toBuilder();
            if (relation.isToMany()) {
                IdField originId = idFieldOf(discovery.getModels().get(origin), metadata);
                String foreignKey = NamingUtil.foreignKeyName(fieldName);
                if (!target.hasField(foreignKey)) {
                    builder.field(FieldDefinition.builder()
                            .name(foreignKey)
                            .dslType(originId.type() + "?")
                            .build());
                }
                builder.field(inverseField(fieldName, origin + "?",
                        relationAttribute(relation.getRelationName(), foreignKey, originId.name()), relation));
            } else if (obligation.uniqueForeignKey()) {
                builder.field(inverseField(fieldName, origin + "?",
                        "@relation(\"" + relation.getRelationName() + "\")", relation));
            } else {
                builder.field(inverseField(fieldName, origin + "[]",
                        "@relation(\"" + relation.getRelationName() + "\")", relation));
            }
            log.debug("Injected inverse {}.{} for {}", target.getName(), fieldName, relation);
            models.put(target.getName(), builder.build());
        }
    }

    private static FieldDefinition inverseField(String name, String dslType, String attribute, RelationDescriptor relation) {
        return FieldDefinition.builder()
                .name(name)
                .dslType(dslType)
                .attribute(attribute)
                .relationName(relation.getRelationName())
                .relatedModel(relation.getFromModel())
                .build();
    }

    private static ModelDefinition withModelAttributes(ModelDefinition model,
                                                       ObjectNode object,
                                                       MetadataTable metadata,
                                                       String defaultSchema) {
        Optional<ModelMetadata> modelMetadata = metadata.modelOf(object);
        if (modelMetadata.isEmpty()) {
            return model;
        }
        ModelMetadata md = modelMetadata.get();
        ModelDefinition.ModelDefinitionBuilder builder = model.toBuilder();
        for (IndexDefinition index : md.getIndexes()) {
            builder.modelAttribute(renderIndex(index));
        }
        if (md.getMap() != null) {
            builder.modelAttribute("@@map(\"" + md.getMap() + "\")");
        }
        if (md.getSchema() != null && !md.getSchema().equals(defaultSchema)) {
            builder.modelAttribute("@@schema(\"" + md.getSchema() + "\")");
        }
        return builder.build();
    }

    static String renderIndex(IndexDefinition index) {
        StringBuilder sb = new StringBuilder(index.isUnique() ? "@@unique([" : "@@index([")
                .append(String.join(", ", index.getFields()))
                .append(']');
        if (index.getName() != null) {
            sb.append(", map: \"").append(index.getName()).append('"');
        }
        return sb.append(')').toString();
    }

    /**
     * Primary key of a model as seen from a foreign key: a field marked as id
     * in metadata, else a scalar field named {@code id}, else the synthesized
     * String id.
     */
    private static IdField idFieldOf(ObjectNode object, MetadataTable metadata) {
        if (object == null) {
            return new IdField("id", DEFAULT_ID_TYPE);
        }
        for (Map.Entry<String, SchemaNode> entry : object.getFields().entrySet()) {
            if (metadata.resolveField(entry.getValue()).map(FieldMetadata::isId).orElse(false)) {
                return new IdField(entry.getKey(), DEFAULT_ID_TYPE);
            }
        }
        SchemaNode id = object.getField("id");
        if (id != null && SchemaNodes.unwrap(id) instanceof NumberNode) {
            return new IdField("id", "Int");
        }
        return new IdField("id", DEFAULT_ID_TYPE);
    }

    private record IdField(String name, String type) {
    }

    private record InverseObligation(RelationDescriptor relation, boolean uniqueForeignKey) {
    }
}
