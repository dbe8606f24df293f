package com.rainmaker.schema.codegen.mapper;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.rainmaker.schema.codegen.exception.SchemaGenerationException;
import com.rainmaker.schema.codegen.util.NamingUtil;
import com.rainmaker.schema.model.ArrayNode;
import com.rainmaker.schema.model.BooleanNode;
import com.rainmaker.schema.model.DiscriminatedUnionNode;
import com.rainmaker.schema.model.FieldMetadata;
import com.rainmaker.schema.model.LazyNode;
import com.rainmaker.schema.model.LiteralNode;
import com.rainmaker.schema.model.NodeHandle;
import com.rainmaker.schema.model.NullNode;
import com.rainmaker.schema.model.NullableNode;
import com.rainmaker.schema.model.NumberNode;
import com.rainmaker.schema.model.ObjectNode;
import com.rainmaker.schema.model.OptionalNode;
import com.rainmaker.schema.model.RecordNode;
import com.rainmaker.schema.model.SchemaNode;
import com.rainmaker.schema.model.SchemaNodeVisitor;
import com.rainmaker.schema.model.SchemaNodes;
import com.rainmaker.schema.model.StringFormat;
import com.rainmaker.schema.model.StringNode;
import com.rainmaker.schema.model.UnionNode;

/**
 * Maps one field's schema to a DSL type and attribute list.
 *
 * <ul>
 *   <li>string, number, boolean: {@code String}, {@code Int}, {@code Boolean};
 *       datetime strings are {@code DateTime}, uuid strings add {@code @db.Uuid},
 *       email strings add {@code @unique}</li>
 *   <li>known object: the model name</li>
 *   <li>array: element type plus {@code []}</li>
 *   <li>literal: the literal's scalar type with a {@code @default}</li>
 *   <li>enumeration union: the derived enum name; union with an object, array,
 *       record or union option: {@code Json}; union of bare literals:
 *       {@code String}</li>
 *   <li>record and discriminated union: {@code Json}</li>
 *   <li>optional and nullable: inner type plus {@code ?}, except for lists</li>
 * </ul>
 *
 * Stateless; each call works on its own visited set.
 */
public class SchemaToDslTypeMapper {

    static final String JSON = "Json";
    static final String JSON_ATTRIBUTE = "@db.Json";

    public MappedField mapField(SchemaNode node, String fieldName, String parentModelName, TypeMappingContext context) {
        return mapField(node, fieldName, parentModelName, context, new HashSet<>());
    }

    public MappedField mapField(SchemaNode node,
                                String fieldName,
                                String parentModelName,
                                TypeMappingContext context,
                                Set<NodeHandle> visited) {
        MappedField structural = node.accept(new MappingVisitor(fieldName, parentModelName, context, visited));

        Set<String> attributes = new LinkedHashSet<>(structural.getAttributes());
        context.metadata().resolveField(node)
                .ifPresent(metadata -> appendMetadata(attributes, metadata, structural, node, context));
        return new MappedField(structural.getDslType(), new ArrayList<>(attributes));
    }

    private void appendMetadata(Set<String> attributes,
                                FieldMetadata metadata,
                                MappedField structural,
                                SchemaNode node,
                                TypeMappingContext context) {
        SchemaNode target = SchemaNodes.unwrapWithArrays(node);
        if (metadata.getRelation() != null && context.modelNameOf(target).isPresent()) {
            attributes.add("@relation(\"" + metadata.getRelation() + "\")");
        }
        if (metadata.isUnique()) {
            attributes.add("@unique");
        }
        if (metadata.isId() || metadata.getDefaultValue() != null) {
            // A declared default replaces the one implied by a literal.
            attributes.removeIf(attribute -> attribute.startsWith("@default("));
        }
        if (metadata.isId()) {
            attributes.add("@id");
            attributes.add("@default(dbgenerated(\"gen_random_uuid()\"))");
            attributes.add("@db.Uuid");
        } else if (metadata.getDefaultValue() != null) {
            attributes.add("@default(" + formatDefaultValue(metadata.getDefaultValue(), structural.getBaseType()) + ")");
        }
        if (metadata.isUpdatedAt()) {
            attributes.add("@updatedAt");
        }
        if (metadata.isIndex()) {
            attributes.add("@index");
        }
        if (metadata.getMap() != null) {
            attributes.add("@map(\"" + escape(metadata.getMap()) + "\")");
        }
        if (metadata.getDb() != null && metadata.getDb().getType() != null) {
            attributes.add("@db." + metadata.getDb().getType());
        }
    }

    /**
     * Function calls such as {@code now()} are kept verbatim; String and
     * DateTime values are quoted; everything else is emitted as is.
     */
    static String formatDefaultValue(String value, String baseType) {
        if (value.endsWith("()")) {
            return value;
        }
        if ("String".equals(baseType) || "DateTime".equals(baseType)) {
            return "\"" + escape(value) + "\"";
        }
        return value;
    }

    public static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static final class MappingVisitor implements SchemaNodeVisitor<MappedField> {

        private final String fieldName;
        private final String parentModelName;
        private final TypeMappingContext context;
        private final Set<NodeHandle> visited;

        private MappingVisitor(String fieldName, String parentModelName, TypeMappingContext context,
                               Set<NodeHandle> visited) {
            this.fieldName = fieldName;
            this.parentModelName = parentModelName;
            this.context = context;
            this.visited = visited;
        }

        private MappedField visit(SchemaNode node) {
            if (!visited.add(node.getHandle())) {
                throw new SchemaGenerationException(
                        "Schema refers back to itself without passing through an object model", fieldName,
                        parentModelName);
            }
            return node.accept(this);
        }

        private List<String> scalarAttributes(String... extra) {
            List<String> attributes = new ArrayList<>();
            if ("id".equals(fieldName)) {
                attributes.add("@id");
            }
            attributes.addAll(List.of(extra));
            return attributes;
        }

        @Override
        public MappedField visitString(StringNode node) {
            visited.add(node.getHandle());
            if (node.getFormat() == StringFormat.DATETIME) {
                return new MappedField("DateTime", scalarAttributes());
            }
            if (node.getFormat() == StringFormat.UUID) {
                return new MappedField("String", scalarAttributes("@db.Uuid"));
            }
            if (node.getFormat() == StringFormat.EMAIL) {
                return new MappedField("String", scalarAttributes("@unique"));
            }
            return new MappedField("String", scalarAttributes());
        }

        @Override
        public MappedField visitNumber(NumberNode node) {
            visited.add(node.getHandle());
            return new MappedField("Int", scalarAttributes());
        }

        @Override
        public MappedField visitBoolean(BooleanNode node) {
            visited.add(node.getHandle());
            return new MappedField("Boolean", scalarAttributes());
        }

        @Override
        public MappedField visitNull(NullNode node) {
            throw new SchemaGenerationException(
                    "A null schema has no column type; wrap the field with nullable() instead", fieldName,
                    parentModelName);
        }

        @Override
        public MappedField visitLiteral(LiteralNode node) {
            Object value = node.getValue();
            if (node.isString()) {
                return new MappedField("String", scalarAttributes("@default(\"" + escape((String) value) + "\")"));
            }
            if (node.isBoolean()) {
                return new MappedField("Boolean", scalarAttributes("@default(" + value + ")"));
            }
            if (value instanceof Double) {
                return new MappedField("Float", scalarAttributes("@default(" + value + ")"));
            }
            if (node.isNumber()) {
                return new MappedField("Int", scalarAttributes("@default(" + value + ")"));
            }
            throw new SchemaGenerationException(
                    "A null literal has no column type", fieldName, parentModelName);
        }

        @Override
        public MappedField visitObject(ObjectNode node) {
            String modelName = context.modelNameOf(node).orElseThrow(() -> new SchemaGenerationException(
                    "Schema for nested object not found in model table", fieldName, parentModelName));
            return MappedField.of(modelName);
        }

        @Override
        public MappedField visitArray(ArrayNode node) {
            MappedField element = visit(node.getElement());
            if (element.isList() || SchemaNodes.unwrap(node.getElement()) instanceof ArrayNode) {
                // Lists of lists have no column form.
                return MappedField.of(JSON, JSON_ATTRIBUTE);
            }
            List<String> attributes = new ArrayList<>();
            for (String attribute : element.getAttributes()) {
                if (!attribute.equals("@id") && !attribute.startsWith("@default") && !attribute.equals("@unique")) {
                    attributes.add(attribute);
                }
            }
            return new MappedField(element.getBaseType() + "[]", attributes);
        }

        @Override
        public MappedField visitRecord(RecordNode node) {
            return MappedField.of(JSON, JSON_ATTRIBUTE);
        }

        @Override
        public MappedField visitUnion(UnionNode node) {
            if (node.isEnumeration()) {
                return new MappedField(NamingUtil.enumName(parentModelName, fieldName), scalarAttributes());
            }
            boolean anyComplex = false;
            boolean allLiterals = true;
            for (SchemaNode option : node.getOptions()) {
                SchemaNode unwrapped = SchemaNodes.unwrap(option);
                anyComplex |= unwrapped.getKind().isComplex();
                allLiterals &= unwrapped instanceof LiteralNode;
            }
            if (anyComplex) {
                return MappedField.of(JSON, JSON_ATTRIBUTE);
            }
            if (allLiterals) {
                // Value set is not enforced by the column; use enumOf for a real enum.
                return new MappedField("String", scalarAttributes());
            }
            throw new SchemaGenerationException(
                    "Unsupported union of primitive types; use a single type, enumOf or an object option",
                    fieldName, parentModelName);
        }

        @Override
        public MappedField visitDiscriminatedUnion(DiscriminatedUnionNode node) {
            return MappedField.of(JSON, JSON_ATTRIBUTE);
        }

        @Override
        public MappedField visitOptional(OptionalNode node) {
            return optional(visit(node.getInner()));
        }

        @Override
        public MappedField visitNullable(NullableNode node) {
            return optional(visit(node.getInner()));
        }

        @Override
        public MappedField visitLazy(LazyNode node) {
            return visit(node.resolve());
        }

        private MappedField optional(MappedField inner) {
            if (inner.isList() || inner.isOptional()) {
                return inner;
            }
            return new MappedField(inner.getDslType() + "?", inner.getAttributes());
        }
    }
}
