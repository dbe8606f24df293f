package com.rainmaker.schema.validation;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rainmaker.schema.codegen.exception.SchemaValidationException;
import com.rainmaker.schema.model.FieldMetadata;
import com.rainmaker.schema.model.MetadataTable;
import com.rainmaker.schema.model.NodeHandle;
import com.rainmaker.schema.model.ObjectNode;
import com.rainmaker.schema.model.SchemaNode;
import com.rainmaker.schema.model.SchemaNodes;
import com.rainmaker.schema.model.UnionNode;

/**
 * Fail-fast checks run before any DSL text is produced.
 *
 * Every method throws {@link SchemaValidationException} on the first
 * violation it finds; nothing is accumulated.
 */
public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    public void validateFieldName(String name) {
        validateFieldName(name, null);
    }

    public void validateFieldName(String name, String model) {
        if (ReservedWords.isReserved(name)) {
            throw new SchemaValidationException(
                    "Field name '" + name + "' is a reserved word in the schema DSL", name, model);
        }
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new SchemaValidationException(
                    "Field name '" + name + "' must start with a letter or underscore and contain only"
                            + " alphanumeric characters and underscores",
                    name, model);
        }
    }

    /**
     * Requires an object root and legal field names. Enumeration values must
     * also be identifiers because they are emitted bare.
     */
    public void validateSchema(SchemaNode schema, String model) {
        if (!(schema instanceof ObjectNode object)) {
            throw new SchemaValidationException(
                    "Schema must be an object schema, got " + schema.getKind(), null, model);
        }
        log.debug("Validating schema for model {}", model);
        for (Map.Entry<String, SchemaNode> entry : object.getFields().entrySet()) {
            validateFieldName(entry.getKey(), model);
            validateEnumValues(entry.getValue(), entry.getKey(), model);
        }
    }

    private void validateEnumValues(SchemaNode field, String fieldName, String model) {
        if (SchemaNodes.unwrapWithArrays(field) instanceof UnionNode union && union.isEnumeration()) {
            for (String value : union.getEnumValues()) {
                if (!IDENTIFIER.matcher(value).matches()) {
                    throw new SchemaValidationException(
                            "Enum value '" + value + "' is not a valid identifier", fieldName, model);
                }
            }
        }
    }

    /**
     * Checks that every field carrying a relation name points at a model in
     * {@code schemaMap}.
     *
     * The target is the explicit {@link FieldMetadata#getReferences()} when
     * set, otherwise the model the field's object schema is registered under.
     */
    public void validateRelations(SchemaNode schema,
                                  Map<String, ? extends SchemaNode> schemaMap,
                                  MetadataTable metadata,
                                  String model) {
        if (!(schema instanceof ObjectNode object)) {
            throw new SchemaValidationException(
                    "Schema must be an object schema, got " + schema.getKind(), null, model);
        }
        Map<NodeHandle, String> modelNames = new HashMap<>();
        schemaMap.forEach((name, node) -> modelNames.put(node.getHandle(), name));

        for (Map.Entry<String, SchemaNode> entry : object.getFields().entrySet()) {
            String fieldName = entry.getKey();
            Optional<FieldMetadata> fieldMetadata = metadata.resolveField(entry.getValue());
            if (fieldMetadata.isEmpty() || fieldMetadata.get().getRelation() == null) {
                continue;
            }
            SchemaNode target = SchemaNodes.unwrapWithArrays(entry.getValue());
            if (!(target instanceof ObjectNode)) {
                throw new SchemaValidationException(
                        "Relation '" + fieldMetadata.get().getRelation() + "' is declared on a field that does"
                                + " not hold an object schema",
                        fieldName, model);
            }
            String resolved = modelNames.get(target.getHandle());
            String declared = fieldMetadata.get().getReferences() != null
                    ? fieldMetadata.get().getReferences()
                    : resolved;
            if (declared == null || !schemaMap.containsKey(declared)) {
                throw new SchemaValidationException(
                        "Relation target model '" + (declared != null ? declared : "<anonymous object>")
                                + "' not found in schema map",
                        fieldName, model);
            }
            if (resolved != null && !declared.equals(resolved)) {
                throw new SchemaValidationException(
                        "Relation declares target '" + declared + "' but the field holds model '" + resolved + "'",
                        fieldName, model);
            }
        }
    }
}
