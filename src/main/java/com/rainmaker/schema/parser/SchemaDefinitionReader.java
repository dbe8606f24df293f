package com.rainmaker.schema.parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.rainmaker.schema.codegen.util.FileWriteUtil;
import com.rainmaker.schema.model.FieldMetadata;
import com.rainmaker.schema.model.ForbiddenKind;
import com.rainmaker.schema.model.IndexDefinition;
import com.rainmaker.schema.model.LiteralNode;
import com.rainmaker.schema.model.MetadataTable;
import com.rainmaker.schema.model.ModelMetadata;
import com.rainmaker.schema.model.NumberNode;
import com.rainmaker.schema.model.ObjectNode;
import com.rainmaker.schema.model.SchemaNode;
import com.rainmaker.schema.model.SchemaSet;
import com.rainmaker.schema.model.Schemas;
import com.rainmaker.schema.model.StringNode;

/**
 * Reads a JSON schema definition file into a {@link SchemaSet}.
 *
 * Format:
 * <pre>
 * {
 *   "models": {
 *     "User": {
 *       "type": "object",
 *       "fields": {
 *         "id":    { "type": "uuid", "meta": { "id": true } },
 *         "email": "email",
 *         "posts": { "type": "array", "element": { "type": "ref", "model": "Post" },
 *                    "meta": { "relation": "UserPosts" } }
 *       },
 *       "modelMeta": { "map": "users", "indexes": [ { "fields": ["email"] } ] }
 *     }
 *   }
 * }
 * </pre>
 *
 * A bare string is shorthand for {@code {"type": "..."}}. {@code ref} nodes are
 * lazy references to top-level models, so definitions may refer to models
 * declared later and to themselves.
 */
public class SchemaDefinitionReader {

    private static final Logger log = LoggerFactory.getLogger(SchemaDefinitionReader.class);

    private final ObjectMapper objectMapper;

    public SchemaDefinitionReader() {
        this(new ObjectMapper());
    }

    public SchemaDefinitionReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SchemaSet read(Path file) throws IOException {
        log.info("Reading schema definitions from {}", file);
        return read(FileWriteUtil.readString(file));
    }

    public SchemaSet read(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SchemaDefinitionException("Invalid JSON: " + e.getOriginalMessage(), null, e);
        }
        if (root == null || !root.isObject() || !root.path("models").isObject()) {
            throw new SchemaDefinitionException("Definition must be an object with a \"models\" object", null);
        }
        return new Run().read(root.get("models"));
    }

    /**
     * State of a single read: parsed top-level models, metadata and pending
     * references.
     */
    private static final class Run {

        private final Map<String, SchemaNode> models = new LinkedHashMap<>();
        private final MetadataTable metadata = new MetadataTable();
        private final Map<String, String> references = new LinkedHashMap<>();

        private SchemaSet read(JsonNode modelsNode) {
            Iterator<Map.Entry<String, JsonNode>> it = modelsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                models.put(entry.getKey(), parse(entry.getValue(), entry.getKey()));
            }
            references.forEach((path, model) -> {
                if (!models.containsKey(model)) {
                    throw new SchemaDefinitionException("Reference to undefined model '" + model + "'", path);
                }
            });
            log.debug("Read {} model definition(s)", models.size());
            return new SchemaSet(models, metadata);
        }

        private SchemaNode parse(JsonNode json, String path) {
            if (json == null || json.isNull() || json.isMissingNode()) {
                throw new SchemaDefinitionException("Missing schema", path);
            }
            if (json.isTextual()) {
                return parseType(json.asText(), MissingNode.getInstance(), path);
            }
            if (!json.isObject()) {
                throw new SchemaDefinitionException("Schema must be a type name or an object", path);
            }
            String type = requiredText(json, "type", path);
            SchemaNode node;
            try {
                node = parseType(type, json, path);
            } catch (IllegalArgumentException e) {
                throw new SchemaDefinitionException(e.getMessage(), path, e);
            }

            if (json.path("nullable").asBoolean(false)) {
                node = Schemas.nullable(node);
            }
            if (json.path("optional").asBoolean(false)) {
                node = Schemas.optional(node);
            }
            if (json.has("meta")) {
                metadata.field(node, parseFieldMetadata(json.get("meta"), path));
            }
            if (json.has("modelMeta")) {
                if (!(node instanceof ObjectNode object)) {
                    throw new SchemaDefinitionException("modelMeta is only allowed on object schemas", path);
                }
                metadata.model(object, parseModelMetadata(json.get("modelMeta"), path));
            }
            return node;
        }

        private SchemaNode parseType(String type, JsonNode json, String path) {
            Optional<ForbiddenKind> forbidden = ForbiddenKind.fromName(type);
            if (forbidden.isPresent()) {
                throw new SchemaDefinitionException(forbidden.get().describe(), path);
            }
            switch (type) {
                case "string":
                    return lengths(Schemas.string(), json);
                case "number":
                    return bounds(json.path("integer").asBoolean(false) ? Schemas.integer() : Schemas.number(), json);
                case "int":
                    return bounds(Schemas.integer(), json);
                case "boolean":
                    return Schemas.bool();
                case "null":
                    return Schemas.nullValue();
                case "literal":
                    return literal(json.get("value"), path);
                case "dateString":
                    return Schemas.dateString();
                case "uuid":
                    return Schemas.uuid();
                case "url":
                    return Schemas.url();
                case "email":
                    return lengths(Schemas.email(), json);
                case "numberString":
                    return Schemas.numberString();
                case "object":
                    return object(json, path);
                case "array":
                    return Schemas.array(parse(json.get("element"), path + ".element"));
                case "record":
                    return Schemas.record(parse(json.get("value"), path + ".value"));
                case "union":
                    return Schemas.union(options(json, path).toArray(new SchemaNode[0]));
                case "discriminatedUnion":
                    return discriminatedUnion(json, path);
                case "optional":
                    return Schemas.optional(parse(json.get("inner"), path + ".inner"));
                case "nullable":
                    return Schemas.nullable(parse(json.get("inner"), path + ".inner"));
                case "enum":
                    return Schemas.enumOf(textArray(json, "values", path).toArray(new String[0]));
                case "ref":
                    return reference(requiredText(json, "model", path), path);
                default:
                    throw new SchemaDefinitionException("Unknown schema type '" + type + "'", path);
            }
        }

        private ObjectNode object(JsonNode json, String path) {
            ObjectNode.Builder builder = Schemas.object();
            JsonNode fields = json.path("fields");
            if (!fields.isMissingNode() && !fields.isObject()) {
                throw new SchemaDefinitionException("\"fields\" must be an object", path);
            }
            Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                builder.field(field.getKey(), parse(field.getValue(), path + "." + field.getKey()));
            }
            return builder.build();
        }

        private SchemaNode discriminatedUnion(JsonNode json, String path) {
            String key = requiredText(json, "key", path);
            List<ObjectNode> variants = new ArrayList<>();
            JsonNode array = json.path("variants");
            if (!array.isArray()) {
                throw new SchemaDefinitionException("\"variants\" must be an array", path);
            }
            for (int i = 0; i < array.size(); i++) {
                SchemaNode variant = parse(array.get(i), path + ".variants[" + i + "]");
                if (!(variant instanceof ObjectNode object)) {
                    throw new SchemaDefinitionException("Discriminated union variants must be objects",
                            path + ".variants[" + i + "]");
                }
                variants.add(object);
            }
            return Schemas.discriminatedUnion(key, variants.toArray(new ObjectNode[0]));
        }

        private List<SchemaNode> options(JsonNode json, String path) {
            JsonNode array = json.path("options");
            if (!array.isArray()) {
                throw new SchemaDefinitionException("\"options\" must be an array", path);
            }
            List<SchemaNode> options = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                options.add(parse(array.get(i), path + ".options[" + i + "]"));
            }
            return options;
        }

        private SchemaNode reference(String model, String path) {
            references.put(path, model);
            return Schemas.lazy(() -> {
                SchemaNode target = models.get(model);
                if (target == null) {
                    throw new IllegalStateException("Reference to undefined model '" + model + "'");
                }
                return target;
            });
        }

        private static LiteralNode literal(JsonNode value, String path) {
            if (value == null || value.isNull()) {
                return Schemas.nullLiteral();
            }
            if (value.isTextual()) {
                return Schemas.literal(value.asText());
            }
            if (value.isBoolean()) {
                return Schemas.literal(value.asBoolean());
            }
            if (value.isIntegralNumber() && value.canConvertToLong()) {
                return Schemas.literal(value.asLong());
            }
            if (value.isNumber()) {
                return Schemas.literal(value.asDouble());
            }
            throw new SchemaDefinitionException("Literal value must be a string, number, boolean or null", path);
        }

        private static StringNode lengths(StringNode node, JsonNode json) {
            StringNode result = node;
            if (json.has("minLength")) {
                result = result.minLength(json.get("minLength").asInt());
            }
            if (json.has("maxLength")) {
                result = result.maxLength(json.get("maxLength").asInt());
            }
            return result;
        }

        private static NumberNode bounds(NumberNode node, JsonNode json) {
            NumberNode result = node;
            if (json.has("min")) {
                result = result.min(json.get("min").asDouble());
            }
            if (json.has("max")) {
                result = result.max(json.get("max").asDouble());
            }
            return result;
        }

        private static FieldMetadata parseFieldMetadata(JsonNode meta, String path) {
            if (!meta.isObject()) {
                throw new SchemaDefinitionException("\"meta\" must be an object", path);
            }
            FieldMetadata.FieldMetadataBuilder builder = FieldMetadata.builder()
                    .unique(meta.path("unique").asBoolean(false))
                    .id(meta.path("id").asBoolean(false))
                    .updatedAt(meta.path("updatedAt").asBoolean(false))
                    .index(meta.path("index").asBoolean(false))
                    .relation(optionalText(meta, "relation"))
                    .references(optionalText(meta, "references"))
                    .map(optionalText(meta, "map"));
            if (meta.has("default") && !meta.get("default").isNull()) {
                JsonNode value = meta.get("default");
                if (value.isContainerNode()) {
                    throw new SchemaDefinitionException("Default value must be a scalar", path);
                }
                builder.defaultValue(value.asText());
            }
            if (meta.has("db")) {
                JsonNode db = meta.get("db");
                builder.db(FieldMetadata.DbMetadata.builder()
                        .type(optionalText(db, "type"))
                        .name(optionalText(db, "name"))
                        .build());
            }
            return builder.build();
        }

        private static ModelMetadata parseModelMetadata(JsonNode meta, String path) {
            if (!meta.isObject()) {
                throw new SchemaDefinitionException("\"modelMeta\" must be an object", path);
            }
            ModelMetadata.ModelMetadataBuilder builder = ModelMetadata.builder()
                    .map(optionalText(meta, "map"))
                    .schema(optionalText(meta, "schema"));
            JsonNode indexes = meta.path("indexes");
            for (int i = 0; i < indexes.size(); i++) {
                JsonNode index = indexes.get(i);
                String indexPath = path + ".modelMeta.indexes[" + i + "]";
                List<String> fields = textArray(index, "fields", indexPath);
                if (fields.isEmpty()) {
                    throw new SchemaDefinitionException("An index needs at least one field", indexPath);
                }
                builder.index(IndexDefinition.builder()
                        .fields(fields)
                        .name(optionalText(index, "name"))
                        .unique(index.path("unique").asBoolean(false))
                        .build());
            }
            return builder.build();
        }

        private static String requiredText(JsonNode json, String key, String path) {
            JsonNode value = json.get(key);
            if (value == null || !value.isTextual()) {
                throw new SchemaDefinitionException("\"" + key + "\" must be a string", path);
            }
            return value.asText();
        }

        private static String optionalText(JsonNode json, String key) {
            JsonNode value = json.get(key);
            return value == null || value.isNull() ? null : value.asText();
        }

        private static List<String> textArray(JsonNode json, String key, String path) {
            JsonNode array = json.path(key);
            if (!array.isArray()) {
                throw new SchemaDefinitionException("\"" + key + "\" must be an array of strings", path);
            }
            List<String> values = new ArrayList<>();
            for (JsonNode value : array) {
                if (!value.isTextual()) {
                    throw new SchemaDefinitionException("\"" + key + "\" must be an array of strings", path);
                }
                values.add(value.asText());
            }
            return values;
        }
    }
}
