package com.rainmaker.schema.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

import lombok.experimental.UtilityClass;

/**
 * The only entry point for building schema nodes.
 *
 * Every constructor here produces a JSON-representable node. Kinds that have
 * no JSON representation (dates, big integers, maps, sets, functions,
 * transforms, first-class enums and so on) have no constructor at all; see
 * {@link ForbiddenKind} for the alternatives to use instead.
 *
 * <pre>{@code
 * ObjectNode user = Schemas.object()
 *         .field("id", Schemas.uuid())
 *         .field("email", Schemas.email())
 *         .field("status", Schemas.enumOf("ACTIVE", "INACTIVE"))
 *         .field("createdAt", Schemas.dateString())
 *         .build();
 * }</pre>
 */
@UtilityClass
public class Schemas {

    // ---- primitives ----

    public StringNode string() {
        return new StringNode(StringFormat.PLAIN, null, null);
    }

    public NumberNode number() {
        return new NumberNode(false, null, null);
    }

    public BooleanNode bool() {
        return new BooleanNode();
    }

    public NullNode nullValue() {
        return new NullNode();
    }

    public LiteralNode literal(String value) {
        return new LiteralNode(Objects.requireNonNull(value, "value"));
    }

    public LiteralNode literal(long value) {
        return new LiteralNode(value);
    }

    public LiteralNode literal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Literal " + value + " has no JSON representation");
        }
        return new LiteralNode(value);
    }

    public LiteralNode literal(boolean value) {
        return new LiteralNode(value);
    }

    public LiteralNode nullLiteral() {
        return new LiteralNode(null);
    }

    // ---- refined primitives ----

    /**
     * Strict ISO-8601 UTC datetime string, e.g. {@code 2023-12-25T10:30:00.000Z}.
     */
    public StringNode dateString() {
        return new StringNode(StringFormat.DATETIME, null, null);
    }

    public StringNode uuid() {
        return new StringNode(StringFormat.UUID, null, null);
    }

    public StringNode url() {
        return new StringNode(StringFormat.URL, null, null);
    }

    public StringNode email() {
        return new StringNode(StringFormat.EMAIL, null, null);
    }

    /**
     * Digit-only string. Kept as a string so leading zeros survive.
     */
    public StringNode numberString() {
        return new StringNode(StringFormat.DIGITS, null, null);
    }

    public NumberNode integer() {
        return new NumberNode(true, null, null);
    }

    // ---- composites ----

    public ObjectNode.Builder object() {
        return ObjectNode.builder();
    }

    public ArrayNode array(SchemaNode element) {
        return new ArrayNode(Objects.requireNonNull(element, "element"));
    }

    public RecordNode record(SchemaNode valueType) {
        return new RecordNode(Objects.requireNonNull(valueType, "valueType"));
    }

    public UnionNode union(SchemaNode... options) {
        if (options.length == 0) {
            throw new IllegalArgumentException("A union needs at least one option");
        }
        return new UnionNode(Arrays.asList(requireNoNulls(options)), false);
    }

    /**
     * Union of string literals that compiles to a named enum.
     */
    public UnionNode enumOf(String... values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("An enumeration needs at least one value");
        }
        Set<String> seen = new HashSet<>();
        List<SchemaNode> literals = new ArrayList<>();
        for (String value : values) {
            if (!seen.add(Objects.requireNonNull(value, "enum value"))) {
                throw new IllegalArgumentException("Duplicate enumeration value '" + value + "'");
            }
            literals.add(new LiteralNode(value));
        }
        return new UnionNode(literals, true);
    }

    public DiscriminatedUnionNode discriminatedUnion(String key, ObjectNode... variants) {
        Objects.requireNonNull(key, "key");
        if (variants.length == 0) {
            throw new IllegalArgumentException("A discriminated union needs at least one variant");
        }
        Set<Object> tags = new HashSet<>();
        for (ObjectNode variant : requireNoNulls(variants)) {
            if (!(variant.getField(key) instanceof LiteralNode tag)) {
                throw new IllegalArgumentException(
                        "Every variant of a discriminated union needs a literal '" + key + "' field");
            }
            if (!tags.add(tag.getValue())) {
                throw new IllegalArgumentException("Duplicate discriminator value '" + tag.getValue() + "'");
            }
        }
        return new DiscriminatedUnionNode(key, Arrays.asList(variants));
    }

    // ---- modifiers ----

    public OptionalNode optional(SchemaNode inner) {
        return new OptionalNode(Objects.requireNonNull(inner, "inner"));
    }

    public NullableNode nullable(SchemaNode inner) {
        return new NullableNode(Objects.requireNonNull(inner, "inner"));
    }

    /**
     * Deferred reference; required for any self-referential structure.
     */
    public LazyNode lazy(Supplier<? extends SchemaNode> thunk) {
        return new LazyNode(Objects.requireNonNull(thunk, "thunk"));
    }

    private <T> T[] requireNoNulls(T[] items) {
        for (T item : items) {
            Objects.requireNonNull(item, "schema option");
        }
        return items;
    }
}
