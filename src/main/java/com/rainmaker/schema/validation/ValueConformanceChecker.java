package com.rainmaker.schema.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.rainmaker.schema.model.ArrayNode;
import com.rainmaker.schema.model.BooleanNode;
import com.rainmaker.schema.model.DiscriminatedUnionNode;
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
import com.rainmaker.schema.model.StringNode;
import com.rainmaker.schema.model.UnionNode;

/**
 * Checks a realized JSON value against a schema.
 *
 * Values are the plain Java shapes a JSON parser produces: {@link Map} with
 * String keys, {@link List}, String, Number, Boolean and null. Keys that the
 * schema does not declare are ignored.
 */
public class ValueConformanceChecker {

    /**
     * @return one {@code path: message} entry per violation, empty when the
     *         value conforms
     */
    public List<String> check(SchemaNode schema, Object value) {
        List<String> issues = new ArrayList<>();
        check(schema, value, "root", issues);
        return issues;
    }

    public boolean conforms(SchemaNode schema, Object value) {
        return check(schema, value).isEmpty();
    }

    private void check(SchemaNode schema, Object value, String path, List<String> issues) {
        schema.accept(new Checker(value, path, issues));
    }

    private final class Checker implements SchemaNodeVisitor<Void> {

        private final Object value;
        private final String path;
        private final List<String> issues;

        private Checker(Object value, String path, List<String> issues) {
            this.value = value;
            this.path = path;
            this.issues = issues;
        }

        private Void issue(String message) {
            issues.add(path + ": " + message);
            return null;
        }

        private Void expected(String type) {
            return issue("expected " + type + ", got " + describe(value));
        }

        @Override
        public Void visitString(StringNode node) {
            if (!(value instanceof String text)) {
                return expected("string");
            }
            if (!node.getFormat().matches(text)) {
                issue("invalid " + node.getFormat().name().toLowerCase(Locale.ROOT) + " '" + text + "'");
            }
            if (node.getMinLength() != null && text.length() < node.getMinLength()) {
                issue("must be at least " + node.getMinLength() + " characters");
            }
            if (node.getMaxLength() != null && text.length() > node.getMaxLength()) {
                issue("must be at most " + node.getMaxLength() + " characters");
            }
            return null;
        }

        @Override
        public Void visitNumber(NumberNode node) {
            if (!(value instanceof Number number)) {
                return expected("number");
            }
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return issue("number must be finite");
            }
            if (node.isInteger() && d != Math.rint(d)) {
                issue("expected integer, got " + number);
            }
            if (node.getMin() != null && d < node.getMin()) {
                issue("must be greater than or equal to " + node.getMin());
            }
            if (node.getMax() != null && d > node.getMax()) {
                issue("must be less than or equal to " + node.getMax());
            }
            return null;
        }

        @Override
        public Void visitBoolean(BooleanNode node) {
            return value instanceof Boolean ? null : expected("boolean");
        }

        @Override
        public Void visitNull(NullNode node) {
            return value == null ? null : expected("null");
        }

        @Override
        public Void visitLiteral(LiteralNode node) {
            if (literalMatches(node, value)) {
                return null;
            }
            return issue("expected literal " + node.getValue() + ", got " + describe(value));
        }

        @Override
        public Void visitObject(ObjectNode node) {
            if (!(value instanceof Map<?, ?> map)) {
                return expected("object");
            }
            for (Map.Entry<String, SchemaNode> field : node.getFields().entrySet()) {
                String fieldPath = path + "." + field.getKey();
                if (!map.containsKey(field.getKey())) {
                    if (!SchemaNodes.isOptional(field.getValue())) {
                        issues.add(fieldPath + ": required");
                    }
                    continue;
                }
                check(field.getValue(), map.get(field.getKey()), fieldPath, issues);
            }
            return null;
        }

        @Override
        public Void visitArray(ArrayNode node) {
            if (!(value instanceof List<?> list)) {
                return expected("array");
            }
            for (int i = 0; i < list.size(); i++) {
                check(node.getElement(), list.get(i), path + "[" + i + "]", issues);
            }
            return null;
        }

        @Override
        public Void visitRecord(RecordNode node) {
            if (!(value instanceof Map<?, ?> map)) {
                return expected("object");
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    issue("record keys must be strings");
                    continue;
                }
                check(node.getValueType(), entry.getValue(), path + "." + entry.getKey(), issues);
            }
            return null;
        }

        @Override
        public Void visitUnion(UnionNode node) {
            for (SchemaNode option : node.getOptions()) {
                if (ValueConformanceChecker.this.conforms(option, value)) {
                    return null;
                }
            }
            if (node.isEnumeration()) {
                return issue("expected one of " + node.getEnumValues() + ", got " + describe(value));
            }
            return issue("value matches no union option");
        }

        @Override
        public Void visitDiscriminatedUnion(DiscriminatedUnionNode node) {
            if (!(value instanceof Map<?, ?> map)) {
                return expected("object");
            }
            Object tag = map.get(node.getDiscriminator());
            for (ObjectNode variant : node.getVariants()) {
                if (literalMatches((LiteralNode) variant.getField(node.getDiscriminator()), tag)) {
                    return variant.accept(this);
                }
            }
            return issue("invalid discriminator value " + describe(tag) + " for '" + node.getDiscriminator() + "'");
        }

        @Override
        public Void visitOptional(OptionalNode node) {
            if (value == null) {
                return null;
            }
            return node.getInner().accept(this);
        }

        @Override
        public Void visitNullable(NullableNode node) {
            if (value == null) {
                return null;
            }
            return node.getInner().accept(this);
        }

        @Override
        public Void visitLazy(LazyNode node) {
            Set<NodeHandle> seen = new HashSet<>();
            SchemaNode current = node;
            while (current instanceof LazyNode lazy) {
                if (!seen.add(lazy.getHandle())) {
                    return issue("lazy schema never resolves to a concrete schema");
                }
                current = lazy.resolve();
            }
            return current.accept(this);
        }
    }

    private static boolean literalMatches(LiteralNode literal, Object value) {
        Object expected = literal.getValue();
        if (expected instanceof Number e && value instanceof Number v) {
            return e.doubleValue() == v.doubleValue();
        }
        return Objects.equals(expected, value);
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof List) {
            return "array";
        }
        if (value instanceof Map) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }
}
