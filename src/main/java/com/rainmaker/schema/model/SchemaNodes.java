package com.rainmaker.schema.model;

import java.util.HashSet;
import java.util.Set;

import com.rainmaker.schema.codegen.exception.SchemaGenerationException;

import lombok.experimental.UtilityClass;

/**
 * Structural helpers shared by the compiler passes.
 */
@UtilityClass
public class SchemaNodes {

    /**
     * Strips Optional, Nullable and Lazy wrappers.
     *
     * @throws SchemaGenerationException if the wrappers form a cycle with no
     *         concrete node inside
     */
    public SchemaNode unwrap(SchemaNode node) {
        return unwrap(node, false);
    }

    /**
     * Strips Optional, Nullable and Lazy wrappers as well as Array layers,
     * yielding the element type a field ultimately holds.
     */
    public SchemaNode unwrapWithArrays(SchemaNode node) {
        return unwrap(node, true);
    }

    /**
     * Whether the outermost layers (Optional, Nullable, Lazy) wrap an Array.
     */
    public boolean isList(SchemaNode node) {
        return unwrap(node) instanceof ArrayNode;
    }

    /**
     * Whether the field itself may be absent: its wrapper chain, before any
     * Array layer, contains Optional or Nullable.
     */
    public boolean isOptional(SchemaNode node) {
        Set<NodeHandle> seen = new HashSet<>();
        SchemaNode current = node;
        while (seen.add(current.getHandle())) {
            if (current instanceof OptionalNode || current instanceof NullableNode) {
                return true;
            }
            if (current instanceof LazyNode lazy) {
                current = lazy.resolve();
            } else {
                return false;
            }
        }
        return false;
    }

    private SchemaNode unwrap(SchemaNode node, boolean throughArrays) {
        Set<NodeHandle> seen = new HashSet<>();
        SchemaNode current = node;
        while (seen.add(current.getHandle())) {
            if (current instanceof OptionalNode optional) {
                current = optional.getInner();
            } else if (current instanceof NullableNode nullable) {
                current = nullable.getInner();
            } else if (current instanceof LazyNode lazy) {
                current = lazy.resolve();
            } else if (throughArrays && current instanceof ArrayNode array) {
                current = array.getElement();
            } else {
                return current;
            }
        }
        throw new SchemaGenerationException("Schema wrappers form a cycle at " + current, null, null);
    }
}
