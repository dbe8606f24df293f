package com.rainmaker.schema.model;

/**
 * Base class for all schema nodes.
 *
 * Nodes are immutable and compared by identity. Every node carries a
 * {@link NodeHandle} used by the compiler passes for cycle detection and by
 * {@link MetadataTable} to attach out-of-band field and model metadata.
 */
public abstract class SchemaNode {

    private final NodeHandle handle = NodeHandle.next();

    public final NodeHandle getHandle() {
        return handle;
    }

    public abstract NodeKind getKind();

    public abstract <R> R accept(SchemaNodeVisitor<R> visitor);

    public OptionalNode optional() {
        return new OptionalNode(this);
    }

    public NullableNode nullable() {
        return new NullableNode(this);
    }

    @Override
    public String toString() {
        return getKind().name().toLowerCase() + handle;
    }
}
