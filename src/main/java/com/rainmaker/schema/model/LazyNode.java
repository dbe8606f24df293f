package com.rainmaker.schema.model;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Deferred reference to another node. This is the only way to introduce a
 * self-referential or mutually recursive structure.
 *
 * The thunk is evaluated at most once; later calls to {@link #resolve()}
 * return the same node instance.
 */
public final class LazyNode extends SchemaNode {

    private final Supplier<? extends SchemaNode> thunk;
    private volatile SchemaNode resolved;

    LazyNode(Supplier<? extends SchemaNode> thunk) {
        this.thunk = thunk;
    }

    public SchemaNode resolve() {
        SchemaNode result = resolved;
        if (result == null) {
            synchronized (this) {
                result = resolved;
                if (result == null) {
                    result = Objects.requireNonNull(thunk.get(), "lazy schema resolved to null");
                    resolved = result;
                }
            }
        }
        return result;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LAZY;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitLazy(this);
    }
}
