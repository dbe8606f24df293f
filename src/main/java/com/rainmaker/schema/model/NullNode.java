package com.rainmaker.schema.model;

public final class NullNode extends SchemaNode {

    NullNode() {
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NULL;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitNull(this);
    }
}
