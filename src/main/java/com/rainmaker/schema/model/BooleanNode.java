package com.rainmaker.schema.model;

public final class BooleanNode extends SchemaNode {

    BooleanNode() {
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BOOLEAN;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
