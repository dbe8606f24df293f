package com.rainmaker.schema.model;

import lombok.Getter;

@Getter
public final class NullableNode extends SchemaNode {

    private final SchemaNode inner;

    NullableNode(SchemaNode inner) {
        this.inner = inner;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NULLABLE;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitNullable(this);
    }
}
