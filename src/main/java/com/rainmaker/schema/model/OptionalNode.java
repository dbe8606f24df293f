package com.rainmaker.schema.model;

import lombok.Getter;

@Getter
public final class OptionalNode extends SchemaNode {

    private final SchemaNode inner;

    OptionalNode(SchemaNode inner) {
        this.inner = inner;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.OPTIONAL;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitOptional(this);
    }
}
