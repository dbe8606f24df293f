package com.rainmaker.schema.model;

import lombok.Getter;

@Getter
public final class ArrayNode extends SchemaNode {

    private final SchemaNode element;

    ArrayNode(SchemaNode element) {
        this.element = element;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARRAY;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}
