package com.rainmaker.schema.model;

import lombok.Getter;

@Getter
public final class NumberNode extends SchemaNode {

    private final boolean integer;
    private final Double min;
    private final Double max;

    NumberNode(boolean integer, Double min, Double max) {
        this.integer = integer;
        this.min = min;
        this.max = max;
    }

    public NumberNode min(double value) {
        return new NumberNode(integer, value, max);
    }

    public NumberNode max(double value) {
        return new NumberNode(integer, min, value);
    }

    public NumberNode integer() {
        return new NumberNode(true, min, max);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NUMBER;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
