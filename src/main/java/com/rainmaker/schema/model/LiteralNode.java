package com.rainmaker.schema.model;

import lombok.Getter;

/**
 * A single fixed JSON value: a string, a number, a boolean or null.
 */
@Getter
public final class LiteralNode extends SchemaNode {

    private final Object value;

    LiteralNode(Object value) {
        this.value = value;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LITERAL;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return "literal(" + value + ")" + getHandle();
    }
}
