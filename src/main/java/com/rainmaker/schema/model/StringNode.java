package com.rainmaker.schema.model;

import lombok.Getter;

@Getter
public final class StringNode extends SchemaNode {

    private final StringFormat format;
    private final Integer minLength;
    private final Integer maxLength;

    StringNode(StringFormat format, Integer minLength, Integer maxLength) {
        this.format = format;
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    public StringNode minLength(int length) {
        return new StringNode(format, length, maxLength);
    }

    public StringNode maxLength(int length) {
        return new StringNode(format, minLength, length);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STRING;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}
