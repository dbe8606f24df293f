package com.rainmaker.schema.model;

import lombok.Getter;

/**
 * A string-keyed map of uniformly typed values.
 */
@Getter
public final class RecordNode extends SchemaNode {

    private final SchemaNode valueType;

    RecordNode(SchemaNode valueType) {
        this.valueType = valueType;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RECORD;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitRecord(this);
    }
}
