package com.rainmaker.schema.model;

import java.util.List;

import lombok.Getter;

/**
 * A union of object variants told apart by a literal discriminator field.
 */
@Getter
public final class DiscriminatedUnionNode extends SchemaNode {

    private final String discriminator;
    private final List<ObjectNode> variants;

    DiscriminatedUnionNode(String discriminator, List<ObjectNode> variants) {
        this.discriminator = discriminator;
        this.variants = List.copyOf(variants);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DISCRIMINATED_UNION;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitDiscriminatedUnion(this);
    }
}
