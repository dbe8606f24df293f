package com.rainmaker.schema.model;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * A union of alternative schemas.
 *
 * A union built through {@link Schemas#enumOf(String...)} is flagged as an
 * enumeration and becomes a named enum in the generated document. A union of
 * literals built through {@link Schemas#union(SchemaNode...)} stays a plain
 * union.
 */
@Getter
public final class UnionNode extends SchemaNode {

    private final List<SchemaNode> options;
    private final boolean enumeration;

    UnionNode(List<SchemaNode> options, boolean enumeration) {
        this.options = List.copyOf(options);
        this.enumeration = enumeration;
    }

    /**
     * Values of an enumeration union, in declaration order.
     */
    public List<String> getEnumValues() {
        if (!enumeration) {
            throw new IllegalStateException("Union " + getHandle() + " was not built as an enumeration");
        }
        return options.stream()
                .map(option -> (String) ((LiteralNode) option).getValue())
                .collect(Collectors.toList());
    }

    public boolean isLiteralUnion() {
        return options.stream().allMatch(option -> option instanceof LiteralNode);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNION;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visitUnion(this);
    }
}
