package com.rainmaker.schema.model;

/**
 * Visitor over the closed schema node family. Every compiler pass implements
 * this interface, so a new node kind cannot fall through to a default branch.
 */
public interface SchemaNodeVisitor<R> {
    R visitString(StringNode node);
    R visitNumber(NumberNode node);
    R visitBoolean(BooleanNode node);
    R visitNull(NullNode node);
    R visitLiteral(LiteralNode node);
    R visitObject(ObjectNode node);
    R visitArray(ArrayNode node);
    R visitRecord(RecordNode node);
    R visitUnion(UnionNode node);
    R visitDiscriminatedUnion(DiscriminatedUnionNode node);
    R visitOptional(OptionalNode node);
    R visitNullable(NullableNode node);
    R visitLazy(LazyNode node);
}
