package com.rainmaker.schema.model;

import com.rainmaker.schema.codegen.exception.SchemaGenerationException;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Schemas, SchemaNodes and MetadataTable.
 */
class SchemasTest {

    @Test
    void testEnumOfRejectsEmptyAndDuplicateValues() {
        assertThatThrownBy(Schemas::enumOf)
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Schemas.enumOf("A", "B", "A"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate enumeration value 'A'");
    }

    @Test
    void testEnumOfKeepsDeclaredOrder() {
        UnionNode status = Schemas.enumOf("PENDING", "ACTIVE", "CLOSED");

        assertThat(status.isEnumeration()).isTrue();
        assertThat(status.getEnumValues()).containsExactly("PENDING", "ACTIVE", "CLOSED");
    }

    @Test
    void testPlainLiteralUnionIsNotAnEnumeration() {
        UnionNode union = Schemas.union(Schemas.literal("a"), Schemas.literal("b"));

        assertThat(union.isEnumeration()).isFalse();
        assertThat(union.isLiteralUnion()).isTrue();
        assertThatThrownBy(union::getEnumValues).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testUnionNeedsAnOption() {
        assertThatThrownBy(Schemas::union).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDiscriminatedUnionRequiresLiteralTagInEveryVariant() {
        ObjectNode card = Schemas.object().field("kind", Schemas.literal("card")).build();
        ObjectNode bank = Schemas.object().field("kind", Schemas.string()).build();

        assertThatThrownBy(() -> Schemas.discriminatedUnion("kind", card, bank))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("literal 'kind'");
    }

    @Test
    void testDiscriminatedUnionRejectsDuplicateTags() {
        ObjectNode a = Schemas.object().field("kind", Schemas.literal("x")).build();
        ObjectNode b = Schemas.object().field("kind", Schemas.literal("x")).build();

        assertThatThrownBy(() -> Schemas.discriminatedUnion("kind", a, b))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testObjectBuilderRejectsDuplicateField() {
        ObjectNode.Builder builder = Schemas.object().field("name", Schemas.string());

        assertThatThrownBy(() -> builder.field("name", Schemas.number()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testNonFiniteLiteralIsRejected() {
        assertThatThrownBy(() -> Schemas.literal(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testForbiddenKindsNameAnAlternative() {
        assertThat(ForbiddenKind.fromName("date")).contains(ForbiddenKind.DATE);
        assertThat(ForbiddenKind.fromName("bigint")).contains(ForbiddenKind.BIGINT);
        assertThat(ForbiddenKind.fromName("string")).isEmpty();
        assertThat(ForbiddenKind.MAP.describe())
                .startsWith("JSON-serializable schemas only.")
                .contains("record()");
    }

    @Test
    void testLazyResolvesOnce() {
        AtomicInteger calls = new AtomicInteger();
        ObjectNode target = Schemas.object().field("name", Schemas.string()).build();
        LazyNode lazy = Schemas.lazy(() -> {
            calls.incrementAndGet();
            return target;
        });

        assertThat(lazy.resolve()).isSameAs(target);
        assertThat(lazy.resolve()).isSameAs(target);
        assertThat(calls).hasValue(1);
    }

    @Test
    void testUnwrapStripsWrappersButNotArrays() {
        StringNode inner = Schemas.string();
        ArrayNode list = Schemas.array(inner);
        SchemaNode wrapped = Schemas.optional(Schemas.nullable(Schemas.lazy(() -> list)));

        assertThat(SchemaNodes.unwrap(wrapped)).isSameAs(list);
        assertThat(SchemaNodes.unwrapWithArrays(wrapped)).isSameAs(inner);
        assertThat(SchemaNodes.isList(wrapped)).isTrue();
        assertThat(SchemaNodes.isOptional(wrapped)).isTrue();
        assertThat(SchemaNodes.isOptional(Schemas.array(Schemas.optional(inner)))).isFalse();
    }

    @Test
    void testWrapperOnlyCycleIsRejected() {
        SchemaNode[] holder = new SchemaNode[1];
        LazyNode lazy = Schemas.lazy(() -> holder[0]);
        holder[0] = Schemas.optional(lazy);

        assertThatThrownBy(() -> SchemaNodes.unwrap(lazy))
                .isInstanceOf(SchemaGenerationException.class)
                .hasMessageContaining("wrappers form a cycle");
    }

    @Test
    void testNodesHaveDistinctHandles() {
        assertThat(Schemas.string().getHandle()).isNotEqualTo(Schemas.string().getHandle());
    }

    @Test
    void testMetadataResolvesFromOutermostNode() {
        StringNode email = Schemas.email();
        OptionalNode optionalEmail = Schemas.optional(email);
        MetadataTable table = new MetadataTable()
                .field(email, FieldMetadata.builder().unique(true).build())
                .field(optionalEmail, FieldMetadata.builder().index(true).build());

        assertThat(table.resolveField(optionalEmail)).get().extracting(FieldMetadata::isIndex).isEqualTo(true);
        assertThat(table.resolveField(Schemas.nullable(email))).get()
                .extracting(FieldMetadata::isUnique).isEqualTo(true);
        assertThat(table.resolveField(Schemas.string())).isEmpty();
    }

    @Test
    void testSchemaSetRejectsDuplicateModel() {
        SchemaSet.Builder builder = SchemaSet.builder().model("User", Schemas.object().build());

        assertThatThrownBy(() -> builder.model("User", Schemas.object().build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testStringFormats() {
        assertThat(StringFormat.DATETIME.matches("2024-01-31T10:15:30.123Z")).isTrue();
        assertThat(StringFormat.DATETIME.matches("2024-01-31")).isFalse();
        assertThat(StringFormat.UUID.matches("123e4567-e89b-12d3-a456-426614174000")).isTrue();
        assertThat(StringFormat.EMAIL.matches("a@b.io")).isTrue();
        assertThat(StringFormat.URL.matches("https://example.com/x?y=1")).isTrue();
        assertThat(StringFormat.DIGITS.matches("0042")).isTrue();
        assertThat(StringFormat.DIGITS.matches("4.2")).isFalse();
        assertThat(StringFormat.PLAIN.matches("anything")).isTrue();
    }
}
