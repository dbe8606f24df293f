package com.rainmaker.schema.codegen;

import com.rainmaker.schema.codegen.exception.SchemaGenerationException;
import com.rainmaker.schema.codegen.exception.SchemaValidationException;
import com.rainmaker.schema.codegen.model.CompilationResult;
import com.rainmaker.schema.codegen.model.EnumDefinition;
import com.rainmaker.schema.codegen.model.FieldDefinition;
import com.rainmaker.schema.codegen.model.ModelDefinition;
import com.rainmaker.schema.model.FieldMetadata;
import com.rainmaker.schema.model.IndexDefinition;
import com.rainmaker.schema.model.LazyNode;
import com.rainmaker.schema.model.ModelMetadata;
import com.rainmaker.schema.model.ObjectNode;
import com.rainmaker.schema.model.SchemaNode;
import com.rainmaker.schema.model.SchemaSet;
import com.rainmaker.schema.model.Schemas;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaCompiler, covering the emitted document end to end.
 */
class SchemaCompilerTest {

    private final SchemaCompiler compiler = new SchemaCompiler();

    /**
     * User has many posts, each post has one author, both sides named UserPosts.
     */
    private SchemaSet blog() {
        ObjectNode[] post = new ObjectNode[1];
        SchemaNode posts = Schemas.array(Schemas.lazy(() -> post[0]));
        ObjectNode user = Schemas.object()
                .field("id", Schemas.string())
                .field("email", Schemas.email())
                .field("posts", posts)
                .build();
        SchemaNode author = Schemas.lazy(() -> user);
        post[0] = Schemas.object()
                .field("id", Schemas.string())
                .field("title", Schemas.string())
                .field("author", author)
                .build();
        return SchemaSet.builder()
                .model("User", user)
                .model("Post", post[0])
                .field(posts, FieldMetadata.relation("UserPosts"))
                .field(author, FieldMetadata.relation("UserPosts"))
                .build();
    }

    @Test
    void testRelationRoundTrip() {
        String document = compiler.compile(blog(), CompilerOptions.defaults());

        assertThat(document).isEqualTo("""
                model User {
                  id String @id
                  email String @unique
                  posts Post[] @relation("UserPosts")
                }

                model Post {
                  id String @id
                  title String
                  authorId String
                  author User @relation("UserPosts", fields: [authorId], references: [id])
                }
                """);
    }

    @Test
    void testCompilationIsIdempotent() {
        SchemaSet schemas = blog();

        assertThat(compiler.compile(schemas, CompilerOptions.defaults()))
                .isEqualTo(compiler.compile(schemas, CompilerOptions.defaults()));
    }

    @Test
    void testIdIsSynthesizedWhenMissing() {
        ObjectNode note = Schemas.object().field("body", Schemas.string()).build();

        assertThat(compiler.compile(Map.of("Note", note))).isEqualTo("""
                model Note {
                  id String @id @default(uuid())
                  body String
                }
                """);
    }

    @Test
    void testEveryModelHasExactlyOneIdAndUniqueFieldNames() {
        ObjectNode customer = Schemas.object()
                .field("id", Schemas.uuid())
                .field("name", Schemas.string())
                .field("address", Schemas.object().field("city", Schemas.string()).build())
                .field("orders", Schemas.array(Schemas.object()
                        .field("total", Schemas.number())
                        .field("status", Schemas.enumOf("OPEN", "PAID"))
                        .build()))
                .build();

        CompilationResult result = compiler.compileModels(SchemaSet.of(Map.of("Customer", customer)),
                CompilerOptions.defaults());

        assertThat(result.getModels()).extracting(ModelDefinition::getName)
                .containsExactly("Customer", "CustomerAddress", "CustomerOrdersItem");
        assertThat(result.getNestedModelCount()).isEqualTo(2);
        for (ModelDefinition model : result.getModels()) {
            assertThat(model.getFields()).filteredOn(FieldDefinition::isId).hasSize(1);
            List<String> names = model.getFields().stream().map(FieldDefinition::getName).toList();
            assertThat(names).doesNotHaveDuplicates();
        }
        assertThat(result.getEnums()).extracting(EnumDefinition::getName).containsExactly("CustomerOrdersItemStatusEnum");
    }

    @Test
    void testTwoIdFieldsAreRejected() {
        SchemaNode key = Schemas.uuid();
        ObjectNode token = Schemas.object()
                .field("id", Schemas.string())
                .field("key", key)
                .build();
        SchemaSet schemas = SchemaSet.builder()
                .model("Token", token)
                .field(key, FieldMetadata.builder().id(true).build())
                .build();

        assertThatThrownBy(() -> compiler.compile(schemas, CompilerOptions.defaults()))
                .isInstanceOf(SchemaGenerationException.class)
                .hasMessageContaining("more than one @id");
    }

    @Test
    void testLiteralIdIsPrimaryKey() {
        ObjectNode setting = Schemas.object()
                .field("id", Schemas.literal("fixed"))
                .field("name", Schemas.string())
                .build();

        assertThat(compiler.compile(Map.of("Setting", setting))).isEqualTo("""
                model Setting {
                  id String @id @default("fixed")
                  name String
                }
                """);
    }

    @Test
    void testRelationColumnMetadataLandsOnForeignKey() {
        ObjectNode user = Schemas.object().field("name", Schemas.string()).build();
        SchemaNode author = Schemas.optional(user);
        ObjectNode post = Schemas.object().field("author", author).build();
        SchemaSet schemas = SchemaSet.builder()
                .model("User", user)
                .model("Post", post)
                .field(author, FieldMetadata.builder()
                        .unique(true)
                        .map("author_id")
                        .db(FieldMetadata.DbMetadata.builder().type("Uuid").build())
                        .build())
                .build();

        String document = compiler.compile(schemas, CompilerOptions.defaults());

        assertThat(document)
                .contains("  authorId String? @unique @map(\"author_id\") @db.Uuid\n")
                .contains("  post Post? @relation(\"PostToUser\")\n");
    }

    @Test
    void testColumnMetadataOnToManyRelationIsRejected() {
        ObjectNode tag = Schemas.object().field("label", Schemas.string()).build();
        SchemaNode tags = Schemas.array(tag);
        ObjectNode post = Schemas.object().field("tags", tags).build();
        SchemaSet schemas = SchemaSet.builder()
                .model("Tag", tag)
                .model("Post", post)
                .field(tags, FieldMetadata.builder().map("tag_ids").build())
                .build();

        assertThatThrownBy(() -> compiler.compile(schemas, CompilerOptions.defaults()))
                .isInstanceOf(SchemaGenerationException.class)
                .hasMessageContaining("'tags'");
    }

    @Test
    void testDefaultOnRelationFieldIsRejected() {
        ObjectNode user = Schemas.object().field("name", Schemas.string()).build();
        SchemaNode owner = Schemas.lazy(() -> user);
        ObjectNode pet = Schemas.object().field("owner", owner).build();
        SchemaSet schemas = SchemaSet.builder()
                .model("User", user)
                .model("Pet", pet)
                .field(owner, FieldMetadata.builder().defaultValue("x").build())
                .build();

        assertThatThrownBy(() -> compiler.compile(schemas, CompilerOptions.defaults()))
                .isInstanceOf(SchemaGenerationException.class)
                .hasMessageContaining("relation field 'owner'");
    }

    @Test
    void testReservedFieldNameFailsFast() {
        ObjectNode query = Schemas.object().field("select", Schemas.string()).build();

        assertThatThrownBy(() -> compiler.compile(Map.of("Query", query)))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("'select'");
    }

    @Test
    void testSchemaValidationCanBeDisabled() {
        ObjectNode query = Schemas.object().field("select", Schemas.string()).build();
        CompilerOptions options = CompilerOptions.builder().validateSchema(false).build();

        assertThat(compiler.compile(SchemaSet.of(Map.of("Query", query)), options)).contains("  select String\n");
    }

    @Test
    void testReservedNameInsideNestedModelIsRejected() {
        ObjectNode shop = Schemas.object()
                .field("owner", Schemas.object().field("where", Schemas.string()).build())
                .build();

        assertThatThrownBy(() -> compiler.compile(Map.of("Shop", shop)))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("'where'");
    }

    @Test
    void testLiteralUnionFallsBackToString() {
        ObjectNode thing = Schemas.object()
                .field("kind", Schemas.union(Schemas.literal("a"), Schemas.literal("b")))
                .build();

        assertThat(compiler.compile(Map.of("Thing", thing))).contains("  kind String\n");
    }

    @Test
    void testComplexUnionFallsBackToJson() {
        ObjectNode thing = Schemas.object()
                .field("data", Schemas.union(Schemas.string(), Schemas.object().field("x", Schemas.number()).build()))
                .field("extra", Schemas.record(Schemas.string()))
                .build();

        assertThat(compiler.compile(Map.of("Thing", thing)))
                .contains("  data Json @db.Json\n")
                .contains("  extra Json @db.Json\n")
                .doesNotContain("model ThingData");
    }

    @Test
    void testNestedObjectBecomesOneToOneWithInverse() {
        ObjectNode user = Schemas.object()
                .field("profile", Schemas.object().field("bio", Schemas.string()).build())
                .build();

        assertThat(compiler.compile(Map.of("User", user))).isEqualTo("""
                model User {
                  id String @id @default(uuid())
                  profileId String @unique
                  profile UserProfile @relation("UserToUserProfile", fields: [profileId], references: [id])
                }

                model UserProfile {
                  id String @id @default(uuid())
                  bio String
                  user User? @relation("UserToUserProfile")
                }
                """);
    }

    @Test
    void testArrayOfObjectsGetsBackReference() {
        ObjectNode invoice = Schemas.object()
                .field("lines", Schemas.array(Schemas.object().field("sku", Schemas.string()).build()))
                .build();

        assertThat(compiler.compile(Map.of("Invoice", invoice))).isEqualTo("""
                model Invoice {
                  id String @id @default(uuid())
                  lines InvoiceLinesItem[] @relation("InvoiceToInvoiceLinesItem")
                }

                model InvoiceLinesItem {
                  id String @id @default(uuid())
                  sku String
                  invoiceId String?
                  invoice Invoice? @relation("InvoiceToInvoiceLinesItem", fields: [invoiceId], references: [id])
                }
                """);
    }

    @Test
    void testOptionalToOneGetsListInverse() {
        ObjectNode user = Schemas.object().field("name", Schemas.string()).build();
        ObjectNode post = Schemas.object().field("author", Schemas.optional(user)).build();

        String document = compiler.compile(SchemaSet.builder().model("User", user).model("Post", post).build(),
                CompilerOptions.defaults());

        assertThat(document).isEqualTo("""
                model User {
                  id String @id @default(uuid())
                  name String
                  post Post[] @relation("PostToUser")
                }

                model Post {
                  id String @id @default(uuid())
                  authorId String?
                  author User? @relation("PostToUser", fields: [authorId], references: [id])
                }
                """);
    }

    @Test
    void testOneToOneDeclaredOnBothSides() {
        ObjectNode[] profile = new ObjectNode[1];
        SchemaNode profileField = Schemas.lazy(() -> profile[0]);
        ObjectNode user = Schemas.object().field("profile", profileField).build();
        SchemaNode ownerField = Schemas.lazy(() -> user);
        profile[0] = Schemas.object().field("owner", ownerField).build();
        SchemaSet schemas = SchemaSet.builder()
                .model("User", user)
                .model("Profile", profile[0])
                .field(profileField, FieldMetadata.relation("UserProfile"))
                .field(ownerField, FieldMetadata.relation("UserProfile"))
                .build();

        String document = compiler.compile(schemas, CompilerOptions.defaults());

        assertThat(document)
                .contains("  profileId String @unique\n"
                        + "  profile Profile @relation(\"UserProfile\", fields: [profileId], references: [id])\n")
                .contains("  owner User? @relation(\"UserProfile\")\n")
                .doesNotContain("ownerId");
    }

    @Test
    void testExplicitForeignKeyFieldIsReused() {
        ObjectNode user = Schemas.object().field("id", Schemas.integer()).build();
        ObjectNode post = Schemas.object()
                .field("authorId", Schemas.integer())
                .field("author", Schemas.optional(user))
                .build();

        String document = compiler.compile(SchemaSet.builder().model("User", user).model("Post", post).build(),
                CompilerOptions.defaults());

        assertThat(document).contains("""
                model Post {
                  id String @id @default(uuid())
                  authorId Int
                  author User? @relation("PostToUser", fields: [authorId], references: [id])
                }
                """);
    }

    @Test
    void testForeignKeyTypeFollowsTargetId() {
        ObjectNode user = Schemas.object().field("id", Schemas.integer()).build();
        ObjectNode post = Schemas.object().field("author", user).build();

        String document = compiler.compile(SchemaSet.builder().model("User", user).model("Post", post).build(),
                CompilerOptions.defaults());

        assertThat(document).contains("  authorId Int @unique\n");
    }

    @Test
    void testSelfRelationEmitsPlainField() {
        LazyNode[] self = new LazyNode[1];
        ObjectNode category = Schemas.object()
                .field("name", Schemas.string())
                .field("parent", Schemas.optional(Schemas.lazy(() -> self[0])))
                .build();
        self[0] = Schemas.lazy(() -> category);

        assertThat(compiler.compile(Map.of("Category", category))).isEqualTo("""
                model Category {
                  id String @id @default(uuid())
                  name String
                  parent Category?
                }
                """);
    }

    @Test
    void testEnumsComeFirst() {
        ObjectNode user = Schemas.object().field("role", Schemas.enumOf("ADMIN", "MEMBER")).build();

        assertThat(compiler.compile(Map.of("User", user))).isEqualTo("""
                enum UserRoleEnum {
                  ADMIN
                  MEMBER
                }

                model User {
                  id String @id @default(uuid())
                  role UserRoleEnum
                }
                """);
    }

    @Test
    void testModelAttributesAndDefaultSchema() {
        ObjectNode account = Schemas.object()
                .field("tenant", Schemas.string())
                .field("email", Schemas.string())
                .build();
        ModelMetadata metadata = ModelMetadata.builder()
                .index(IndexDefinition.builder().field("email").name("account_email_idx").build())
                .index(IndexDefinition.builder().field("tenant").field("email").unique(true).build())
                .map("accounts")
                .schema("billing")
                .build();
        SchemaSet schemas = SchemaSet.builder().model("Account", account, metadata).build();

        String document = compiler.compile(schemas, CompilerOptions.builder().defaultSchema("public").build());

        assertThat(document).endsWith("""
                  email String
                  @@index([email], map: "account_email_idx")
                  @@unique([tenant, email])
                  @@map("accounts")
                  @@schema("billing")
                }
                """);
        assertThat(compiler.compile(schemas, CompilerOptions.builder().defaultSchema("billing").build()))
                .doesNotContain("@@schema");
    }

    @Test
    void testIncludeAndExcludeFilterTopLevelModels() {
        ObjectNode a = Schemas.object().field("x", Schemas.string()).build();
        ObjectNode b = Schemas.object().field("y", Schemas.string()).build();
        SchemaSet schemas = SchemaSet.builder().model("Alpha", a).model("Beta", b).build();

        assertThat(compiler.compile(schemas, CompilerOptions.builder().include("Beta").build()))
                .contains("model Beta").doesNotContain("model Alpha");
        assertThat(compiler.compile(schemas, CompilerOptions.builder().exclude("Beta").build()))
                .contains("model Alpha").doesNotContain("model Beta");
        assertThatThrownBy(() -> compiler.compile(schemas, CompilerOptions.builder().include("Gamma").build()))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("'Gamma'");
    }

    @Test
    void testRelationValidationCanBeDisabled() {
        ObjectNode user = Schemas.object().field("name", Schemas.string()).build();
        SchemaNode owner = Schemas.lazy(() -> user);
        ObjectNode pet = Schemas.object().field("owner", owner).build();
        SchemaSet schemas = SchemaSet.builder()
                .model("User", user)
                .model("Pet", pet)
                .field(owner, FieldMetadata.builder().relation("PetOwner").references("Person").build())
                .build();

        assertThatThrownBy(() -> compiler.compile(schemas, CompilerOptions.defaults()))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("'Person' not found");
        assertThat(compiler.compile(schemas, CompilerOptions.builder().validateRelations(false).build()))
                .contains("owner User @relation(\"PetOwner\", fields: [ownerId], references: [id])");
    }

    @Test
    void testEmptyInputGivesEmptyDocument() {
        assertThat(compiler.compile(Map.of())).isEmpty();
    }
}
