package com.rainmaker.schema.integration;

import com.rainmaker.schema.cli.CompileCommand;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete compile process, from definition file to
 * written document.
 */
class CompilerIntegrationTest {

    private static final String BLOG_DOCUMENT = """
            enum UserRoleEnum {
              ADMIN
              MEMBER
            }

            model User {
              id String @id @db.Uuid @default(dbgenerated("gen_random_uuid()"))
              email String @unique
              role UserRoleEnum
              createdAt DateTime @default(now())
              posts Post[] @relation("UserPosts")
              @@map("users")
            }

            model Post {
              id String @id @db.Uuid @default(dbgenerated("gen_random_uuid()"))
              title String
              published Boolean @default(false)
              tags String[]
              authorId String
              author User @relation("UserPosts", fields: [authorId], references: [id])
              @@index([title])
            }
            """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(stdout, true, StandardCharsets.UTF_8);
        return new CommandLine(new CompileCommand(out)).execute(args);
    }

    private Path copyFixture() throws IOException {
        Path schema = tempDir.resolve("blog-schema.json");
        try (InputStream in = getClass().getResourceAsStream("/fixtures/blog-schema.json")) {
            assertThat(in).isNotNull();
            Files.copy(in, schema);
        }
        return schema;
    }

    @Test
    void testCompileToStandardOutput() throws IOException {
        Path schema = copyFixture();

        int exitCode = run("-s", schema.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo(BLOG_DOCUMENT);
    }

    @Test
    void testCompileToFileWithHeader() throws IOException {
        Path schema = copyFixture();
        Path output = tempDir.resolve("prisma/schema.prisma");

        int exitCode = run("-s", schema.toString(), "-o", output.toString(), "--header");

        assertThat(exitCode).isZero();
        assertThat(Files.exists(output)).isTrue();
        String document = Files.readString(output);
        assertThat(document)
                .startsWith("datasource db {")
                .contains("generator client {")
                .endsWith(BLOG_DOCUMENT);
        assertThat(stdout.size()).isZero();
    }

    @Test
    void testExistingOutputNeedsForce() throws IOException {
        Path schema = copyFixture();
        Path output = tempDir.resolve("schema.prisma");
        Files.writeString(output, "keep me");

        assertThat(run("-s", schema.toString(), "-o", output.toString())).isEqualTo(1);
        assertThat(Files.readString(output)).isEqualTo("keep me");

        assertThat(run("-s", schema.toString(), "-o", output.toString(), "--force")).isZero();
        assertThat(Files.readString(output)).isEqualTo(BLOG_DOCUMENT);
    }

    @Test
    void testIncludeRestrictsModels() throws IOException {
        Path schema = tempDir.resolve("shop.json");
        Files.writeString(schema, """
                {"models": {
                  "Product": {"type": "object", "fields": {"name": "string"}},
                  "Order": {"type": "object", "fields": {"total": "number"}}
                }}
                """);

        assertThat(run("-s", schema.toString(), "--include", "Order")).isZero();

        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo("""
                model Order {
                  id String @id @default(uuid())
                  total Int
                }
                """);
    }

    @Test
    void testReservedFieldNameFailsCompilation() throws IOException {
        Path schema = tempDir.resolve("bad.json");
        Files.writeString(schema, """
                {"models": {"Query": {"type": "object", "fields": {"where": "string"}}}}
                """);

        assertThat(run("-s", schema.toString())).isEqualTo(1);
        assertThat(stdout.size()).isZero();
    }

    @Test
    void testMalformedDefinitionFails() throws IOException {
        Path schema = tempDir.resolve("broken.json");
        Files.writeString(schema, "{\"models\": {\"Event\": {\"type\": \"object\", \"fields\": {\"at\": \"date\"}}}}");

        assertThat(run("-s", schema.toString())).isEqualTo(1);
    }

    @Test
    void testMissingSchemaOptionFails() {
        assertThat(run()).isEqualTo(1);
    }
}
