package com.rainmaker.schema.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Options recognized by {@link SchemaCompiler}.
 *
 * Only the validation switches, include/exclude filters and default schema
 * influence the compiled text. Log level and paths are honored by the command
 * line front end.
 */
@Data
@Builder(toBuilder = true)
public class CompilerOptions {

    /**
     * One of {@code error}, {@code warn}, {@code info}, {@code debug}.
     */
    @Builder.Default
    private String logLevel = "info";

    /**
     * Where the rendered document is written.
     */
    private Path outputPath;

    /**
     * Schema definition file to read.
     */
    private Path schemaPath;

    /**
     * When not empty, only these top-level models are compiled.
     */
    @Singular("include")
    private List<String> includedModels;

    /**
     * Top-level models left out of the compilation.
     */
    @Singular("exclude")
    private List<String> excludedModels;

    @Builder.Default
    private boolean validateSchema = true;

    @Builder.Default
    private boolean validateRelations = true;

    /**
     * Database schema that needs no {@code @@schema} directive.
     */
    private String defaultSchema;

    public static CompilerOptions defaults() {
        return CompilerOptions.builder().build();
    }
}
