package com.rainmaker.schema.cli.model;

import java.nio.file.Path;

import com.rainmaker.schema.codegen.CompilerOptions;
import com.rainmaker.schema.codegen.project.DocumentHeader;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps CompileCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedCompileOptions {
    Path schemaPath;
    /**
     * Null when the document goes to standard output.
     */
    Path outputPath;
    CompilerOptions compilerOptions;
    /**
     * Null when no header was requested.
     */
    DocumentHeader header;
}
