package com.rainmaker.schema.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rainmaker.schema.cli.model.ValidatedCompileOptions;
import com.rainmaker.schema.codegen.CompilerOptions;
import com.rainmaker.schema.codegen.model.CompilationResult;
import com.rainmaker.schema.codegen.model.RelationDescriptor;

/**
 * Responsible only for printing CLI output for the "compile" command.
 * No validation, no execution.
 */
public class CompileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CompileResultsPrinter.class);

    public void printBanner(ValidatedCompileOptions v) {
        CompilerOptions c = v.getCompilerOptions();
        log.info("=================================================");
        log.info("Schema Model Compiler");
        log.info("=================================================");
        log.info("Schema File: {}", v.getSchemaPath());
        log.info("Output: {}", v.getOutputPath() != null ? v.getOutputPath() : "standard output");
        log.info("Include: {}", c.getIncludedModels().isEmpty() ? "All" : String.join(", ", c.getIncludedModels()));
        log.info("Exclude: {}", c.getExcludedModels().isEmpty() ? "None" : String.join(", ", c.getExcludedModels()));
        log.info("Validate Schema: {}", c.isValidateSchema());
        log.info("Validate Relations: {}", c.isValidateRelations());
        log.info("Default Schema: {}", c.getDefaultSchema() != null ? c.getDefaultSchema() : "None");
        if (v.getHeader() != null) {
            log.info("Datasource Provider: {}", v.getHeader().getProvider());
        }
        log.info("=================================================");
    }

    public void printSuccess(ValidatedCompileOptions v, CompilationResult result) {
        log.info("");
        log.info("=================================================");
        log.info("COMPILATION SUCCESSFUL");
        log.info("=================================================");
        if (v.getOutputPath() != null) {
            log.info("Output Path: {}", v.getOutputPath());
        }
        log.info("Models: {} ({} nested)", result.getModels().size(), result.getNestedModelCount());
        log.info("Enums: {}", result.getEnums().size());
        log.info("Relations: {}", result.getRelations().size());
        for (RelationDescriptor relation : result.getRelations()) {
            log.debug("  {}", relation);
        }
        log.info("=================================================");
    }
}
