package com.rainmaker.schema.codegen.exception;

/**
 * A schema shape the type mapper or emitter cannot express in the DSL.
 */
public class SchemaGenerationException extends SchemaCompilerException {

    private static final long serialVersionUID = 1L;

    public SchemaGenerationException(String message, String field, String model) {
        super(message, field, model);
    }

    public SchemaGenerationException(String message, String field, String model, Throwable cause) {
        super(message, field, model, cause);
    }
}
