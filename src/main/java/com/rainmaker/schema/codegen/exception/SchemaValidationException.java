package com.rainmaker.schema.codegen.exception;

/**
 * Illegal identifier, non-object root, bad enum value or broken relation.
 */
public class SchemaValidationException extends SchemaCompilerException {

    private static final long serialVersionUID = 1L;

    public SchemaValidationException(String message, String field, String model) {
        super(message, field, model);
    }
}
