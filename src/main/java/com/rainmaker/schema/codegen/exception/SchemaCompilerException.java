package com.rainmaker.schema.codegen.exception;

import java.util.Optional;

/**
 * Base class for failures that abort a compilation. Carries the field and
 * model being processed, when known.
 */
public abstract class SchemaCompilerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String model;

    protected SchemaCompilerException(String message, String field, String model) {
        super(message);
        this.field = field;
        this.model = model;
    }

    protected SchemaCompilerException(String message, String field, String model, Throwable cause) {
        super(message, cause);
        this.field = field;
        this.model = model;
    }

    public Optional<String> getField() {
        return Optional.ofNullable(field);
    }

    public Optional<String> getModel() {
        return Optional.ofNullable(model);
    }

    /**
     * Message prefixed with the model and field location, for log output.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (model != null) {
            sb.append(model);
            if (field != null) {
                sb.append('.').append(field);
            }
            sb.append(": ");
        } else if (field != null) {
            sb.append(field).append(": ");
        }
        return sb.append(getMessage()).toString();
    }
}
