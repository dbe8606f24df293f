package com.rainmaker.schema.parser;

/**
 * A schema definition file is malformed or asks for a node kind that has no
 * JSON representation.
 */
public class SchemaDefinitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public SchemaDefinitionException(String message, String path) {
        super(path != null ? path + ": " + message : message);
        this.path = path;
    }

    public SchemaDefinitionException(String message, String path, Throwable cause) {
        super(path != null ? path + ": " + message : message, cause);
        this.path = path;
    }

    /**
     * Location inside the definition, e.g. {@code User.posts.element}.
     */
    public String getPath() {
        return path;
    }
}
