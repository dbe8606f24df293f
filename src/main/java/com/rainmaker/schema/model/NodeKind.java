package com.rainmaker.schema.model;

/**
 * The closed set of JSON-representable schema node kinds.
 */
public enum NodeKind {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    LITERAL,
    OBJECT,
    ARRAY,
    RECORD,
    UNION,
    DISCRIMINATED_UNION,
    OPTIONAL,
    NULLABLE,
    LAZY;

    /**
     * Kinds that are stored as a JSON blob rather than as a scalar or model column.
     */
    public boolean isComplex() {
        return this == OBJECT || this == ARRAY || this == RECORD || this == UNION || this == DISCRIMINATED_UNION;
    }

    public boolean isWrapper() {
        return this == OPTIONAL || this == NULLABLE || this == LAZY;
    }
}
