package com.rainmaker.schema.codegen.model;

public enum Cardinality {
    ONE,
    MANY
}
