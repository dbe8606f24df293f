package com.rainmaker.schema.codegen.mapper;

import java.util.List;

import lombok.Value;

/**
 * DSL type and attributes produced for one field.
 */
@Value
public class MappedField {

    String dslType;
    List<String> attributes;

    public MappedField(String dslType, List<String> attributes) {
        this.dslType = dslType;
        this.attributes = List.copyOf(attributes);
    }

    public static MappedField of(String dslType, String... attributes) {
        return new MappedField(dslType, List.of(attributes));
    }

    public boolean isList() {
        return dslType.endsWith("[]");
    }

    public boolean isOptional() {
        return dslType.endsWith("?");
    }

    /**
     * Type without the optional or list suffix.
     */
    public String getBaseType() {
        if (isList()) {
            return dslType.substring(0, dslType.length() - 2);
        }
        if (isOptional()) {
            return dslType.substring(0, dslType.length() - 1);
        }
        return dslType;
    }
}
