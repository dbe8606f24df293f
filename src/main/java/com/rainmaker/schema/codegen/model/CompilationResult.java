package com.rainmaker.schema.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Structured output of one compilation together with its rendered text.
 */
@Value
@Builder
public class CompilationResult {

    @NonNull
    @Singular
    List<EnumDefinition> enums;

    @NonNull
    @Singular
    List<ModelDefinition> models;

    @NonNull
    @Singular
    List<RelationDescriptor> relations;

    @NonNull
    String document;

    /**
     * Number of caller-supplied models; the remaining models were synthesized
     * from nested objects.
     */
    int topLevelModelCount;

    public int getNestedModelCount() {
        return models.size() - topLevelModelCount;
    }
}
