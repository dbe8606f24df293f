package com.rainmaker.schema.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class EnumDefinition {

    @NonNull
    String name;

    @NonNull
    @Singular
    List<String> values;
}
