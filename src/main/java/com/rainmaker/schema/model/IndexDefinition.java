package com.rainmaker.schema.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class IndexDefinition {

    @NonNull
    @Singular
    List<String> fields;

    String name;

    boolean unique;
}
