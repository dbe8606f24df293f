package com.rainmaker.schema.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Schema kinds that have no JSON representation, each with the JSON-safe
 * alternative to use. None of them can be built through {@link Schemas}.
 */
public enum ForbiddenKind {
    DATE("Use dateString() with ISO datetime format instead of date"),
    BIGINT("Use number() or string() instead of bigint"),
    SYMBOL("Symbols are not JSON-serializable"),
    UNDEFINED("Use nullValue() or optional() instead of undefined"),
    VOID("Void is not JSON-serializable"),
    ANY("Define an explicit schema instead of any"),
    UNKNOWN("Define an explicit schema instead of unknown"),
    NEVER("Never type is not JSON-serializable"),
    MAP("Use record() instead of map"),
    SET("Use array() instead of set"),
    FUNCTION("Functions are not JSON-serializable"),
    TRANSFORM("Transforms are not allowed, handle transformations outside the schema"),
    PROMISE("Promises are not JSON-serializable"),
    EFFECT("Effects are not allowed, handle side effects outside the schema"),
    CUSTOM("Custom types are not allowed"),
    NAN("NaN is not reliably JSON-serializable");

    private final String alternative;

    ForbiddenKind(String alternative) {
        this.alternative = alternative;
    }

    public String getAlternative() {
        return alternative;
    }

    public String describe() {
        return "JSON-serializable schemas only. " + alternative;
    }

    public static Optional<ForbiddenKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.name().equals(normalized))
                .findFirst();
    }
}
