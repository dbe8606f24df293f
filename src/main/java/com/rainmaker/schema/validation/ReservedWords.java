package com.rainmaker.schema.validation;

import java.util.Locale;
import java.util.Set;

/**
 * Words that may not be used as field names in the generated DSL.
 */
public final class ReservedWords {

    private static final Set<String> WORDS = Set.of(
            "select", "where", "order", "and", "or", "not", "if", "else",
            "for", "while", "do", "return", "function", "var", "let", "const",
            "enum", "class", "interface", "extends", "implements", "public",
            "private", "protected", "static", "import", "export", "default",
            "new", "delete", "model", "type", "true", "false", "null", "undefined");

    private ReservedWords() {
        // Utility class
    }

    /**
     * Case-insensitive check.
     */
    public static boolean isReserved(String name) {
        return name != null && WORDS.contains(name.toLowerCase(Locale.ROOT));
    }
}
