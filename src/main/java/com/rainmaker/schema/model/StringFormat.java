package com.rainmaker.schema.model;

import java.util.regex.Pattern;

/**
 * Refinements baked into the convenience string constructors.
 */
public enum StringFormat {
    PLAIN(null),
    DATETIME(Pattern.compile(
            "^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?Z$")),
    UUID(Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$")),
    URL(Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://[^\\s/?#]+([/?#]\\S*)?$")),
    EMAIL(Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$")),
    DIGITS(Pattern.compile("^\\d+$"));

    private final Pattern pattern;

    StringFormat(Pattern pattern) {
        this.pattern = pattern;
    }

    public boolean matches(String value) {
        return pattern == null || pattern.matcher(value).matches();
    }
}
