package com.rainmaker.schema.json;

/**
 * A realized value contains something with no JSON representation.
 */
public class JsonSafetyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public JsonSafetyException(String message, String path) {
        super(message);
        this.path = path;
    }

    public JsonSafetyException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * Location of the offending value, e.g. {@code root.items[2]}.
     */
    public String getPath() {
        return path;
    }
}
