package io.tabula.core;

/**
 * Raised while reading a row when an accessor that declares no failure throws anyway,
 * or when reflective invocation itself breaks.
 */
public class ColumnAccessException extends TabulaException {

    private final String path;

    public ColumnAccessException(String path, Throwable cause) {
        super("Failed to read path: " + path, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
