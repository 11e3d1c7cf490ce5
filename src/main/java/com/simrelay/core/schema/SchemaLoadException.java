package com.simrelay.core.schema;

/**
 * Thrown when the variable schema cannot be read or is structurally invalid.
 * Raised during context startup, so it aborts the process.
 */
public class SchemaLoadException extends RuntimeException {

    public SchemaLoadException(String message) {
        super(message);
    }

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
