package com.example.retrosheet.schema;

/**
 * A static defect in the declared schemas or entity configuration. Raised before any
 * source file is read; aborts the whole run.
 */
public class SchemaDefinitionException extends RuntimeException {

    public SchemaDefinitionException(String message) {
        super(message);
    }

    public SchemaDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
