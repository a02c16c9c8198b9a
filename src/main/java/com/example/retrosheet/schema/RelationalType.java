package com.example.retrosheet.schema;

import java.util.Locale;

/**
 * Relational column types accepted in schema declarations. Any other type name is a
 * schema definition bug and is rejected when the declarations are loaded.
 */
public enum RelationalType {
    INTEGER,
    SMALLINT,
    FLOAT,
    CHAR,
    STRING,
    TEXT,
    BOOLEAN,
    DATE,
    DATETIME;

    public static RelationalType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new SchemaDefinitionException("Missing relational type");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        // VARCHAR(n), CHAR(3) and friends carry a length we do not need
        int paren = normalized.indexOf('(');
        if (paren > 0) {
            normalized = normalized.substring(0, paren).trim();
        }
        if ("VARCHAR".equals(normalized)) {
            normalized = STRING.name();
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new SchemaDefinitionException("Unmapped relational type '" + name + "'", e);
        }
    }
}
