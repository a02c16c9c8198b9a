package com.example.retrosheet.reader;

import lombok.Getter;

/**
 * A field of the normalized stream that none of its column's coercion rules accept, or a
 * record of the wrong width. Signals a gap in the normalization rules; aborts the owning
 * entity only.
 */
@Getter
public class TypeCoercionException extends RuntimeException {

    private final String entity;
    private final long recordNumber;
    private final String column;
    private final String literal;

    public TypeCoercionException(String entity, long recordNumber, String column, String literal, String reason) {
        super(String.format("%s record %d, column %s: %s (value '%s')", entity, recordNumber,
                column == null ? "-" : column, reason, literal));
        this.entity = entity;
        this.recordNumber = recordNumber;
        this.column = column;
        this.literal = literal;
    }
}
