package com.example.retrosheet.schema;

/**
 * Closed set of semantic column types a Parquet artifact can carry.
 */
public enum FieldType {
    INT16,
    INT32,
    FLOAT64,
    UTF8,
    BOOLEAN,
    TIMESTAMP_MILLIS;

    /** True for the integral types whose values can be delta encoded. */
    public boolean isIntegral() {
        return this == INT16 || this == INT32 || this == TIMESTAMP_MILLIS;
    }
}
