package com.example.retrosheet.schema;

import lombok.NonNull;
import lombok.Value;

/**
 * One declared relational column, in declaration order.
 */
@Value
public class ColumnDeclaration {
    @NonNull String name;
    @NonNull RelationalType type;
    boolean autoincrement;
    boolean nullable;

    public static ColumnDeclaration of(String name, RelationalType type) {
        return new ColumnDeclaration(name, type, false, true);
    }
}
