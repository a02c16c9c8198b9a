package com.example.retrosheet.reader;

import com.example.retrosheet.schema.EntitySchema;
import com.example.retrosheet.schema.FieldType;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A fully materialized entity: schema plus one {@code Object[]} per row, values positioned
 * in schema order.
 */
public class TypedTable {

    @Getter
    private final EntitySchema schema;
    private final List<Object[]> rows;

    public TypedTable(EntitySchema schema) {
        this(schema, new ArrayList<>());
    }

    private TypedTable(EntitySchema schema, List<Object[]> rows) {
        this.schema = schema;
        this.rows = rows;
    }

    public void add(Object[] row) {
        if (row.length != schema.width()) {
            throw new IllegalArgumentException("Row has " + row.length + " values, schema " + schema.getEntity() + " has " + schema.width());
        }
        rows.add(row);
    }

    public int rowCount() {
        return rows.size();
    }

    public Object[] row(int index) {
        return rows.get(index);
    }

    public Object value(int row, String column) {
        int index = schema.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("No column " + column + " in " + schema.getEntity());
        }
        return rows.get(row)[index];
    }

    public List<Object[]> rows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * Copy of this table stably sorted on one column, nulls last. Rows with equal keys keep
     * their stream order, so the result is a total, reproducible order.
     */
    public TypedTable sortedBy(String column) {
        int index = schema.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("No column " + column + " in " + schema.getEntity());
        }
        Comparator<Object> values = Comparator.nullsLast(valueOrder(schema.field(index).getType()));
        List<Object[]> sorted = new ArrayList<>(rows);
        // List.sort is a stable merge sort
        sorted.sort(Comparator.comparing((Object[] row) -> row[index], values));
        return new TypedTable(schema, sorted);
    }

    private static Comparator<Object> valueOrder(FieldType type) {
        return switch (type) {
            case INT16 -> Comparator.comparing(Short.class::cast);
            case INT32 -> Comparator.comparing(Integer.class::cast);
            case FLOAT64 -> Comparator.comparing(Double.class::cast);
            case UTF8 -> Comparator.comparing(String.class::cast);
            case BOOLEAN -> Comparator.comparing(Boolean.class::cast);
            case TIMESTAMP_MILLIS -> Comparator.comparing(Long.class::cast);
        };
    }
}
