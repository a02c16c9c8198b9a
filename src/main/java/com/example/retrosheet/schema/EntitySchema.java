package com.example.retrosheet.schema;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, immutable field list of one entity. The order is both the column order of
 * the normalized simple file and the column order of the Parquet artifact.
 */
@Value
public class EntitySchema {
    String entity;
    List<FieldSpec> fields;

    public EntitySchema(String entity, List<FieldSpec> fields) {
        this.entity = entity;
        this.fields = List.copyOf(fields);
    }

    public int width() {
        return fields.size();
    }

    public FieldSpec field(int index) {
        return fields.get(index);
    }

    /** Position of the named column, or -1. */
    public int indexOf(String column) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(column)) {
                return i;
            }
        }
        return -1;
    }

    public List<String> columnNames() {
        return fields.stream().map(FieldSpec::getName).collect(Collectors.toList());
    }
}
