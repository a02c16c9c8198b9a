package com.example.retrosheet.schema;

import lombok.NonNull;
import lombok.Value;

@Value
public class FieldSpec {
    @NonNull String name;
    @NonNull FieldType type;
    boolean nullable;
}
