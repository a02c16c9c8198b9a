package com.example.retrosheet.entity;

import com.example.retrosheet.normalize.RowFilter;
import lombok.Builder;
import lombok.Value;

/**
 * Normalization rules of one entity.
 */
@Value
@Builder(toBuilder = true)
public class EntityRules {
    /** Suppress lines identical to one already emitted for the entity. */
    @Builder.Default boolean dedupe = true;
    /** Discard the first physical line of every source file. */
    @Builder.Default boolean stripHeader = false;
    /** Prepend the source file's tag as a new leading field. */
    @Builder.Default boolean prependTag = false;
    /** Pad records one field short of the schema width, drop shorter ones. */
    @Builder.Default boolean repair = true;
    /** Optional keep rule; null keeps every row. */
    RowFilter rowFilter;
    @Builder.Default char delimiter = ',';
    @Builder.Default char quoteChar = '"';

    public static EntityRules defaults() {
        return builder().build();
    }
}
