package com.example.retrosheet.columnar;

/**
 * Per-column encoding choice.
 * <ul>
 *   <li>DICTIONARY: value dictionary plus per-row indices, for low-cardinality columns;</li>
 *   <li>DELTA: differences between successive values, for near-monotonic integer or
 *       timestamp keys;</li>
 *   <li>PLAIN: no dictionary, for known high-cardinality columns such as free text.</li>
 * </ul>
 */
public enum ColumnEncoding {
    DICTIONARY,
    DELTA,
    PLAIN
}
