package com.example.retrosheet.normalize;

import lombok.Data;

/**
 * Counters of one entity's normalization pass.
 */
@Data
public class NormalizationStats {
    private int files;
    private long records;
    private long emitted;
    private long blank;
    private long headers;
    private long filtered;
    private long padded;
    private long dropped;
    private long duplicates;

    void file() { files++; }
    void record() { records++; }
    void emit() { emitted++; }
    void blank() { blank++; }
    void header() { headers++; }
    void filter() { filtered++; }
    void pad() { padded++; }
    void drop() { dropped++; }
    void duplicate() { duplicates++; }
}
