package com.example.retrosheet.normalize;

/**
 * Keep rule applied to a record before tagging and repair.
 */
@FunctionalInterface
public interface RowFilter {
    boolean accept(String record);
}
