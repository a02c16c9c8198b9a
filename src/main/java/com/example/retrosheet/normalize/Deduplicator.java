package com.example.retrosheet.normalize;

import java.util.HashSet;
import java.util.Set;

/**
 * Remembers every line emitted during one entity pass and rejects repeats, so the first
 * occurrence in sorted source order wins. A new instance is created for each pass and
 * dropped when the pass ends.
 */
public final class Deduplicator {

    private final boolean enabled;
    private final Set<String> emitted = new HashSet<>();

    public Deduplicator(boolean enabled) {
        this.enabled = enabled;
    }

    /** True if the line has not been seen in this pass; records it. Always true when disabled. */
    public boolean firstOccurrence(String line) {
        return !enabled || emitted.add(line);
    }

    public int size() {
        return emitted.size();
    }
}
