package com.example.retrosheet.entity;

import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * One input file of an entity, with the tag derived from its name. Retrosheet names
 * per-season files with the year as the last four characters of the stem
 * ({@code GL1901.TXT}, {@code CLE1901.ROS}), so that suffix is the tag.
 */
@Value
public class SourceFile implements Comparable<SourceFile> {

    public static final int DEFAULT_TAG_LENGTH = 4;

    @NonNull Path path;
    @NonNull String tag;

    public static SourceFile of(Path path) {
        return of(path, DEFAULT_TAG_LENGTH);
    }

    public static SourceFile of(Path path, int tagLength) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return new SourceFile(path, stem.substring(Math.max(0, stem.length() - tagLength)));
    }

    @Override
    public int compareTo(SourceFile other) {
        return path.compareTo(other.path);
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
