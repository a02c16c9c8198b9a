package com.example.retrosheet;

import com.example.retrosheet.normalize.NormalizationStats;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Outcome of one entity's run: either the written artifact or the failure that stopped it.
 */
@Value
public class EntityResult {

    public enum Failure {
        /** A field no coercion rule accepts. */
        COERCION,
        /** Reading sources or writing outputs failed. */
        IO,
        UNEXPECTED
    }

    String entity;
    Failure failure;
    String message;
    NormalizationStats stats;
    long rows;
    Path artifact;
    Duration elapsed;

    public static EntityResult success(String entity, NormalizationStats stats, long rows, Path artifact, Duration elapsed) {
        return new EntityResult(entity, null, null, stats, rows, artifact, elapsed);
    }

    public static EntityResult failure(String entity, Failure failure, String message, NormalizationStats stats, Duration elapsed) {
        return new EntityResult(entity, failure, message, stats, 0, null, elapsed);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
