package com.example.retrosheet.normalize;

import lombok.Value;

/**
 * Brings a record to the schema width. A record missing exactly its trailing field gets an
 * empty one appended; a record missing more is dropped. Wider records pass unchanged and
 * are left for the typed reader to reject.
 */
public final class RowRepair {

    public enum Outcome { ACCEPTED, PADDED, DROPPED }

    @Value
    public static class Result {
        Outcome outcome;
        String line;
        int fieldCount;
    }

    private final int width;
    private final char delimiter;
    private final char quote;

    public RowRepair(int width, char delimiter, char quote) {
        this.width = width;
        this.delimiter = delimiter;
        this.quote = quote;
    }

    public Result apply(String line) {
        int fields = DelimitedLine.countFields(line, delimiter, quote);
        if (fields == width - 1) {
            return new Result(Outcome.PADDED, line + delimiter, fields);
        }
        if (fields < width - 1) {
            return new Result(Outcome.DROPPED, line, fields);
        }
        return new Result(Outcome.ACCEPTED, line, fields);
    }
}
