package com.example.retrosheet.normalize;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * Keeps rows whose trailing field carries a marker, e.g. the game log acquisition flag
 * that tells whether the log line is the only complete record of a game.
 * <p>
 * Three readings of "carries" exist and they disagree on malformed rows:
 * <ul>
 *   <li>{@link Mode#FIELD_EQUALS}: the unquoted, trimmed trailing field equals the marker;</li>
 *   <li>{@link Mode#FIELD_CONTAINS}: the raw trailing field contains the marker anywhere;</li>
 *   <li>{@link Mode#LAST_CHARACTER}: the last character of the record, after dropping a
 *       closing quote, equals the marker's last character.</li>
 * </ul>
 */
@EqualsAndHashCode
public final class TrailingFieldFilter implements RowFilter {

    public enum Mode { FIELD_EQUALS, FIELD_CONTAINS, LAST_CHARACTER }

    private final String marker;
    private final Mode mode;
    private final char delimiter;
    private final char quote;

    public TrailingFieldFilter(@NonNull String marker, @NonNull Mode mode, char delimiter, char quote) {
        if (marker.isEmpty()) {
            throw new IllegalArgumentException("marker must not be empty");
        }
        this.marker = marker;
        this.mode = mode;
        this.delimiter = delimiter;
        this.quote = quote;
    }

    public static TrailingFieldFilter equalTo(String marker) {
        return new TrailingFieldFilter(marker, Mode.FIELD_EQUALS, ',', '"');
    }

    @Override
    public boolean accept(String record) {
        switch (mode) {
            case FIELD_EQUALS:
                return marker.equals(DelimitedLine.unquote(DelimitedLine.lastField(record, delimiter, quote), quote));
            case FIELD_CONTAINS:
                return DelimitedLine.lastField(record, delimiter, quote).contains(marker);
            case LAST_CHARACTER:
                String trimmed = record.stripTrailing();
                if (!trimmed.isEmpty() && trimmed.charAt(trimmed.length() - 1) == quote) {
                    trimmed = trimmed.substring(0, trimmed.length() - 1);
                }
                return !trimmed.isEmpty() && trimmed.charAt(trimmed.length() - 1) == marker.charAt(marker.length() - 1);
            default:
                throw new IllegalStateException("Unknown mode " + mode);
        }
    }

    @Override
    public String toString() {
        return "trailing field " + mode + " '" + marker + "'";
    }
}
