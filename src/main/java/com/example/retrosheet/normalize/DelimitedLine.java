package com.example.retrosheet.normalize;

/**
 * Quote-aware helpers over one delimited record. Only a quote at the start of a field opens a
 * quoted value; a quote anywhere else in an unquoted field is literal text ({@code 6'1"}).
 * Inside a quoted value a doubled quote is an escaped quote and a single one closes it.
 */
public final class DelimitedLine {

    private DelimitedLine() {}

    /** Receives the index of every unquoted delimiter. */
    private interface DelimiterVisitor {
        void delimiter(int index);
    }

    /** @return true when the record ends inside a quoted value */
    private static boolean scan(CharSequence record, char delimiter, char quote, DelimiterVisitor visitor) {
        boolean quoted = false;
        boolean fieldStart = true;
        for (int i = 0; i < record.length(); i++) {
            char c = record.charAt(i);
            if (quoted) {
                if (c == quote) {
                    if (i + 1 < record.length() && record.charAt(i + 1) == quote) {
                        i++;
                    } else {
                        quoted = false;
                    }
                }
            } else if (c == delimiter) {
                visitor.delimiter(i);
                fieldStart = true;
            } else {
                if (c == quote && fieldStart) {
                    quoted = true;
                }
                fieldStart = false;
            }
        }
        return quoted;
    }

    public static int countFields(String record, char delimiter, char quote) {
        int[] fields = {1};
        scan(record, delimiter, quote, i -> fields[0]++);
        return fields[0];
    }

    /** True when the record ends inside a quoted value, i.e. its value continues on the next line. */
    public static boolean hasOpenQuote(CharSequence record, char delimiter, char quote) {
        return scan(record, delimiter, quote, i -> { });
    }

    /** The raw text after the last unquoted delimiter, quotes included. */
    public static String lastField(String record, char delimiter, char quote) {
        int[] start = {0};
        scan(record, delimiter, quote, i -> start[0] = i + 1);
        return record.substring(start[0]);
    }

    public static String unquote(String field, char quote) {
        String trimmed = field.trim();
        if (trimmed.length() >= 2 && trimmed.charAt(0) == quote && trimmed.charAt(trimmed.length() - 1) == quote) {
            String q = String.valueOf(quote);
            return trimmed.substring(1, trimmed.length() - 1).replace(q + q, q);
        }
        return trimmed;
    }
}
