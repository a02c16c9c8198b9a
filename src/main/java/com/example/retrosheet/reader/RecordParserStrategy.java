package com.example.retrosheet.reader;

import java.io.IOException;
import java.io.Reader;

/**
 * Delimited-text parser strategy, to allow switching between uniVocity and Commons CSV.
 * Implementations hand every record to the consumer with empty values (quoted or not) as
 * {@code null}, keep quoted line breaks inside their value, and return the record count.
 */
public interface RecordParserStrategy {

    long parse(Reader input, RecordConsumer consumer) throws IOException;

    @FunctionalInterface
    interface RecordConsumer {
        void accept(String[] values, long recordNumber);
    }

    static RecordParserStrategy named(String name, char delimiter, char quoteChar) {
        if ("commons".equalsIgnoreCase(name)) {
            CommonsCsvRecordParser.Config cfg = new CommonsCsvRecordParser.Config();
            cfg.setDelimiter(delimiter);
            cfg.setQuoteChar(quoteChar);
            return new CommonsCsvRecordParser(cfg);
        }
        if ("univocity".equalsIgnoreCase(name)) {
            UniVocityRecordParser.Config cfg = new UniVocityRecordParser.Config();
            cfg.setDelimiter(delimiter);
            cfg.setQuoteChar(quoteChar);
            return new UniVocityRecordParser(cfg);
        }
        throw new IllegalArgumentException("Unknown parser '" + name + "', expected univocity or commons");
    }
}
