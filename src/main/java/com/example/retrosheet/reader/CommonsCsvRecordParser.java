package com.example.retrosheet.reader;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;

/**
 * Apache Commons CSV implementation (alternative).
 */
@Slf4j
public class CommonsCsvRecordParser implements RecordParserStrategy {

    @Data
    public static class Config {
        private char delimiter = ',';
        private char quoteChar = '"';
    }

    private final Config cfg;

    public CommonsCsvRecordParser(Config cfg) {
        this.cfg = cfg;
    }

    @Override
    public long parse(Reader input, RecordConsumer consumer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(cfg.delimiter)
                .setQuote(cfg.quoteChar)
                .setRecordSeparator('\n')
                .setIgnoreEmptyLines(true)
                .build();

        long count = 0;
        try (CSVParser parser = format.parse(input)) {
            for (CSVRecord rec : parser) {
                String[] values = new String[rec.size()];
                for (int i = 0; i < values.length; i++) {
                    String value = rec.get(i);
                    values[i] = value.isEmpty() ? null : value;
                }
                count++;
                consumer.accept(values, count);
                if (count % 100_000 == 0) {
                    log.info("commons-csv parsed {} rows", count);
                }
            }
        } catch (IllegalStateException ex) {
            // commons-csv reports malformed quoting as IllegalStateException wrapping an IOException
            throw new IOException("commons-csv failed after record " + count + ": " + ex.getMessage(), ex);
        }
        return count;
    }
}
