package com.example.retrosheet.reader;

import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;

/**
 * uniVocity parser implementation (default).
 */
@Slf4j
public class UniVocityRecordParser implements RecordParserStrategy {

    @Data
    public static class Config {
        private char delimiter = ',';
        private char quoteChar = '"';
        private int maxColumns = 512;
        private int maxCharsPerColumn = 10_000_000;
    }

    private final Config cfg;

    public UniVocityRecordParser(Config cfg) {
        this.cfg = cfg;
    }

    @Override
    public long parse(Reader input, RecordConsumer consumer) throws IOException {
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setDelimiter(cfg.delimiter);
        settings.getFormat().setQuote(cfg.quoteChar);
        settings.getFormat().setQuoteEscape(cfg.quoteChar);
        settings.getFormat().setLineSeparator("\n");
        settings.setHeaderExtractionEnabled(false);
        settings.setIgnoreLeadingWhitespaces(false);
        settings.setIgnoreTrailingWhitespaces(false);
        settings.setIgnoreLeadingWhitespacesInQuotes(false);
        settings.setIgnoreTrailingWhitespacesInQuotes(false);
        settings.setSkipEmptyLines(true);
        settings.setNullValue(null);
        settings.setEmptyValue(null);
        settings.setMaxColumns(cfg.maxColumns);
        settings.setMaxCharsPerColumn(cfg.maxCharsPerColumn);

        CsvParser parser = new CsvParser(settings);
        long count = 0;
        try {
            parser.beginParsing(input);
            String[] row;
            while ((row = parser.parseNext()) != null) {
                count++;
                consumer.accept(row, count);
                if (count % 100_000 == 0) {
                    log.info("uniVocity parsed {} rows", count);
                }
            }
        } catch (TextParsingException ex) {
            throw new IOException("uniVocity failed at record " + (count + 1) + ": " + ex.getMessage(), ex);
        } finally {
            parser.stopParsing();
        }
        return count;
    }
}
