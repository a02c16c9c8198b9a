package com.example.retrosheet.normalize;

import com.example.retrosheet.entity.EntityDefinition;
import com.example.retrosheet.entity.EntityRules;
import com.example.retrosheet.entity.SourceFile;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Merges the sorted source files of one entity into a single stream of cleaned lines.
 * <p>
 * Per physical line: a byte-order mark (first line only) and DOS end-of-file characters are
 * stripped, the header line is skipped when the entity has one, blank lines are skipped and
 * a line ending inside a quoted value is joined with the following ones. A quoted value that
 * is still open after {@value #MAX_JOINED_LINES} lines, or at the end of its file, costs only
 * its opening line; the lines after it are read again as records of their own. Each resulting
 * record then goes through the row filter, tagging, width repair and deduplication, in that order.
 * <p>
 * A malformed record never stops the pass; it is logged with its source and counted in
 * {@link NormalizationStats}. I/O errors on a source file do stop it.
 */
@Slf4j
public class LineNormalizer {

    /** MS-DOS end-of-file marker (Ctrl+Z) found at the end of older files. */
    static final char DOS_EOF = '\u001A';
    private static final char BOM = '\uFEFF';
    /** Physical lines one quoted value may span before its opening line is given up on. */
    static final int MAX_JOINED_LINES = 16;

    private final EntityDefinition entity;
    private final EntityRules rules;
    private final int width;
    private final RowRepair repair;
    private final SourceCharsets charsets;

    public LineNormalizer(EntityDefinition entity, int width, SourceCharsets charsets) {
        this.entity = entity;
        this.rules = entity.getRules();
        this.width = width;
        this.repair = rules.isRepair() ? new RowRepair(width, rules.getDelimiter(), rules.getQuoteChar()) : null;
        this.charsets = charsets;
    }

    /**
     * Starts a new pass over all sources. Every pass has its own duplicate set and counters.
     */
    public Pass open() {
        return new Pass();
    }

    /**
     * Runs one full pass and writes each line followed by {@code '\n'}.
     */
    public NormalizationStats writeTo(Writer out) throws IOException {
        try (Pass pass = open()) {
            while (pass.hasNext()) {
                out.write(pass.next());
                out.write('\n');
                if (pass.getStats().getEmitted() % 100_000 == 0) {
                    log.info("{}: normalized {} lines", entity.getName(), pass.getStats().getEmitted());
                }
            }
            out.flush();
            return pass.getStats();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    static String clean(String physical, boolean firstLine) {
        String line = physical;
        if (firstLine && !line.isEmpty() && line.charAt(0) == BOM) {
            line = line.substring(1);
        }
        int start = 0;
        int end = line.length();
        while (start < end && line.charAt(start) == DOS_EOF) start++;
        while (end > start && (line.charAt(end - 1) == DOS_EOF || line.charAt(end - 1) == '\r')) end--;
        return line.substring(start, end);
    }

    @Value
    private static class PhysicalLine {
        long number;
        String text;
    }

    /**
     * One lazy, single-pass iteration over the entity's sources.
     */
    public final class Pass implements Iterator<String>, Closeable {

        @Getter
        private final NormalizationStats stats = new NormalizationStats();
        private final Deduplicator deduplicator = new Deduplicator(rules.isDedupe());
        private final Iterator<SourceFile> files = entity.getSources().iterator();
        // lines of an abandoned multi-line record, read again as records of their own
        private final Deque<PhysicalLine> replay = new ArrayDeque<>();

        private SourceFile current;
        private BufferedReader reader;
        private long lineNumber;
        private List<PhysicalLine> pending;
        private String next;

        private Pass() {}

        @Override
        public boolean hasNext() {
            if (next == null) {
                try {
                    next = advance();
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed reading " + current, e);
                }
            }
            return next != null;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String line = next;
            next = null;
            return line;
        }

        private String advance() throws IOException {
            while (true) {
                PhysicalLine line = replay.pollFirst();
                if (line == null) {
                    if (reader == null) {
                        if (!files.hasNext()) {
                            return null;
                        }
                        openNext(files.next());
                    }
                    String physical = reader.readLine();
                    if (physical == null) {
                        if (pending != null) {
                            abandonPending("an unterminated quoted value");
                        } else {
                            finishFile();
                        }
                        continue;
                    }
                    lineNumber++;
                    line = new PhysicalLine(lineNumber, clean(physical, lineNumber == 1));
                }
                String out = accept(line);
                if (out != null) {
                    return out;
                }
            }
        }

        private String accept(PhysicalLine line) {
            if (pending != null) {
                pending.add(line);
                String joined = pending.stream().map(PhysicalLine::getText).collect(Collectors.joining("\n"));
                if (DelimitedLine.hasOpenQuote(joined, rules.getDelimiter(), rules.getQuoteChar())) {
                    if (pending.size() > MAX_JOINED_LINES) {
                        abandonPending("a quoted value spanning more than " + MAX_JOINED_LINES + " lines");
                    }
                    return null;
                }
                long start = pending.get(0).getNumber();
                pending = null;
                return process(new RawRecord(current, start, joined));
            }
            if (line.getNumber() == 1 && rules.isStripHeader()) {
                stats.header();
                log.debug("Skipped header of {}: {}", current, line.getText());
                return null;
            }
            if (line.getText().isBlank()) {
                stats.blank();
                return null;
            }
            if (DelimitedLine.hasOpenQuote(line.getText(), rules.getDelimiter(), rules.getQuoteChar())) {
                pending = new ArrayList<>();
                pending.add(line);
                return null;
            }
            return process(new RawRecord(current, line.getNumber(), line.getText()));
        }

        /** Drops the opening line of the pending record and queues the lines after it. */
        private void abandonPending(String reason) {
            PhysicalLine opening = pending.get(0);
            stats.record();
            stats.drop();
            log.warn("Dropped row in {} with {}: {}",
                    new RawRecord(current, opening.getNumber(), opening.getText()).location(), reason, opening.getText());
            for (int i = pending.size() - 1; i >= 1; i--) {
                replay.addFirst(pending.get(i));
            }
            pending = null;
        }

        private String process(RawRecord raw) {
            stats.record();
            String text = raw.getText();
            RowFilter filter = rules.getRowFilter();
            if (filter != null && !filter.accept(text)) {
                stats.filter();
                log.debug("Row in {} rejected by {}: {}", raw.location(), filter, text);
                return null;
            }
            if (rules.isPrependTag()) {
                text = raw.getSource().getTag() + rules.getDelimiter() + text;
            }
            if (repair != null) {
                RowRepair.Result result = repair.apply(text);
                switch (result.getOutcome()) {
                    case DROPPED:
                        stats.drop();
                        log.warn("Dropped row in {} with {} of {} fields: {}", raw.location(), result.getFieldCount(), width, text);
                        return null;
                    case PADDED:
                        stats.pad();
                        log.warn("Padded row in {} with an empty trailing field: {}", raw.location(), text);
                        text = result.getLine();
                        break;
                    default:
                        break;
                }
            }
            if (!deduplicator.firstOccurrence(text)) {
                stats.duplicate();
                log.warn("Duplicate row in {}: {}", raw.location(), text);
                return null;
            }
            stats.emit();
            return text;
        }

        private void openNext(SourceFile source) throws IOException {
            current = source;
            lineNumber = 0;
            Charset charset = charsets.charsetFor(source.getPath());
            reader = new BufferedReader(new InputStreamReader(Files.newInputStream(source.getPath()),
                    charset.newDecoder()
                            .onMalformedInput(CodingErrorAction.REPLACE)
                            .onUnmappableCharacter(CodingErrorAction.REPLACE)));
            stats.file();
            log.debug("{}: reading {} as {}", entity.getName(), source, charset.name());
        }

        private void finishFile() throws IOException {
            reader.close();
            reader = null;
        }

        @Override
        public void close() throws IOException {
            if (reader != null) {
                reader.close();
                reader = null;
            }
        }
    }
}
