package com.example.retrosheet.schema;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads ordered column declarations from a CSV document with the header
 * {@code entity,column,type,autoincrement,nullable}. The last two values may be left
 * empty and default to {@code false} and {@code true}. Lines starting with {@code #} are
 * comments.
 */
@Slf4j
public final class SchemaDeclarationLoader {

    public static final String BUNDLED_RESOURCE = "retrosheet-schema.csv";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setCommentMarker('#')
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();

    private SchemaDeclarationLoader() {}

    public static Map<String, List<ColumnDeclaration>> loadBundled() {
        InputStream in = SchemaDeclarationLoader.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE);
        if (in == null) {
            throw new SchemaDefinitionException("Schema resource " + BUNDLED_RESOURCE + " not found on classpath");
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader, BUNDLED_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + BUNDLED_RESOURCE, e);
        }
    }

    public static Map<String, List<ColumnDeclaration>> load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader, file.toString());
        }
    }

    public static Map<String, List<ColumnDeclaration>> load(Reader reader, String origin) throws IOException {
        Map<String, List<ColumnDeclaration>> declarations = new LinkedHashMap<>();
        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord rec : parser) {
                if (!rec.isConsistent()) {
                    throw new SchemaDefinitionException(origin + ":" + rec.getRecordNumber()
                            + ": expected " + parser.getHeaderNames().size() + " values, got " + rec.size());
                }
                String entity = rec.get("entity");
                RelationalType type;
                try {
                    type = RelationalType.fromName(rec.get("type"));
                } catch (SchemaDefinitionException e) {
                    throw new SchemaDefinitionException(origin + ":" + rec.getRecordNumber()
                            + ": column " + entity + "." + rec.get("column") + ": " + e.getMessage(), e);
                }
                boolean autoincrement = flag(rec, "autoincrement", false);
                boolean nullable = flag(rec, "nullable", true);
                declarations.computeIfAbsent(entity, k -> new ArrayList<>())
                        .add(new ColumnDeclaration(rec.get("column"), type, autoincrement, nullable));
            }
        }
        log.debug("Loaded column declarations for {} entities from {}", declarations.size(), origin);
        return declarations;
    }

    private static boolean flag(CSVRecord rec, String column, boolean defaultValue) {
        if (!rec.isMapped(column) || !rec.isSet(column)) {
            return defaultValue;
        }
        String value = rec.get(column);
        if (value.isEmpty()) {
            return defaultValue;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "1":
                return true;
            case "false":
            case "no":
            case "0":
                return false;
            default:
                throw new SchemaDefinitionException("Invalid " + column + " flag '" + value + "' at record " + rec.getRecordNumber());
        }
    }
}
