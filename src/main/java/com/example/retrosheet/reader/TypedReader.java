package com.example.retrosheet.reader;

import com.example.retrosheet.io.ChunkedMappedInputStream;
import com.example.retrosheet.schema.EntitySchema;
import com.example.retrosheet.schema.FieldSpec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Parses a normalized simple file into a {@link TypedTable}. The file has no header; values
 * are assigned to columns by position. The file is read through chunked memory mappings of
 * {@code blockSize} bytes.
 */
@Slf4j
public class TypedReader {

    private final RecordParserStrategy parser;
    private final long blockSize;

    public TypedReader(RecordParserStrategy parser, long blockSize) {
        this.parser = parser;
        this.blockSize = blockSize;
    }

    /**
     * @throws TypeCoercionException on the first field or record no rule accepts
     */
    public TypedTable read(Path simpleFile, EntitySchema schema) throws IOException {
        try (InputStream in = new ChunkedMappedInputStream(simpleFile, blockSize);
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            TypedTable table = read(reader, schema);
            log.info("{}: read {} typed rows from {}", schema.getEntity(), table.rowCount(), simpleFile);
            return table;
        }
    }

    public TypedTable read(Reader reader, EntitySchema schema) throws IOException {
        TypedTable table = new TypedTable(schema);
        parser.parse(reader, (values, recordNumber) -> table.add(toRow(schema, values, recordNumber)));
        return table;
    }

    static Object[] toRow(EntitySchema schema, String[] values, long recordNumber) {
        if (values.length != schema.width()) {
            throw new TypeCoercionException(schema.getEntity(), recordNumber, null, String.join(",", nullsAsEmpty(values)),
                    "expected " + schema.width() + " fields, got " + values.length);
        }
        Object[] row = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            FieldSpec field = schema.field(i);
            try {
                row[i] = ValueCoercer.coerce(values[i], field);
            } catch (IllegalArgumentException e) {
                throw new TypeCoercionException(schema.getEntity(), recordNumber, field.getName(), values[i],
                        field.getType() + " " + e.getMessage());
            }
        }
        return row;
    }

    private static String[] nullsAsEmpty(String[] values) {
        String[] copy = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i] == null ? "" : values[i];
        }
        return copy;
    }
}
