package com.example.retrosheet.columnar;

import com.example.retrosheet.reader.TypedTable;
import com.example.retrosheet.schema.EntitySchema;
import com.example.retrosheet.schema.FieldSpec;
import lombok.extern.slf4j.Slf4j;
import org.apache.parquet.column.ParquetProperties.WriterVersion;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.schema.MessageType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a {@link TypedTable} to {@code <outputDir>/<entity>.parquet}.
 * <p>
 * Files use the v2 writer so that integer and timestamp columns without a dictionary are
 * stored DELTA_BINARY_PACKED. The artifact is written next to its destination under a
 * temporary name and moved over any previous one, so readers never see a partial file.
 */
@Slf4j
public class ColumnarWriter {

    public static final String EXTENSION = ".parquet";

    private final Path outputDir;
    private final int rowGroupSize;
    private final int pageRowCountLimit;

    /**
     * @param rowGroupSize      target row group size in bytes
     * @param pageRowCountLimit maximum rows buffered per page before a size check
     */
    public ColumnarWriter(Path outputDir, int rowGroupSize, int pageRowCountLimit) {
        this.outputDir = outputDir;
        this.rowGroupSize = rowGroupSize;
        this.pageRowCountLimit = pageRowCountLimit;
    }

    public Path artifactPath(String entity) {
        return outputDir.resolve(entity + EXTENSION);
    }

    public Path write(TypedTable table, String entity, ColumnEncodingPolicy policy) throws IOException {
        EntitySchema schema = table.getSchema();
        policy.validate(schema);
        String sortKey = policy.effectiveSortKey(schema);
        TypedTable ordered = sortKey != null ? table.sortedBy(sortKey) : table;
        MessageType type = ParquetSchemas.toMessageType(schema);

        Files.createDirectories(outputDir);
        Path target = artifactPath(entity);
        Path tmp = outputDir.resolve("." + entity + EXTENSION + ".tmp");

        ExampleParquetWriter.Builder builder = ExampleParquetWriter.builder(new NioOutputFile(tmp))
                .withType(type)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .withWriterVersion(WriterVersion.PARQUET_2_0)
                .withCompressionCodec(policy.getCodec())
                .withRowGroupSize(rowGroupSize)
                .withPageRowCountLimit(pageRowCountLimit)
                .withDictionaryEncoding(policy.getDefaultEncoding() == ColumnEncoding.DICTIONARY);
        for (FieldSpec field : schema.getFields()) {
            builder = builder.withDictionaryEncoding(field.getName(),
                    policy.encodingOf(field.getName()) == ColumnEncoding.DICTIONARY);
        }

        SimpleGroupFactory groups = new SimpleGroupFactory(type);
        try (ParquetWriter<Group> writer = builder.build()) {
            for (Object[] row : ordered.rows()) {
                writer.write(toGroup(groups.newGroup(), schema, row));
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.info("{}: wrote {} rows to {} ({}, sorted by {})", entity, ordered.rowCount(), target,
                policy.getCodec(), sortKey == null ? "stream order" : sortKey);
        return target;
    }

    static Group toGroup(Group group, EntitySchema schema, Object[] row) {
        for (int i = 0; i < row.length; i++) {
            Object value = row[i];
            if (value == null) {
                continue;
            }
            String name = schema.field(i).getName();
            switch (schema.field(i).getType()) {
                case INT16:
                    group.append(name, ((Short) value).intValue());
                    break;
                case INT32:
                    group.append(name, ((Integer) value).intValue());
                    break;
                case FLOAT64:
                    group.append(name, ((Double) value).doubleValue());
                    break;
                case UTF8:
                    group.append(name, (String) value);
                    break;
                case BOOLEAN:
                    group.append(name, ((Boolean) value).booleanValue());
                    break;
                case TIMESTAMP_MILLIS:
                    group.append(name, ((Long) value).longValue());
                    break;
                default:
                    throw new IllegalStateException("Unhandled field type " + schema.field(i).getType());
            }
        }
        return group;
    }
}
