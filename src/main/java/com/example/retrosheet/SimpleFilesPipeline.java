package com.example.retrosheet;

import com.example.retrosheet.columnar.ColumnarWriter;
import com.example.retrosheet.entity.EntityDefinition;
import com.example.retrosheet.io.ChunkedMappedOutputStream;
import com.example.retrosheet.normalize.LineNormalizer;
import com.example.retrosheet.normalize.NormalizationStats;
import com.example.retrosheet.normalize.SourceCharsets;
import com.example.retrosheet.reader.RecordParserStrategy;
import com.example.retrosheet.reader.TypeCoercionException;
import com.example.retrosheet.reader.TypedReader;
import com.example.retrosheet.reader.TypedTable;
import com.example.retrosheet.schema.EntitySchema;
import com.example.retrosheet.schema.SchemaDefinitionException;
import com.example.retrosheet.schema.SchemaRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs every configured entity through normalization, typed reading and columnar writing.
 * <p>
 * Configuration is checked in the constructor, before any file is touched: every entity must
 * have a schema whose types all map, and its encoding policy must fit that schema. After that,
 * entities run one at a time; a failing entity is recorded in the {@link RunSummary} and the
 * next one still runs.
 */
@Slf4j
public class SimpleFilesPipeline {

    public static final String SIMPLE_FILE_EXTENSION = ".csv";

    private final PipelineConfig config;
    private final SchemaRegistry registry;
    private final SourceCharsets charsets;
    private final ColumnarWriter writer;

    /**
     * @throws SchemaDefinitionException if the schemas or entity configuration are unusable
     */
    public SimpleFilesPipeline(PipelineConfig config) {
        this.config = config;
        this.registry = new SchemaRegistry(config.getDeclarations());
        Set<String> names = new HashSet<>();
        for (EntityDefinition entity : config.getEntities()) {
            if (!names.add(entity.getName())) {
                throw new SchemaDefinitionException("Entity '" + entity.getName() + "' is configured twice");
            }
            EntitySchema schema = registry.schemaFor(entity.getName());
            entity.getEncoding().validate(schema);
            // fail fast on an unknown parser name
            RecordParserStrategy.named(config.getParser(), entity.getRules().getDelimiter(), entity.getRules().getQuoteChar());
        }
        this.charsets = SourceCharsets.of(config.getSourceCharset());
        this.writer = new ColumnarWriter(config.getOutputDir(), config.getRowGroupSize(), config.getPageRowCountLimit());
    }

    public RunSummary run() {
        log.info("Writing simple files for {} entities (charset {}, parser {})",
                config.getEntities().size(), charsets, config.getParser());
        List<EntityResult> results = new ArrayList<>();
        for (EntityDefinition entity : config.getEntities()) {
            results.add(runEntity(entity));
        }
        RunSummary summary = new RunSummary(results);
        log.info("Run finished: {}", summary.describe());
        return summary;
    }

    EntityResult runEntity(EntityDefinition entity) {
        String name = entity.getName();
        long start = System.nanoTime();
        NormalizationStats stats = null;
        try {
            EntitySchema schema = registry.schemaFor(name);
            if (entity.getSources().isEmpty()) {
                log.warn("{}: no source files", name);
            }
            Path simpleFile = config.effectiveStagingDir().resolve(name + SIMPLE_FILE_EXTENSION);
            stats = writeSimpleFile(entity, schema, simpleFile);
            log.info("{}: {} files, {} records, {} lines emitted ({} filtered, {} padded, {} dropped, {} duplicates)",
                    name, stats.getFiles(), stats.getRecords(), stats.getEmitted(), stats.getFiltered(),
                    stats.getPadded(), stats.getDropped(), stats.getDuplicates());

            RecordParserStrategy parser = RecordParserStrategy.named(config.getParser(),
                    entity.getRules().getDelimiter(), entity.getRules().getQuoteChar());
            TypedTable table = new TypedReader(parser, config.getReadBlockSize()).read(simpleFile, schema);
            Path artifact = writer.write(table, name, entity.getEncoding());
            return EntityResult.success(name, stats, table.rowCount(), artifact, since(start));
        } catch (TypeCoercionException e) {
            log.error("{}: type coercion failed, entity aborted: {}", name, e.getMessage());
            return EntityResult.failure(name, EntityResult.Failure.COERCION, e.getMessage(), stats, since(start));
        } catch (IOException | UncheckedIOException e) {
            log.error("{}: I/O failure, entity aborted: {}", name, e.getMessage(), e);
            return EntityResult.failure(name, EntityResult.Failure.IO, e.getMessage(), stats, since(start));
        } catch (RuntimeException e) {
            log.error("{}: unexpected failure, entity aborted: {}", name, e.getMessage(), e);
            return EntityResult.failure(name, EntityResult.Failure.UNEXPECTED, String.valueOf(e), stats, since(start));
        }
    }

    private NormalizationStats writeSimpleFile(EntityDefinition entity, EntitySchema schema, Path simpleFile) throws IOException {
        Files.createDirectories(simpleFile.getParent());
        Path tmp = simpleFile.resolveSibling("." + simpleFile.getFileName() + ".tmp");
        LineNormalizer normalizer = new LineNormalizer(entity, schema.width(), charsets);
        NormalizationStats stats;
        try (Writer out = new BufferedWriter(new OutputStreamWriter(
                new ChunkedMappedOutputStream(tmp, config.getWriteChunkSize()), StandardCharsets.UTF_8))) {
            stats = normalizer.writeTo(out);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        Files.move(tmp, simpleFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return stats;
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
