package com.example.retrosheet;

import com.example.retrosheet.entity.EntityDefinition;
import com.example.retrosheet.normalize.SourceCharsets;
import com.example.retrosheet.schema.ColumnDeclaration;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything one pipeline run needs. Built once by the caller and never mutated.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    /** Directory receiving the Parquet artifacts. */
    @NonNull Path outputDir;
    /** Directory receiving the normalized simple files; the output directory when unset. */
    Path stagingDir;
    /** Entities in processing order. */
    @Singular List<EntityDefinition> entities;
    /** Ordered column declarations per entity. */
    @NonNull Map<String, List<ColumnDeclaration>> declarations;

    /** Source decoding: a charset name or {@value SourceCharsets#AUTO}. */
    @Builder.Default String sourceCharset = SourceCharsets.AUTO;
    /** Simple-file parser: univocity or commons. */
    @Builder.Default String parser = "univocity";
    /** Bytes mapped at a time when reading a simple file. */
    @Builder.Default long readBlockSize = 64L * 1024 * 1024;
    /** Bytes mapped at a time when writing a simple file. */
    @Builder.Default long writeChunkSize = 64L * 1024 * 1024;
    /** Parquet row group size in bytes. */
    @Builder.Default int rowGroupSize = 128 * 1024 * 1024;
    /** Parquet page row count limit. */
    @Builder.Default int pageRowCountLimit = 20_000;

    public Path effectiveStagingDir() {
        return stagingDir != null ? stagingDir : outputDir;
    }
}
