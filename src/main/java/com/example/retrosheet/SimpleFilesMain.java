package com.example.retrosheet;

import com.example.retrosheet.entity.EntityDefinition;
import com.example.retrosheet.entity.RetrosheetEntities;
import com.example.retrosheet.normalize.SourceCharsets;
import com.example.retrosheet.schema.ColumnDeclaration;
import com.example.retrosheet.schema.SchemaDeclarationLoader;
import com.example.retrosheet.schema.SchemaDefinitionException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Builds the Retrosheet simple files and their Parquet artifacts.
 *
 * Example usage:
 * java -jar retrosheet-columnar.jar retrosheet retrosheet_simple auto univocity 67108864 schedule,roster
 *
 * Exit status: 0 when every entity succeeded, 1 when some entity failed, 2 on a configuration error.
 */
@Slf4j
public class SimpleFilesMain {

    static final int EXIT_OK = 0;
    static final int EXIT_ENTITY_FAILED = 1;
    static final int EXIT_CONFIGURATION = 2;

    @Data
    public static class Options {
        private Path retrosheetDir;
        private Path outputDir;
        private String sourceCharset = SourceCharsets.AUTO;
        private String parser = "univocity"; // or "commons"
        private long readBlockSize = 64L * 1024 * 1024;
        private List<String> entities = new ArrayList<>(RetrosheetEntities.names());
        private Path schemaFile; // bundled declarations when null
    }

    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        if (args.length < 2) {
            System.out.println("Usage: java -jar retrosheet-columnar.jar <retrosheetDir> <outputDir> [sourceCharset|auto] [parser=univocity|commons] [readBlockSizeBytes] [entities] [schemaFile]");
            System.out.println("Example: java -jar ... retrosheet retrosheet_simple auto univocity 67108864 gamelog,schedule,park,roster,bio");
            return EXIT_CONFIGURATION;
        }
        SimpleFilesPipeline pipeline;
        try {
            Options options = parseOptions(args);
            log.info("Options: {}", options);
            pipeline = new SimpleFilesPipeline(toConfig(options));
        } catch (SchemaDefinitionException | IllegalArgumentException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIGURATION;
        } catch (IOException e) {
            log.error("Failed resolving sources: {}", e.getMessage(), e);
            return EXIT_CONFIGURATION;
        }

        long start = System.currentTimeMillis();
        RunSummary summary = pipeline.run();
        long end = System.currentTimeMillis();
        log.info("Completed. Entities: {}, failed: {}, Time(s): {}", summary.getResults().size(), summary.failed().size(), (end - start) / 1000.0);
        return summary.allSucceeded() ? EXIT_OK : EXIT_ENTITY_FAILED;
    }

    static Options parseOptions(String[] args) {
        Options options = new Options();
        options.setRetrosheetDir(Paths.get(args[0]));
        options.setOutputDir(Paths.get(args[1]));
        if (args.length > 2) options.setSourceCharset(args[2]);
        if (args.length > 3) options.setParser(args[3]);
        if (args.length > 4) options.setReadBlockSize(Long.parseLong(args[4]));
        if (args.length > 5) options.setEntities(Arrays.asList(args[5].split(",")));
        if (args.length > 6) options.setSchemaFile(Paths.get(args[6]));
        return options;
    }

    static PipelineConfig toConfig(Options options) throws IOException {
        Map<String, List<ColumnDeclaration>> declarations = options.getSchemaFile() != null
                ? SchemaDeclarationLoader.load(options.getSchemaFile())
                : SchemaDeclarationLoader.loadBundled();
        List<EntityDefinition> entities = RetrosheetEntities.resolve(options.getRetrosheetDir(), options.getEntities());
        return PipelineConfig.builder()
                .outputDir(options.getOutputDir())
                .declarations(declarations)
                .entities(entities)
                .sourceCharset(options.getSourceCharset())
                .parser(options.getParser())
                .readBlockSize(options.getReadBlockSize())
                .build();
    }
}
