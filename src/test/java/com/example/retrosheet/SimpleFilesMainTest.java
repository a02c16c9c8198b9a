package com.example.retrosheet;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class SimpleFilesMainTest {

    @TempDir
    Path dir;

    @Test
    void missingArgumentsIsAConfigurationError() {
        assertThat(SimpleFilesMain.run(new String[]{"retrosheet"})).isEqualTo(SimpleFilesMain.EXIT_CONFIGURATION);
    }

    @Test
    void unknownEntityIsAConfigurationError() {
        String[] args = {dir.toString(), dir.resolve("out").toString(), "auto", "univocity", "1024", "schedule,boxscore"};

        assertThat(SimpleFilesMain.run(args)).isEqualTo(SimpleFilesMain.EXIT_CONFIGURATION);
        assertThat(dir.resolve("out")).doesNotExist();
    }

    @Test
    void unknownParserAndBadBlockSizeAreConfigurationErrors() {
        String out = dir.resolve("out").toString();

        assertThat(SimpleFilesMain.run(new String[]{dir.toString(), out, "auto", "jackson"}))
                .isEqualTo(SimpleFilesMain.EXIT_CONFIGURATION);
        assertThat(SimpleFilesMain.run(new String[]{dir.toString(), out, "auto", "univocity", "64MB"}))
                .isEqualTo(SimpleFilesMain.EXIT_CONFIGURATION);
    }

    @Test
    void successfulRunExitsZero() throws Exception {
        Files.createDirectories(dir.resolve("rosters"));
        Files.writeString(dir.resolve("rosters/CLE1901.ROS"), "bradb101,Bradley,Bill,R,R,CLE,3B\n", StandardCharsets.UTF_8);
        String[] args = {dir.toString(), dir.resolve("out").toString(), "UTF-8", "commons", "4096", "roster"};

        assertThat(SimpleFilesMain.run(args)).isEqualTo(SimpleFilesMain.EXIT_OK);
        assertThat(dir.resolve("out/roster.parquet")).exists();
        assertThat(Files.readString(dir.resolve("out/roster.csv"))).isEqualTo("1901,bradb101,Bradley,Bill,R,R,CLE,3B\n");
    }

    @Test
    void failedEntityExitsOne() throws Exception {
        Files.createDirectories(dir.resolve("rosters"));
        // a year tag that is not a number
        Files.writeString(dir.resolve("rosters/CLEXXXX.ROS"), "bradb101,Bradley,Bill,R,R,CLE,3B\n", StandardCharsets.UTF_8);
        String[] args = {dir.toString(), dir.resolve("out").toString(), "UTF-8", "univocity", "4096", "roster"};

        assertThat(SimpleFilesMain.run(args)).isEqualTo(SimpleFilesMain.EXIT_ENTITY_FAILED);
    }
}
