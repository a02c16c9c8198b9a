package com.example.retrosheet.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ChunkedMappedStreamsTest {

    @TempDir
    Path dir;

    private static byte[] sample(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) ('a' + i % 26);
        }
        return data;
    }

    @Test
    void outputIsTrimmedToBytesWrittenAcrossChunks() throws Exception {
        Path file = dir.resolve("out.csv");
        byte[] data = sample(1000);

        try (OutputStream out = new ChunkedMappedOutputStream(file, 64)) {
            out.write(data, 0, 500);
            out.write(data[500]);
            out.write(data, 501, 499);
        }

        assertThat(Files.readAllBytes(file)).isEqualTo(data);
    }

    @Test
    void reopeningTruncatesPreviousContent() throws Exception {
        Path file = dir.resolve("out.csv");
        Files.write(file, sample(4096));

        try (OutputStream out = new ChunkedMappedOutputStream(file, 128)) {
            out.write("1901\n".getBytes(StandardCharsets.UTF_8));
        }

        assertThat(Files.readString(file)).isEqualTo("1901\n");
    }

    @Test
    void inputReadsAcrossChunkBoundaries() throws Exception {
        Path file = dir.resolve("in.csv");
        byte[] data = sample(1000);
        Files.write(file, data);

        ByteArrayOutputStream copy = new ByteArrayOutputStream();
        try (InputStream in = new ChunkedMappedInputStream(file, 7)) {
            copy.write(in.read());
            byte[] buf = new byte[100];
            int n;
            while ((n = in.read(buf, 0, buf.length)) != -1) {
                copy.write(buf, 0, n);
            }
            assertThat(in.read()).isEqualTo(-1);
        }

        assertThat(copy.toByteArray()).isEqualTo(data);
    }

    @Test
    void emptyFileIsImmediatelyAtEnd() throws Exception {
        Path file = dir.resolve("empty.csv");
        try (OutputStream out = new ChunkedMappedOutputStream(file, 16)) {
            out.flush();
        }
        assertThat(file).isEmptyFile();

        try (InputStream in = new ChunkedMappedInputStream(file, 16)) {
            assertThat(in.read()).isEqualTo(-1);
            assertThat(in.read(new byte[4], 0, 4)).isEqualTo(-1);
        }
    }

    @Test
    void rejectsChunkSizeOutsideIntRange() {
        Path file = dir.resolve("x.csv");
        assertThatThrownBy(() -> new ChunkedMappedOutputStream(file, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChunkedMappedInputStream(file, Integer.MAX_VALUE + 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
