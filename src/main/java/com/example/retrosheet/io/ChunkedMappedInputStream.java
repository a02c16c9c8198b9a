package com.example.retrosheet.io;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * An InputStream that maps a file in chunks of {@code chunkSize} bytes and presents
 * them as one continuous stream. The previous chunk is unmapped before the next one
 * is mapped, so at most one chunk is resident at a time.
 */
@Slf4j
public class ChunkedMappedInputStream extends InputStream {

    private final FileChannel channel;
    private final long fileSize;
    private final long chunkSize;
    private long position = 0;

    private MappedByteBuffer mapped;

    public ChunkedMappedInputStream(Path file, long chunkSize) throws IOException {
        Objects.requireNonNull(file, "file");
        if (chunkSize <= 0 || chunkSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("chunkSize must be in (0, " + Integer.MAX_VALUE + "]: " + chunkSize);
        }
        this.channel = FileChannel.open(file, StandardOpenOption.READ);
        this.fileSize = channel.size();
        this.chunkSize = chunkSize;
        mapNext();
    }

    private void mapNext() throws IOException {
        UnmapUtil.unmap(mapped);
        if (position >= fileSize) {
            mapped = null;
            return;
        }
        long size = Math.min(chunkSize, fileSize - position);
        mapped = channel.map(FileChannel.MapMode.READ_ONLY, position, size);
        position += size;
        log.debug("Mapped chunk: startPos={}, size={}", position - size, size);
    }

    @Override
    public int read() throws IOException {
        while (mapped != null) {
            if (mapped.hasRemaining()) {
                return mapped.get() & 0xFF;
            }
            mapNext();
        }
        return -1;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        int totalRead = 0;
        while (len > 0 && mapped != null) {
            if (!mapped.hasRemaining()) {
                mapNext();
                continue;
            }
            int toRead = Math.min(len, mapped.remaining());
            mapped.get(b, off, toRead);
            off += toRead;
            len -= toRead;
            totalRead += toRead;
        }
        return totalRead == 0 ? -1 : totalRead;
    }

    @Override
    public void close() throws IOException {
        try {
            UnmapUtil.unmap(mapped);
            mapped = null;
        } finally {
            channel.close();
        }
    }
}
