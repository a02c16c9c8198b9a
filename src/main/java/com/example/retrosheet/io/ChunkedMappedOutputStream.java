package com.example.retrosheet.io;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * OutputStream backed by chunked memory-mapped file regions. The target file is
 * truncated on open and trimmed to the number of bytes actually written on close.
 */
@Slf4j
public class ChunkedMappedOutputStream extends OutputStream {

    private final FileChannel channel;
    private final long chunkSize;

    // absolute file position where the current mapping starts
    private long mappingStart = 0L;

    private MappedByteBuffer mapped;

    public ChunkedMappedOutputStream(Path file, long chunkSize) throws IOException {
        if (chunkSize <= 0 || chunkSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("chunkSize must be in (0, " + Integer.MAX_VALUE + "]: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.channel = FileChannel.open(file,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING);
    }

    private void mapNext() throws IOException {
        if (mapped != null) {
            mappingStart += mapped.position();
            UnmapUtil.unmap(mapped);
            mapped = null;
        }
        // READ_WRITE mapping grows the file to cover the region
        mapped = channel.map(FileChannel.MapMode.READ_WRITE, mappingStart, chunkSize);
        log.debug("Mapped output chunk: start={}, size={}", mappingStart, mapped.capacity());
    }

    @Override
    public synchronized void write(int b) throws IOException {
        if (mapped == null || !mapped.hasRemaining()) {
            mapNext();
        }
        mapped.put((byte) b);
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) throws IOException {
        int remaining = len;
        int srcPos = off;
        while (remaining > 0) {
            if (mapped == null || !mapped.hasRemaining()) {
                mapNext();
            }
            int toWrite = Math.min(mapped.remaining(), remaining);
            mapped.put(b, srcPos, toWrite);
            srcPos += toWrite;
            remaining -= toWrite;
        }
    }

    @Override
    public synchronized void close() throws IOException {
        try {
            if (mapped != null) {
                mapped.force();
                mappingStart += mapped.position();
                UnmapUtil.unmap(mapped);
                mapped = null;
            }
            if (channel.size() > mappingStart) {
                channel.truncate(mappingStart);
            }
        } finally {
            channel.close();
        }
    }
}
