package com.example.retrosheet.columnar;

import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Parquet {@link OutputFile} over a local path, written through a {@link FileChannel}
 * instead of a Hadoop filesystem.
 */
final class NioOutputFile implements OutputFile {

    private final Path file;

    NioOutputFile(Path file) {
        this.file = file;
    }

    @Override
    public PositionOutputStream create(long blockSizeHint) throws IOException {
        return open(StandardOpenOption.CREATE_NEW);
    }

    @Override
    public PositionOutputStream createOrOverwrite(long blockSizeHint) throws IOException {
        return open(StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    private PositionOutputStream open(StandardOpenOption... mode) throws IOException {
        StandardOpenOption[] options = new StandardOpenOption[mode.length + 1];
        options[0] = StandardOpenOption.WRITE;
        System.arraycopy(mode, 0, options, 1, mode.length);
        return new NioPositionOutputStream(FileChannel.open(file, options));
    }

    @Override
    public boolean supportsBlockSize() {
        return false;
    }

    @Override
    public long defaultBlockSize() {
        return 0;
    }

    @Override
    public String toString() {
        return file.toString();
    }

    private static final class NioPositionOutputStream extends PositionOutputStream {
        private final FileChannel ch;
        private long pos = 0L;

        NioPositionOutputStream(FileChannel ch) {
            this.ch = ch;
        }

        @Override
        public long getPos() {
            return pos;
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[]{(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            ByteBuffer bb = ByteBuffer.wrap(b, off, len);
            while (bb.hasRemaining()) {
                pos += ch.write(bb, pos);
            }
        }

        @Override
        public void close() throws IOException {
            ch.close();
        }
    }
}
