package com.phillippitts.sermonflow.service.audio.capture;

import com.phillippitts.sermonflow.service.audio.WavWriter;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Streams PCM into a WAV chunk file. The header is written with size 0 and patched on close.
 */
final class ChunkFileWriter implements Closeable {

    private final Path path;
    private final int index;
    private final FileChannel channel;
    private long dataBytes;
    private boolean closed;

    private ChunkFileWriter(Path path, int index, FileChannel channel) {
        this.path = path;
        this.index = index;
        this.channel = channel;
    }

    static ChunkFileWriter open(Path path, int index) throws IOException {
        FileChannel ch = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        try {
            writeFully(ch, ByteBuffer.wrap(WavWriter.header(0)));
        } catch (IOException e) {
            ch.close();
            throw e;
        }
        return new ChunkFileWriter(path, index, ch);
    }

    void write(byte[] src, int off, int len) throws IOException {
        writeFully(channel, ByteBuffer.wrap(src, off, len));
        dataBytes += len;
    }

    long dataBytes() {
        return dataBytes;
    }

    Path path() {
        return path;
    }

    int index() {
        return index;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            channel.position(0);
            writeFully(channel, ByteBuffer.wrap(WavWriter.header((int) dataBytes)));
            channel.force(false);
        } finally {
            channel.close();
        }
    }

    private static void writeFully(FileChannel ch, ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) {
            ch.write(buf);
        }
    }

    static String fileName(int index) {
        return String.format("chunk_%03d.wav", index);
    }
}
