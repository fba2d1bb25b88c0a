package com.phillippitts.sermonflow.service.audio;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the format and data location of a WAV file by walking its RIFF chunks.
 *
 * <p>Handles files with extra chunks (LIST, fact) and extended fmt chunks. Only the header region is
 * read; the PCM payload is never loaded.
 */
public final class WavHeaderReader {

    /**
     * Parsed header.
     *
     * @param dataOffset absolute file offset of the first PCM byte
     * @param dataSize   size of the data chunk, clamped to the bytes actually present
     */
    public record WavInfo(int audioFormat, int channels, int sampleRate, int byteRate,
                          int blockAlign, int bitsPerSample, long dataOffset, long dataSize) {

        public double durationSeconds() {
            return byteRate <= 0 ? 0.0 : (double) dataSize / byteRate;
        }

        public boolean isPcm16() {
            return audioFormat == WavFormat.AUDIO_FORMAT_PCM && bitsPerSample == 16;
        }
    }

    private WavHeaderReader() {}

    /**
     * @return header info, or empty when the file is not a RIFF/WAVE file or lacks fmt/data chunks
     * @throws IOException when the file cannot be read
     */
    public static Optional<WavInfo> read(Path path) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(path.toFile(), "r")) {
            long length = raf.length();
            if (length < WavFormat.RIFF_HEADER_SIZE) {
                return Optional.empty();
            }
            byte[] riff = new byte[WavFormat.RIFF_HEADER_SIZE];
            raf.readFully(riff);
            if (!"RIFF".equals(id(riff, 0)) || !"WAVE".equals(id(riff, 8))) {
                return Optional.empty();
            }

            byte[] fmt = null;
            long offset = WavFormat.RIFF_HEADER_SIZE;
            byte[] chunkHeader = new byte[WavFormat.CHUNK_HEADER_SIZE];
            while (offset + WavFormat.CHUNK_HEADER_SIZE <= length) {
                raf.seek(offset);
                raf.readFully(chunkHeader);
                String chunkId = id(chunkHeader, 0);
                long chunkSize = readLEInt(chunkHeader, 4) & 0xFFFFFFFFL;
                long body = offset + WavFormat.CHUNK_HEADER_SIZE;

                if ("fmt ".equals(chunkId)) {
                    if (chunkSize < WavFormat.FMT_CHUNK_MIN_SIZE) {
                        return Optional.empty();
                    }
                    fmt = new byte[WavFormat.FMT_CHUNK_MIN_SIZE];
                    raf.readFully(fmt);
                } else if ("data".equals(chunkId)) {
                    if (fmt == null) {
                        return Optional.empty();
                    }
                    long available = Math.min(chunkSize, length - body);
                    return Optional.of(new WavInfo(
                            readLEShort(fmt, 0), readLEShort(fmt, 2), readLEInt(fmt, 4), readLEInt(fmt, 8),
                            readLEShort(fmt, 12), readLEShort(fmt, 14), body, available));
                }
                // chunks are padded to even boundaries
                offset = body + chunkSize + (chunkSize % 2);
            }
            return Optional.empty();
        }
    }

    private static String id(byte[] a, int off) {
        return new String(a, off, 4, StandardCharsets.US_ASCII);
    }

    static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
                | ((a[off + 1] & 0xFF) << 8)
                | ((a[off + 2] & 0xFF) << 16)
                | ((a[off + 3] & 0xFF) << 24);
    }
}
