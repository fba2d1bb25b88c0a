package com.phillippitts.sermonflow.service.audio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static com.phillippitts.sermonflow.service.audio.CaptureFormat.BITS_PER_SAMPLE;
import static com.phillippitts.sermonflow.service.audio.CaptureFormat.BLOCK_ALIGN;
import static com.phillippitts.sermonflow.service.audio.CaptureFormat.BYTE_RATE;
import static com.phillippitts.sermonflow.service.audio.CaptureFormat.CHANNELS;
import static com.phillippitts.sermonflow.service.audio.CaptureFormat.SAMPLE_RATE;

/**
 * Builds the canonical 44-byte WAV header for {@link CaptureFormat} audio.
 *
 * <p>Chunk files are written with a placeholder header first and patched with the real data size once
 * the chunk is closed, so a chunk can be streamed to disk without buffering it in memory.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * @param dataSize size of the PCM payload in bytes
     * @return header bytes, little-endian
     */
    public static byte[] header(int dataSize) {
        if (dataSize < 0) {
            throw new IllegalArgumentException("dataSize must be >= 0");
        }
        ByteBuffer buf = ByteBuffer.allocate(WavFormat.CANONICAL_HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(new byte[] {'R', 'I', 'F', 'F'});
        buf.putInt(36 + dataSize);
        buf.put(new byte[] {'W', 'A', 'V', 'E'});
        buf.put(new byte[] {'f', 'm', 't', ' '});
        buf.putInt(WavFormat.FMT_CHUNK_MIN_SIZE);
        buf.putShort((short) WavFormat.AUDIO_FORMAT_PCM);
        buf.putShort((short) CHANNELS);
        buf.putInt(SAMPLE_RATE);
        buf.putInt(BYTE_RATE);
        buf.putShort((short) BLOCK_ALIGN);
        buf.putShort((short) BITS_PER_SAMPLE);
        buf.put(new byte[] {'d', 'a', 't', 'a'});
        buf.putInt(dataSize);
        return buf.array();
    }
}
