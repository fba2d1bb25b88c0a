package com.phillippitts.sermonflow.service.audio;

import javax.sound.sampled.AudioFormat;

/**
 * Format of live recordings: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class CaptureFormat {

    public static final int SAMPLE_RATE = 16_000;
    public static final int BITS_PER_SAMPLE = 16;
    public static final int CHANNELS = 1;
    public static final boolean SIGNED = true;
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per PCM frame. */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS;
    /** Bytes per second of audio, 32,000. */
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;

    private CaptureFormat() {}

    public static AudioFormat toJavaSound() {
        return new AudioFormat(SAMPLE_RATE, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
    }

    /** PCM payload size of {@code seconds} of audio, frame aligned. */
    public static long bytesFor(int seconds) {
        return (long) seconds * BYTE_RATE;
    }

    public static double secondsFor(long bytes) {
        return (double) bytes / BYTE_RATE;
    }
}
