package com.phillippitts.sermonflow.service.audio;

/**
 * Structural constants of the RIFF/WAVE container.
 *
 * <pre>
 * RIFF header   12 bytes  "RIFF" size "WAVE"
 * fmt chunk      8 + 16+  format fields
 * data chunk     8 + n    PCM samples
 * </pre>
 */
public final class WavFormat {

    public static final int RIFF_HEADER_SIZE = 12;
    public static final int CHUNK_HEADER_SIZE = 8;
    public static final int FMT_CHUNK_MIN_SIZE = 16;
    public static final int AUDIO_FORMAT_PCM = 1;
    /** Size of the canonical header written for recordings. */
    public static final int CANONICAL_HEADER_SIZE = 44;

    private WavFormat() {}
}
