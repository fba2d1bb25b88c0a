package com.phillippitts.sermonflow.domain;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * One bounded segment of a sermon's audio: the unit of upload and of waveform summarization.
 *
 * @param localPath  file on this machine, or {@code null} once cleaned up
 * @param remotePath object key after upload, or {@code null} while pending
 * @param waveform   peak summary in [0,1], empty when the container cannot be summarized
 */
public record AudioChunk(
        UUID id,
        UUID sermonId,
        int chunkIndex,
        double startOffsetSeconds,
        double durationSeconds,
        Path localPath,
        String remotePath,
        List<Float> waveform,
        boolean uploadPending) {

    public AudioChunk {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sermonId, "sermonId");
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be >= 0");
        }
        if (startOffsetSeconds < 0 || durationSeconds < 0) {
            throw new IllegalArgumentException("offset and duration must be >= 0");
        }
        waveform = waveform == null ? List.of() : List.copyOf(waveform);
    }

    public static AudioChunk pending(UUID sermonId, int chunkIndex, double startOffsetSeconds,
                                     double durationSeconds, Path localPath) {
        return new AudioChunk(UUID.randomUUID(), sermonId, chunkIndex, startOffsetSeconds, durationSeconds,
                localPath, null, List.of(), true);
    }

    public double endOffsetSeconds() {
        return startOffsetSeconds + durationSeconds;
    }

    public AudioChunk withWaveform(List<Float> samples) {
        return new AudioChunk(id, sermonId, chunkIndex, startOffsetSeconds, durationSeconds, localPath,
                remotePath, samples, uploadPending);
    }

    public AudioChunk withRemotePath(String key) {
        return new AudioChunk(id, sermonId, chunkIndex, startOffsetSeconds, durationSeconds, localPath,
                key, waveform, false);
    }

    /** File extension of the local file without the dot, e.g. {@code wav}. */
    public String fileExtension() {
        if (localPath == null) {
            return "";
        }
        String name = localPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Checks that chunks are indexed {@code 0..n-1} in order and that each offset equals the sum of
     * all earlier durations.
     *
     * @throws IllegalArgumentException describing the first violation
     */
    public static void requireContiguous(List<AudioChunk> chunks) {
        double expectedOffset = 0;
        for (int i = 0; i < chunks.size(); i++) {
            AudioChunk c = chunks.get(i);
            if (c.chunkIndex() != i) {
                throw new IllegalArgumentException("Chunk at position " + i + " has index " + c.chunkIndex());
            }
            if (Math.abs(c.startOffsetSeconds() - expectedOffset) > 1e-6) {
                throw new IllegalArgumentException("Chunk " + i + " starts at " + c.startOffsetSeconds()
                        + "s, expected " + expectedOffset + "s");
            }
            expectedOffset += c.durationSeconds();
        }
    }

    /** Sum of durations in seconds. */
    public static double totalDuration(List<AudioChunk> chunks) {
        double total = 0;
        for (AudioChunk c : chunks) {
            total += c.durationSeconds();
        }
        return total;
    }
}
