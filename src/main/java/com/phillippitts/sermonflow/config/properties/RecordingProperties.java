package com.phillippitts.sermonflow.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for live sermon recording.
 *
 * <p>Recordings are written as 16 kHz, 16-bit PCM mono WAV chunks of {@code chunkDurationSeconds}.
 */
@Validated
@ConfigurationProperties(prefix = "sermon.recording")
public class RecordingProperties {

    /** Length of one chunk file in seconds. */
    @Min(5)
    @Max(3600)
    private final int chunkDurationSeconds;

    /** Stop is refused until this much audio has been captured. */
    @Min(0)
    @Max(600)
    private final int minimumDurationSeconds;

    /** Number of recent level samples kept for the meter display. */
    @Min(1)
    @Max(10_000)
    private final int levelHistorySize;

    /** Milliseconds of audio per read from the capture line. */
    @Min(10)
    @Max(500)
    private final int readMillis;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public RecordingProperties(Integer chunkDurationSeconds,
                               Integer minimumDurationSeconds,
                               Integer levelHistorySize,
                               Integer readMillis,
                               String deviceName) {
        this.chunkDurationSeconds = chunkDurationSeconds == null ? 600 : chunkDurationSeconds;
        this.minimumDurationSeconds = minimumDurationSeconds == null ? 30 : minimumDurationSeconds;
        this.levelHistorySize = levelHistorySize == null ? 100 : levelHistorySize;
        this.readMillis = readMillis == null ? 50 : readMillis;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public static RecordingProperties defaults() {
        return new RecordingProperties(null, null, null, null, null);
    }

    public int getChunkDurationSeconds() { return chunkDurationSeconds; }
    public int getMinimumDurationSeconds() { return minimumDurationSeconds; }
    public int getLevelHistorySize() { return levelHistorySize; }
    public int getReadMillis() { return readMillis; }
    public String getDeviceName() { return deviceName; }
}
