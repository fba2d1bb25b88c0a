package com.phillippitts.sermonflow.config.properties;

import com.phillippitts.sermonflow.service.validation.AudioContainerType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Limits for importing external audio files.
 */
@Validated
@ConfigurationProperties(prefix = "sermon.import")
public class ImportProperties {

    /** Largest accepted file, in megabytes (1 MB = 1024 * 1024 bytes). */
    @Positive
    private final long maxSizeMb;

    @NotEmpty
    private final Set<AudioContainerType> allowedTypes;

    /** ffprobe executable used for durations of compressed containers. */
    @NotBlank
    private final String ffprobePath;

    @ConstructorBinding
    public ImportProperties(Long maxSizeMb, List<AudioContainerType> allowedTypes, String ffprobePath) {
        this.maxSizeMb = maxSizeMb == null ? 500L : maxSizeMb;
        this.allowedTypes = (allowedTypes == null || allowedTypes.isEmpty())
                ? EnumSet.allOf(AudioContainerType.class)
                : EnumSet.copyOf(allowedTypes);
        this.ffprobePath = (ffprobePath == null || ffprobePath.isBlank()) ? "ffprobe" : ffprobePath;
    }

    public static ImportProperties defaults() {
        return new ImportProperties(null, null, null);
    }

    public long getMaxSizeMb() { return maxSizeMb; }
    public long getMaxSizeBytes() { return maxSizeMb * 1024L * 1024L; }
    public Set<AudioContainerType> getAllowedTypes() { return allowedTypes; }
    public String getFfprobePath() { return ffprobePath; }
}
