package com.phillippitts.sermonflow.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Processing cycle policy: how long to wait for the job's progress stream and how many jobs the
 * in-process queue runs at once.
 */
@Validated
@ConfigurationProperties(prefix = "sermon.processing")
public class ProcessingProperties {

    private final Duration timeout;

    @Min(1)
    @Max(16)
    private final int maxConcurrentJobs;

    @ConstructorBinding
    public ProcessingProperties(Duration timeout, Integer maxConcurrentJobs) {
        this.timeout = timeout == null ? Duration.ofMinutes(30) : timeout;
        if (this.timeout.isNegative() || this.timeout.isZero()) {
            throw new IllegalArgumentException("sermon.processing.timeout must be positive");
        }
        this.maxConcurrentJobs = maxConcurrentJobs == null ? 2 : maxConcurrentJobs;
    }

    public static ProcessingProperties defaults() {
        return new ProcessingProperties(null, null);
    }

    public Duration getTimeout() { return timeout; }
    public int getMaxConcurrentJobs() { return maxConcurrentJobs; }
}
