package com.phillippitts.sermonflow.domain;

import java.util.Objects;

/**
 * One entry of a job's progress stream: the job snapshot plus the composite fraction in [0,1].
 */
public record ProgressUpdate(ProcessingJob job, double progress) {

    public ProgressUpdate {
        Objects.requireNonNull(job, "job");
        if (Double.isNaN(progress)) {
            throw new IllegalArgumentException("progress must be a number");
        }
        progress = Math.max(0.0, Math.min(1.0, progress));
    }
}
