package com.phillippitts.sermonflow.domain;

/**
 * Lifecycle of a single remote processing stage (transcription or study guide).
 */
public enum ProcessingStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    /** True while the stage still has to run, either for the first time or after a failure. */
    public boolean needsWork() {
        return this == PENDING || this == FAILED;
    }
}
