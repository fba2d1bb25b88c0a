package com.phillippitts.sermonflow.domain;

/**
 * Display status of a sermon, derived from its two stage statuses and never stored.
 *
 * <p>Derivation rules, first match wins:
 * <ol>
 *   <li>transcription failed: {@link #ERROR}</li>
 *   <li>either stage running: {@link #PROCESSING}</li>
 *   <li>both stages pending: {@link #PENDING}</li>
 *   <li>transcription succeeded, study guide failed: {@link #DEGRADED}</li>
 *   <li>both succeeded: {@link #READY}</li>
 *   <li>transcription succeeded, study guide pending or running: {@link #PROCESSING}</li>
 *   <li>anything else: {@link #PENDING}</li>
 * </ol>
 */
public enum SermonStatus {
    PENDING("Pending"),
    PROCESSING("Processing"),
    READY("Ready"),
    DEGRADED("Partially ready"),
    ERROR("Error");

    private final String displayName;

    SermonStatus(String displayName) {
        this.displayName = displayName;
    }

    public static SermonStatus from(ProcessingStatus transcription, ProcessingStatus studyGuide) {
        if (transcription == ProcessingStatus.FAILED) {
            return ERROR;
        }
        if (transcription == ProcessingStatus.RUNNING || studyGuide == ProcessingStatus.RUNNING) {
            return PROCESSING;
        }
        if (transcription == ProcessingStatus.PENDING && studyGuide == ProcessingStatus.PENDING) {
            return PENDING;
        }
        if (transcription == ProcessingStatus.SUCCEEDED) {
            return switch (studyGuide) {
                case FAILED -> DEGRADED;
                case SUCCEEDED -> READY;
                case PENDING, RUNNING -> PROCESSING;
            };
        }
        return PENDING;
    }

    /** Whether the transcript can be shown. */
    public boolean isViewable() {
        return this == READY || this == DEGRADED;
    }

    public boolean canRetryStudyGuide() {
        return this == DEGRADED;
    }

    public String getDisplayName() {
        return displayName;
    }
}
