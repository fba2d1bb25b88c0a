package com.phillippitts.sermonflow.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Remote-side view of a sermon's processing job.
 */
public record ProcessingJob(
        UUID sermonId,
        ProcessingStatus transcriptionStatus,
        ProcessingStatus studyGuideStatus,
        String transcriptionError,
        String studyGuideError) {

    public ProcessingJob {
        Objects.requireNonNull(sermonId, "sermonId");
        Objects.requireNonNull(transcriptionStatus, "transcriptionStatus");
        Objects.requireNonNull(studyGuideStatus, "studyGuideStatus");
    }

    public static ProcessingJob of(Sermon sermon) {
        return new ProcessingJob(sermon.id(), sermon.transcriptionStatus(), sermon.studyGuideStatus(),
                sermon.transcriptionError(), sermon.studyGuideError());
    }

    public boolean isComplete() {
        return transcriptionStatus == ProcessingStatus.SUCCEEDED && studyGuideStatus == ProcessingStatus.SUCCEEDED;
    }

    public boolean transcriptionFailed() {
        return transcriptionStatus == ProcessingStatus.FAILED;
    }

    public boolean studyGuideFailed() {
        return studyGuideStatus == ProcessingStatus.FAILED;
    }

    /**
     * Whether no further progress will be reported for this job. Used by every completion check,
     * streamed or polled.
     */
    public boolean isTerminal() {
        return isComplete() || transcriptionFailed() || studyGuideFailed();
    }

    public boolean isRunning() {
        return transcriptionStatus == ProcessingStatus.RUNNING || studyGuideStatus == ProcessingStatus.RUNNING;
    }

    public SermonStatus status() {
        return SermonStatus.from(transcriptionStatus, studyGuideStatus);
    }
}
