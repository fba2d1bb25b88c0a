package com.phillippitts.sermonflow.service.queue;

import com.phillippitts.sermonflow.domain.ProcessingJob;

import java.util.Optional;
import java.util.UUID;

/**
 * Schedules transcription and study guide generation for uploaded sermons.
 */
public interface ProcessingJobQueue {

    /**
     * Schedules processing for a persisted sermon whose chunks are uploaded. Enqueueing a sermon that is
     * already queued, running or complete does not start a second job.
     */
    void enqueue(UUID sermonId);

    /** Current job state, or empty for an unknown sermon. */
    Optional<ProcessingJob> status(UUID sermonId);

    /**
     * Opens an ordered, non-decreasing stream of progress updates. The stream ends after a terminal job
     * update or when the subscription is closed by the consumer.
     */
    ProgressSubscription progressStream(UUID sermonId);
}
