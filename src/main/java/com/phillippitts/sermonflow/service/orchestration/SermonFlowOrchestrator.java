package com.phillippitts.sermonflow.service.orchestration;

import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.domain.FlowPhase;
import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.SermonStatus;
import com.phillippitts.sermonflow.domain.StudyGuide;
import com.phillippitts.sermonflow.domain.Transcript;
import com.phillippitts.sermonflow.exception.SermonFlowException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one sermon through capture or import, upload, remote processing and viewing.
 *
 * <p>The orchestrator owns the current {@link Sermon}, its chunk list and the current {@link FlowPhase}.
 * Mutating entry points are serialized against each other; long-running work (metering, the duration
 * timer, the processing sequence) runs on background executors and reports back through phase
 * transitions.
 *
 * <p><b>Phase flow:</b>
 * <pre>
 * INPUT → RECORDING | IMPORTING → PROCESSING(step*) → VIEWING | ERROR
 * ERROR → INPUT (dismissError) | PROCESSING (retry)
 * </pre>
 *
 * <p><b>Failure reporting:</b> intents return the resulting phase and capture failures into
 * {@link FlowPhase.Kind#ERROR}. Two cases throw instead: {@link #stopRecording()} before the minimum
 * duration throws {@link com.phillippitts.sermonflow.exception.RecordingTooShortException} and leaves the
 * recording running, and an intent that is not valid in the current phase throws
 * {@link IllegalStateException}.
 *
 * @see DefaultSermonFlowOrchestrator
 */
public interface SermonFlowOrchestrator {

    FlowPhase currentPhase();

    /**
     * The error of the current phase, or the non-blocking study guide failure of a degraded sermon
     * being viewed.
     */
    Optional<SermonFlowException> currentError();

    Optional<Sermon> currentSermon();

    /** Chunks of the current cycle in index order. */
    List<AudioChunk> currentChunks();

    Optional<Transcript> currentTranscript();

    Optional<StudyGuide> currentStudyGuide();

    /** Derived status of the current sermon, empty when no sermon is active. */
    Optional<SermonStatus> currentStatus();

    /** Elapsed time, pause state and levels of the active recording; idle values otherwise. */
    RecordingSnapshot recordingSnapshot();

    /** Highest overall progress reached in the current processing cycle (0..1). */
    double processingProgress();

    /** Rough processing time for the current sermon's audio, empty before any audio exists. */
    Optional<Duration> estimatedProcessingTime();

    /**
     * Starts a live recording.
     *
     * <p>Requires an authenticated user and microphone permission; either failing moves to the error phase.
     *
     * @param title sermon title, defaulted when blank
     * @param speakerName optional speaker
     * @return resulting phase
     * @throws IllegalStateException unless the phase is {@code INPUT}
     */
    FlowPhase startRecording(String title, String speakerName);

    /** No-op unless recording and not paused. */
    FlowPhase pauseRecording();

    /** No-op unless recording and paused. */
    FlowPhase resumeRecording();

    /**
     * Finalizes the recording and starts processing.
     *
     * @return {@code PROCESSING(Uploading(0))} on success
     * @throws com.phillippitts.sermonflow.exception.RecordingTooShortException before the minimum duration;
     *         the phase stays {@code RECORDING}
     * @throws IllegalStateException unless recording
     */
    FlowPhase stopRecording();

    /**
     * Discards the recording and every chunk written so far. No sermon record remains.
     *
     * @throws IllegalStateException unless recording
     */
    FlowPhase cancelRecording();

    /**
     * Validates, copies and processes an audio file.
     *
     * @param source file to import
     * @param title sermon title, defaults to the file name without extension
     * @param speakerName optional speaker
     * @return resulting phase
     * @throws IllegalStateException unless the phase is {@code INPUT}
     */
    FlowPhase importAudio(Path source, String title, String speakerName);

    /**
     * Replays the processing sequence from the upload step with the existing local chunks.
     *
     * @throws IllegalStateException unless in a retryable error phase with chunks to replay
     */
    FlowPhase retry();

    /**
     * Leaves the error phase. The failed sermon stays persisted.
     *
     * @throws IllegalStateException unless in the error phase
     */
    FlowPhase dismissError();

    /** Cancels all running work and returns to {@code INPUT} with no current sermon. */
    FlowPhase reset();

    /**
     * Opens a persisted sermon: viewing if processed, re-subscribing to progress if still running,
     * error if a stage failed.
     *
     * @throws java.util.NoSuchElementException if the sermon is unknown
     */
    FlowPhase loadExistingSermon(UUID sermonId);

    /**
     * Releases the progress subscription and timeout of a processing cycle. Uploaded chunks and the remote
     * job are kept; {@link #resumeFromBackground()} picks the sermon up again.
     */
    FlowPhase enterBackground();

    /** Reloads the current sermon after {@link #enterBackground()}. */
    FlowPhase resumeFromBackground();
}
