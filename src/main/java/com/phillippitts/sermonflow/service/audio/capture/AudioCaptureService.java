package com.phillippitts.sermonflow.service.audio.capture;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Microphone capture that writes a sermon's audio as a sequence of chunk files.
 *
 * Contract:
 * - One active session at a time
 * - Chunks are written to the sermon's local directory, indexed from 0
 * - Pause and resume are no-ops for unknown or finished sessions
 */
public interface AudioCaptureService {

    /**
     * Opens the microphone and starts writing chunks of {@code chunkDurationSeconds}.
     *
     * @param onChunkCompleted called from the capture thread each time a full chunk is closed
     * @return session id
     * @throws com.phillippitts.sermonflow.exception.MicrophonePermissionDeniedException if access is denied
     * @throws com.phillippitts.sermonflow.exception.RecordingFailedException on device or file errors
     * @throws IllegalStateException if another session is active
     */
    UUID startSession(UUID sermonId, int chunkDurationSeconds, Consumer<ChunkCompletedEvent> onChunkCompleted);

    void pauseSession(UUID sessionId);

    void resumeSession(UUID sessionId);

    boolean isPaused(UUID sessionId);

    /** Seconds of audio captured so far, excluding paused time. */
    double capturedSeconds(UUID sessionId);

    /**
     * Finalizes the in-progress chunk and returns every chunk file in index order.
     *
     * @throws com.phillippitts.sermonflow.exception.RecordingTooShortException before the minimum duration;
     *         capture keeps running
     * @throws com.phillippitts.sermonflow.exception.RecordingFailedException if capture failed mid-session
     */
    List<Path> stopSession(UUID sessionId);

    /** Stops capture and deletes every chunk written for the session. */
    void cancelSession(UUID sessionId);

    /** Live input levels of the active session. */
    AudioLevelMeter levelMeter();
}
