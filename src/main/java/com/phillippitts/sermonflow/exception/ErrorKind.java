package com.phillippitts.sermonflow.exception;

/**
 * Failure categories that can end a recording, import or processing cycle.
 */
public enum ErrorKind {
    NOT_AUTHENTICATED(false),
    MICROPHONE_PERMISSION_DENIED(false),
    RECORDING_FAILED(false),
    RECORDING_TOO_SHORT(false),
    FILE_TOO_LARGE(false),
    UNSUPPORTED_AUDIO_FORMAT(false),
    IMPORT_FAILED(false),
    CHUNK_NOT_FOUND(false),
    TRANSCRIPTION_FAILED(false),
    STUDY_GUIDE_GENERATION_FAILED(true),
    PROCESSING_TIMEOUT(true);

    private final boolean retryableByDefault;

    ErrorKind(boolean retryableByDefault) {
        this.retryableByDefault = retryableByDefault;
    }

    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }
}
