package com.phillippitts.sermonflow.exception;

/**
 * Transcription failed, or the cycle failed locally before the remote job could run.
 *
 * <p>A failure reported by the job itself is final for that sermon. Local failures (upload, persist,
 * enqueue) are created with {@link #retryable(String, Throwable)}.
 */
public class TranscriptionFailedException extends SermonFlowException {

    private final String reason;

    public TranscriptionFailedException(String reason) {
        super(ErrorKind.TRANSCRIPTION_FAILED, "Transcription failed: " + reason);
        this.reason = reason;
    }

    private TranscriptionFailedException(String reason, boolean retryable, Throwable cause) {
        super(ErrorKind.TRANSCRIPTION_FAILED, "Transcription failed: " + reason, retryable, cause);
        this.reason = reason;
    }

    public static TranscriptionFailedException retryable(String reason, Throwable cause) {
        return new TranscriptionFailedException(reason, true, cause);
    }

    public String getReason() {
        return reason;
    }
}
