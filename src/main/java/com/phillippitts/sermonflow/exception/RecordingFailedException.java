package com.phillippitts.sermonflow.exception;

/**
 * The capture device or session failed while starting or during recording.
 */
public class RecordingFailedException extends SermonFlowException {

    private final String reason;

    public RecordingFailedException(String reason) {
        super(ErrorKind.RECORDING_FAILED, "Recording failed: " + reason);
        this.reason = reason;
    }

    public RecordingFailedException(String reason, Throwable cause) {
        super(ErrorKind.RECORDING_FAILED, "Recording failed: " + reason, ErrorKind.RECORDING_FAILED.isRetryableByDefault(), cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
