package com.phillippitts.sermonflow.exception;

/**
 * Stop was requested before the minimum recording duration elapsed. Recording continues.
 */
public class RecordingTooShortException extends SermonFlowException {

    private final int actualSeconds;
    private final int minimumSeconds;

    public RecordingTooShortException(int actualSeconds, int minimumSeconds) {
        super(ErrorKind.RECORDING_TOO_SHORT, "Recording is too short (" + actualSeconds
                + "s). Please record at least " + minimumSeconds + " seconds.");
        this.actualSeconds = actualSeconds;
        this.minimumSeconds = minimumSeconds;
    }

    public int getActualSeconds() {
        return actualSeconds;
    }

    public int getMinimumSeconds() {
        return minimumSeconds;
    }
}
