package com.phillippitts.sermonflow.exception;

/** The microphone could not be opened because access was not granted. */
public class MicrophonePermissionDeniedException extends SermonFlowException {

    public MicrophonePermissionDeniedException() {
        super(ErrorKind.MICROPHONE_PERMISSION_DENIED, "Microphone access is required to record sermons");
    }
}
