package com.phillippitts.sermonflow.exception;

public class UnsupportedAudioFormatException extends SermonFlowException {

    private final String typeIdentifier;

    public UnsupportedAudioFormatException(String typeIdentifier) {
        super(ErrorKind.UNSUPPORTED_AUDIO_FORMAT, "Unsupported audio format: " + typeIdentifier);
        this.typeIdentifier = typeIdentifier;
    }

    public String getTypeIdentifier() {
        return typeIdentifier;
    }
}
