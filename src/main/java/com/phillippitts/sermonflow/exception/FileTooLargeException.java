package com.phillippitts.sermonflow.exception;

public class FileTooLargeException extends SermonFlowException {

    private final long maxMegabytes;

    public FileTooLargeException(long maxMegabytes) {
        super(ErrorKind.FILE_TOO_LARGE, "File is too large. Maximum size is " + maxMegabytes + " MB.");
        this.maxMegabytes = maxMegabytes;
    }

    public long getMaxMegabytes() {
        return maxMegabytes;
    }
}
