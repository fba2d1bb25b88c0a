package com.phillippitts.sermonflow.exception;

/**
 * An import passed validation but could not be read or copied.
 */
public class ImportFailedException extends SermonFlowException {

    private final String reason;

    public ImportFailedException(String reason) {
        super(ErrorKind.IMPORT_FAILED, "Import failed: " + reason);
        this.reason = reason;
    }

    public ImportFailedException(String reason, Throwable cause) {
        super(ErrorKind.IMPORT_FAILED, "Import failed: " + reason, ErrorKind.IMPORT_FAILED.isRetryableByDefault(), cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
