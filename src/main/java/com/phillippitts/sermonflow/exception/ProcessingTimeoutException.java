package com.phillippitts.sermonflow.exception;

/** The progress stream did not reach a terminal state in time. */
public class ProcessingTimeoutException extends SermonFlowException {

    public ProcessingTimeoutException() {
        super(ErrorKind.PROCESSING_TIMEOUT, "Processing took too long. Please try again.");
    }
}
