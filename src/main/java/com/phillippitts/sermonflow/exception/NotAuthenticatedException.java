package com.phillippitts.sermonflow.exception;

/** No signed-in user is available. */
public class NotAuthenticatedException extends SermonFlowException {

    public NotAuthenticatedException() {
        super(ErrorKind.NOT_AUTHENTICATED, "Please sign in to record or import sermons");
    }
}
