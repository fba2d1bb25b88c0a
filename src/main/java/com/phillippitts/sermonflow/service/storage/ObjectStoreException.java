package com.phillippitts.sermonflow.service.storage;

/**
 * Object storage failure. Unchecked; callers translate it into a sermon flow error.
 */
public class ObjectStoreException extends RuntimeException {

    public ObjectStoreException(String message) {
        super(message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
