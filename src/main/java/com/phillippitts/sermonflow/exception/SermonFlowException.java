package com.phillippitts.sermonflow.exception;

/**
 * Base exception for every sermon flow failure.
 *
 * <p>Each subclass maps to one {@link ErrorKind}. Retryability defaults to the kind's value but can be
 * set per instance, so a local upload failure can be offered for retry while a failed remote
 * transcription is not.
 */
public class SermonFlowException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean retryable;

    protected SermonFlowException(ErrorKind kind, String message) {
        this(kind, message, kind.isRetryableByDefault(), null);
    }

    protected SermonFlowException(ErrorKind kind, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Whether the flow offers {@code retry()} after this failure. */
    public boolean isRetryable() {
        return retryable;
    }
}
