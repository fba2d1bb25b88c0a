/**
 * Exception hierarchy for the sermon flow.
 *
 * <p>All exceptions extend {@link com.phillippitts.sermonflow.exception.SermonFlowException}, an unchecked
 * exception tagged with an {@link com.phillippitts.sermonflow.exception.ErrorKind}. The orchestrator turns
 * them into the {@code ERROR} phase; the REST layer maps them to HTTP responses.
 */
package com.phillippitts.sermonflow.exception;
