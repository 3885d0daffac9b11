package io.queryweaver.client;

/**
 * Lifecycle of one streaming session.
 *
 * <pre>
 * IDLE -> REQUESTING -> FAILED ------------------------> CLOSED
 *                    \-> STREAMING -> DRAINING -------> CLOSED
 * </pre>
 *
 * Cancellation moves any state to {@link #CLOSED}.
 */
public enum SessionState {
    /** Created; no request has been sent yet. */
    IDLE,
    /** Waiting for the response status and headers. */
    REQUESTING,
    /** Ended before streaming; a single error message is pending. */
    FAILED,
    /** Reading and decoding the response body. */
    STREAMING,
    /** Body ended; decoding the trailing frame. */
    DRAINING,
    /** Terminal. */
    CLOSED
}
