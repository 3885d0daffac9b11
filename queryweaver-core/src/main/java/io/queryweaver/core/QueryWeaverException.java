package io.queryweaver.core;

/**
 * Base class for QueryWeaver client exceptions.
 *
 * <p>Most failures of a streaming session are reported as {@link StreamMessage.Error} messages rather than
 * thrown. Exceptions are reserved for conditions a caller must be able to tell apart from ordinary data.
 */
public abstract class QueryWeaverException extends RuntimeException {

    protected QueryWeaverException(String message) {
        super(message);
    }

    protected QueryWeaverException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised by a message sequence whose transport broke. The sequence has already delivered an
     * error message describing the failure.
     */
    public static class StreamFailure extends QueryWeaverException {
        public StreamFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a frame decodes as JSON but does not describe a message.
     */
    public static class MalformedMessage extends QueryWeaverException {
        public MalformedMessage(String message) {
            super(message);
        }
    }

    /**
     * Raised when a client is built from missing or unparsable settings.
     */
    public static class InvalidConfiguration extends QueryWeaverException {
        public InvalidConfiguration(String message) {
            super(message);
        }

        public InvalidConfiguration(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
