package org.kasd.api;

/**
 * Thrown when the embedding API is used incorrectly, e.g. with an invalid log level.
 * <p>
 * It is part of the public API and hides the internal exception types of the interpreter.
 * Errors in the executed source text are not exceptions; they are reported through
 * {@link KasdContext#lastError()}.
 */
public class KasdException extends RuntimeException {

    /**
     * Constructs a new exception with the specified detail message.
     * @param message The detail message.
     */
    public KasdException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public KasdException(String message, Throwable cause) {
        super(message, cause);
    }
}
