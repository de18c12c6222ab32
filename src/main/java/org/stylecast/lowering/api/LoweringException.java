package org.stylecast.lowering.api;

/**
 * Thrown when a source file cannot be scanned at all, for example because a
 * template literal is never terminated. Problems inside a single styled component
 * never surface as this exception; they are reported as warnings instead.
 */
public class LoweringException extends Exception {

    /**
     * Constructs a new LoweringException with the specified detail message.
     * @param message The detail message.
     */
    public LoweringException(String message) {
        super(message);
    }

    /**
     * Constructs a new LoweringException with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause of the exception.
     */
    public LoweringException(String message, Throwable cause) {
        super(message, cause);
    }
}
