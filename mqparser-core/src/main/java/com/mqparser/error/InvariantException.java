package com.mqparser.error;

/**
 * An internal consistency check failed. This is a parser bug, never a syntax error in the input.
 */
public class InvariantException extends RuntimeException {

    public InvariantException(String message) {
        super(message);
    }

    public InvariantException(String message, Throwable cause) {
        super(message, cause);
    }
}
