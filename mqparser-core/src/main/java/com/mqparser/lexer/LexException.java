package com.mqparser.lexer;

/**
 * Thrown when the source text cannot be split into tokens.
 */
public class LexException extends RuntimeException {

    private final Position position;

    public LexException(String message, Position position) {
        super(message + " at " + position);
        this.position = position;
    }

    public Position getPosition() {
        return position;
    }
}
