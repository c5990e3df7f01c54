package com.mqparser.lexer;

/**
 * A single lexed token. {@code positionEnd} is exclusive.
 */
public record Token(TokenKind kind, String data, Position positionStart, Position positionEnd) {

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + "('" + data + "')@" + positionStart;
    }
}
