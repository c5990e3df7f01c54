package com.mqparser.error;

import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;

/**
 * A user-facing syntax error, positioned at the offending token.
 * The token is null when the parser ran past the end of the input.
 */
public abstract class ParseException extends RuntimeException {

    private final Token token;
    private final int tokenIndex;
    private final Position position;

    protected ParseException(String message, Token token, int tokenIndex, Position position) {
        super(message + " at " + position);
        this.token = token;
        this.tokenIndex = tokenIndex;
        this.position = position;
    }

    public Token getToken() {
        return token;
    }

    public int getTokenIndex() {
        return tokenIndex;
    }

    public Position getPosition() {
        return position;
    }

    static String describe(Token token) {
        return token == null ? "the end of input" : "'" + token.data() + "'";
    }
}
