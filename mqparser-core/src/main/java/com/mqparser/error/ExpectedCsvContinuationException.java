package com.mqparser.error;

import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;

/**
 * A comma was not followed by another value.
 */
public class ExpectedCsvContinuationException extends ParseException {

    public enum Kind {
        DANGLING_COMMA,
        LET_EXPRESSION
    }

    private final Kind kind;

    public ExpectedCsvContinuationException(Kind kind, Token found, int tokenIndex, Position position) {
        super(kind == Kind.DANGLING_COMMA
                ? "Expected a value after the comma but found " + describe(found)
                : "Expected another variable after the comma in a let expression but found " + describe(found),
            found, tokenIndex, position);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
