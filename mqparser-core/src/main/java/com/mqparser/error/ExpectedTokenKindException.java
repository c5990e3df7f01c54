package com.mqparser.error;

import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;
import com.mqparser.lexer.TokenKind;

public class ExpectedTokenKindException extends ParseException {

    private final TokenKind expected;

    public ExpectedTokenKindException(TokenKind expected, Token found, int tokenIndex, Position position) {
        super("Expected " + expected.display() + " but found " + describe(found), found, tokenIndex, position);
        this.expected = expected;
    }

    public TokenKind getExpected() {
        return expected;
    }
}
