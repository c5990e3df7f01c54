package com.mqparser.error;

import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;
import com.mqparser.lexer.TokenKind;

import java.util.List;
import java.util.stream.Collectors;

public class ExpectedAnyTokenKindException extends ParseException {

    private final List<TokenKind> expected;

    public ExpectedAnyTokenKindException(List<TokenKind> expected, Token found, int tokenIndex, Position position) {
        super("Expected one of [" + expected.stream().map(TokenKind::display).collect(Collectors.joining(", "))
                + "] but found " + describe(found),
            found, tokenIndex, position);
        this.expected = List.copyOf(expected);
    }

    public List<TokenKind> getExpected() {
        return expected;
    }
}
