package com.mqparser.error;

import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;

public class ExpectedGeneralizedIdentifierException extends ParseException {

    public ExpectedGeneralizedIdentifierException(Token found, int tokenIndex, Position position) {
        super("Expected a field name but found " + describe(found), found, tokenIndex, position);
    }
}
