package com.mqparser.error;

import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;

public class InvalidPrimitiveTypeException extends ParseException {

    public InvalidPrimitiveTypeException(Token found, int tokenIndex, Position position) {
        super(describe(found) + " is not a primitive type", found, tokenIndex, position);
    }
}
