package com.mqparser.error;

import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;

public class UnusedTokensRemainException extends ParseException {

    public UnusedTokensRemainException(Token firstUnused, int tokenIndex, Position position) {
        super("Unused tokens remain, starting with " + describe(firstUnused), firstUnused, tokenIndex, position);
    }
}
