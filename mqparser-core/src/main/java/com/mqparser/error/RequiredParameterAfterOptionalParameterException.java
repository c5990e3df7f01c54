package com.mqparser.error;

import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;

public class RequiredParameterAfterOptionalParameterException extends ParseException {

    public RequiredParameterAfterOptionalParameterException(Token found, int tokenIndex, Position position) {
        super("Required parameter " + describe(found) + " follows an optional parameter", found, tokenIndex, position);
    }
}
