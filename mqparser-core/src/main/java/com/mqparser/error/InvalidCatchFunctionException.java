package com.mqparser.error;

import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;

/**
 * A catch handler may take at most one parameter, without a type, and may not declare a return type.
 */
public class InvalidCatchFunctionException extends ParseException {

    public InvalidCatchFunctionException(Token functionStart, int tokenIndex, Position position) {
        super("Catch handler must take at most one untyped parameter and no return type",
            functionStart, tokenIndex, position);
    }
}
