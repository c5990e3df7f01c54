package com.mqparser.engine;

public enum ParenthesisDisambiguation {
    FUNCTION_EXPRESSION,
    PARENTHESIZED_EXPRESSION
}
