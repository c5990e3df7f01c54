package com.mqparser.ast;

/**
 * Every fixed piece of syntax that is kept in the tree as a {@link Constant} leaf.
 */
public enum ConstantKind {
    // Arithmetic operators
    MULTIPLICATION("*"),
    DIVISION("/"),
    ADDITION("+"),
    SUBTRACTION("-"),
    CONCATENATION("&"),

    // Equality operators
    EQUAL_TO("="),
    NOT_EQUAL_TO("<>"),

    // Logical operators
    AND("and"),
    OR("or"),

    // Relational operators
    LESS_THAN("<"),
    LESS_THAN_EQUAL_TO("<="),
    GREATER_THAN(">"),
    GREATER_THAN_EQUAL_TO(">="),

    // Unary operators
    POSITIVE("+"),
    NEGATIVE("-"),
    NOT("not"),

    // Keywords
    AS("as"),
    CATCH("catch"),
    EACH("each"),
    ELSE("else"),
    ERROR("error"),
    IF("if"),
    IN("in"),
    IS("is"),
    LET("let"),
    META("meta"),
    OTHERWISE("otherwise"),
    SECTION("section"),
    SHARED("shared"),
    THEN("then"),
    TRY("try"),
    TYPE("type"),

    // Contextual identifiers
    FUNCTION("function"),
    NULLABLE("nullable"),
    OPTIONAL("optional"),
    TABLE("table"),

    // Misc
    AT_SIGN("@"),
    COMMA(","),
    DOT_DOT(".."),
    ELLIPSIS("..."),
    EQUAL("="),
    FAT_ARROW("=>"),
    NULL_COALESCING("??"),
    QUESTION_MARK("?"),
    SEMICOLON(";"),

    // Wrappers
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    LEFT_PARENTHESIS("("),
    RIGHT_PARENTHESIS(")");

    private final String text;

    ConstantKind(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
