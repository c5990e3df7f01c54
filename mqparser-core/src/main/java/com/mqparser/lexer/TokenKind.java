package com.mqparser.lexer;

import java.util.HashMap;
import java.util.Map;

public enum TokenKind {
    // Punctuators
    AMPERSAND("&"),
    ASTERISK("*"),
    AT_SIGN("@"),
    COMMA(","),
    DIVISION("/"),
    DOT_DOT(".."),
    ELLIPSIS("..."),
    EQUAL("="),
    FAT_ARROW("=>"),
    GREATER_THAN(">"),
    GREATER_THAN_EQUAL_TO(">="),
    LEFT_BRACE("{"),
    LEFT_BRACKET("["),
    LEFT_PARENTHESIS("("),
    LESS_THAN("<"),
    LESS_THAN_EQUAL_TO("<="),
    MINUS("-"),
    NOT_EQUAL("<>"),
    NULL_COALESCING_OPERATOR("??"),
    PLUS("+"),
    QUESTION_MARK("?"),
    RIGHT_BRACE("}"),
    RIGHT_BRACKET("]"),
    RIGHT_PARENTHESIS(")"),
    SEMICOLON(";"),

    // Literals
    HEX_LITERAL("hex literal"),
    IDENTIFIER("identifier"),
    NULL_LITERAL("null"),
    NUMERIC_LITERAL("numeric literal"),
    TEXT_LITERAL("text literal"),

    // Keywords
    KEYWORD_AND("and"),
    KEYWORD_AS("as"),
    KEYWORD_EACH("each"),
    KEYWORD_ELSE("else"),
    KEYWORD_ERROR("error"),
    KEYWORD_FALSE("false"),
    KEYWORD_IF("if"),
    KEYWORD_IN("in"),
    KEYWORD_IS("is"),
    KEYWORD_LET("let"),
    KEYWORD_META("meta"),
    KEYWORD_NOT("not"),
    KEYWORD_OR("or"),
    KEYWORD_OTHERWISE("otherwise"),
    KEYWORD_SECTION("section"),
    KEYWORD_SHARED("shared"),
    KEYWORD_THEN("then"),
    KEYWORD_TRUE("true"),
    KEYWORD_TRY("try"),
    KEYWORD_TYPE("type"),

    // Hash keywords
    KEYWORD_HASH_BINARY("#binary"),
    KEYWORD_HASH_DATE("#date"),
    KEYWORD_HASH_DATE_TIME("#datetime"),
    KEYWORD_HASH_DATE_TIME_ZONE("#datetimezone"),
    KEYWORD_HASH_DURATION("#duration"),
    KEYWORD_HASH_INFINITY("#infinity"),
    KEYWORD_HASH_NAN("#nan"),
    KEYWORD_HASH_SECTIONS("#sections"),
    KEYWORD_HASH_SHARED("#shared"),
    KEYWORD_HASH_TABLE("#table"),
    KEYWORD_HASH_TIME("#time");

    private static final Map<String, TokenKind> KEYWORDS = new HashMap<>();

    static {
        for (TokenKind kind : values()) {
            if (kind.name().startsWith("KEYWORD_") || kind == NULL_LITERAL) {
                KEYWORDS.put(kind.display, kind);
            }
        }
    }

    private final String display;

    TokenKind(String display) {
        this.display = display;
    }

    /**
     * Source text for punctuators and keywords, a short description for the literal kinds.
     */
    public String display() {
        return display;
    }

    public boolean isKeyword() {
        return name().startsWith("KEYWORD_");
    }

    /**
     * Looks up a plain or hash keyword (including {@code null}) by its exact source text.
     */
    public static TokenKind keyword(String text) {
        return KEYWORDS.get(text);
    }
}
