package com.mqparser.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits M source text into tokens. Whitespace and comments are dropped.
 */
public class Lexer {
    private static final char LINE_SEPARATOR = (char) 0x2028;
    private static final char PARAGRAPH_SEPARATOR = (char) 0x2029;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int position = 0;
    private int line = 0;
    private int lineStart = 0;

    // Token start, captured before each scan
    private int startPosition;
    private int startLine;
    private int startLineStart;

    public Lexer(String source) {
        this.source = source;
    }

    public static LexerSnapshot lex(String source) {
        return new Lexer(source).tokenize();
    }

    public LexerSnapshot tokenize() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            markStart();
            scanToken();
        }
        return new LexerSnapshot(source, tokens);
    }

    // ========================================================================
    // Scanning
    // ========================================================================

    private void scanToken() {
        char c = peek();

        if (isIdentifierStart(c)) {
            scanIdentifierOrKeyword();
            return;
        }
        if (isDigit(c) || (c == '.' && isDigit(peekAt(1)))) {
            scanNumber();
            return;
        }

        switch (c) {
            case '"' -> scanText();
            case '#' -> scanHash();
            case '&' -> single(TokenKind.AMPERSAND);
            case '*' -> single(TokenKind.ASTERISK);
            case '@' -> single(TokenKind.AT_SIGN);
            case ',' -> single(TokenKind.COMMA);
            case '/' -> single(TokenKind.DIVISION);
            case '{' -> single(TokenKind.LEFT_BRACE);
            case '}' -> single(TokenKind.RIGHT_BRACE);
            case '[' -> single(TokenKind.LEFT_BRACKET);
            case ']' -> single(TokenKind.RIGHT_BRACKET);
            case '(' -> single(TokenKind.LEFT_PARENTHESIS);
            case ')' -> single(TokenKind.RIGHT_PARENTHESIS);
            case ';' -> single(TokenKind.SEMICOLON);
            case '+' -> single(TokenKind.PLUS);
            case '-' -> single(TokenKind.MINUS);
            case '.' -> {
                if (peekAt(1) == '.' && peekAt(2) == '.') {
                    multi(TokenKind.ELLIPSIS, 3);
                } else if (peekAt(1) == '.') {
                    multi(TokenKind.DOT_DOT, 2);
                } else {
                    throw new LexException("Unexpected character '.'", currentPosition());
                }
            }
            case '=' -> {
                if (peekAt(1) == '>') {
                    multi(TokenKind.FAT_ARROW, 2);
                } else {
                    single(TokenKind.EQUAL);
                }
            }
            case '>' -> {
                if (peekAt(1) == '=') {
                    multi(TokenKind.GREATER_THAN_EQUAL_TO, 2);
                } else {
                    single(TokenKind.GREATER_THAN);
                }
            }
            case '<' -> {
                if (peekAt(1) == '=') {
                    multi(TokenKind.LESS_THAN_EQUAL_TO, 2);
                } else if (peekAt(1) == '>') {
                    multi(TokenKind.NOT_EQUAL, 2);
                } else {
                    single(TokenKind.LESS_THAN);
                }
            }
            case '?' -> {
                if (peekAt(1) == '?') {
                    multi(TokenKind.NULL_COALESCING_OPERATOR, 2);
                } else {
                    single(TokenKind.QUESTION_MARK);
                }
            }
            default -> throw new LexException("Unexpected character '" + c + "'", currentPosition());
        }
    }

    private void scanIdentifierOrKeyword() {
        advance();
        while (!isAtEnd()) {
            char c = peek();
            if (isIdentifierPart(c)) {
                advance();
            } else if (c == '.' && isIdentifierPart(peekAt(1))) {
                advance();
            } else {
                break;
            }
        }

        String text = source.substring(startPosition, position);
        TokenKind keyword = TokenKind.keyword(text);
        addToken(keyword != null ? keyword : TokenKind.IDENTIFIER);
    }

    private void scanNumber() {
        if (peek() == '0' && (peekAt(1) == 'x' || peekAt(1) == 'X') && isHexDigit(peekAt(2))) {
            advance();
            advance();
            while (isHexDigit(peek())) {
                advance();
            }
            addToken(TokenKind.HEX_LITERAL);
            return;
        }

        while (isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && isDigit(peekAt(1))) {
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        if (peek() == 'e' || peek() == 'E') {
            int exponentOffset = (peekAt(1) == '+' || peekAt(1) == '-') ? 2 : 1;
            if (isDigit(peekAt(exponentOffset))) {
                for (int i = 0; i < exponentOffset; i++) {
                    advance();
                }
                while (isDigit(peek())) {
                    advance();
                }
            }
        }
        addToken(TokenKind.NUMERIC_LITERAL);
    }

    private void scanText() {
        Position start = currentPosition();
        advance();
        if (!consumeQuotedBody()) {
            throw new LexException("Unterminated text literal", start);
        }
        addToken(TokenKind.TEXT_LITERAL);
    }

    private void scanHash() {
        Position start = currentPosition();
        if (peekAt(1) == '"') {
            advance();
            advance();
            if (!consumeQuotedBody()) {
                throw new LexException("Unterminated quoted identifier", start);
            }
            addToken(TokenKind.IDENTIFIER);
            return;
        }

        advance();
        while (isLetter(peek())) {
            advance();
        }
        String text = source.substring(startPosition, position);
        TokenKind keyword = TokenKind.keyword(text);
        if (keyword == null) {
            throw new LexException("Unknown keyword '" + text + "'", start);
        }
        addToken(keyword);
    }

    // Consumes up to and including the closing quote; "" is an escaped quote.
    private boolean consumeQuotedBody() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '"') {
                if (peekAt(1) == '"') {
                    advance();
                    advance();
                    continue;
                }
                advance();
                return true;
            }
            advance();
        }
        return false;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c) || isLineTerminator(c)) {
                advance();
            } else if (c == '/' && peekAt(1) == '/') {
                while (!isAtEnd() && !isLineTerminator(peek())) {
                    advance();
                }
            } else if (c == '/' && peekAt(1) == '*') {
                Position start = currentPosition();
                advance();
                advance();
                boolean closed = false;
                while (!isAtEnd()) {
                    if (peek() == '*' && peekAt(1) == '/') {
                        advance();
                        advance();
                        closed = true;
                        break;
                    }
                    advance();
                }
                if (!closed) {
                    throw new LexException("Unterminated multiline comment", start);
                }
            } else {
                return;
            }
        }
    }

    // ========================================================================
    // Cursor helpers
    // ========================================================================

    private void single(TokenKind kind) {
        multi(kind, 1);
    }

    private void multi(TokenKind kind, int length) {
        for (int i = 0; i < length; i++) {
            advance();
        }
        addToken(kind);
    }

    private void markStart() {
        startPosition = position;
        startLine = line;
        startLineStart = lineStart;
    }

    private void addToken(TokenKind kind) {
        Position start = new Position(startLine, startPosition - startLineStart, startPosition);
        tokens.add(new Token(kind, source.substring(startPosition, position), start, currentPosition()));
    }

    private Position currentPosition() {
        return new Position(line, position - lineStart, position);
    }

    private void advance() {
        char c = source.charAt(position++);
        if (c == '\r' && peek() == '\n') {
            return;
        }
        if (isLineTerminator(c)) {
            line++;
            lineStart = position;
        }
    }

    private boolean isAtEnd() {
        return position >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekAt(int offset) {
        int index = position + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r' || c == '\u0085' || c == LINE_SEPARATOR || c == PARAGRAPH_SEPARATOR;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isLetter(char c) {
        return Character.isLetter(c);
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
