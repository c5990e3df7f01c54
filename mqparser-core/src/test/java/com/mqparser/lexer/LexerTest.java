package com.mqparser.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenKind> kinds(String source) {
        return Lexer.lex(source).tokens().stream().map(Token::kind).collect(Collectors.toList());
    }

    @Test
    void testLetExpressionTokens() {
        assertEquals(List.of(TokenKind.KEYWORD_LET, TokenKind.IDENTIFIER, TokenKind.EQUAL,
                TokenKind.NUMERIC_LITERAL, TokenKind.KEYWORD_IN, TokenKind.IDENTIFIER),
            kinds("let x = 1 in x"));
    }

    @Test
    void testMultiCharacterPunctuators() {
        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.NULL_COALESCING_OPERATOR, TokenKind.IDENTIFIER,
                TokenKind.FAT_ARROW, TokenKind.DOT_DOT, TokenKind.ELLIPSIS, TokenKind.NOT_EQUAL,
                TokenKind.LESS_THAN_EQUAL_TO, TokenKind.GREATER_THAN_EQUAL_TO, TokenKind.QUESTION_MARK),
            kinds("a ?? b => .. ... <> <= >= ?"));
    }

    @Test
    void testHashKeywordsAndQuotedIdentifier() {
        List<Token> tokens = Lexer.lex("#date #infinity #\"Quoted Name\"").tokens();
        assertEquals(TokenKind.KEYWORD_HASH_DATE, tokens.get(0).kind());
        assertEquals(TokenKind.KEYWORD_HASH_INFINITY, tokens.get(1).kind());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(2).kind());
        assertEquals("#\"Quoted Name\"", tokens.get(2).data());
    }

    @Test
    void testLiterals() {
        assertEquals(List.of(TokenKind.HEX_LITERAL, TokenKind.NUMERIC_LITERAL, TokenKind.NUMERIC_LITERAL,
                TokenKind.TEXT_LITERAL, TokenKind.NULL_LITERAL, TokenKind.KEYWORD_TRUE),
            kinds("0xFF 1.5e3 .5 \"a\"\"b\" null true"));
        assertEquals("\"a\"\"b\"", Lexer.lex("\"a\"\"b\"").get(0).data(), "Escaped quotes stay in the token");
    }

    @Test
    void testDottedIdentifierIsOneToken() {
        List<Token> tokens = Lexer.lex("Table.AddColumn(x)").tokens();
        assertEquals(TokenKind.IDENTIFIER, tokens.get(0).kind());
        assertEquals("Table.AddColumn", tokens.get(0).data());
        assertEquals(4, tokens.size());
    }

    @Test
    void testCommentsAreSkipped() {
        assertEquals(List.of(TokenKind.NUMERIC_LITERAL, TokenKind.PLUS, TokenKind.NUMERIC_LITERAL),
            kinds("1 // line comment\n + /* block */ 2"));
    }

    @Test
    void testPositions() {
        LexerSnapshot snapshot = Lexer.lex("a\n  bc");
        Token b = snapshot.get(1);
        assertEquals(new Position(1, 2, 4), b.positionStart());
        assertEquals(new Position(1, 4, 6), b.positionEnd());
        assertEquals("2:3", b.positionStart().toString(), "Positions print one based");
        assertNull(snapshot.get(2), "Out of range lookups return null");
    }

    @Test
    void testSliceCoversSourceBetweenTokens() {
        LexerSnapshot snapshot = Lexer.lex("[Date  Time = 1]");
        assertEquals("Date  Time", snapshot.slice(1, 2));
    }

    @Test
    void testLexErrors() {
        LexException unterminated = assertThrows(LexException.class, () -> Lexer.lex("\"abc"));
        assertEquals(Position.START, unterminated.getPosition());
        assertThrows(LexException.class, () -> Lexer.lex("#unknown"));
        assertThrows(LexException.class, () -> Lexer.lex("1 /* open"));
        assertThrows(LexException.class, () -> Lexer.lex("a $ b"));
    }
}
