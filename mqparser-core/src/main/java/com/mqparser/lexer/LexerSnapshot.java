package com.mqparser.lexer;

import java.util.List;

/**
 * The immutable output of the lexer: the source text and its tokens, in order.
 */
public record LexerSnapshot(String text, List<Token> tokens) {

    public LexerSnapshot {
        tokens = List.copyOf(tokens);
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int tokenIndex) {
        return tokenIndex >= 0 && tokenIndex < tokens.size() ? tokens.get(tokenIndex) : null;
    }

    /**
     * Returns the source text covered by the inclusive token range.
     */
    public String slice(int tokenIndexStart, int tokenIndexEnd) {
        Token first = tokens.get(tokenIndexStart);
        Token last = tokens.get(tokenIndexEnd);
        return text.substring(first.positionStart().codeUnit(), last.positionEnd().codeUnit());
    }
}
