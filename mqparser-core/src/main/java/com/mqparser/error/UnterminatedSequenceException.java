package com.mqparser.error;

import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;

public class UnterminatedSequenceException extends ParseException {

    public enum SequenceKind {
        BRACKET,
        PARENTHESIS
    }

    private final SequenceKind sequenceKind;

    public UnterminatedSequenceException(SequenceKind sequenceKind, Token start, int tokenIndex, Position position) {
        super("Unterminated " + (sequenceKind == SequenceKind.BRACKET ? "bracket" : "parenthesis")
                + " starting with " + describe(start),
            start, tokenIndex, position);
        this.sequenceKind = sequenceKind;
    }

    public SequenceKind getSequenceKind() {
        return sequenceKind;
    }
}
