package com.mqparser.ast;

import com.mqparser.lexer.Position;

/**
 * Inclusive token index range of a node plus the source positions it spans.
 * An empty node (an array wrapper with no elements) has {@code tokenIndexEnd < tokenIndexStart}.
 */
public record TokenRange(
    int tokenIndexStart,
    int tokenIndexEnd,
    Position positionStart,
    Position positionEnd
) {
    public int tokenCount() {
        return Math.max(0, tokenIndexEnd - tokenIndexStart + 1);
    }

    @Override
    public String toString() {
        return "[" + tokenIndexStart + ".." + tokenIndexEnd + "]";
    }
}
