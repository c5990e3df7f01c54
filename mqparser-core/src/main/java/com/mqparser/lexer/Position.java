package com.mqparser.lexer;

/**
 * A zero based location in the source text.
 *
 * @param lineNumber    line of the location
 * @param lineCodeUnit  UTF-16 offset from the start of the line
 * @param codeUnit      UTF-16 offset from the start of the text
 */
public record Position(int lineNumber, int lineCodeUnit, int codeUnit) {

    public static final Position START = new Position(0, 0, 0);

    @Override
    public String toString() {
        return (lineNumber + 1) + ":" + (lineCodeUnit + 1);
    }
}
