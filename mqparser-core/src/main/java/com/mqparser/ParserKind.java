package com.mqparser;

/**
 * Which parser implementation reads binary expressions.
 */
public enum ParserKind {
    /** One production per precedence level. */
    NAIVE,
    /** Flat operator runs grouped by precedence afterwards. */
    COMBINATORIAL
}
