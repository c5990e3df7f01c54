package com.mqparser.engine;

/**
 * What to do when a bracket or parenthesis cannot be classified by peeking ahead.
 */
public enum DisambiguationBehavior {
    /** Report an unterminated bracket or parenthesis. */
    STRICT,
    /** Try every candidate reading and keep the one that got furthest. */
    THOROUGH
}
