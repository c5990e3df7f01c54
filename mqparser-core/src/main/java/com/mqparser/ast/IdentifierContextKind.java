package com.mqparser.ast;

/**
 * Where an identifier appears, which decides how later phases resolve it.
 */
public enum IdentifierContextKind {
    KEY,
    KEYWORD,
    PARAMETER,
    VALUE
}
