package com.mqparser.ast;

public enum LiteralKind {
    LIST,
    LOGICAL,
    NULL,
    NUMERIC,
    RECORD,
    TEXT
}
