package com.mqparser;

public enum EntryPoint {
    /** An expression document, or a section document when that fails. */
    DOCUMENT,
    EXPRESSION,
    SECTION_DOCUMENT
}
