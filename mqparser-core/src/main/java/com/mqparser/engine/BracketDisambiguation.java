package com.mqparser.engine;

public enum BracketDisambiguation {
    FIELD_PROJECTION,
    FIELD_SELECTION,
    RECORD
}
