package com.mqparser.ast;

import java.util.HashMap;
import java.util.Map;

public enum PrimitiveTypeKind {
    ACTION("action"),
    ANY("any"),
    ANY_NON_NULL("anynonnull"),
    BINARY("binary"),
    DATE("date"),
    DATE_TIME("datetime"),
    DATE_TIME_ZONE("datetimezone"),
    DURATION("duration"),
    FUNCTION("function"),
    LIST("list"),
    LOGICAL("logical"),
    NONE("none"),
    NULL("null"),
    NUMBER("number"),
    RECORD("record"),
    TABLE("table"),
    TEXT("text"),
    TIME("time"),
    TYPE("type");

    private static final Map<String, PrimitiveTypeKind> BY_TEXT = new HashMap<>();

    static {
        for (PrimitiveTypeKind kind : values()) {
            BY_TEXT.put(kind.text, kind);
        }
    }

    private final String text;

    PrimitiveTypeKind(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /**
     * @return the primitive type spelled exactly as {@code text}, or null
     */
    public static PrimitiveTypeKind fromText(String text) {
        return BY_TEXT.get(text);
    }
}
