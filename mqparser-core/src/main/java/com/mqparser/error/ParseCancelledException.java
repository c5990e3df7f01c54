package com.mqparser.error;

public class ParseCancelledException extends RuntimeException {

    public ParseCancelledException(String message) {
        super(message);
    }
}
