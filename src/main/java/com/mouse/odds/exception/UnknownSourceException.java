package com.mouse.odds.exception;

public class UnknownSourceException extends RuntimeException {

    public UnknownSourceException(String sourceId) {
        super("No source configured with id '" + sourceId + "'");
    }
}
