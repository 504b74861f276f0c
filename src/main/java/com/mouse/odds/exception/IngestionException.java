package com.mouse.odds.exception;

public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable e) {
        super(message, e);
    }
}
