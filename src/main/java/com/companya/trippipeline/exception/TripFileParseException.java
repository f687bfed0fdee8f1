package com.companya.trippipeline.exception;

public class TripFileParseException extends RuntimeException {

    public TripFileParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
