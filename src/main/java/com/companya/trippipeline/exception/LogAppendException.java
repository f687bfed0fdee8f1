package com.companya.trippipeline.exception;

public class LogAppendException extends RuntimeException {

    public LogAppendException(String message, Throwable cause) {
        super(message, cause);
    }
}
