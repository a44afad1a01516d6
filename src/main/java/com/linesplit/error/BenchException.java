package com.linesplit.error;

import lombok.Getter;

/**
 * Exception thrown by benchmark operations.
 */
@Getter
public class BenchException extends Exception {
    private final ErrorType errorType;

    public BenchException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public BenchException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    @Override
    public String toString() {
        return String.format("BenchException{type=%s, message='%s'}", errorType, getMessage());
    }
}
