package com.pointbreak.award.exception;

/**
 * Bad or unsupported search input. Never retried.
 */
public class SearchValidationException extends RuntimeException {
    public SearchValidationException(String message) {
        super(message);
    }

    public SearchValidationException(String message, Throwable e) {
        super(message, e);
    }
}
