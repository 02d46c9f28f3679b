package com.pointbreak.award.exception;

/**
 * The browser context behind a session crashed, disconnected or was closed.
 */
public class BrowserSessionClosedException extends RuntimeException {
    public BrowserSessionClosedException(String message) {
        super(message);
    }

    public BrowserSessionClosedException(String message, Throwable e) {
        super(message, e);
    }
}
