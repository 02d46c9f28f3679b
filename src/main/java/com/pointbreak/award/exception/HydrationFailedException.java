package com.pointbreak.award.exception;

public class HydrationFailedException extends RuntimeException {
    public HydrationFailedException(String message) {
        super(message);
    }

    public HydrationFailedException(String message, Throwable e) {
        super(message, e);
    }
}
