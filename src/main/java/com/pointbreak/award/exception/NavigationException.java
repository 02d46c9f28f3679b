package com.pointbreak.award.exception;

public class NavigationException extends RuntimeException {
    public NavigationException(String message) {
        super(message);
    }

    public NavigationException(String message, Throwable e) {
        super(message, e);
    }
}
