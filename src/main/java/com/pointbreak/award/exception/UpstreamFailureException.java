package com.pointbreak.award.exception;

/**
 * Base for every failure that maps to an upstream-failure response.
 */
public class UpstreamFailureException extends RuntimeException {
    public UpstreamFailureException(String message) {
        super(message);
    }

    public UpstreamFailureException(String message, Throwable e) {
        super(message, e);
    }
}
