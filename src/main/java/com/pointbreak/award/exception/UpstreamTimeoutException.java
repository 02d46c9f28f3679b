package com.pointbreak.award.exception;

/**
 * A dispatch deadline elapsed. The session that served the call is kept.
 */
public class UpstreamTimeoutException extends UpstreamFailureException {
    public UpstreamTimeoutException(String message) {
        super(message);
    }

    public UpstreamTimeoutException(String message, Throwable e) {
        super(message, e);
    }
}
