package com.pointbreak.award.exception;

public class UpstreamUnavailableException extends UpstreamFailureException {
    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable e) {
        super(message, e);
    }
}
