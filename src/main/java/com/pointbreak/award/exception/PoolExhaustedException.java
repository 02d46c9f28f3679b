package com.pointbreak.award.exception;

/**
 * No session became available before the lease timeout elapsed.
 */
public class PoolExhaustedException extends UpstreamFailureException {
    public PoolExhaustedException(String message) {
        super(message);
    }

    public PoolExhaustedException(String message, Throwable e) {
        super(message, e);
    }
}
