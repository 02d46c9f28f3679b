package com.pointbreak.award.enums;

/**
 * Why upstream turned a fast-path request away.
 */
public enum RejectionKind {
    AUTHENTICATION,
    RATE_LIMITED,
    CHALLENGE;

    public static RejectionKind fromStatus(int status) {
        if (status == 401 || status == 403 || status == 419) {
            return AUTHENTICATION;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        return null;
    }
}
