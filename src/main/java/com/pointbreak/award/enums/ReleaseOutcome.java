package com.pointbreak.award.enums;

/**
 * How a leased session fared. Fatal outcomes send the session to {@link SessionState#DEGRADED}.
 */
public enum ReleaseOutcome {
    SUCCESS(false),
    // the call failed for reasons unrelated to the session (bad gateway, malformed body)
    FAILED(false),
    TIMEOUT(false),
    REJECTED(true),
    CRASHED(true);

    private final boolean fatal;

    ReleaseOutcome(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
