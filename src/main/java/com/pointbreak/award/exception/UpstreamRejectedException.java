package com.pointbreak.award.exception;

import com.pointbreak.award.enums.RejectionKind;
import lombok.Getter;

/**
 * Upstream refused a fast-path call because of the session (auth, rate limit or bot challenge).
 * The dispatcher recovers from this through the browser path; it is never surfaced on its own.
 */
@Getter
public class UpstreamRejectedException extends RuntimeException {

    private final int status;
    private final RejectionKind kind;

    public UpstreamRejectedException(int status, RejectionKind kind) {
        super("Upstream rejected request with HTTP " + status + " (" + kind + ")");
        this.status = status;
        this.kind = kind;
    }
}
