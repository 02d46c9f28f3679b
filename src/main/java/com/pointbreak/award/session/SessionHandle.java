package com.pointbreak.award.session;

import com.pointbreak.award.enums.SessionState;
import com.pointbreak.award.interfaces.BrowserSession;
import com.pointbreak.award.model.Fingerprint;
import com.pointbreak.award.model.SessionCookie;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * One authenticated upstream session living in a pool slot.
 * State, usage and cookies only change through {@link SessionPool}.
 */
public class SessionHandle {

    @Getter
    private final int slotId;
    @Getter
    private final Fingerprint fingerprint;
    @Getter
    private final BrowserSession browserSession;
    @Getter
    private final Instant createdAt;
    private final SessionCookieJar cookieJar;

    private volatile SessionState state = SessionState.WARMING;
    private volatile int usageCount;
    private volatile boolean crashSignalled;

    SessionHandle(int slotId, HydratedSession hydrated) {
        this.slotId = slotId;
        this.fingerprint = hydrated.fingerprint();
        this.browserSession = hydrated.browserSession();
        this.cookieJar = new SessionCookieJar(hydrated.cookies());
        this.createdAt = Instant.now();
    }

    public SessionState getState() {
        return state;
    }

    public int getUsageCount() {
        return usageCount;
    }

    /**
     * Cookie header for the fast path. Only meaningful while the caller holds the lease.
     */
    public String cookieHeader() {
        return cookieJar.toHeader();
    }

    public List<SessionCookie> cookies() {
        return cookieJar.snapshot();
    }

    void setState(SessionState state) {
        this.state = state;
    }

    int incrementUsage() {
        return ++usageCount;
    }

    boolean isCrashSignalled() {
        return crashSignalled;
    }

    void signalCrash() {
        this.crashSignalled = true;
    }

    int mergeCookies(List<SessionCookie> cookies) {
        return cookieJar.merge(cookies);
    }

    @Override
    public String toString() {
        return "Session[slot=" + slotId + ", state=" + state + ", uses=" + usageCount
                + ", profile=" + (fingerprint == null ? null : fingerprint.getProfileId()) + "]";
    }
}
