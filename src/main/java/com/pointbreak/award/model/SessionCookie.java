package com.pointbreak.award.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SessionCookie {
    String name;
    String value;
    String domain;
    @Builder.Default
    String path = "/";
    // seconds since epoch, -1 for a session cookie
    @Builder.Default
    double expires = -1;
    boolean httpOnly;
    boolean secure;

    public boolean isExpired(long nowEpochSeconds) {
        return expires >= 0 && expires < nowEpochSeconds;
    }

    public String key() {
        return name + "|" + (domain == null ? "" : domain) + "|" + (path == null ? "/" : path);
    }
}
