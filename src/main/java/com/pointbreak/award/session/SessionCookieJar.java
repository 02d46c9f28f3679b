package com.pointbreak.award.session;

import com.pointbreak.award.model.SessionCookie;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Insertion-ordered cookies keyed by name, domain and path. Not thread-safe; guarded by the pool.
 */
public class SessionCookieJar {

    private final Map<String, SessionCookie> cookies = new LinkedHashMap<>();

    SessionCookieJar(Collection<SessionCookie> initial) {
        merge(initial);
    }

    /**
     * Upserts the given cookies in place. Cookies that are already expired are dropped.
     */
    int merge(Collection<SessionCookie> incoming) {
        if (incoming == null) {
            return 0;
        }
        long now = Instant.now().getEpochSecond();
        int changed = 0;
        for (SessionCookie cookie : incoming) {
            if (cookie == null || cookie.getName() == null || cookie.getValue() == null) {
                continue;
            }
            if (cookie.isExpired(now)) {
                if (cookies.remove(cookie.key()) != null) {
                    changed++;
                }
                continue;
            }
            SessionCookie previous = cookies.put(cookie.key(), cookie);
            if (!cookie.equals(previous)) {
                changed++;
            }
        }
        return changed;
    }

    List<SessionCookie> snapshot() {
        return new ArrayList<>(cookies.values());
    }

    String toHeader() {
        long now = Instant.now().getEpochSecond();
        return cookies.values().stream()
                .filter(c -> !c.isExpired(now))
                .map(c -> c.getName() + "=" + c.getValue())
                .collect(Collectors.joining("; "));
    }

    int size() {
        return cookies.size();
    }
}
