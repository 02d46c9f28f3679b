package com.pointbreak.award.interfaces;

import com.pointbreak.award.enums.CredentialsMode;
import com.pointbreak.award.model.Fingerprint;
import com.pointbreak.award.model.SessionCookie;
import com.pointbreak.award.model.UpstreamResponse;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Page-rendering capability used to warm sessions and to run requests from inside a real page.
 */
public interface BrowserProvider {

    /**
     * Opens a new context carrying the fingerprint and navigates it to the url.
     *
     * @throws com.pointbreak.award.exception.NavigationException if the page never loads
     */
    BrowserSession navigate(String url, Fingerprint fingerprint);

    /**
     * Evaluates a script of the form {@code async (args) => {status, body} | {error}} in the session's page.
     * {@code args.credentials} is set from the credentials mode.
     *
     * @throws com.pointbreak.award.exception.BrowserSessionClosedException if the context is gone
     */
    UpstreamResponse executeInPage(BrowserSession session, String script, Map<String, Object> args,
                                   CredentialsMode credentialsMode, Duration timeout);

    List<SessionCookie> readCookies(BrowserSession session);

    /**
     * Registers a listener fired at most once when the context crashes, disconnects or closes.
     */
    void onDisconnect(BrowserSession session, Runnable listener);

    void close(BrowserSession session);
}
