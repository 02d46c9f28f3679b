package com.pointbreak.award.interfaces;

import com.pointbreak.award.model.Fingerprint;
import com.pointbreak.award.model.UpstreamResponse;

import java.time.Duration;

/**
 * Direct HTTP client that replays a harvested session without a browser.
 */
public interface SyntheticHttpClient {

    /**
     * Posts a JSON body carrying the cookie header and fingerprint headers.
     *
     * @return the 2xx response whose body is a JSON document
     * @throws com.pointbreak.award.exception.UpstreamRejectedException  auth, rate limit or challenge
     * @throws com.pointbreak.award.exception.UpstreamTimeoutException   the timeout elapsed
     * @throws com.pointbreak.award.exception.UpstreamUnavailableException any other failure
     */
    UpstreamResponse postJson(String url, String jsonBody, String cookieHeader,
                              Fingerprint fingerprint, Duration timeout);
}
