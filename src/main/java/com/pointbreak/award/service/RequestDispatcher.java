package com.pointbreak.award.service;

import com.pointbreak.award.config.ScraperConfig;
import com.pointbreak.award.enums.CredentialsMode;
import com.pointbreak.award.enums.RejectionKind;
import com.pointbreak.award.enums.SearchType;
import com.pointbreak.award.exception.UpstreamRejectedException;
import com.pointbreak.award.exception.UpstreamTimeoutException;
import com.pointbreak.award.exception.UpstreamUnavailableException;
import com.pointbreak.award.interfaces.BrowserProvider;
import com.pointbreak.award.interfaces.SyntheticHttpClient;
import com.pointbreak.award.model.RawOffer;
import com.pointbreak.award.model.SearchRequest;
import com.pointbreak.award.model.SessionCookie;
import com.pointbreak.award.model.UpstreamResponse;
import com.pointbreak.award.session.SessionHandle;
import com.pointbreak.award.session.SessionPool;
import com.pointbreak.award.utils.InPageFetchScript;
import com.pointbreak.award.utils.ItineraryParser;
import com.pointbreak.award.utils.ItineraryPayloadBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs one itinerary search over a leased session: fast path first, one browser fallback on rejection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestDispatcher {

    private final SessionPool sessionPool;
    private final SyntheticHttpClient syntheticHttpClient;
    private final BrowserProvider browserProvider;
    private final ItineraryPayloadBuilder payloadBuilder;
    private final ItineraryParser itineraryParser;
    private final ScraperConfig scraperConfig;

    public List<RawOffer> execute(SearchRequest request, SearchType searchType) {
        String payload = payloadBuilder.build(request, searchType);
        SessionHandle handle = sessionPool.lease();
        long deadlineNs = System.nanoTime() + scraperConfig.getDispatchDeadline().toNanos();
        String label = searchType.getWireValue() + " " + request.getOrigin() + "-" + request.getDestination()
                + " via slot " + handle.getSlotId();

        DispatchAttempt<List<RawOffer>> attempt = new DispatchAttempt<>(label,
                () -> fastPath(handle, payload, searchType, deadlineNs),
                () -> fallbackPath(handle, payload, searchType, deadlineNs));
        try {
            List<RawOffer> offers = attempt.run();
            log.info("[{}] {} offers", label, offers.size());
            return offers;
        } finally {
            sessionPool.release(handle, attempt.getOutcome());
        }
    }

    private List<RawOffer> fastPath(SessionHandle handle, String payload, SearchType searchType, long deadlineNs) {
        UpstreamResponse response = syntheticHttpClient.postJson(scraperConfig.getApiUrl(), payload,
                handle.cookieHeader(), handle.getFingerprint(), remaining(deadlineNs));
        return itineraryParser.parse(response.getBody(), searchType);
    }

    private List<RawOffer> fallbackPath(SessionHandle handle, String payload, SearchType searchType, long deadlineNs) {
        Map<String, Object> args = Map.of("url", scraperConfig.getApiUrl(), "body", payload);
        UpstreamResponse response = browserProvider.executeInPage(handle.getBrowserSession(),
                InPageFetchScript.SCRIPT, args, CredentialsMode.INCLUDE, remaining(deadlineNs));

        int status = response.getStatus();
        RejectionKind rejection = RejectionKind.fromStatus(status);
        if (rejection != null) {
            throw new UpstreamRejectedException(status, rejection);
        }
        if (status < 200 || status >= 300) {
            throw new UpstreamUnavailableException("Fallback returned HTTP " + status);
        }
        UpstreamResponse accepted = OkHttpSyntheticClient.classifyBody(status, response.getBody());

        List<SessionCookie> refreshed = browserProvider.readCookies(handle.getBrowserSession());
        sessionPool.mergeCookies(handle, refreshed);

        return itineraryParser.parse(accepted.getBody(), searchType);
    }

    private static Duration remaining(long deadlineNs) {
        long remainingNs = deadlineNs - System.nanoTime();
        if (remainingNs <= 0) {
            throw new UpstreamTimeoutException("Dispatch deadline exceeded");
        }
        return Duration.ofNanos(remainingNs);
    }
}
