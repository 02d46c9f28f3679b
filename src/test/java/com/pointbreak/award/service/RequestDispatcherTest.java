package com.pointbreak.award.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pointbreak.award.config.ScraperConfig;
import com.pointbreak.award.enums.CabinClass;
import com.pointbreak.award.enums.CredentialsMode;
import com.pointbreak.award.enums.RejectionKind;
import com.pointbreak.award.enums.ReleaseOutcome;
import com.pointbreak.award.enums.SearchType;
import com.pointbreak.award.exception.UpstreamRejectedException;
import com.pointbreak.award.exception.UpstreamTimeoutException;
import com.pointbreak.award.exception.UpstreamUnavailableException;
import com.pointbreak.award.interfaces.BrowserProvider;
import com.pointbreak.award.interfaces.BrowserSession;
import com.pointbreak.award.interfaces.SyntheticHttpClient;
import com.pointbreak.award.model.Fingerprint;
import com.pointbreak.award.model.RawOffer;
import com.pointbreak.award.model.SearchRequest;
import com.pointbreak.award.model.SessionCookie;
import com.pointbreak.award.model.UpstreamResponse;
import com.pointbreak.award.session.SessionHandle;
import com.pointbreak.award.session.SessionPool;
import com.pointbreak.award.utils.ItineraryParser;
import com.pointbreak.award.utils.ItineraryPayloadBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class RequestDispatcherTest {

    private static final String API_URL = "https://www.aa.com/booking/api/search/itinerary";
    private static final String COOKIE_HEADER = "sid=abc";
    private static final String AWARD_BODY = """
            {"slices":[{"hash":"h1",
              "segments":[{"flight":{"carrierCode":"AA","flightNumber":"123"}}],
              "departureDateTime":"2025-12-15T08:00:00.000-05:00",
              "arrivalDateTime":"2025-12-15T16:30:00.000-08:00",
              "productPricing":[{"cheapestPrice":{"productType":"MAIN"},
                "regularPrice":{"slicePricing":{"perPassengerAwardPoints":12500,
                  "allPassengerDisplayTotal":{"amount":5.60}}}}]}]}
            """;

    @Mock
    private SessionPool sessionPool;
    @Mock
    private SyntheticHttpClient syntheticHttpClient;
    @Mock
    private BrowserProvider browserProvider;
    @Mock
    private SessionHandle handle;
    @Mock
    private BrowserSession browserSession;

    private RequestDispatcher dispatcher;
    private final Fingerprint fingerprint = Fingerprint.builder().profileId("p1").userAgent("UA").locale("en-US").build();
    private final SearchRequest request = SearchRequest.of("lax", "jfk", "2025-12-15", 1, CabinClass.MAIN);

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        ScraperConfig config = new ScraperConfig();
        config.setDispatchDeadlineMs(5_000);

        dispatcher = new RequestDispatcher(sessionPool, syntheticHttpClient, browserProvider,
                new ItineraryPayloadBuilder(mapper), new ItineraryParser(mapper), config);

        when(sessionPool.lease()).thenReturn(handle);
        lenient().when(handle.getSlotId()).thenReturn(7);
        lenient().when(handle.cookieHeader()).thenReturn(COOKIE_HEADER);
        lenient().when(handle.getFingerprint()).thenReturn(fingerprint);
        lenient().when(handle.getBrowserSession()).thenReturn(browserSession);
    }

    /* -------------------------- Helpers -------------------------- */

    private void fastPathReturns(String body) {
        when(syntheticHttpClient.postJson(eq(API_URL), anyString(), eq(COOKIE_HEADER), eq(fingerprint), any(Duration.class)))
                .thenReturn(new UpstreamResponse(200, body));
    }

    private void fastPathThrows(RuntimeException e) {
        when(syntheticHttpClient.postJson(eq(API_URL), anyString(), eq(COOKIE_HEADER), eq(fingerprint), any(Duration.class)))
                .thenThrow(e);
    }

    private void fallbackReturns(int status, String body) {
        when(browserProvider.executeInPage(eq(browserSession), anyString(), anyMap(), eq(CredentialsMode.INCLUDE), any(Duration.class)))
                .thenReturn(new UpstreamResponse(status, body));
    }

    /* ========================= TESTS ========================= */

    @Nested
    @DisplayName("fast path")
    class FastPath {

        @Test
        @DisplayName("success parses offers and releases healthy")
        void execute_fastSuccess_releasesSuccess() {
            fastPathReturns(AWARD_BODY);

            List<RawOffer> offers = dispatcher.execute(request, SearchType.AWARD);

            assertThat(offers).singleElement().satisfies(o -> {
                assertThat(o.getHash()).isEqualTo("h1");
                assertThat(o.getFlightNumber()).isEqualTo("AA123");
                assertThat(o.pricingFor(CabinClass.MAIN)).isPresent();
            });
            verify(sessionPool).release(handle, ReleaseOutcome.SUCCESS);
            verifyNoInteractions(browserProvider);
        }

        @Test
        @DisplayName("timeout surfaces without fallback and the session is kept")
        void execute_fastTimeout_releasesTimeout() {
            fastPathThrows(new UpstreamTimeoutException("slow"));

            assertThatThrownBy(() -> dispatcher.execute(request, SearchType.AWARD))
                    .isInstanceOf(UpstreamTimeoutException.class);
            verify(sessionPool).release(handle, ReleaseOutcome.TIMEOUT);
            verifyNoInteractions(browserProvider);
        }

        @Test
        @DisplayName("malformed body is an upstream failure, not a rejection")
        void execute_malformedBody_failsWithoutFallback() {
            fastPathReturns("{not json");

            assertThatThrownBy(() -> dispatcher.execute(request, SearchType.REVENUE))
                    .isInstanceOf(UpstreamUnavailableException.class);
            verify(sessionPool).release(handle, ReleaseOutcome.FAILED);
            verifyNoInteractions(browserProvider);
        }
    }

    @Nested
    @DisplayName("fallback")
    class Fallback {

        @Test
        @DisplayName("authentication rejection falls back once through the browser and merges cookies")
        void execute_rejected_fallsBackOnce() {
            fastPathThrows(new UpstreamRejectedException(403, RejectionKind.AUTHENTICATION));
            fallbackReturns(200, AWARD_BODY);
            List<SessionCookie> refreshed = List.of(SessionCookie.builder().name("sid").value("new").build());
            when(browserProvider.readCookies(browserSession)).thenReturn(refreshed);

            List<RawOffer> offers = dispatcher.execute(request, SearchType.AWARD);

            assertThat(offers).hasSize(1);
            verify(browserProvider, times(1))
                    .executeInPage(eq(browserSession), anyString(), anyMap(), eq(CredentialsMode.INCLUDE), any(Duration.class));
            verify(sessionPool).mergeCookies(handle, refreshed);
            verify(sessionPool).release(handle, ReleaseOutcome.SUCCESS);
        }

        @Test
        @DisplayName("fallback rejected too: unavailable, session released as rejected")
        void execute_fallbackRejected_releasesRejected() {
            fastPathThrows(new UpstreamRejectedException(429, RejectionKind.RATE_LIMITED));
            fallbackReturns(403, "<html>denied</html>");

            assertThatThrownBy(() -> dispatcher.execute(request, SearchType.AWARD))
                    .isInstanceOf(UpstreamUnavailableException.class);
            verify(browserProvider, times(1))
                    .executeInPage(any(), anyString(), anyMap(), any(), any());
            verify(sessionPool, never()).mergeCookies(any(), any());
            verify(sessionPool).release(handle, ReleaseOutcome.REJECTED);
        }

        @Test
        @DisplayName("challenge page in the browser counts as a failed fallback")
        void execute_fallbackChallenge_releasesRejected() {
            fastPathThrows(new UpstreamRejectedException(200, RejectionKind.CHALLENGE));
            fallbackReturns(200, "<html>please verify</html>");

            assertThatThrownBy(() -> dispatcher.execute(request, SearchType.REVENUE))
                    .isInstanceOf(UpstreamUnavailableException.class);
            verify(sessionPool).release(handle, ReleaseOutcome.REJECTED);
        }
    }
}
