package com.pointbreak.award.manager;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.pointbreak.award.config.ScraperConfig;
import com.pointbreak.award.enums.CredentialsMode;
import com.pointbreak.award.exception.BrowserSessionClosedException;
import com.pointbreak.award.exception.NavigationException;
import com.pointbreak.award.exception.UpstreamTimeoutException;
import com.pointbreak.award.exception.UpstreamUnavailableException;
import com.pointbreak.award.interfaces.BrowserSession;
import com.pointbreak.award.model.Fingerprint;
import com.pointbreak.award.model.UpstreamResponse;
import com.pointbreak.award.utils.InPageFetchScript;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Result mapping of the in-page fetch and session threading. Playwright itself is mocked; no browser is launched.
 */
public class BrowserManagerTest {

    private static final String BOOKING_URL = "https://www.aa.com/booking/choose-flights/1";

    private final Fingerprint fingerprint = Fingerprint.builder()
            .profileId("win10-firefox-131")
            .userAgent("Mozilla/5.0 test")
            .locale("en-US")
            .build();

    private static Playwright playwrightServing(Page page) {
        Playwright playwright = mock(Playwright.class);
        BrowserType firefox = mock(BrowserType.class);
        Browser browser = mock(Browser.class);
        BrowserContext context = mock(BrowserContext.class);
        when(playwright.firefox()).thenReturn(firefox);
        when(firefox.launch(any())).thenReturn(browser);
        when(browser.newContext(any())).thenReturn(context);
        when(context.newPage()).thenReturn(page);
        return playwright;
    }

    private static BrowserManager managerServing(Playwright... playwrights) {
        ScraperConfig config = new ScraperConfig();
        config.setBrowserEngine("firefox");
        Queue<Playwright> queue = new ConcurrentLinkedQueue<>(List.of(playwrights));
        return new BrowserManager(config, queue::poll);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void slowNavigation_doesNotDelayFetchInAnotherSession() throws Exception {
        Page readyPage = mock(Page.class);
        when(readyPage.evaluate(anyString(), any())).thenReturn(Map.of("status", 200, "body", "{}"));

        CountDownLatch navigationStarted = new CountDownLatch(1);
        CountDownLatch navigationDone = new CountDownLatch(1);
        Page warmingPage = mock(Page.class);
        when(warmingPage.navigate(anyString(), any(Page.NavigateOptions.class))).thenAnswer(inv -> {
            navigationStarted.countDown();
            navigationDone.await(10, TimeUnit.SECONDS);
            return null;
        });

        BrowserManager manager = managerServing(playwrightServing(readyPage), playwrightServing(warmingPage));
        ExecutorService hydration = Executors.newSingleThreadExecutor();
        try {
            BrowserSession ready = manager.navigate(BOOKING_URL, fingerprint);
            Future<BrowserSession> warming = hydration.submit(() -> manager.navigate(BOOKING_URL, fingerprint));
            assertThat(navigationStarted.await(5, TimeUnit.SECONDS)).isTrue();

            long started = System.nanoTime();
            UpstreamResponse response = manager.executeInPage(ready, "async (args) => ({})", Map.of(),
                    CredentialsMode.INCLUDE, Duration.ofMillis(200));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertThat(response.getStatus()).isEqualTo(200);
            assertThat(elapsedMs).isLessThan(1_000);
            assertThat(warming.isDone()).isFalse();

            navigationDone.countDown();
            assertThat(warming.get(5, TimeUnit.SECONDS).isClosed()).isFalse();
        } finally {
            navigationDone.countDown();
            hydration.shutdownNow();
            manager.shutdown();
        }
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void navigate_pageNeverLoads_closesItsPlaywright() {
        Page page = mock(Page.class);
        when(page.navigate(anyString(), any(Page.NavigateOptions.class)))
                .thenThrow(new PlaywrightException("net::ERR_TIMED_OUT"));
        Playwright playwright = playwrightServing(page);
        BrowserManager manager = managerServing(playwright);

        assertThatThrownBy(() -> manager.navigate(BOOKING_URL, fingerprint))
                .isInstanceOf(NavigationException.class);
        verify(page, times(2)).navigate(anyString(), any(Page.NavigateOptions.class));
        verify(playwright).close();
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void close_releasesPlaywrightAndRefusesFurtherCalls() {
        Page page = mock(Page.class);
        Playwright playwright = playwrightServing(page);
        BrowserManager manager = managerServing(playwright);
        BrowserSession session = manager.navigate(BOOKING_URL, fingerprint);

        manager.close(session);

        verify(page).close();
        verify(playwright).close();
        assertThat(session.isClosed()).isTrue();
        assertThatThrownBy(() -> manager.readCookies(session))
                .isInstanceOf(BrowserSessionClosedException.class);
    }

    @Test
    void toUpstreamResponse_statusAndBody() {
        UpstreamResponse response = BrowserManager.toUpstreamResponse(Map.of("status", 200, "body", "{\"slices\":[]}"));

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo("{\"slices\":[]}");
    }

    @Test
    void toUpstreamResponse_doubleStatus_truncated() {
        Map<String, Object> result = new HashMap<>();
        result.put("status", 403.0);
        result.put("body", null);

        UpstreamResponse response = BrowserManager.toUpstreamResponse(result);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getBody()).isEmpty();
    }

    @Test
    void toUpstreamResponse_abort_isTimeout() {
        assertThatThrownBy(() -> BrowserManager.toUpstreamResponse(
                Map.of("error", "signal is aborted", "name", InPageFetchScript.ABORT_ERROR)))
                .isInstanceOf(UpstreamTimeoutException.class);
    }

    @Test
    void toUpstreamResponse_networkError_isUnavailable() {
        assertThatThrownBy(() -> BrowserManager.toUpstreamResponse(
                Map.of("error", "NetworkError when attempting to fetch resource.", "name", "TypeError")))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("NetworkError");
    }

    @Test
    void toUpstreamResponse_noResult_isUnavailable() {
        assertThatThrownBy(() -> BrowserManager.toUpstreamResponse(null))
                .isInstanceOf(UpstreamUnavailableException.class);
        assertThatThrownBy(() -> BrowserManager.toUpstreamResponse(Map.of("body", "x")))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    void playwrightSession_disconnectFiresOnceAndNotAfterClose() {
        BrowserManager.PlaywrightSession lost = new BrowserManager.PlaywrightSession("s1", "test-s1");
        int[] fired = {0};
        lost.addListener(() -> fired[0]++);

        lost.fireDisconnect("crash");
        lost.fireDisconnect("close");

        assertThat(fired[0]).isEqualTo(1);
        assertThat(lost.isClosed()).isTrue();

        BrowserManager.PlaywrightSession closed = new BrowserManager.PlaywrightSession("s2", "test-s2");
        int[] closedFired = {0};
        closed.addListener(() -> closedFired[0]++);
        closed.markClosed();
        closed.fireDisconnect("close");

        assertThat(closedFired[0]).isZero();
    }

    @Test
    void playwrightSession_lateListenerRunsImmediately() {
        BrowserManager.PlaywrightSession lost = new BrowserManager.PlaywrightSession("s3", "test-s3");
        lost.fireDisconnect("crash");

        int[] fired = {0};
        lost.addListener(() -> fired[0]++);

        assertThat(fired[0]).isEqualTo(1);
    }
}
