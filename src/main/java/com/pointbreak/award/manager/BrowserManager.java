package com.pointbreak.award.manager;

import com.microsoft.playwright.*;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.ServiceWorkerPolicy;
import com.microsoft.playwright.options.WaitUntilState;
import com.pointbreak.award.config.ScraperConfig;
import com.pointbreak.award.enums.CredentialsMode;
import com.pointbreak.award.exception.BrowserSessionClosedException;
import com.pointbreak.award.exception.NavigationException;
import com.pointbreak.award.exception.UpstreamTimeoutException;
import com.pointbreak.award.exception.UpstreamUnavailableException;
import com.pointbreak.award.interfaces.BrowserProvider;
import com.pointbreak.award.interfaces.BrowserSession;
import com.pointbreak.award.model.Fingerprint;
import com.pointbreak.award.model.SessionCookie;
import com.pointbreak.award.model.UpstreamResponse;
import com.pointbreak.award.utils.InPageFetchScript;
import com.pointbreak.award.utils.StealthScriptBuilder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Playwright-backed {@link BrowserProvider}.
 * <p>
 * Playwright objects are not thread-safe. Every session owns its own Playwright instance, browser,
 * context and page, all confined to a dedicated thread, so warming one session never queues behind
 * a fetch running in another.
 */
@Component
@Slf4j
public class BrowserManager implements BrowserProvider {
    private static final int NAV_MAX_ATTEMPTS = 2;
    private static final long EVALUATE_GRACE_MS = 5_000;
    private static final Duration DISPOSE_TIMEOUT = Duration.ofSeconds(30);

    private final ScraperConfig scraperConfig;
    private final Supplier<Playwright> playwrightFactory;
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final Map<String, PlaywrightSession> sessions = new ConcurrentHashMap<>();

    @Autowired
    public BrowserManager(ScraperConfig scraperConfig) {
        this(scraperConfig, Playwright::create);
    }

    BrowserManager(ScraperConfig scraperConfig, Supplier<Playwright> playwrightFactory) {
        this.scraperConfig = scraperConfig;
        this.playwrightFactory = playwrightFactory;
    }

    // ==================== NAVIGATION ====================

    @Override
    public BrowserSession navigate(String url, Fingerprint fingerprint) {
        PlaywrightSession session = new PlaywrightSession(UUID.randomUUID().toString(),
                "browser-session-" + threadCounter.incrementAndGet());
        try {
            session.call(() -> {
                open(session, fingerprint);
                navigateWithRetry(session.getPage(), url);
                return null;
            }, null);
        } catch (RuntimeException e) {
            session.markClosed();
            session.dispose();
            throw e;
        }
        sessions.put(session.getId(), session);
        log.info("Opened browser session {} for profile {}", session.getId(), fingerprint.getProfileId());
        return session;
    }

    // runs on the session's own thread
    private void open(PlaywrightSession session, Fingerprint fingerprint) {
        session.playwright = playwrightFactory.get();
        session.browser = launchBrowser(session.playwright);
        session.browser.onDisconnected(b -> session.fireDisconnect("browser disconnected"));

        session.context = session.browser.newContext(createStealthContextOptions(fingerprint));
        session.context.addInitScript(StealthScriptBuilder.build(fingerprint));
        session.context.onClose(c -> session.fireDisconnect("context closed"));

        session.page = session.context.newPage();
        session.page.setDefaultNavigationTimeout(scraperConfig.getNavigationTimeoutMs());
        session.page.onCrash(p -> session.fireDisconnect("page crashed"));
        session.page.onClose(p -> session.fireDisconnect("page closed"));
    }

    Browser.NewContextOptions createStealthContextOptions(Fingerprint fingerprint) {
        log.debug("Creating stealth context options for {}", fingerprint.getProfileId());
        Map<String, String> headers = new HashMap<>(fingerprint.getHeaders());
        headers.put("Accept-Language", fingerprint.acceptLanguage());

        return new Browser.NewContextOptions()
                .setUserAgent(fingerprint.getUserAgent())
                .setViewportSize(fingerprint.getViewportWidth(), fingerprint.getViewportHeight())
                .setLocale(fingerprint.getLocale())
                .setTimezoneId(fingerprint.getTimeZone())
                .setExtraHTTPHeaders(headers)
                .setServiceWorkers(ServiceWorkerPolicy.BLOCK);
    }

    private void navigateWithRetry(Page page, String url) {
        int attempt = 0;
        while (true) {
            try {
                log.info("Navigation attempt {} to {}", attempt + 1, url);
                page.navigate(url, new Page.NavigateOptions()
                        .setTimeout(scraperConfig.getNavigationTimeoutMs())
                        .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
                page.waitForSelector("body", new Page.WaitForSelectorOptions().setTimeout(30_000));
                log.info("Navigation successful on attempt {}", attempt + 1);
                return;
            } catch (PlaywrightException e) {
                log.warn("Navigation attempt {} failed: {}", attempt + 1, e.getMessage());
                if (++attempt >= NAV_MAX_ATTEMPTS) {
                    throw new NavigationException("Could not load " + url, e);
                }
            }
        }
    }

    private Browser launchBrowser(Playwright pw) {
        String engine = scraperConfig.getBrowserEngine() == null
                ? "firefox" : scraperConfig.getBrowserEngine().trim().toLowerCase(Locale.ROOT);
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                .setHeadless(scraperConfig.isHeadless())
                .setTimeout(120_000);

        log.info("Launching {} (headless={})", engine, scraperConfig.isHeadless());
        switch (engine) {
            case "chromium":
                return pw.chromium().launch(options.setArgs(new ArrayList<>(scraperConfig.getBROWSER_FLAGS())));
            case "webkit":
                return pw.webkit().launch(options);
            case "firefox":
                return pw.firefox().launch(options);
            default:
                throw new IllegalStateException("Unsupported browser engine: " + engine);
        }
    }

    // ==================== IN-PAGE EXECUTION ====================

    @Override
    public UpstreamResponse executeInPage(BrowserSession session, String script, Map<String, Object> args,
                                          CredentialsMode credentialsMode, Duration timeout) {
        PlaywrightSession target = requireOpen(session);

        Map<String, Object> evaluateArgs = new HashMap<>(args);
        evaluateArgs.put("credentials", credentialsMode.getFetchValue());
        evaluateArgs.put("timeoutMs", timeout.toMillis());

        Object result;
        try {
            result = target.call(() -> target.getPage().evaluate(script, evaluateArgs),
                    timeout.plusMillis(EVALUATE_GRACE_MS));
        } catch (PlaywrightException e) {
            if (target.isClosed()) {
                throw new BrowserSessionClosedException("Browser session " + target.getId() + " closed during fetch", e);
            }
            throw new UpstreamUnavailableException("In-page fetch failed: " + e.getMessage(), e);
        }
        return toUpstreamResponse(result);
    }

    @SuppressWarnings("unchecked")
    static UpstreamResponse toUpstreamResponse(Object result) {
        if (!(result instanceof Map)) {
            throw new UpstreamUnavailableException("In-page fetch returned no result");
        }
        Map<String, Object> map = (Map<String, Object>) result;
        if (map.get("error") != null) {
            if (InPageFetchScript.ABORT_ERROR.equals(map.get("name"))) {
                throw new UpstreamTimeoutException("In-page fetch aborted: " + map.get("error"));
            }
            throw new UpstreamUnavailableException("In-page fetch failed: " + map.get("error"));
        }
        Object status = map.get("status");
        if (!(status instanceof Number)) {
            throw new UpstreamUnavailableException("In-page fetch returned no status");
        }
        Object body = map.get("body");
        return new UpstreamResponse(((Number) status).intValue(), body == null ? "" : body.toString());
    }

    // ==================== COOKIES ====================

    @Override
    public List<SessionCookie> readCookies(BrowserSession session) {
        PlaywrightSession target = requireOpen(session);
        List<Cookie> cookies;
        try {
            cookies = target.call(() -> target.getContext().cookies(), null);
        } catch (PlaywrightException e) {
            throw new BrowserSessionClosedException("Could not read cookies from " + target.getId(), e);
        }

        List<SessionCookie> result = new ArrayList<>(cookies.size());
        for (Cookie c : cookies) {
            result.add(SessionCookie.builder()
                    .name(c.name)
                    .value(c.value)
                    .domain(c.domain)
                    .path(c.path == null ? "/" : c.path)
                    .expires(c.expires == null ? -1 : c.expires)
                    .httpOnly(Boolean.TRUE.equals(c.httpOnly))
                    .secure(Boolean.TRUE.equals(c.secure))
                    .build());
        }
        return result;
    }

    // ==================== LIFECYCLE ====================

    @Override
    public void onDisconnect(BrowserSession session, Runnable listener) {
        PlaywrightSession target = sessions.get(session.getId());
        if (target == null) {
            listener.run();
            return;
        }
        target.addListener(listener);
    }

    @Override
    public void close(BrowserSession session) {
        PlaywrightSession target = sessions.remove(session.getId());
        if (target == null || !target.markClosed()) {
            return;
        }
        target.dispose();
        log.info("Closed browser session {}", target.getId());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down browser manager ({} open sessions)", sessions.size());
        List<PlaywrightSession> open = new ArrayList<>(sessions.values());
        sessions.clear();
        for (PlaywrightSession session : open) {
            if (session.markClosed()) {
                session.dispose();
            }
        }
    }

    // ==================== HELPERS ====================

    private PlaywrightSession requireOpen(BrowserSession session) {
        PlaywrightSession target = sessions.get(session.getId());
        if (target == null || target.isClosed()) {
            throw new BrowserSessionClosedException("Browser session " + session.getId() + " is closed");
        }
        return target;
    }

    private static void safeClose(AutoCloseable c) {
        if (c == null) return;
        try {
            c.close();
        } catch (Exception e) {
            log.debug("Ignoring close failure: {}", e.getMessage());
        }
    }

    /**
     * One Playwright instance with its browser, context and page, driven from a single owner thread.
     * Disconnect listeners fire once, and never after an explicit close.
     */
    static final class PlaywrightSession implements BrowserSession {
        private final String id;
        private final ExecutorService thread;
        private volatile Thread owner;
        private final AtomicBoolean closed = new AtomicBoolean();
        private final AtomicBoolean disconnected = new AtomicBoolean();
        private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

        // confined to the owner thread
        private Playwright playwright;
        private Browser browser;
        private BrowserContext context;
        private Page page;

        PlaywrightSession(String id, String threadName) {
            this.id = id;
            this.thread = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, threadName);
                t.setDaemon(true);
                owner = t;
                return t;
            });
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public boolean isClosed() {
            return closed.get() || disconnected.get();
        }

        BrowserContext getContext() {
            return context;
        }

        Page getPage() {
            return page;
        }

        boolean markClosed() {
            return closed.compareAndSet(false, true);
        }

        /**
         * Runs the task on this session's thread and waits for it, or for the timeout when one is given.
         */
        <T> T call(Callable<T> task, Duration timeout) {
            if (Thread.currentThread() == owner) {
                try {
                    return task.call();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException("Browser call failed", e);
                }
            }
            Future<T> future;
            try {
                future = thread.submit(task);
            } catch (RejectedExecutionException e) {
                throw new BrowserSessionClosedException("Browser session " + id + " is shut down", e);
            }
            try {
                return timeout == null ? future.get() : future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new UpstreamTimeoutException("Browser call exceeded " + timeout.toMillis() + "ms", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw new UpstreamUnavailableException("Interrupted while waiting for browser session " + id, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("Browser call failed", cause);
            }
        }

        /**
         * Closes page, context, browser and Playwright on the owner thread, then stops the thread.
         */
        void dispose() {
            try {
                call(() -> {
                    safeClose(page);
                    safeClose(context);
                    safeClose(browser);
                    safeClose(playwright);
                    return null;
                }, DISPOSE_TIMEOUT);
            } catch (RuntimeException e) {
                log.warn("Browser session {} did not close cleanly: {}", id, e.getMessage());
            } finally {
                thread.shutdownNow();
            }
        }

        void addListener(Runnable listener) {
            listeners.add(listener);
            if (disconnected.get() && listeners.remove(listener)) {
                listener.run();
            }
        }

        void fireDisconnect(String reason) {
            if (closed.get() || !disconnected.compareAndSet(false, true)) {
                return;
            }
            log.warn("Browser session {} lost: {}", id, reason);
            for (Runnable listener : listeners) {
                if (listeners.remove(listener)) {
                    try {
                        listener.run();
                    } catch (RuntimeException e) {
                        log.error("Disconnect listener failed for {}: {}", id, e.getMessage());
                    }
                }
            }
        }
    }
}
