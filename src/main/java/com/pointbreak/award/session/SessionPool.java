package com.pointbreak.award.session;

import com.pointbreak.award.config.ScraperConfig;
import com.pointbreak.award.enums.ReleaseOutcome;
import com.pointbreak.award.enums.SessionState;
import com.pointbreak.award.exception.BrowserSessionClosedException;
import com.pointbreak.award.exception.HydrationFailedException;
import com.pointbreak.award.exception.PoolExhaustedException;
import com.pointbreak.award.interfaces.BrowserProvider;
import com.pointbreak.award.model.SessionCookie;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the authenticated upstream sessions.
 * <p>
 * Sessions live in an arena of slots keyed by id. A replacement is always hydrated into a fresh
 * slot, so a slot that has been handed out is never rewritten underneath its borrower. Leases are
 * served in arrival order: while anyone is queued, a released session goes to the oldest waiter
 * instead of back to the ready queue.
 * <p>
 * Every mutation of a session (state, usage, cookies) happens under {@link #lock} inside
 * {@link #lease}, {@link #release}, {@link #mergeCookies} or the hydration/crash callbacks.
 */
@Slf4j
@Component
public class SessionPool {

    private final ScraperConfig config;
    private final SessionHydrator hydrator;
    private final BrowserProvider browserProvider;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Integer, SessionHandle> slots = new LinkedHashMap<>();
    private final Deque<SessionHandle> ready = new ArrayDeque<>();
    private final Deque<CompletableFuture<SessionHandle>> waiters = new ArrayDeque<>();
    private final AtomicInteger nextSlotId = new AtomicInteger(1);
    private final AtomicLong retiredTotal = new AtomicLong();
    private int warming;
    private boolean shutdown;

    private final ExecutorService hydrationExecutor = Executors.newCachedThreadPool(daemon("session-hydrator"));
    private final ExecutorService retirementExecutor = Executors.newSingleThreadExecutor(daemon("session-retirer"));

    public SessionPool(ScraperConfig config, SessionHydrator hydrator, BrowserProvider browserProvider) {
        this.config = config;
        this.hydrator = hydrator;
        this.browserProvider = browserProvider;
    }

    @PostConstruct
    void start() {
        if (!config.isWarmOnStartup()) {
            log.info("Session pool created cold (size={}, rotationThreshold={})",
                    config.getPoolSize(), config.getRotationThreshold());
            return;
        }
        log.info("Warming session pool (size={}, rotationThreshold={})",
                config.getPoolSize(), config.getRotationThreshold());
        lock.lock();
        try {
            topUpLocked();
        } finally {
            lock.unlock();
        }
    }

    // ==================== HYDRATION ====================

    /**
     * Runs the warm-up flow (with retry and backoff) into a fresh slot and publishes the result.
     * The returned session is Ready, unless a queued lease claimed it on publication.
     *
     * @throws HydrationFailedException once every attempt has failed
     */
    public SessionHandle hydrate() {
        lock.lock();
        try {
            ensureOpenLocked();
            warming++;
        } finally {
            lock.unlock();
        }
        return hydrateIntoFreshSlot();
    }

    private SessionHandle hydrateIntoFreshSlot() {
        SessionHandle handle = null;
        HydrationFailedException failure = null;
        try {
            handle = hydrateWithRetry();
        } catch (HydrationFailedException e) {
            failure = e;
        }

        boolean discard = false;
        boolean lostBeforePublish = false;
        lock.lock();
        try {
            warming--;
            if (handle != null && shutdown) {
                discard = true;
            } else if (handle != null) {
                slots.put(handle.getSlotId(), handle);
                if (handle.isCrashSignalled()) {
                    lostBeforePublish = true;
                    degradeLocked(handle, "browser disconnected before publication");
                } else {
                    log.info("Hydrated {} (profile={}, cookies={})", handle,
                            handle.getFingerprint().getProfileId(), handle.cookies().size());
                    offerLocked(handle);
                }
            } else if (warming == 0 && liveCountLocked() == 0 && !waiters.isEmpty()) {
                failWaitersLocked(new PoolExhaustedException("No upstream session could be established", failure));
            }
        } finally {
            lock.unlock();
        }

        if (discard) {
            closeQuietly(handle);
            throw new PoolExhaustedException("Session pool is shut down");
        }
        if (lostBeforePublish) {
            throw new HydrationFailedException("Browser disconnected before " + handle + " was published");
        }
        if (failure != null) {
            throw failure;
        }
        return handle;
    }

    private SessionHandle hydrateWithRetry() {
        int maxAttempts = Math.max(1, config.getHydrationMaxAttempts());
        RuntimeException lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                HydratedSession hydrated = hydrator.hydrate();
                SessionHandle handle = new SessionHandle(nextSlotId.getAndIncrement(), hydrated);
                browserProvider.onDisconnect(hydrated.browserSession(), () -> onBrowserDisconnected(handle));
                if (handle.isCrashSignalled()) {
                    closeQuietly(handle);
                    throw new BrowserSessionClosedException("Browser session " + hydrated.browserSession().getId()
                            + " disconnected during hydration");
                }
                return handle;
            } catch (RuntimeException e) {
                lastException = e;
                log.warn("Hydration attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    backoffBeforeRetry(attempt);
                }
            }
        }

        log.error("Hydration failed after {} attempts", maxAttempts);
        throw new HydrationFailedException("Hydration failed after " + maxAttempts + " attempts", lastException);
    }

    private void backoffBeforeRetry(int attempt) {
        long backoffMs = config.getHydrationBackoffMs() * attempt;
        if (backoffMs <= 0) {
            return;
        }
        try {
            log.debug("Waiting {}ms before next hydration attempt", backoffMs);
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new HydrationFailedException("Hydration interrupted during backoff", ie);
        }
    }

    private void spawnHydrationLocked() {
        warming++;
        try {
            hydrationExecutor.execute(() -> {
                try {
                    hydrateIntoFreshSlot();
                } catch (HydrationFailedException | PoolExhaustedException e) {
                    log.error("Background hydration failed: {}", e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            warming--;
            log.warn("Hydration executor rejected task: {}", e.getMessage());
        }
    }

    // keeps live + warming at the configured size
    private void topUpLocked() {
        int missing = config.getPoolSize() - liveCountLocked() - warming;
        for (int i = 0; i < missing; i++) {
            spawnHydrationLocked();
        }
    }

    // ==================== LEASE / RELEASE ====================

    public SessionHandle lease() {
        return lease(config.getLeaseTimeout());
    }

    /**
     * Hands out a Ready session as Busy, waiting in FIFO order if none is free.
     *
     * @throws PoolExhaustedException if nothing became available within the timeout
     */
    public SessionHandle lease(Duration timeout) {
        CompletableFuture<SessionHandle> ticket;
        lock.lock();
        try {
            ensureOpenLocked();
            if (waiters.isEmpty()) {
                SessionHandle handle = ready.pollFirst();
                if (handle != null) {
                    handle.setState(SessionState.BUSY);
                    log.debug("Leased {}", handle);
                    return handle;
                }
            }
            ticket = new CompletableFuture<>();
            waiters.addLast(ticket);
            topUpLocked();
            log.debug("Lease queued (waiting={}, warming={})", waiters.size(), warming);
        } finally {
            lock.unlock();
        }
        return awaitTicket(ticket, timeout);
    }

    SessionHandle awaitTicket(CompletableFuture<SessionHandle> ticket, Duration timeout) {
        try {
            return ticket.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (abandonTicket(ticket)) {
                log.warn("Lease timed out after {}ms", timeout.toMillis());
                throw new PoolExhaustedException("No upstream session became available within " + timeout.toMillis() + "ms");
            }
            // handed over between the timeout and the abandon
            return ticket.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!abandonTicket(ticket) && !ticket.isCompletedExceptionally()) {
                handBack(ticket.join());
            }
            throw new PoolExhaustedException("Interrupted while waiting for an upstream session", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof PoolExhaustedException exhausted) {
                throw exhausted;
            }
            throw new PoolExhaustedException("Lease failed", e.getCause());
        }
    }

    private boolean abandonTicket(CompletableFuture<SessionHandle> ticket) {
        lock.lock();
        try {
            return waiters.remove(ticket);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a leased session. Usage always grows by one. Rejected or crashed sessions, and
     * sessions that reached the rotation threshold, are degraded and replaced in the background.
     */
    public void release(SessionHandle handle, ReleaseOutcome outcome) {
        lock.lock();
        try {
            requireLeasedLocked(handle);
            int uses = handle.incrementUsage();

            String degradeReason = null;
            if (outcome.isFatal()) {
                degradeReason = "outcome " + outcome;
            } else if (handle.isCrashSignalled()) {
                degradeReason = "browser disconnected while leased";
            } else if (uses >= config.getRotationThreshold()) {
                degradeReason = "rotation threshold " + config.getRotationThreshold() + " reached";
            }

            if (degradeReason != null) {
                degradeLocked(handle, degradeReason);
            } else {
                log.debug("Released {} ({})", handle, outcome);
                offerLocked(handle);
            }
        } finally {
            lock.unlock();
        }
    }

    // returns a session that was handed over but never used, without counting a use
    private void handBack(SessionHandle handle) {
        lock.lock();
        try {
            requireLeasedLocked(handle);
            if (handle.isCrashSignalled()) {
                degradeLocked(handle, "browser disconnected while leased");
            } else {
                log.debug("Handed back unused {}", handle);
                offerLocked(handle);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Folds cookies refreshed by the browser path into a leased session's jar.
     */
    public void mergeCookies(SessionHandle handle, List<SessionCookie> cookies) {
        lock.lock();
        try {
            requireLeasedLocked(handle);
            int changed = handle.mergeCookies(cookies);
            log.debug("Merged cookies into {} ({} changed)", handle, changed);
        } finally {
            lock.unlock();
        }
    }

    private void requireLeasedLocked(SessionHandle handle) {
        if (handle == null || slots.get(handle.getSlotId()) != handle || handle.getState() != SessionState.BUSY) {
            throw new IllegalStateException("Session is not leased from this pool: " + handle);
        }
    }

    private void offerLocked(SessionHandle handle) {
        CompletableFuture<SessionHandle> waiter;
        while ((waiter = waiters.pollFirst()) != null) {
            handle.setState(SessionState.BUSY);
            if (waiter.complete(handle)) {
                log.debug("Handed {} to queued lease", handle);
                return;
            }
        }
        handle.setState(SessionState.READY);
        ready.addLast(handle);
    }

    private void failWaitersLocked(RuntimeException cause) {
        CompletableFuture<SessionHandle> waiter;
        while ((waiter = waiters.pollFirst()) != null) {
            waiter.completeExceptionally(cause);
        }
    }

    // ==================== DEGRADE / RETIRE ====================

    private void onBrowserDisconnected(SessionHandle handle) {
        lock.lock();
        try {
            if (slots.get(handle.getSlotId()) != handle) {
                // not published yet; hydration checks the flag before offering it
                if (handle.getState() == SessionState.WARMING) {
                    handle.signalCrash();
                }
                return;
            }
            if (handle.getState() == SessionState.READY) {
                degradeLocked(handle, "browser disconnected");
            } else if (handle.getState() == SessionState.BUSY) {
                log.warn("Browser disconnected under leased {}", handle);
                handle.signalCrash();
            }
        } finally {
            lock.unlock();
        }
    }

    private void degradeLocked(SessionHandle handle, String reason) {
        handle.setState(SessionState.DEGRADED);
        ready.remove(handle);
        log.info("Degraded {}: {}", handle, reason);

        if (!shutdown) {
            topUpLocked();
            try {
                retirementExecutor.execute(() -> retire(handle));
            } catch (RejectedExecutionException e) {
                log.warn("Retirement executor rejected {}: {}", handle, e.getMessage());
            }
        }
    }

    private void retire(SessionHandle handle) {
        closeQuietly(handle);
        lock.lock();
        try {
            handle.setState(SessionState.RETIRED);
            if (slots.remove(handle.getSlotId(), handle)) {
                retiredTotal.incrementAndGet();
            }
        } finally {
            lock.unlock();
        }
        log.info("Retired {}", handle);
    }

    private void closeQuietly(SessionHandle handle) {
        try {
            browserProvider.close(handle.getBrowserSession());
        } catch (RuntimeException e) {
            log.warn("Failed to close browser session for {}: {}", handle, e.getMessage());
        }
    }

    // ==================== INTROSPECTION ====================

    public PoolStats stats() {
        lock.lock();
        try {
            int readyCount = 0;
            int busy = 0;
            int degraded = 0;
            for (SessionHandle handle : slots.values()) {
                switch (handle.getState()) {
                    case READY -> readyCount++;
                    case BUSY -> busy++;
                    case DEGRADED -> degraded++;
                    default -> { }
                }
            }
            return new PoolStats(warming, readyCount, busy, degraded, retiredTotal.get(), waiters.size());
        } finally {
            lock.unlock();
        }
    }

    public boolean isHealthy() {
        return stats().isHealthy();
    }

    private int liveCountLocked() {
        int live = 0;
        for (SessionHandle handle : slots.values()) {
            if (handle.getState() == SessionState.READY || handle.getState() == SessionState.BUSY) {
                live++;
            }
        }
        return live;
    }

    private void ensureOpenLocked() {
        if (shutdown) {
            throw new PoolExhaustedException("Session pool is shut down");
        }
    }

    // ==================== SHUTDOWN ====================

    @PreDestroy
    public void shutdown() {
        List<SessionHandle> toClose;
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            failWaitersLocked(new PoolExhaustedException("Session pool is shut down"));
            toClose = new ArrayList<>(slots.values());
            toClose.forEach(h -> h.setState(SessionState.RETIRED));
            slots.clear();
            ready.clear();
        } finally {
            lock.unlock();
        }

        log.info("Shutting down session pool ({} sessions)", toClose.size());
        hydrationExecutor.shutdownNow();
        retirementExecutor.shutdown();
        toClose.forEach(this::closeQuietly);
        try {
            if (!retirementExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                retirementExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            retirementExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemon(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
