package com.pointbreak.award.service;

import com.pointbreak.award.enums.ReleaseOutcome;
import com.pointbreak.award.exception.BrowserSessionClosedException;
import com.pointbreak.award.exception.UpstreamFailureException;
import com.pointbreak.award.exception.UpstreamRejectedException;
import com.pointbreak.award.exception.UpstreamTimeoutException;
import com.pointbreak.award.exception.UpstreamUnavailableException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * One fast-path-then-fallback run over a leased session.
 * <pre>
 * ATTEMPTING_FAST --ok--------------------------> DONE
 * ATTEMPTING_FAST --rejected--> ATTEMPTING_FALLBACK --ok--> DONE
 * ATTEMPTING_FAST --timeout/failure-------------> FAILED
 * ATTEMPTING_FALLBACK --any failure--------------> FAILED
 * </pre>
 * The fallback runs at most once. {@link #getOutcome()} tells the pool how to release the session.
 */
@Slf4j
public class DispatchAttempt<T> {

    public enum State {
        ATTEMPTING_FAST,
        ATTEMPTING_FALLBACK,
        DONE,
        FAILED
    }

    private final String label;
    private final Supplier<T> fastPath;
    private final Supplier<T> fallbackPath;

    @Getter
    private State state = State.ATTEMPTING_FAST;
    @Getter
    private int fallbackAttempts;
    private ReleaseOutcome outcome;
    private T result;
    private RuntimeException failure;

    public DispatchAttempt(String label, Supplier<T> fastPath, Supplier<T> fallbackPath) {
        this.label = label;
        this.fastPath = fastPath;
        this.fallbackPath = fallbackPath;
    }

    public T run() {
        if (state != State.ATTEMPTING_FAST) {
            throw new IllegalStateException("Dispatch attempt already ran: " + state);
        }
        while (true) {
            switch (state) {
                case ATTEMPTING_FAST -> attemptFast();
                case ATTEMPTING_FALLBACK -> attemptFallback();
                case DONE -> {
                    return result;
                }
                case FAILED -> throw failure;
            }
        }
    }

    /**
     * How the session should be released. A run that never finished counts as a plain failure.
     */
    public ReleaseOutcome getOutcome() {
        return outcome == null ? ReleaseOutcome.FAILED : outcome;
    }

    private void attemptFast() {
        try {
            complete(fastPath.get());
        } catch (UpstreamRejectedException e) {
            log.info("[{}] fast path rejected (HTTP {}, {}), falling back to browser", label, e.getStatus(), e.getKind());
            state = State.ATTEMPTING_FALLBACK;
        } catch (UpstreamTimeoutException e) {
            log.warn("[{}] fast path timed out: {}", label, e.getMessage());
            fail(ReleaseOutcome.TIMEOUT, e);
        } catch (UpstreamFailureException e) {
            log.warn("[{}] fast path failed: {}", label, e.getMessage());
            fail(ReleaseOutcome.FAILED, e);
        } catch (RuntimeException e) {
            log.error("[{}] fast path error", label, e);
            fail(ReleaseOutcome.FAILED, e);
        }
    }

    private void attemptFallback() {
        fallbackAttempts++;
        try {
            complete(fallbackPath.get());
            log.info("[{}] fallback succeeded", label);
        } catch (UpstreamTimeoutException e) {
            log.warn("[{}] fallback timed out: {}", label, e.getMessage());
            fail(ReleaseOutcome.TIMEOUT, e);
        } catch (BrowserSessionClosedException e) {
            log.error("[{}] browser session lost during fallback: {}", label, e.getMessage());
            fail(ReleaseOutcome.CRASHED, new UpstreamUnavailableException("Browser session lost during fallback", e));
        } catch (RuntimeException e) {
            log.error("[{}] fallback failed: {}", label, e.getMessage());
            fail(ReleaseOutcome.REJECTED, new UpstreamUnavailableException("Upstream rejected both fast path and fallback", e));
        }
    }

    private void complete(T value) {
        result = value;
        outcome = ReleaseOutcome.SUCCESS;
        state = State.DONE;
    }

    private void fail(ReleaseOutcome releaseOutcome, RuntimeException cause) {
        outcome = releaseOutcome;
        failure = cause;
        state = State.FAILED;
    }
}
