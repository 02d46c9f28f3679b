package com.pointbreak.award.session;

/**
 * Runs a single out-of-band warm-up attempt. Retries are the pool's business.
 */
@FunctionalInterface
public interface SessionHydrator {

    /**
     * @throws com.pointbreak.award.exception.HydrationFailedException if no usable session could be established
     */
    HydratedSession hydrate();
}
