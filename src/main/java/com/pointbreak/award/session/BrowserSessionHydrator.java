package com.pointbreak.award.session;

import com.pointbreak.award.config.ScraperConfig;
import com.pointbreak.award.exception.HydrationFailedException;
import com.pointbreak.award.interfaces.BrowserProvider;
import com.pointbreak.award.interfaces.BrowserSession;
import com.pointbreak.award.manager.ProfileManager;
import com.pointbreak.award.model.Fingerprint;
import com.pointbreak.award.model.SessionCookie;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Warm-up flow: pick a fingerprint, load the booking page, harvest the cookies it sets.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BrowserSessionHydrator implements SessionHydrator {

    private final ScraperConfig scraperConfig;
    private final ProfileManager profileManager;
    private final BrowserProvider browserProvider;

    @Override
    public HydratedSession hydrate() {
        Fingerprint fingerprint = profileManager.nextFingerprint();
        log.info("Hydrating session with profile {}", fingerprint.getProfileId());

        BrowserSession browserSession;
        try {
            browserSession = browserProvider.navigate(scraperConfig.getBookingUrl(), fingerprint);
        } catch (RuntimeException e) {
            throw new HydrationFailedException("Could not open booking page: " + e.getMessage(), e);
        }

        try {
            List<SessionCookie> cookies = browserProvider.readCookies(browserSession);
            if (cookies.isEmpty()) {
                throw new HydrationFailedException("Booking page set no cookies");
            }
            log.info("Harvested {} cookies with profile {}", cookies.size(), fingerprint.getProfileId());
            return new HydratedSession(browserSession, fingerprint, cookies);
        } catch (RuntimeException e) {
            closeQuietly(browserSession);
            if (e instanceof HydrationFailedException) {
                throw e;
            }
            throw new HydrationFailedException("Could not read session cookies: " + e.getMessage(), e);
        }
    }

    private void closeQuietly(BrowserSession browserSession) {
        try {
            browserProvider.close(browserSession);
        } catch (RuntimeException e) {
            log.warn("Failed to close browser session {}: {}", browserSession.getId(), e.getMessage());
        }
    }
}
