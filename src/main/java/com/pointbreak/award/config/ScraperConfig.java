package com.pointbreak.award.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@Data
@Configuration
public class ScraperConfig {
    private final List<String> BROWSER_FLAGS = Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-blink-features=AutomationControlled",
            "--disable-infobars",
            "--disable-extensions",
            "--disable-default-apps",
            "--disable-popup-blocking",
            "--disable-notifications",
            "--mute-audio",
            "--no-first-run",
            "--lang=en-US"
    );

    // ==================== SESSION POOL ====================

    @Value("${scraper.pool.size:2}")
    private int poolSize = 2;

    @Value("${scraper.pool.rotation-threshold:75}")
    private int rotationThreshold = 75;

    @Value("${scraper.pool.lease-timeout-ms:45000}")
    private long leaseTimeoutMs = 45_000;

    @Value("${scraper.pool.warm-on-startup:true}")
    private boolean warmOnStartup = true;

    // ==================== HYDRATION ====================

    @Value("${scraper.hydration.max-attempts:3}")
    private int hydrationMaxAttempts = 3;

    @Value("${scraper.hydration.backoff-ms:2000}")
    private long hydrationBackoffMs = 2_000;

    // ==================== DISPATCH ====================

    @Value("${scraper.dispatch.deadline-ms:40000}")
    private long dispatchDeadlineMs = 40_000;

    // ==================== BROWSER ====================

    @Value("${scraper.browser.headless:true}")
    private boolean headless = true;

    @Value("${scraper.browser.engine:firefox}")
    private String browserEngine = "firefox";

    @Value("${scraper.browser.navigation-timeout-ms:60000}")
    private long navigationTimeoutMs = 60_000;

    // ==================== UPSTREAM ====================

    @Value("${scraper.upstream.api-url:https://www.aa.com/booking/api/search/itinerary}")
    private String apiUrl = "https://www.aa.com/booking/api/search/itinerary";

    @Value("${scraper.upstream.booking-url:https://www.aa.com/booking/choose-flights/1}")
    private String bookingUrl = "https://www.aa.com/booking/choose-flights/1";

    @Value("${scraper.upstream.origin:https://www.aa.com}")
    private String upstreamOrigin = "https://www.aa.com";

    public Duration getLeaseTimeout() {
        return Duration.ofMillis(leaseTimeoutMs);
    }

    public Duration getDispatchDeadline() {
        return Duration.ofMillis(dispatchDeadlineMs);
    }
}
