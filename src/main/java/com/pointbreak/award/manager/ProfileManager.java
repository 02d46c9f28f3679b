package com.pointbreak.award.manager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pointbreak.award.exception.DeviceNotFoundException;
import com.pointbreak.award.model.Fingerprint;
import com.pointbreak.award.model.profile.UserAgentProfile;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves browser identities from {@code static/devices.json}, round-robin.
 */
@Component
@Slf4j
public class ProfileManager {
    static final String DEVICES_RESOURCE = "static/devices.json";

    private final List<UserAgentProfile> profiles = new ArrayList<>();
    private final AtomicInteger currentIndex = new AtomicInteger(0);

    @PostConstruct
    void init() {
        loadProfiles(DEVICES_RESOURCE);
    }

    void loadProfiles(String resource) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (inputStream == null) {
                throw new IllegalStateException(resource + " not found in classpath.");
            }

            List<UserAgentProfile> deviceList = new ObjectMapper()
                    .readValue(inputStream, new TypeReference<List<UserAgentProfile>>() {});
            profiles.clear();
            profiles.addAll(deviceList);

            log.info("Loaded {} device profiles", deviceList.size());
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to load device profiles from {}", resource, e);
            throw new IllegalStateException("Device profile initialization failed", e);
        }
    }

    public UserAgentProfile getNextProfile() {
        if (profiles.isEmpty()) {
            throw new DeviceNotFoundException("No device profiles loaded");
        }

        int index = currentIndex.getAndUpdate(i -> (i + 1) % profiles.size());
        UserAgentProfile agentProfile = profiles.get(index);

        log.debug("Selected profile index: {}, ID: {}", index, agentProfile.getId());
        return agentProfile;
    }

    public Fingerprint nextFingerprint() {
        return toFingerprint(getNextProfile());
    }

    static Fingerprint toFingerprint(UserAgentProfile profile) {
        Fingerprint.FingerprintBuilder builder = Fingerprint.builder()
                .profileId(profile.getId())
                .userAgent(profile.getUserAgent())
                .platform(profile.getPlatform())
                .locale(profile.getLocale() == null ? "en-US" : profile.getLocale())
                .timeZone(profile.getTimeZone() == null ? "America/New_York" : profile.getTimeZone())
                .hardwareConcurrency(profile.getHardwareConcurrency())
                .headers(getAllHeaders(profile));

        if (profile.getLanguages() != null) {
            builder.languages(profile.getLanguages());
        }
        UserAgentProfile.Viewport viewport = profile.getViewport();
        if (viewport != null && viewport.getWidth() != null && viewport.getHeight() != null) {
            builder.viewportWidth(viewport.getWidth()).viewportHeight(viewport.getHeight());
        } else {
            builder.viewportWidth(1366).viewportHeight(768);
        }
        return builder.build();
    }

    private static Map<String, String> getAllHeaders(UserAgentProfile profile) {
        Map<String, String> all = new LinkedHashMap<>();
        if (profile.getHeaders() == null) {
            return all;
        }
        if (profile.getHeaders().getStandardHeaders() != null) {
            all.putAll(profile.getHeaders().getStandardHeaders());
        }
        if (profile.getHeaders().getClientHintsHeaders() != null) {
            all.putAll(profile.getHeaders().getClientHintsHeaders());
        }
        return all;
    }
}
