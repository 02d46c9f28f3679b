package com.pointbreak.award.utils;

import com.google.gson.Gson;
import com.pointbreak.award.model.Fingerprint;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Init script that aligns navigator properties with the fingerprint a context was opened with.
 */
public final class StealthScriptBuilder {
    private static final Gson GSON = new Gson();

    private StealthScriptBuilder() {
    }

    public static String build(Fingerprint fingerprint) {
        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("platform", fingerprint.getPlatform());
        profile.put("languages", fingerprint.getLanguages().isEmpty()
                ? new String[]{fingerprint.getLocale()}
                : fingerprint.getLanguages());
        profile.put("hardwareConcurrency", fingerprint.getHardwareConcurrency() == null ? 8 : fingerprint.getHardwareConcurrency());

        return String.format("""
        const profile = %s;

        Object.defineProperty(navigator, 'webdriver', {
            get: () => undefined,
            configurable: true
        });

        if (profile.platform) {
            Object.defineProperty(navigator, 'platform', {
                get: () => profile.platform,
                configurable: true
            });
        }

        Object.defineProperty(navigator, 'languages', {
            get: () => profile.languages,
            configurable: true
        });

        Object.defineProperty(navigator, 'hardwareConcurrency', {
            get: () => profile.hardwareConcurrency,
            configurable: true
        });

        const originalQuery = window.navigator.permissions && window.navigator.permissions.query;
        if (originalQuery) {
            window.navigator.permissions.query = (parameters) => (
                parameters.name === 'notifications'
                    ? Promise.resolve({ state: Notification.permission })
                    : originalQuery(parameters)
            );
        }
        """, GSON.toJson(profile));
    }
}
