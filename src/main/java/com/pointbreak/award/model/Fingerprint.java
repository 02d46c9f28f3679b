package com.pointbreak.award.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Browser identity a session presents upstream. The fast path replays the same values as headers
 * so both paths look like one client.
 */
@Value
@Builder
public class Fingerprint {
    String profileId;
    String userAgent;
    String platform;
    String locale;
    @Singular
    List<String> languages;
    int viewportWidth;
    int viewportHeight;
    String timeZone;
    Integer hardwareConcurrency;
    @Singular
    Map<String, String> headers;

    public String acceptLanguage() {
        if (languages.isEmpty()) {
            return locale;
        }
        return String.join(",", languages);
    }
}
