package com.pointbreak.award.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserAgentProfile {
    private String id;
    private String type;
    private String userAgent;
    private Viewport viewport;
    private String platform;
    private Integer hardwareConcurrency;
    private String timeZone;
    private String locale;
    private List<String> languages;
    private Headers headers;

    // --- Nested Classes ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Viewport {
        private Integer width;
        private Integer height;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Headers {
        private Map<String, String> standardHeaders;
        private Map<String, String> clientHintsHeaders;
    }
}
