package com.pointbreak.award.interceptor;

import com.pointbreak.award.model.Fingerprint;
import lombok.RequiredArgsConstructor;
import okhttp3.Interceptor;
import okhttp3.Request;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * Makes a synthetic request carry the same identity as the browser session it replays.
 */
@RequiredArgsConstructor
public class HeadersInterceptor implements Interceptor {
    private static final Set<String> RESERVED = Set.of("cookie", "user-agent", "accept-encoding", "content-length", "host");

    private final Fingerprint fingerprint;
    private final String cookieHeader;
    private final String referer;
    private final String origin;

    @Override
    public okhttp3.Response intercept(Interceptor.Chain chain) throws IOException {
        Request original = chain.request();

        Request.Builder builder = original.newBuilder();

        // profile headers first so the fixed ones below win
        fingerprint.getHeaders().forEach((key, value) -> {
            if (!RESERVED.contains(key.toLowerCase(Locale.ROOT))) {
                builder.header(key, value);
            }
        });

        builder.header("User-Agent", fingerprint.getUserAgent() != null ? fingerprint.getUserAgent() : "Mozilla/5.0")
                .header("Accept", "application/json, text/plain, */*")
                .header("Accept-Language", fingerprint.acceptLanguage())
                .header("Accept-Encoding", "gzip, deflate, br")
                .header("Content-Type", "application/json")
                .header("Origin", origin)
                .header("Referer", referer)
                .header("Sec-Fetch-Dest", "empty")
                .header("Sec-Fetch-Mode", "cors")
                .header("Sec-Fetch-Site", "same-origin")
                .header("Connection", "keep-alive");

        if (cookieHeader != null && !cookieHeader.isEmpty()) {
            builder.header("Cookie", cookieHeader);
        }

        return chain.proceed(builder.build());
    }
}
