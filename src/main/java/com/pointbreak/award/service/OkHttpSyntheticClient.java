package com.pointbreak.award.service;

import com.pointbreak.award.config.ScraperConfig;
import com.pointbreak.award.enums.RejectionKind;
import com.pointbreak.award.exception.UpstreamRejectedException;
import com.pointbreak.award.exception.UpstreamTimeoutException;
import com.pointbreak.award.exception.UpstreamUnavailableException;
import com.pointbreak.award.interceptor.HeadersInterceptor;
import com.pointbreak.award.interfaces.SyntheticHttpClient;
import com.pointbreak.award.model.Fingerprint;
import com.pointbreak.award.model.UpstreamResponse;
import com.pointbreak.award.utils.DecompressionUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * Fast path: replays a harvested session over plain HTTP.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OkHttpSyntheticClient implements SyntheticHttpClient {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient okHttpClient;
    private final ScraperConfig scraperConfig;

    @Override
    public UpstreamResponse postJson(String url, String jsonBody, String cookieHeader,
                                     Fingerprint fingerprint, Duration timeout) {
        OkHttpClient client = okHttpClient.newBuilder()
                .callTimeout(timeout)
                .addInterceptor(new HeadersInterceptor(fingerprint, cookieHeader,
                        scraperConfig.getBookingUrl(), scraperConfig.getUpstreamOrigin()))
                .build();

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(jsonBody, JSON))
                .build();

        long requestStart = System.currentTimeMillis();
        try (okhttp3.Response response = client.newCall(request).execute()) {
            int status = response.code();
            long requestDuration = System.currentTimeMillis() - requestStart;

            RejectionKind rejection = RejectionKind.fromStatus(status);
            if (rejection != null) {
                log.warn("Upstream rejected synthetic request: HTTP {} ({}) after {}ms", status, rejection, requestDuration);
                throw new UpstreamRejectedException(status, rejection);
            }
            if (status < 200 || status >= 300) {
                log.warn("HTTP {} for {} (took {}ms)", status, url, requestDuration);
                throw new UpstreamUnavailableException("Upstream returned HTTP " + status);
            }

            String body = DecompressionUtil.decompressResponse(response);
            return classifyBody(status, body);
        } catch (InterruptedIOException e) {
            log.warn("Synthetic request timed out after {}ms", System.currentTimeMillis() - requestStart);
            throw new UpstreamTimeoutException("Upstream did not answer within " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            log.warn("Synthetic request failed: {}", e.getMessage());
            throw new UpstreamUnavailableException("Upstream request failed: " + e.getMessage(), e);
        }
    }

    /**
     * A 2xx whose body is not a JSON object is the anti-bot interstitial, not data.
     */
    static UpstreamResponse classifyBody(int status, String body) {
        String trimmed = body == null ? "" : body.trim();
        if (trimmed.isEmpty()) {
            throw new UpstreamUnavailableException("Upstream returned an empty body");
        }
        if (!trimmed.startsWith("{")) {
            log.warn("Upstream returned a non-JSON body, treating as challenge");
            throw new UpstreamRejectedException(status, RejectionKind.CHALLENGE);
        }
        return new UpstreamResponse(status, trimmed);
    }
}
