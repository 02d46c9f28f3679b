package com.pointbreak.award.service;

import com.pointbreak.award.config.ScraperConfig;
import com.pointbreak.award.enums.RejectionKind;
import com.pointbreak.award.exception.UpstreamRejectedException;
import com.pointbreak.award.exception.UpstreamTimeoutException;
import com.pointbreak.award.exception.UpstreamUnavailableException;
import com.pointbreak.award.model.Fingerprint;
import com.pointbreak.award.model.UpstreamResponse;
import okhttp3.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OkHttpSyntheticClientTest {

    private static final String URL = "https://www.aa.com/booking/api/search/itinerary";
    private static final MediaType JSON = MediaType.get("application/json");
    private static final MediaType HTML = MediaType.get("text/html");

    private final Fingerprint fingerprint = Fingerprint.builder()
            .profileId("p1")
            .userAgent("Mozilla/5.0 (Test)")
            .locale("en-US")
            .build();

    private final AtomicReference<Request> lastRequest = new AtomicReference<>();
    private Interceptor canned;
    private OkHttpSyntheticClient client;

    @BeforeEach
    void setUp() {
        OkHttpClient base = new OkHttpClient.Builder()
                .addInterceptor(chain -> canned.intercept(chain))
                .build();
        client = new OkHttpSyntheticClient(base, new ScraperConfig());
    }

    /* -------------------------- Helpers -------------------------- */

    private void respond(int code, byte[] body, MediaType type, String encoding) {
        canned = chain -> {
            lastRequest.set(chain.request());
            Response.Builder builder = new Response.Builder()
                    .request(chain.request())
                    .protocol(Protocol.HTTP_1_1)
                    .code(code)
                    .message("canned")
                    .body(ResponseBody.create(body, type));
            if (encoding != null) {
                builder.header("Content-Encoding", encoding);
            }
            return builder.build();
        };
    }

    private void respond(int code, String body, MediaType type) {
        respond(code, body.getBytes(StandardCharsets.UTF_8), type, null);
    }

    private UpstreamResponse post() {
        return client.postJson(URL, "{\"q\":1}", "sid=abc", fingerprint, Duration.ofSeconds(5));
    }

    private static byte[] gzip(String text) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }

    /* ========================= TESTS ========================= */

    @Nested
    @DisplayName("successful responses")
    class Success {

        @Test
        void postJson_jsonBody_returned() {
            respond(200, "{\"slices\":[]}", JSON);

            UpstreamResponse response = post();

            assertThat(response.getStatus()).isEqualTo(200);
            assertThat(response.getBody()).isEqualTo("{\"slices\":[]}");
            assertThat(lastRequest.get().method()).isEqualTo("POST");
            assertThat(lastRequest.get().url().toString()).isEqualTo(URL);
        }

        @Test
        void postJson_gzipBody_decoded() throws IOException {
            respond(200, gzip("{\"slices\":[{\"hash\":\"h1\"}]}"), JSON, "gzip");

            assertThat(post().getBody()).contains("\"h1\"");
        }
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @ParameterizedTest
        @CsvSource({"401,AUTHENTICATION", "403,AUTHENTICATION", "419,AUTHENTICATION", "429,RATE_LIMITED"})
        void postJson_rejectedStatus(int status, RejectionKind kind) {
            respond(status, "{}", JSON);

            assertThatThrownBy(OkHttpSyntheticClientTest.this::post)
                    .isInstanceOfSatisfying(UpstreamRejectedException.class, e -> {
                        assertThat(e.getStatus()).isEqualTo(status);
                        assertThat(e.getKind()).isEqualTo(kind);
                    });
        }

        @Test
        @DisplayName("HTML page behind a 200 is a challenge")
        void postJson_htmlChallenge() {
            respond(200, "<!DOCTYPE html><html>verify you are human</html>", HTML);

            assertThatThrownBy(OkHttpSyntheticClientTest.this::post)
                    .isInstanceOfSatisfying(UpstreamRejectedException.class,
                            e -> assertThat(e.getKind()).isEqualTo(RejectionKind.CHALLENGE));
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void postJson_serverError_unavailable() {
            respond(500, "oops", HTML);

            assertThatThrownBy(OkHttpSyntheticClientTest.this::post)
                    .isInstanceOf(UpstreamUnavailableException.class)
                    .hasMessageContaining("500");
        }

        @Test
        void postJson_emptyBody_unavailable() {
            respond(200, "", JSON);

            assertThatThrownBy(OkHttpSyntheticClientTest.this::post)
                    .isInstanceOf(UpstreamUnavailableException.class);
        }

        @Test
        void postJson_socketTimeout_timeout() {
            canned = chain -> {
                throw new SocketTimeoutException("read timed out");
            };

            assertThatThrownBy(OkHttpSyntheticClientTest.this::post)
                    .isInstanceOf(UpstreamTimeoutException.class);
        }

        @Test
        void postJson_connectionFailure_unavailable() {
            canned = chain -> {
                throw new IOException("connection reset");
            };

            assertThatThrownBy(OkHttpSyntheticClientTest.this::post)
                    .isInstanceOf(UpstreamUnavailableException.class)
                    .hasMessageContaining("connection reset");
        }
    }
}
