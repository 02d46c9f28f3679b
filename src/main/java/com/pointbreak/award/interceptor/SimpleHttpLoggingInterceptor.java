package com.pointbreak.award.interceptor;

import okhttp3.*;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Logs method, url, status and timing. The body is left unread for the caller.
 */
@Slf4j
public class SimpleHttpLoggingInterceptor implements Interceptor {

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();

        log.info("→ {} {}", request.method(), request.url());

        long startNs = System.nanoTime();
        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.error("← FAILED {} after {}ms: {}", request.url().encodedPath(), totalMs, e.getMessage());
            throw e;
        }

        long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        ResponseBody body = response.body();

        log.info("← {} {} | Total: {}ms | Encoding: {} | Size: {} bytes",
                response.code(),
                request.url().encodedPath(),
                totalMs,
                response.header("Content-Encoding", "identity"),
                body != null ? body.contentLength() : -1);

        return response;
    }
}
