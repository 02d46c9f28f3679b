package com.pointbreak.award.config;

import com.pointbreak.award.interceptor.SimpleHttpLoggingInterceptor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class HttpClientConfig {
    private static final long IO_TIMEOUT_MS = 30_000;

    @Bean(destroyMethod = "")
    public OkHttpClient okHttpClient() {
        log.info("Creating shared OkHttp client");
        return new OkHttpClient.Builder()
                .connectionPool(new ConnectionPool(20, 5, TimeUnit.MINUTES))
                .connectTimeout(IO_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .readTimeout(IO_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .writeTimeout(IO_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .followRedirects(true)
                .followSslRedirects(true)
                .retryOnConnectionFailure(true)
                .addInterceptor(new SimpleHttpLoggingInterceptor())
                .build();
    }

    /**
     * Registered as a separate bean so the shared client is torn down with the context.
     */
    @Bean
    public OkHttpClientCloser okHttpClientCloser(OkHttpClient okHttpClient) {
        return new OkHttpClientCloser(okHttpClient);
    }

    @Slf4j
    public static class OkHttpClientCloser implements AutoCloseable {
        private final OkHttpClient client;

        OkHttpClientCloser(OkHttpClient client) {
            this.client = client;
        }

        @Override
        public void close() {
            try {
                client.connectionPool().evictAll();
                client.dispatcher().executorService().shutdown();
                if (client.cache() != null) {
                    client.cache().close();
                }
                log.info("OkHttp client shut down");
            } catch (Exception e) {
                log.debug("Error shutting down OkHttp client: {}", e.getMessage());
            }
        }
    }
}
