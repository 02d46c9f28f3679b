package com.pointbreak.award.utils;

/**
 * Script evaluated inside the booking page for the browser fallback. Resolves to
 * {@code {status, body}} on any HTTP response, or {@code {error, name}} when the fetch itself fails.
 * An abort after {@code args.timeoutMs} reports {@code name = "AbortError"}.
 */
public final class InPageFetchScript {

    public static final String ABORT_ERROR = "AbortError";

    public static final String SCRIPT = """
            async (args) => {
                const controller = new AbortController();
                const timer = setTimeout(() => controller.abort(), args.timeoutMs);
                try {
                    const response = await fetch(args.url, {
                        method: 'POST',
                        credentials: args.credentials,
                        signal: controller.signal,
                        headers: {
                            'accept': 'application/json, text/plain, */*',
                            'content-type': 'application/json'
                        },
                        body: args.body
                    });
                    const text = await response.text();
                    return { status: response.status, body: text };
                } catch (e) {
                    return { error: String(e && e.message ? e.message : e), name: e && e.name ? e.name : 'Error' };
                } finally {
                    clearTimeout(timer);
                }
            }
            """;

    private InPageFetchScript() {
    }
}
