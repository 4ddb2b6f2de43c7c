package com.bcnjobs.tracker.scrape.http;

import com.bcnjobs.tracker.config.TrackerProperties;
import com.bcnjobs.tracker.scrape.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Shared HTTP client for all sources. Requests to one host are serialized and spaced by
 * {@code tracker.per-host-delay-ms}; failures come back as {@link HttpFetchResult} error codes,
 * never as exceptions.
 *
 * <p>Timeouts, I/O errors, 408, 429 and 5xx responses are retried up to
 * {@code tracker.request-max-retries} times with jittered exponential delay. A 403 or 429 pushes
 * the host's next slot out by {@link #THROTTLE_PAUSE}.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    static final Duration THROTTLE_PAUSE = Duration.ofSeconds(30);
    private static final String JSON = "application/json";

    private final TrackerProperties properties;
    private final HttpClient client;
    private final Semaphore inFlight;
    private final Map<String, HostSlot> hosts = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        TrackerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.inFlight = new Semaphore(properties.getGlobalConcurrency());
        this.client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(timeout())
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return withRetries(url, "GET", acceptHeader, null);
    }

    public HttpFetchResult postJson(String url, String jsonBody, String acceptHeader) {
        return withRetries(url, "POST", acceptHeader, jsonBody == null ? "{}" : jsonBody);
    }

    private HttpFetchResult withRetries(String url, String method, String acceptHeader, String body) {
        int retriesLeft = properties.getRequestMaxRetries();
        int attempt = 0;
        while (true) {
            attempt++;
            HttpFetchResult result = attempt(url, method, acceptHeader, body);
            if (retriesLeft-- <= 0 || !isRetryable(result)) {
                return result;
            }
            log.debug("{} {} attempt {} gave {}, retrying", method, url, attempt, outcome(result));
            if (!pauseBeforeRetry(attempt)) {
                return result;
            }
        }
    }

    private HttpFetchResult attempt(String url, String method, String acceptHeader, String body) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return HttpFetchResult.failure(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        HostSlot slot = hosts.computeIfAbsent(uri.getHost().toLowerCase(Locale.ROOT), HostSlot::new);
        try {
            inFlight.acquire();
            try {
                slot.enter(properties.getPerHostDelayMs());
                try {
                    HttpResponse<String> response = client.send(
                        request(uri, method, acceptHeader, body),
                        HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)
                    );
                    if (response.statusCode() == 403 || response.statusCode() == 429) {
                        slot.pushBack(Instant.now().plus(THROTTLE_PAUSE));
                    }
                    Instant finishedAt = Instant.now();
                    return new HttpFetchResult(
                        url,
                        response.uri(),
                        response.statusCode(),
                        response.body(),
                        response.headers().firstValue("Content-Type").orElse(null),
                        finishedAt,
                        Duration.between(startedAt, finishedAt),
                        null,
                        null
                    );
                } finally {
                    slot.leave();
                }
            } finally {
                inFlight.release();
            }
        } catch (HttpTimeoutException e) {
            return HttpFetchResult.failure(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return HttpFetchResult.failure(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpFetchResult.failure(url, startedAt, "interrupted", e.getMessage());
        } catch (RuntimeException e) {
            return HttpFetchResult.failure(url, startedAt, "http_error", e.getMessage());
        }
    }

    private HttpRequest request(URI uri, String method, String acceptHeader, String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout())
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", acceptHeader == null || acceptHeader.isBlank() ? "*/*" : acceptHeader)
            .header("Accept-Language", "en-US,en;q=0.8");
        if ("POST".equals(method)) {
            return builder
                .header("Content-Type", JSON)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        }
        return builder.GET().build();
    }

    static boolean isRetryable(HttpFetchResult result) {
        if (result.errorCode() != null) {
            return switch (result.errorCode()) {
                case "invalid_url", "interrupted" -> false;
                default -> true;
            };
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    /**
     * Sleeps between half and all of {@code base * 2^(attempt-1)}, capped at the configured maximum.
     * Returns false when interrupted.
     */
    private boolean pauseBeforeRetry(int attempt) {
        long ceiling = (long) properties.getRequestRetryBaseDelayMs() << Math.min(attempt - 1, 20);
        if (properties.getRequestRetryMaxDelayMs() > 0) {
            ceiling = Math.min(ceiling, properties.getRequestRetryMaxDelayMs());
        }
        if (ceiling <= 0) {
            return true;
        }
        long half = ceiling / 2;
        try {
            Thread.sleep(half + ThreadLocalRandom.current().nextLong(Math.max(1L, ceiling - half)));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Duration timeout() {
        return Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }

    private static String outcome(HttpFetchResult result) {
        return result.errorCode() == null ? "HTTP " + result.statusCode() : result.errorCode();
    }

    private static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String value = url.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * One request at a time per host, each starting no earlier than {@code nextAllowed}.
     */
    private static final class HostSlot {
        private final String host;
        private final Semaphore turn = new Semaphore(1);
        private Instant nextAllowed = Instant.EPOCH;

        HostSlot(String host) {
            this.host = host;
        }

        void enter(long spacingMs) throws InterruptedException {
            turn.acquire();
            try {
                long waitMs = Duration.between(Instant.now(), nextStart()).toMillis();
                if (waitMs > 0) {
                    Thread.sleep(waitMs);
                }
                schedule(Instant.now().plusMillis(spacingMs));
            } catch (InterruptedException e) {
                turn.release();
                throw e;
            }
        }

        void leave() {
            turn.release();
        }

        synchronized void pushBack(Instant until) {
            if (until.isAfter(nextAllowed)) {
                nextAllowed = until;
                log.info("Backing off host {} until {}", host, until);
            }
        }

        private synchronized Instant nextStart() {
            return nextAllowed;
        }

        private synchronized void schedule(Instant at) {
            if (at.isAfter(nextAllowed)) {
                nextAllowed = at;
            }
        }
    }
}
