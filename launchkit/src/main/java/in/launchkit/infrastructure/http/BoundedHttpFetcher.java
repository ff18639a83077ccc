package in.launchkit.infrastructure.http;

import in.launchkit.domain.common.LaunchKitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Downloads a resource under a connect timeout, a total timeout and a byte cap.
 *
 * The total budget covers connecting, waiting for headers and streaming the body. The body is
 * read incrementally; the stream is closed from a timer thread when the budget runs out so a
 * stalled transfer cannot block past the deadline.
 */
public final class BoundedHttpFetcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BoundedHttpFetcher.class);

    private static final int CHUNK_SIZE = 16 * 1024;

    private final HttpClient httpClient;
    private final Duration connectTimeout;
    private final Duration totalTimeout;
    private final long maxBytes;
    private final ScheduledExecutorService deadlines;

    public BoundedHttpFetcher(Duration connectTimeout, Duration totalTimeout, long maxBytes) {
        this.connectTimeout = connectTimeout;
        this.totalTimeout = totalTimeout;
        this.maxBytes = maxBytes;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        this.deadlines = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bounded-fetch-deadline");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Fetched body with its response metadata.
     */
    public record Fetched(byte[] body, String contentType, URI finalUri) {}

    /**
     * @param errorCode code carried by every failure, e.g. LOGO_FETCH_FAILED
     */
    public Fetched fetch(String url, String errorCode) {
        long startNanos = System.nanoTime();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(totalTimeout)
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            throw failure(errorCode, "Invalid URL", Map.of("reason", "invalid_url"), e);
        }

        CompletableFuture<HttpResponse<InputStream>> future =
            httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream());

        HttpResponse<InputStream> response;
        try {
            response = future.get(totalTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw timeout(errorCode, totalTimeout, "total", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw failure(errorCode, "Fetch interrupted", Map.of("reason", "interrupted"), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HttpConnectTimeoutException) {
                throw timeout(errorCode, connectTimeout, "connect", cause);
            }
            if (cause instanceof HttpTimeoutException) {
                throw timeout(errorCode, totalTimeout, "total", cause);
            }
            throw failure(errorCode, "Fetch failed: " + (cause == null ? e.getMessage() : cause.getMessage()),
                Map.of("reason", "network"), cause);
        }

        try (InputStream body = response.body()) {
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw failure(errorCode, "Fetch returned HTTP " + status,
                    Map.of("reason", "http_status", "status", status), null);
            }

            long declared = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            if (declared > maxBytes) {
                throw tooLarge(errorCode, declared);
            }

            long remainingNanos = totalTimeout.toNanos() - (System.nanoTime() - startNanos);
            byte[] bytes = readBounded(body, remainingNanos, errorCode);
            String contentType = response.headers().firstValue("Content-Type").orElse(null);

            log.debug("[FETCH] {} bytes from {} ({})", bytes.length, response.uri().getHost(), contentType);
            return new Fetched(bytes, contentType, response.uri());

        } catch (IOException e) {
            throw failure(errorCode, "Fetch stream failed: " + e.getMessage(), Map.of("reason", "network"), e);
        }
    }

    private byte[] readBounded(InputStream body, long remainingNanos, String errorCode) throws IOException {
        if (remainingNanos <= 0) {
            throw timeout(errorCode, totalTimeout, "total", null);
        }
        long deadline = System.nanoTime() + remainingNanos;
        ScheduledFuture<?> closer = deadlines.schedule(() -> {
            try {
                body.close();
            } catch (IOException e) {
                log.debug("[FETCH] Close at deadline failed: {}", e.getMessage());
            }
        }, remainingNanos, TimeUnit.NANOSECONDS);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] chunk = new byte[CHUNK_SIZE];
        try {
            int read;
            while ((read = body.read(chunk)) != -1) {
                if (out.size() + (long) read > maxBytes) {
                    throw tooLarge(errorCode, out.size() + (long) read);
                }
                out.write(chunk, 0, read);
            }
        } catch (IOException e) {
            if (System.nanoTime() >= deadline) {
                throw timeout(errorCode, totalTimeout, "total", e);
            }
            throw e;
        } finally {
            closer.cancel(false);
        }
        if (System.nanoTime() >= deadline) {
            throw timeout(errorCode, totalTimeout, "total", null);
        }
        return out.toByteArray();
    }

    private LaunchKitException timeout(String errorCode, Duration limit, String phase, Throwable cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", "timeout");
        details.put("phase", phase);
        details.put("timeoutMs", limit.toMillis());
        return failure(errorCode, "Fetch timed out (" + phase + " " + limit.toMillis() + "ms)", details, cause);
    }

    private LaunchKitException tooLarge(String errorCode, long bytes) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", "too_large");
        details.put("downloadedBytes", bytes);
        details.put("maxBytes", maxBytes);
        return failure(errorCode, "Resource exceeds " + maxBytes + " bytes", details, null);
    }

    private LaunchKitException failure(String errorCode, String message, Map<String, Object> details, Throwable cause) {
        return LaunchKitException.external(errorCode, message, details, cause);
    }

    @Override
    public void close() {
        deadlines.shutdownNow();
    }
}
