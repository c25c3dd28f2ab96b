package org.drinkmap.driver.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Shared outbound HTTP client produced by {@link HttpClientDriver}.
 * <p>
 * Wraps a {@link HttpClient} whose connections are served by a bounded executor, applies the
 * configured request timeout to every request and retries requests that fail to connect.
 * Timeouts and HTTP error statuses are never retried.
 */
public final class PooledHttpClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PooledHttpClient.class);

    private final HttpClient client;
    private final ExecutorService executor;
    private final Duration requestTimeout;
    private final int retries;
    private final List<String> healthUrls;
    private volatile boolean closed = false;

    PooledHttpClient(final HttpClient client, final ExecutorService executor,
                     final Duration requestTimeout, final int retries, final List<String> healthUrls) {
        this.client = Objects.requireNonNull(client, "client");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.retries = Math.max(0, retries);
        this.healthUrls = List.copyOf(healthUrls);
    }

    /**
     * Starts a request builder for the given URI with the configured timeout applied.
     *
     * @param uri The target URI.
     * @return The builder.
     */
    public HttpRequest.Builder request(final String uri) {
        return HttpRequest.newBuilder(URI.create(uri)).timeout(requestTimeout);
    }

    /**
     * Sends a request and returns the body as a string.
     *
     * @param request The request.
     * @return The response.
     * @throws IOException if the request fails after all connect retries.
     * @throws InterruptedException if the calling thread is interrupted.
     */
    public HttpResponse<String> send(final HttpRequest request) throws IOException, InterruptedException {
        return send(request, HttpResponse.BodyHandlers.ofString());
    }

    /**
     * Sends a request with a custom body handler.
     *
     * @param request The request.
     * @param handler The body handler.
     * @param <B>     The body type.
     * @return The response.
     * @throws IOException if the request fails after all connect retries.
     * @throws InterruptedException if the calling thread is interrupted.
     */
    public <B> HttpResponse<B> send(final HttpRequest request, final HttpResponse.BodyHandler<B> handler)
            throws IOException, InterruptedException {
        if (closed) {
            throw new IllegalStateException("HTTP client is closed.");
        }
        int attempt = 0;
        while (true) {
            try {
                return client.send(request, handler);
            } catch (final HttpTimeoutException e) {
                throw e;
            } catch (final ConnectException e) {
                if (attempt >= retries) {
                    throw e;
                }
                attempt++;
                LOGGER.debug("Connect to {} failed ({}), retry {}/{}", request.uri(), e.getMessage(), attempt, retries);
            }
        }
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public int getRetries() {
        return retries;
    }

    /**
     * @return The URLs the health check probes.
     */
    public List<String> getHealthUrls() {
        return healthUrls;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
