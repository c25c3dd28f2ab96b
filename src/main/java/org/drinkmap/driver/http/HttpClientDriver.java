package org.drinkmap.driver.http;

import com.typesafe.config.Config;
import org.drinkmap.driver.DriverConfigurationException;
import org.drinkmap.driver.IDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Produces the shared outbound {@link PooledHttpClient}.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code timeout-ms}: per-request timeout, default 240000</li>
 *   <li>{@code max-connections}: size of the connection executor, default 100</li>
 *   <li>{@code retry}: connect retries per request, default 3</li>
 *   <li>{@code health-urls}: URLs probed by the health check; healthy if any answers 200</li>
 * </ul>
 */
public class HttpClientDriver implements IDriver<PooledHttpClient> {

    public static final String NAME = "http";

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientDriver.class);

    static final long DEFAULT_TIMEOUT_MS = 240_000;
    static final int DEFAULT_MAX_CONNECTIONS = 100;
    static final int DEFAULT_RETRY = 3;
    static final List<String> DEFAULT_HEALTH_URLS = List.of(
        "https://httpbin.org/status/200",
        "https://www.google.com/",
        "https://httpstat.us/200"
    );
    static final Duration HEALTH_PROBE_TIMEOUT = Duration.ofSeconds(5);

    @Override
    public PooledHttpClient initialize(final Config options) {
        final long timeoutMs = options.hasPath("timeout-ms") ? options.getLong("timeout-ms") : DEFAULT_TIMEOUT_MS;
        final int maxConnections = options.hasPath("max-connections")
            ? options.getInt("max-connections")
            : DEFAULT_MAX_CONNECTIONS;
        final int retry = options.hasPath("retry") ? options.getInt("retry") : DEFAULT_RETRY;

        if (timeoutMs <= 0) {
            throw new DriverConfigurationException(NAME, "timeout-ms must be positive, got " + timeoutMs);
        }
        if (maxConnections <= 0) {
            throw new DriverConfigurationException(NAME, "max-connections must be positive, got " + maxConnections);
        }
        if (retry < 0) {
            throw new DriverConfigurationException(NAME, "retry must not be negative, got " + retry);
        }
        final List<String> healthUrls = options.hasPath("health-urls")
            ? options.getStringList("health-urls")
            : DEFAULT_HEALTH_URLS;

        final AtomicInteger threadCounter = new AtomicInteger();
        final ExecutorService executor = Executors.newFixedThreadPool(maxConnections, runnable -> {
            final Thread thread = new Thread(runnable, "http-driver-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        final Duration timeout = Duration.ofMillis(timeoutMs);
        final HttpClient client = HttpClient.newBuilder()
            .executor(executor)
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

        LOGGER.debug("HTTP client created (timeout={} ms, max-connections={}, retry={})", timeoutMs, maxConnections, retry);
        return new PooledHttpClient(client, executor, timeout, retry, healthUrls);
    }

    @Override
    public void cleanup(final PooledHttpClient instance) {
        instance.close();
    }

    @Override
    public boolean healthCheck(final PooledHttpClient instance) throws InterruptedException {
        for (final String url : instance.getHealthUrls()) {
            try {
                final HttpResponse<Void> response = instance.send(
                    instance.request(url).timeout(HEALTH_PROBE_TIMEOUT).GET().build(),
                    HttpResponse.BodyHandlers.discarding());
                if (response.statusCode() == 200) {
                    return true;
                }
            } catch (final IOException e) {
                LOGGER.debug("Health probe {} failed: {}", url, e.getMessage());
            }
        }
        LOGGER.warn("HTTP health check failed for all probe URLs");
        return false;
    }
}
