package org.drinkmap.driver;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.drinkmap.driver.http.HttpClientDriver;
import org.drinkmap.driver.mongo.MongoDriver;
import org.drinkmap.driver.storage.StorageDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the lifecycle of all registered drivers: lazy single-flight initialization, sharing of
 * instances through {@link SharedDriverState}, health checks and concurrent cleanup.
 * <p>
 * Lookup order for {@link #getInstance(String)}:
 * <ol>
 *   <li>unregistered name: {@link DriverNotRegisteredException}</li>
 *   <li>instance in the shared slot: returned without locking</li>
 *   <li>instance in the local cache: returned without locking</li>
 *   <li>otherwise the per-name lock is taken, both are checked again, and the driver is initialized</li>
 * </ol>
 * For any name at most one initialization runs at a time within a container, and callers that
 * waited on the lock receive the instance the winner produced. A failed initialization caches
 * nothing, so the next call retries.
 * <p>
 * After {@link #cleanupAll()} the container is closed and every lookup fails with
 * {@link IllegalStateException}.
 * <p>
 * Thread Safety: all methods may be called concurrently.
 */
public final class DriverContainer {

    private static final Logger LOGGER = LoggerFactory.getLogger(DriverContainer.class);

    private final DriverConfig config;
    private final SharedDriverState sharedState;

    private final ConcurrentMap<String, DriverSpec> drivers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Object> instances = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, DriverState> states = new ConcurrentHashMap<>();
    // Instances this container put into the shared state; only those are withdrawn at cleanup.
    private final ConcurrentMap<String, Object> published = new ConcurrentHashMap<>();

    private volatile boolean closed = false;

    /**
     * @param config      Per-driver options.
     * @param sharedState The shared slot map to publish to and adopt from.
     */
    public DriverContainer(final DriverConfig config, final SharedDriverState sharedState) {
        this.config = Objects.requireNonNull(config, "config");
        this.sharedState = Objects.requireNonNull(sharedState, "sharedState");
    }

    /**
     * Creates a container over the global shared state.
     *
     * @param config Per-driver options.
     */
    public DriverContainer(final DriverConfig config) {
        this(config, SharedDriverState.global());
    }

    /**
     * Creates a container with the built-in {@code http}, {@code storage} and {@code mongo}
     * drivers registered. Nothing is initialized yet.
     *
     * @param config      Per-driver options.
     * @param sharedState The shared slot map.
     * @return The container.
     */
    public static DriverContainer withDefaultDrivers(final DriverConfig config, final SharedDriverState sharedState) {
        final DriverContainer container = new DriverContainer(config, sharedState);
        container.register(HttpClientDriver.NAME, new HttpClientDriver());
        container.register(StorageDriver.NAME, new StorageDriver());
        container.register(MongoDriver.NAME, new MongoDriver());
        return container;
    }

    /**
     * Registers a driver under a name. Nothing is initialized.
     *
     * @param name   The driver name.
     * @param driver The driver.
     * @throws IllegalArgumentException if the name is already registered.
     * @throws IllegalStateException if the container is closed.
     */
    public void register(final String name, final IDriver<?> driver) {
        register(name, driver, ConfigFactory.empty());
    }

    /**
     * Registers a driver with options that take precedence over its {@link DriverConfig} block.
     *
     * @param name    The driver name.
     * @param driver  The driver.
     * @param options Registration options.
     * @throws IllegalArgumentException if the name is already registered.
     * @throws IllegalStateException if the container is closed.
     */
    public void register(final String name, final IDriver<?> driver, final Config options) {
        final DriverSpec spec = new DriverSpec(name, driver, options);
        ensureOpen();
        if (drivers.putIfAbsent(name, spec) != null) {
            LOGGER.warn("Driver '{}' is already registered, ignoring second registration", name);
            throw new IllegalArgumentException("Driver '" + name + "' is already registered.");
        }
        states.put(name, DriverState.REGISTERED);
        LOGGER.debug("Registered driver '{}' ({})", name, driver.getClass().getSimpleName());
    }

    /**
     * Returns the instance for a driver, initializing it on first use.
     *
     * @param name The driver name.
     * @return The shared instance.
     * @throws DriverNotRegisteredException if nothing is registered under the name.
     * @throws DriverConfigurationException if the driver's options are invalid.
     * @throws DriverInitializationException if the driver failed to create its instance.
     * @throws IllegalStateException if the container is closed.
     */
    public Object getInstance(final String name) {
        ensureOpen();
        final DriverSpec spec = drivers.get(name);
        if (spec == null) {
            throw new DriverNotRegisteredException(name);
        }

        final String slotKey = SharedSlotKeys.forDriver(name);
        Object existing = sharedState.get(slotKey);
        if (existing != null) {
            return existing;
        }
        existing = instances.get(name);
        if (existing != null) {
            return existing;
        }

        final ReentrantLock lock = locks.computeIfAbsent(name, k -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverInitializationException(name, "interrupted while waiting for initialization");
        }
        try {
            ensureOpen();
            existing = sharedState.get(slotKey);
            if (existing != null) {
                return existing;
            }
            existing = instances.get(name);
            if (existing != null) {
                return existing;
            }
            return initialize(spec, slotKey);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Typed variant of {@link #getInstance(String)}.
     *
     * @param name The driver name.
     * @param type The expected instance type.
     * @param <T>  The instance type.
     * @return The shared instance.
     * @throws IllegalStateException if the instance is not of the expected type.
     */
    public <T> T getInstance(final String name, final Class<T> type) {
        final Object instance = getInstance(name);
        if (!type.isInstance(instance)) {
            throw new IllegalStateException("Driver '" + name + "' provides "
                + instance.getClass().getName() + " but " + type.getName() + " was expected.");
        }
        return type.cast(instance);
    }

    @SuppressWarnings("unchecked")
    private Object initialize(final DriverSpec spec, final String slotKey) {
        final String name = spec.name();
        final IDriver<?> driver = spec.driver();
        states.put(name, DriverState.INITIALIZING);
        final Config options = spec.options().withFallback(config.optionsFor(name));
        final long start = System.nanoTime();
        final Object instance;
        try {
            instance = driver.initialize(options);
            if (instance == null) {
                throw new DriverInitializationException(name, "driver returned no instance");
            }
        } catch (final DriverException e) {
            states.put(name, DriverState.REGISTERED);
            LOGGER.error("Driver '{}' failed to initialize: {}", name, e.getMessage());
            throw e;
        } catch (final Exception e) {
            states.put(name, DriverState.REGISTERED);
            LOGGER.error("Driver '{}' failed to initialize: {}", name, e.getMessage());
            throw new DriverInitializationException(name, e);
        }

        final Object winner = sharedState.publishIfAbsent(slotKey, instance);
        if (winner != null) {
            // Another container published first; adopt its instance and release ours.
            LOGGER.debug("Driver '{}' was published concurrently by another container, adopting it", name);
            try {
                ((IDriver<Object>) driver).cleanup(instance);
            } catch (final Exception e) {
                LOGGER.warn("Failed to release redundant instance of driver '{}': {}", name, e.getMessage());
            }
            states.put(name, DriverState.READY);
            return winner;
        }

        published.put(slotKey, instance);
        instances.put(name, instance);
        if (closed) {
            // cleanupAll() ran while we were initializing; whoever removes the instance releases it
            published.remove(slotKey, instance);
            sharedState.withdraw(slotKey, instance);
            if (instances.remove(name, instance)) {
                try {
                    ((IDriver<Object>) driver).cleanup(instance);
                } catch (final Exception e) {
                    LOGGER.warn("Failed to release instance of driver '{}' created during shutdown: {}",
                        name, e.getMessage());
                }
            }
            throw new IllegalStateException("Driver container is closed.");
        }
        states.put(name, DriverState.READY);
        LOGGER.info("Driver '{}' initialized in {} ms", name, (System.nanoTime() - start) / 1_000_000);
        return instance;
    }

    /**
     * Releases every instance this container holds, concurrently. Failures are logged and
     * reported, never thrown. Afterwards the container is closed.
     *
     * @return Which drivers were cleaned and which failed.
     */
    @SuppressWarnings("unchecked")
    public CleanupReport cleanupAll() {
        if (closed) {
            return CleanupReport.empty();
        }
        closed = true;

        // Instances added after this point are released by initialize()
        final Map<String, Object> toClean = new LinkedHashMap<>();
        for (final String name : List.copyOf(instances.keySet())) {
            final Object instance = instances.remove(name);
            if (instance != null) {
                toClean.put(name, instance);
            }
        }
        published.forEach(sharedState::withdraw);
        published.clear();
        drivers.keySet().forEach(name -> states.put(name, DriverState.CLOSED));

        if (toClean.isEmpty()) {
            LOGGER.debug("No driver instances to clean up");
            return CleanupReport.empty();
        }

        final ExecutorService executor = Executors.newFixedThreadPool(toClean.size(), runnable -> {
            final Thread thread = new Thread(runnable, "driver-cleanup");
            thread.setDaemon(true);
            return thread;
        });
        final Map<String, Future<?>> futures = new LinkedHashMap<>();
        try {
            toClean.forEach((name, instance) -> futures.put(name, executor.submit(() -> {
                ((IDriver<Object>) drivers.get(name).driver()).cleanup(instance);
                return null;
            })));

            final List<String> cleaned = new ArrayList<>();
            final Map<String, String> failed = new LinkedHashMap<>();
            for (final Map.Entry<String, Future<?>> entry : futures.entrySet()) {
                final String name = entry.getKey();
                try {
                    entry.getValue().get();
                    cleaned.add(name);
                    LOGGER.debug("Driver '{}' cleaned up", name);
                } catch (final ExecutionException e) {
                    final Throwable cause = e.getCause() != null ? e.getCause() : e;
                    failed.put(name, String.valueOf(cause.getMessage()));
                    LOGGER.warn("Cleanup of driver '{}' failed: {}", name, cause.getMessage());
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failed.put(name, "interrupted");
                    LOGGER.warn("Interrupted while cleaning up driver '{}'", name);
                }
            }
            LOGGER.info("Cleaned up {} driver(s), {} failure(s)", cleaned.size(), failed.size());
            return new CleanupReport(cleaned, failed);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Checks every registered driver that has an instance (own or adopted from the shared
     * state). A check that throws counts as unhealthy for that driver only.
     *
     * @return Health per driver name. Drivers without an instance are omitted.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Boolean> healthCheckAll() {
        final Map<String, Boolean> result = new LinkedHashMap<>();
        for (final Map.Entry<String, DriverSpec> entry : drivers.entrySet()) {
            final String name = entry.getKey();
            final Object instance = currentInstance(name);
            if (instance == null) {
                continue;
            }
            boolean healthy;
            try {
                healthy = ((IDriver<Object>) entry.getValue().driver()).healthCheck(instance);
            } catch (final Exception e) {
                LOGGER.warn("Health check of driver '{}' failed: {}", name, e.getMessage());
                healthy = false;
            }
            result.put(name, healthy);
        }
        return result;
    }

    /**
     * @param name The driver name.
     * @return The lifecycle state; {@link DriverState#READY} if an instance is available
     *         through the shared state even though this container did not create it.
     */
    public DriverState getState(final String name) {
        final DriverState state = states.get(name);
        if (state == null) {
            return DriverState.UNREGISTERED;
        }
        if (state == DriverState.REGISTERED && sharedState.get(SharedSlotKeys.forDriver(name)) != null) {
            return DriverState.READY;
        }
        return state;
    }

    /**
     * @return The registered names, in no particular order.
     */
    public List<String> getRegisteredNames() {
        return List.copyOf(drivers.keySet());
    }

    public boolean isRegistered(final String name) {
        return drivers.containsKey(name);
    }

    public boolean isClosed() {
        return closed;
    }

    private Object currentInstance(final String name) {
        final Object shared = sharedState.get(SharedSlotKeys.forDriver(name));
        return shared != null ? shared : instances.get(name);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Driver container is closed.");
        }
    }
}
