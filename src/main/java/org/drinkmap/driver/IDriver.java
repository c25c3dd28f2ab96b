package org.drinkmap.driver;

import com.typesafe.config.Config;

/**
 * Lifecycle contract for a client of one backing service (HTTP pool, object storage,
 * document store).
 * <p>
 * A driver is a stateless factory: {@link #initialize(Config)} creates the client instance,
 * and every other operation receives that instance back. Instances are owned and shared by
 * the {@link DriverContainer}; a driver never caches them itself.
 *
 * @param <T> The type of the client instance this driver produces.
 */
public interface IDriver<T> {

    /**
     * Creates a ready-to-use client instance.
     *
     * @param options The driver's options block. Never null, may be empty.
     * @return The initialized instance. Must not be null.
     * @throws DriverConfigurationException if a required option is missing or invalid.
     * @throws Exception if the backing service cannot be reached or rejects the client.
     */
    T initialize(Config options) throws Exception;

    /**
     * Releases everything held by the instance. Called once, at container shutdown.
     *
     * @param instance The instance returned by {@link #initialize(Config)}.
     * @throws Exception if releasing fails. The container logs and isolates the failure.
     */
    void cleanup(T instance) throws Exception;

    /**
     * Checks whether the instance can still talk to its backing service.
     *
     * @param instance The instance returned by {@link #initialize(Config)}.
     * @return true if healthy.
     * @throws Exception if the check itself fails. The container reports this as unhealthy.
     */
    boolean healthCheck(T instance) throws Exception;
}
