package org.drinkmap.node.processes.driver;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.drinkmap.driver.CleanupReport;
import org.drinkmap.driver.DriverConfig;
import org.drinkmap.driver.DriverContainer;
import org.drinkmap.driver.IDriver;
import org.drinkmap.driver.SharedDriverState;
import org.drinkmap.node.processes.AbstractProcess;
import org.drinkmap.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Owns the node's {@link DriverContainer} and exposes it to other processes.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code drivers}: per-driver options, see {@link DriverConfig}</li>
 *   <li>{@code register}: additional drivers, name to class name; each class needs a public
 *       no-argument constructor</li>
 *   <li>{@code eager}: driver names initialized at start instead of on first use</li>
 * </ul>
 * Stopping the process cleans up every driver instance.
 */
public class DriverContainerProcess extends AbstractProcess implements IServiceProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DriverContainerProcess.class);

    private final DriverContainer container;
    private final List<String> eager;

    public DriverContainerProcess(final String processName, final Map<String, Object> dependencies,
                                  final Config options) {
        super(processName, dependencies, options);
        final Config driversBlock = options.hasPath("drivers") ? options.getConfig("drivers") : ConfigFactory.empty();
        this.container = DriverContainer.withDefaultDrivers(DriverConfig.of(driversBlock), SharedDriverState.global());
        if (options.hasPath("register")) {
            final Config register = options.getConfig("register");
            for (final String name : register.root().keySet()) {
                container.register(name, instantiate(name, register.root().get(name).unwrapped().toString()));
            }
        }
        this.eager = options.hasPath("eager") ? options.getStringList("eager") : List.of();
        for (final String name : eager) {
            if (!container.isRegistered(name)) {
                throw new IllegalArgumentException("Eager driver '" + name + "' is not registered");
            }
        }
        LOGGER.debug("Driver container '{}' created with drivers {}", processName, container.getRegisteredNames());
    }

    @Override
    public void start() {
        for (final String name : eager) {
            container.getInstance(name);
        }
        LOGGER.info("Drivers ready: {} (eager: {})", container.getRegisteredNames(), eager);
    }

    @Override
    public void stop() {
        final CleanupReport report = container.cleanupAll();
        if (report.hasFailures()) {
            LOGGER.warn("Driver cleanup finished with failures: {}", report.failed());
        }
    }

    @Override
    public Object getExposedService() {
        return container;
    }

    public DriverContainer getContainer() {
        return container;
    }

    private static IDriver<?> instantiate(final String name, final String className) {
        try {
            final Class<?> driverClass = Class.forName(className);
            if (!IDriver.class.isAssignableFrom(driverClass)) {
                throw new IllegalArgumentException("Class " + className + " of driver '" + name
                    + "' does not implement IDriver.");
            }
            return (IDriver<?>) driverClass.getConstructor().newInstance();
        } catch (final ReflectiveOperationException e) {
            throw new IllegalArgumentException("Driver '" + name + "' cannot be created from class " + className, e);
        }
    }
}
