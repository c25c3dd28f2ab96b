package org.drinkmap.driver;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValueType;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable per-driver options, read from the {@code drivers} block of the configuration.
 *
 * <pre>
 * drivers {
 *   http    { timeout-ms = 240000, max-connections = 100, retry = 3 }
 *   storage { root-directory = "${java.io.tmpdir}/drinkmap-storage" }
 *   mongo   { host = "localhost", port = 27017, database = "test" }
 * }
 * </pre>
 *
 * Built once at startup and shared read-only; {@link Config} is itself immutable.
 */
public final class DriverConfig {

    static final String DRIVERS_PATH = "drivers";

    private final Config drivers;

    private DriverConfig(final Config drivers) {
        this.drivers = Objects.requireNonNull(drivers, "drivers");
    }

    /**
     * @param driversBlock The content of a {@code drivers} block.
     * @return A config over that block.
     */
    public static DriverConfig of(final Config driversBlock) {
        return new DriverConfig(driversBlock);
    }

    /**
     * @param root A configuration that may contain a {@code drivers} block.
     * @return A config over the block, or an empty config if it is absent.
     */
    public static DriverConfig fromRoot(final Config root) {
        return root.hasPath(DRIVERS_PATH)
            ? new DriverConfig(root.getConfig(DRIVERS_PATH))
            : empty();
    }

    /**
     * @return The defaults declared in {@code reference.conf}.
     */
    public static DriverConfig defaults() {
        return fromRoot(ConfigFactory.defaultReference());
    }

    public static DriverConfig empty() {
        return new DriverConfig(ConfigFactory.empty());
    }

    /**
     * Returns the options of one driver.
     *
     * @param driverName The driver name.
     * @return Its options block, or an empty config if none is configured.
     */
    public Config optionsFor(final String driverName) {
        final String path = ConfigUtil.joinPath(driverName);
        if (drivers.hasPath(path) && drivers.getValue(path).valueType() == ConfigValueType.OBJECT) {
            return drivers.getConfig(path);
        }
        return ConfigFactory.empty();
    }

    /**
     * @return The names that have an options block, sorted.
     */
    public Set<String> configuredNames() {
        return new TreeSet<>(drivers.root().keySet());
    }
}
