package org.drinkmap.driver;

import com.typesafe.config.Config;

import java.util.Objects;

/**
 * A registered driver: its name, implementation and the options passed at registration.
 * Registration options take precedence over the {@code drivers.<name>} block of {@link DriverConfig}.
 *
 * @param name    The driver name.
 * @param driver  The implementation.
 * @param options Options given at registration; empty if none.
 */
public record DriverSpec(String name, IDriver<?> driver, Config options) {

    public DriverSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(driver, "driver");
        Objects.requireNonNull(options, "options");
    }
}
