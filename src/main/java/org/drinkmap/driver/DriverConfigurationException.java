package org.drinkmap.driver;

/**
 * Thrown when a driver's options are missing a required value or contain an invalid one.
 * Fatal for the call that triggered it; nothing is cached.
 */
public class DriverConfigurationException extends DriverException {

    public DriverConfigurationException(final String driverName, final String message) {
        super(driverName, message);
    }
}
