package org.drinkmap.driver;

/**
 * Thrown when a driver fails to create its instance (transport or authentication failure).
 * The driver stays {@link DriverState#REGISTERED}, so a later call may retry.
 */
public class DriverInitializationException extends DriverException {

    public DriverInitializationException(final String driverName, final Throwable cause) {
        super(driverName, "Failed to initialize driver '" + driverName + "': " + cause.getMessage(), cause);
    }

    public DriverInitializationException(final String driverName, final String message) {
        super(driverName, "Failed to initialize driver '" + driverName + "': " + message);
    }
}
