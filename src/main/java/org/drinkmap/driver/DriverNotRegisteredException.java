package org.drinkmap.driver;

/**
 * Thrown when an instance is requested for a name no driver was registered under.
 */
public class DriverNotRegisteredException extends DriverException {

    public DriverNotRegisteredException(final String driverName) {
        super(driverName, "Driver '" + driverName + "' not registered");
    }
}
