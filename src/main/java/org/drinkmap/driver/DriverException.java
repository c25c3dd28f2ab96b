package org.drinkmap.driver;

/**
 * Base class of all failures raised by the driver container.
 */
public class DriverException extends RuntimeException {

    private final String driverName;

    public DriverException(final String driverName, final String message) {
        super(message);
        this.driverName = driverName;
    }

    public DriverException(final String driverName, final String message, final Throwable cause) {
        super(message, cause);
        this.driverName = driverName;
    }

    /**
     * @return The name the failing driver was registered under, or null if unknown.
     */
    public String getDriverName() {
        return driverName;
    }
}
