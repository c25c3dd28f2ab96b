package org.drinkmap.driver;

import java.util.Map;

/**
 * Maps a driver name to the single key its instance is published under in
 * {@link SharedDriverState}.
 * <p>
 * The built-in drivers have fixed keys; any other name uses {@code <name>_driver}.
 */
public final class SharedSlotKeys {

    static final String SUFFIX = "_driver";

    private static final Map<String, String> KNOWN_KEYS = Map.of(
        "http", "http_driver",
        "storage", "storage_driver",
        "mongo", "mongo_driver"
    );

    private SharedSlotKeys() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the shared slot key for a driver name.
     *
     * @param driverName The registered driver name.
     * @return The slot key.
     */
    public static String forDriver(final String driverName) {
        final String known = KNOWN_KEYS.get(driverName);
        return known != null ? known : driverName + SUFFIX;
    }

    /**
     * @return The fixed name to key table of the built-in drivers.
     */
    public static Map<String, String> knownKeys() {
        return KNOWN_KEYS;
    }
}
