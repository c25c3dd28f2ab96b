package org.drinkmap.driver;

/**
 * Lifecycle state of a named driver inside a {@link DriverContainer}.
 */
public enum DriverState {
    /** No driver has been registered under the name. */
    UNREGISTERED,
    /** Registered, no instance yet (or the last initialization failed). */
    REGISTERED,
    /** A caller holds the name's lock and is running {@link IDriver#initialize}. */
    INITIALIZING,
    /** An instance is available, either locally or through the shared slot. */
    READY,
    /** The container has been cleaned up. */
    CLOSED
}
