package org.drinkmap.driver;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide hand-off point for initialized driver instances.
 * <p>
 * Several {@link DriverContainer}s may be built independently (one per HTTP server, per
 * worker, per test fixture); publishing through a common {@code SharedDriverState} lets
 * them reuse each other's instances instead of opening a second connection pool.
 * <p>
 * Slots are write-once-then-stable: the first published instance for a key wins and
 * stays until its owner withdraws it. All operations are single atomic map operations.
 * <p>
 * Thread Safety: fully thread-safe.
 */
public final class SharedDriverState {

    private static final SharedDriverState GLOBAL = new SharedDriverState();

    private final ConcurrentMap<String, Object> slots = new ConcurrentHashMap<>();

    /**
     * @return The state shared by every container of this JVM that does not bring its own.
     */
    public static SharedDriverState global() {
        return GLOBAL;
    }

    /**
     * @param key The slot key, see {@link SharedSlotKeys}.
     * @return The published instance, or null if the slot is empty.
     */
    public Object get(final String key) {
        return slots.get(key);
    }

    /**
     * Publishes an instance unless the slot is already taken.
     *
     * @param key      The slot key.
     * @param instance The instance to publish.
     * @return null if the instance was published, otherwise the instance already in the slot.
     */
    public Object publishIfAbsent(final String key, final Object instance) {
        Objects.requireNonNull(instance, "instance");
        return slots.putIfAbsent(key, instance);
    }

    /**
     * Places an instance into a slot unconditionally. Intended for hosts that create a client
     * outside any container and want containers to adopt it.
     *
     * @param key      The slot key.
     * @param instance The instance.
     */
    public void put(final String key, final Object instance) {
        slots.put(key, Objects.requireNonNull(instance, "instance"));
    }

    /**
     * Empties a slot, but only if it still holds the given instance.
     *
     * @param key      The slot key.
     * @param instance The instance expected in the slot.
     * @return true if the slot was emptied.
     */
    public boolean withdraw(final String key, final Object instance) {
        return slots.remove(key, instance);
    }

    /**
     * @return A snapshot of the occupied slot keys.
     */
    public Set<String> keys() {
        return Collections.unmodifiableSet(Set.copyOf(slots.keySet()));
    }
}
