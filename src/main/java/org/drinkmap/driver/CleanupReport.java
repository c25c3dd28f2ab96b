package org.drinkmap.driver;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link DriverContainer#cleanupAll()}.
 *
 * @param cleaned Names whose cleanup completed.
 * @param failed  Names whose cleanup threw, with the failure message.
 */
public record CleanupReport(List<String> cleaned, Map<String, String> failed) {

    public CleanupReport {
        cleaned = List.copyOf(cleaned);
        failed = Map.copyOf(failed);
    }

    public static CleanupReport empty() {
        return new CleanupReport(List.of(), Map.of());
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
