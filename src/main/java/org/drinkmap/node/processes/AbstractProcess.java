package org.drinkmap.node.processes;

import com.typesafe.config.Config;
import org.drinkmap.node.spi.IProcess;

import java.util.Collections;
import java.util.Map;

/**
 * Base class for processes, holding what the node injects: the process name, the services
 * named in the {@code require} block, and the process {@code options}.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    /**
     * @param processName  The process name from the configuration.
     * @param dependencies Required services keyed by their local name.
     * @param options      The process options.
     */
    protected AbstractProcess(final String processName, final Map<String, Object> dependencies,
                              final Config options) {
        this.processName = processName;
        this.dependencies = dependencies != null ? dependencies : Collections.emptyMap();
        this.options = options;
    }

    public String getProcessName() {
        return processName;
    }

    /**
     * @throws IllegalArgumentException if the dependency is missing or has another type.
     */
    protected <T> T getDependency(final String name, final Class<T> expectedType) {
        final T dependency = getOptionalDependency(name, expectedType);
        if (dependency == null) {
            throw new IllegalArgumentException(
                "Required dependency '" + name + "' not found for process '" + processName + "'");
        }
        return dependency;
    }

    /**
     * @return The dependency, or null if it was not declared.
     * @throws IllegalArgumentException if the dependency has another type.
     */
    protected <T> T getOptionalDependency(final String name, final Class<T> expectedType) {
        final Object dependency = dependencies.get(name);
        if (dependency == null) {
            return null;
        }
        if (!expectedType.isInstance(dependency)) {
            throw new IllegalArgumentException("Dependency '" + name + "' for process '" + processName + "' is "
                + dependency.getClass().getName() + " but expected " + expectedType.getName());
        }
        return expectedType.cast(dependency);
    }
}
