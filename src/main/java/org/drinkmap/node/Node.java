package org.drinkmap.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.drinkmap.node.spi.IProcess;
import org.drinkmap.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Hosts the processes declared under {@code node.processes} and drives their lifecycle.
 *
 * <pre>
 * node.processes {
 *   drivers {
 *     className = "org.drinkmap.node.processes.driver.DriverContainerProcess"
 *     options { ... }
 *   }
 *   http-server {
 *     className = "org.drinkmap.node.processes.http.HttpServerProcess"
 *     require { drivers = "drivers" }
 *     options { ... }
 *   }
 * }
 * </pre>
 *
 * Processes are created in dependency order, each through a public
 * {@code (String, Map<String, Object>, Config)} constructor, and stopped in reverse order.
 */
public final class Node {

    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_CONFIG_PATH = "node.processes";

    private final Map<String, IProcess> managedProcesses = new LinkedHashMap<>();
    private Thread shutdownHook;
    private boolean stopped;

    /**
     * @param config The resolved application configuration.
     * @throws IllegalStateException if a process cannot be created or the dependencies form a cycle.
     */
    public Node(final Config config) {
        try {
            initializeProcesses(config);
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to initialize the node: {}", e.getMessage());
            stopProcesses();
            throw new IllegalStateException("Node initialization failed", e);
        }
    }

    /**
     * Starts all processes in creation order and installs a shutdown hook that stops them.
     */
    public void start() {
        if (managedProcesses.isEmpty()) {
            LOGGER.warn("No processes configured to start. The node will be idle.");
        }
        managedProcesses.forEach((name, process) -> {
            LOGGER.debug("Starting process '{}'", name);
            process.start();
        });

        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started with process(es) {}", managedProcesses.keySet());
    }

    /**
     * Stops all processes in reverse creation order. Later calls do nothing.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        LOGGER.info("Shutdown sequence initiated");

        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
        }
        stopProcesses();
        LOGGER.info("All processes stopped");
    }

    /**
     * @return The processes in creation order.
     */
    public Map<String, IProcess> getProcesses() {
        return Collections.unmodifiableMap(managedProcesses);
    }

    private void stopProcesses() {
        final List<String> names = new ArrayList<>(managedProcesses.keySet());
        Collections.reverse(names);
        for (final String name : names) {
            try {
                LOGGER.debug("Stopping process '{}'", name);
                managedProcesses.get(name).stop();
            } catch (final RuntimeException e) {
                LOGGER.error("Error while stopping process '{}'", name, e);
            }
        }
    }

    private void initializeProcesses(final Config config) {
        if (!config.hasPath(PROCESSES_CONFIG_PATH)) {
            LOGGER.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_CONFIG_PATH);
            return;
        }

        final ConfigObject processesConfig = config.getObject(PROCESSES_CONFIG_PATH);
        final Map<String, ProcessDefinition> definitions = new LinkedHashMap<>();
        for (final String processName : processesConfig.keySet()) {
            definitions.put(processName, ProcessDefinition.parse(processName,
                processesConfig.toConfig().getConfig("\"" + processName + "\"")));
        }

        final List<String> order = topologicalSort(definitions);
        LOGGER.debug("Process instantiation order: {}", order);

        final Map<String, Object> exposedServices = new HashMap<>();
        for (final String processName : order) {
            final ProcessDefinition definition = definitions.get(processName);
            final Map<String, Object> injected = new HashMap<>();
            definition.requires().forEach((localName, source) -> {
                final Object service = exposedServices.get(source);
                if (service == null) {
                    throw new IllegalStateException("Process '" + processName + "' requires a service from '"
                        + source + "', which exposes none.");
                }
                injected.put(localName, service);
            });

            final IProcess process = instantiate(definition, injected);
            managedProcesses.put(processName, process);
            if (process instanceof IServiceProvider) {
                final Object exposed = ((IServiceProvider) process).getExposedService();
                if (exposed != null) {
                    exposedServices.put(processName, exposed);
                    LOGGER.debug("Process '{}' exposes {}", processName, exposed.getClass().getSimpleName());
                }
            }
        }
        LOGGER.info("Initialized {} process(es)", managedProcesses.size());
    }

    private static IProcess instantiate(final ProcessDefinition definition, final Map<String, Object> injected) {
        try {
            final Class<?> processClass = Class.forName(definition.className());
            if (!IProcess.class.isAssignableFrom(processClass)) {
                throw new IllegalArgumentException("Class " + definition.className() + " does not implement IProcess.");
            }
            final Constructor<?> constructor = processClass.getConstructor(String.class, Map.class, Config.class);
            return (IProcess) constructor.newInstance(definition.name(), injected, definition.options());
        } catch (final InvocationTargetException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Process '" + definition.name() + "' failed to initialize: "
                + cause.getMessage(), cause);
        } catch (final ReflectiveOperationException e) {
            throw new IllegalStateException("Process '" + definition.name() + "' cannot be created from class "
                + definition.className(), e);
        }
    }

    /**
     * Orders processes so that every process comes after the processes it requires, keeping
     * declaration order among independent processes (Kahn's algorithm).
     *
     * @throws IllegalStateException on an unknown or circular dependency.
     */
    static List<String> topologicalSort(final Map<String, ProcessDefinition> definitions) {
        final Map<String, Set<String>> dependents = new LinkedHashMap<>();
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (final String name : definitions.keySet()) {
            dependents.put(name, new LinkedHashSet<>());
            inDegree.put(name, 0);
        }
        for (final ProcessDefinition definition : definitions.values()) {
            for (final String required : new LinkedHashSet<>(definition.requires().values())) {
                if (!definitions.containsKey(required)) {
                    throw new IllegalStateException("Process '" + definition.name() + "' depends on '" + required
                        + "' which is not defined in the configuration.");
                }
                dependents.get(required).add(definition.name());
                inDegree.merge(definition.name(), 1, Integer::sum);
            }
        }

        final Queue<String> ready = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                ready.add(name);
            }
        });
        final List<String> result = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String current = ready.poll();
            result.add(current);
            for (final String dependent : dependents.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (result.size() != definitions.size()) {
            final List<String> remaining = new ArrayList<>(definitions.keySet());
            remaining.removeAll(result);
            throw new IllegalStateException("Circular dependency detected among processes: " + remaining);
        }
        return result;
    }

    /**
     * One entry of {@code node.processes}.
     *
     * @param requires Local dependency name to providing process name.
     */
    record ProcessDefinition(String name, String className, Config options, Map<String, String> requires) {

        static ProcessDefinition parse(final String name, final Config processConfig) {
            final Config options = processConfig.hasPath("options")
                ? processConfig.getConfig("options")
                : ConfigFactory.empty();
            final Map<String, String> requires = new LinkedHashMap<>();
            if (processConfig.hasPath("require")) {
                final ConfigObject require = processConfig.getObject("require");
                for (final String localName : require.keySet()) {
                    requires.put(localName, require.get(localName).unwrapped().toString());
                }
            }
            return new ProcessDefinition(name, processConfig.getString("className"), options, requires);
        }
    }
}
