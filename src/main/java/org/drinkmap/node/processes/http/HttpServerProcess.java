package org.drinkmap.node.processes.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.drinkmap.driver.DriverContainer;
import org.drinkmap.node.processes.AbstractProcess;
import org.drinkmap.node.spi.IController;
import org.drinkmap.node.spi.ServiceRegistry;
import org.drinkmap.service.AgentService;
import org.drinkmap.service.StoreService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the Javalin HTTP server. Routes come from the {@code routes} block, where every nested
 * key adds a path segment:
 *
 * <pre>
 * routes {
 *   mongo { "$controller" { className = "org.drinkmap.node.processes.http.api.store.StoreController" } }
 *   agent { "$controller" { className = "...AgentController", options { } } }
 * }
 * </pre>
 *
 * Requires the driver container under the local name {@code drivers}; the store and agent
 * services are built from it and handed to controllers through a {@link ServiceRegistry}.
 */
public class HttpServerProcess extends AbstractProcess {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);

    private static final String ROUTES_CONFIG_KEY = "routes";
    private static final String CONTROLLER_ACTION_KEY = "$controller";
    static final String DEFAULT_AGENT_BASE_URL = "http://localhost:3002";

    private final List<RouteDefinition> routeDefinitions = new ArrayList<>();
    private final ServiceRegistry controllerRegistry = new ServiceRegistry();
    private Javalin app;

    /**
     * @param processName  The process name from the configuration.
     * @param dependencies Must contain the {@link DriverContainer} under {@code drivers}.
     * @param options      Network settings, {@code agent.base-url} and the routes.
     */
    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);

        final DriverContainer container = getDependency("drivers", DriverContainer.class);
        final ObjectMapper objectMapper = new ObjectMapper();
        final StoreService storeService = StoreService.fromContainer(container);
        final String agentBaseUrl = options.hasPath("agent.base-url")
            ? options.getString("agent.base-url")
            : DEFAULT_AGENT_BASE_URL;

        controllerRegistry.register(DriverContainer.class, container);
        controllerRegistry.register(ObjectMapper.class, objectMapper);
        controllerRegistry.register(StoreService.class, storeService);
        controllerRegistry.register(AgentService.class,
            AgentService.fromContainer(container, storeService, objectMapper, agentBaseUrl));

        parseRoutes();
        LOGGER.debug("HttpServerProcess '{}' initialized with {} route(s), agent runtime at {}",
            processName, routeDefinitions.size(), agentBaseUrl);
    }

    @Override
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server is already running.");
            return;
        }

        final String host = options.hasPath("network.host") ? options.getString("network.host") : "0.0.0.0";
        final int port = options.hasPath("network.port") ? options.getInt("network.port") : 8080;

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.statusCode(), ms);
                }
            });

            final int minThreads = options.hasPath("network.threadPool.minThreads")
                ? options.getInt("network.threadPool.minThreads")
                : 8;
            final int maxThreads = options.hasPath("network.threadPool.maxThreads")
                ? options.getInt("network.threadPool.maxThreads")
                : 200;
            final int idleTimeout = options.hasPath("network.threadPool.idleTimeoutMs")
                ? options.getInt("network.threadPool.idleTimeoutMs")
                : 60000;
            final QueuedThreadPool threadPool = new QueuedThreadPool(maxThreads, minThreads, idleTimeout);
            threadPool.setName(processName);
            config.jetty.threadPool = threadPool;
            LOGGER.debug("Configured thread pool '{}' with {}..{} threads", threadPool.getName(), minThreads, maxThreads);
        });

        ApiExceptionHandlers.register(app);
        registerControllers(app);

        app.start(host, port);
        LOGGER.info("HTTP server started on {}:{}", host, app.port());
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped.");
        }
    }

    /**
     * @return The bound port, or -1 if the server is not running.
     */
    public int getPort() {
        return app != null ? app.port() : -1;
    }

    ServiceRegistry getControllerRegistry() {
        return controllerRegistry;
    }

    private void parseRoutes() {
        if (!options.hasPath(ROUTES_CONFIG_KEY)) {
            LOGGER.warn("No '{}' block found in http-server configuration. No routes will be served.", ROUTES_CONFIG_KEY);
            return;
        }
        parseConfigLevel(options.getObject(ROUTES_CONFIG_KEY), "/");
    }

    private void parseConfigLevel(final ConfigObject configObject, final String currentPath) {
        for (final Map.Entry<String, ConfigValue> entry : configObject.entrySet()) {
            final String key = entry.getKey();
            final ConfigValue value = entry.getValue();

            if (key.equals(CONTROLLER_ACTION_KEY)) {
                if (value.valueType() != ConfigValueType.OBJECT) {
                    throw new IllegalArgumentException("Invalid '$controller' at path '" + currentPath
                        + "': expected an object");
                }
                routeDefinitions.add(new RouteDefinition(currentPath, (ConfigObject) value));
            } else if (value.valueType() == ConfigValueType.OBJECT) {
                parseConfigLevel((ConfigObject) value, (currentPath + key + "/").replaceAll("//", "/"));
            }
        }
    }

    private void registerControllers(final Javalin app) {
        for (final RouteDefinition def : routeDefinitions) {
            createController(def).registerRoutes(app, def.basePath());
        }
    }

    private IController createController(final RouteDefinition def) {
        final Config controllerConfig = def.controller().toConfig();
        final String className = controllerConfig.getString("className");
        final Config controllerOptions = controllerConfig.hasPath("options")
            ? controllerConfig.getConfig("options")
            : ConfigFactory.empty();
        LOGGER.debug("Registering controller '{}' at base path '{}'", className, def.basePath());
        try {
            final Class<?> controllerClass = Class.forName(className);
            if (!IController.class.isAssignableFrom(controllerClass)) {
                throw new IllegalArgumentException("Class " + className + " does not implement IController.");
            }
            final Constructor<?> constructor = controllerClass.getConstructor(ServiceRegistry.class, Config.class);
            return (IController) constructor.newInstance(controllerRegistry, controllerOptions);
        } catch (final ReflectiveOperationException e) {
            throw new IllegalStateException("Controller " + className + " at '" + def.basePath()
                + "' cannot be created", e);
        }
    }

    private record RouteDefinition(String basePath, ConfigObject controller) {
        RouteDefinition {
            Objects.requireNonNull(basePath);
            Objects.requireNonNull(controller);
        }
    }
}
