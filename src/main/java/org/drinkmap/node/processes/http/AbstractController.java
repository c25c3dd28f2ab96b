package org.drinkmap.node.processes.http;

import com.typesafe.config.Config;
import org.drinkmap.node.spi.IController;
import org.drinkmap.node.spi.ServiceRegistry;

/**
 * Base class for controllers created by {@link HttpServerProcess}, which passes the shared
 * {@link ServiceRegistry} and the controller's own {@code options} block.
 */
public abstract class AbstractController implements IController {

    protected final ServiceRegistry registry;
    protected final Config options;

    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Joins a base path and a route, collapsing duplicate slashes and dropping a trailing one.
     */
    protected static String path(final String basePath, final String route) {
        final String joined = (basePath + "/" + route).replaceAll("/{2,}", "/");
        return joined.length() > 1 && joined.endsWith("/") ? joined.substring(0, joined.length() - 1) : joined;
    }
}
