package org.drinkmap.node.spi;

import io.javalin.Javalin;

/**
 * A group of HTTP routes mounted by the HTTP server process.
 */
public interface IController {

    /**
     * Registers this controller's routes.
     *
     * @param app      The Javalin application.
     * @param basePath The path prefix the routes are mounted under, with a trailing slash.
     */
    void registerRoutes(Javalin app, String basePath);
}
