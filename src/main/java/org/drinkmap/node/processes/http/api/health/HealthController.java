package org.drinkmap.node.processes.http.api.health;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.drinkmap.driver.DriverContainer;
import org.drinkmap.driver.DriverState;
import org.drinkmap.node.processes.http.AbstractController;
import org.drinkmap.node.processes.http.api.health.dto.DriverHealthDto;
import org.drinkmap.node.spi.ServiceRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness of the node and health of its drivers.
 * <p>
 * {@code GET drivers} reports every registered driver; only initialized drivers are probed,
 * the others report their state with {@code healthy = null}. The status is 503 when any probed
 * driver is unhealthy.
 */
public class HealthController extends AbstractController {

    private final DriverContainer container;

    public HealthController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.container = registry.get(DriverContainer.class);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(path(basePath, ""), ctx -> ctx.status(HttpStatus.OK).json(Map.of("status", "healthy")));
        app.get(path(basePath, "drivers"), this::driverHealth);
    }

    void driverHealth(final Context ctx) {
        final Map<String, Boolean> probed = container.healthCheckAll();
        final Map<String, DriverHealthDto> drivers = new LinkedHashMap<>();
        boolean healthy = true;
        for (final String name : container.getRegisteredNames()) {
            final DriverState state = container.getState(name);
            final Boolean result = probed.get(name);
            drivers.put(name, new DriverHealthDto(state.name(), result));
            if (Boolean.FALSE.equals(result)) {
                healthy = false;
            }
        }

        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthy ? "healthy" : "unhealthy");
        body.put("drivers", drivers);
        ctx.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).json(body);
    }
}
