package org.drinkmap.node.processes.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.javalin.Javalin;
import io.javalin.http.BadRequestResponse;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.drinkmap.driver.DriverException;
import org.drinkmap.node.processes.http.api.dto.ErrorResponseDto;
import org.drinkmap.query.QueryExecutionException;
import org.drinkmap.service.AgentServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps exceptions escaping a route to {@link ErrorResponseDto} responses.
 * <ul>
 *   <li>invalid input: 400 with the validation message</li>
 *   <li>agent runtime failures: 502</li>
 *   <li>driver and query failures, anything else: 500 without internals</li>
 * </ul>
 */
public final class ApiExceptionHandlers {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandlers.class);

    private ApiExceptionHandlers() {
        // Utility class - prevent instantiation
    }

    public static void register(final Javalin app) {
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            LOGGER.debug("Rejected request {}: {}", ctx.path(), e.getMessage());
            respond(ctx, HttpStatus.BAD_REQUEST, e.getMessage());
        });
        app.exception(BadRequestResponse.class, (e, ctx) -> {
            LOGGER.debug("Rejected request {}: {}", ctx.path(), e.getMessage());
            respond(ctx, HttpStatus.BAD_REQUEST, e.getMessage());
        });
        app.exception(JsonProcessingException.class, (e, ctx) -> {
            LOGGER.debug("Malformed body for {}: {}", ctx.path(), e.getOriginalMessage());
            respond(ctx, HttpStatus.BAD_REQUEST, "Malformed request body: " + e.getOriginalMessage());
        });
        app.exception(AgentServiceException.class, (e, ctx) -> {
            LOGGER.warn("Agent runtime failure for request {}: {}", ctx.path(), e.getMessage());
            respond(ctx, HttpStatus.BAD_GATEWAY, "The agent runtime is unavailable.");
        });
        app.exception(DriverException.class, (e, ctx) -> {
            LOGGER.error("Driver failure for request {}: {}", ctx.path(), e.getMessage());
            respond(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error");
        });
        app.exception(QueryExecutionException.class, (e, ctx) -> {
            LOGGER.error("Query failure for request {}: {}", ctx.path(), e.getMessage());
            respond(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error");
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}", ctx.path(), e);
            respond(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "An internal server error occurred.");
        });
    }

    private static void respond(final Context ctx, final HttpStatus status, final String message) {
        ctx.status(status).json(ErrorResponseDto.of(status.getCode(), status.getMessage(), message));
    }
}
