package org.drinkmap.node.processes.http.api.agent;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.drinkmap.node.processes.http.AbstractController;
import org.drinkmap.node.spi.ServiceRegistry;
import org.drinkmap.service.AgentService;
import org.drinkmap.service.dto.ChatRequest;
import org.drinkmap.service.dto.RecommendRequest;

import java.io.InputStream;

/**
 * Front for the LLM agent runtime.
 * <ul>
 *   <li>{@code POST chat/{chatType}}: forwards one message, streams the agent's events back</li>
 *   <li>{@code POST recommend}: nearby drinks plus the agent's recommendation</li>
 * </ul>
 */
public class AgentController extends AbstractController {

    private static final String EVENT_STREAM = "text/event-stream";

    private final AgentService agentService;

    public AgentController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.agentService = registry.get(AgentService.class);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.post(path(basePath, "chat/{chatType}"), this::chat);
        app.post(path(basePath, "recommend"), this::recommend);
    }

    void chat(final Context ctx) {
        final ChatRequest request = ctx.bodyAsClass(ChatRequest.class);
        final InputStream events = agentService.chat(ctx.pathParam("chatType"), request);
        ctx.status(HttpStatus.OK)
            .contentType(EVENT_STREAM)
            .header("Cache-Control", "no-cache")
            .result(events);
    }

    void recommend(final Context ctx) {
        final RecommendRequest request = ctx.bodyAsClass(RecommendRequest.class);
        ctx.status(HttpStatus.OK).json(agentService.recommend(request));
    }
}
