package org.drinkmap.node.processes.http.api.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigFactory;
import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;
import okhttp3.Response;
import org.bson.Document;
import org.drinkmap.junit.extensions.logging.ExpectLog;
import org.drinkmap.junit.extensions.logging.LogLevel;
import org.drinkmap.junit.extensions.logging.LogWatchExtension;
import org.drinkmap.node.processes.http.ApiExceptionHandlers;
import org.drinkmap.node.spi.ServiceRegistry;
import org.drinkmap.service.AgentService;
import org.drinkmap.service.AgentServiceException;
import org.drinkmap.service.dto.ChatRequest;
import org.drinkmap.service.dto.RecommendRequest;
import org.drinkmap.service.dto.RecommendationResponse;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class AgentControllerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AgentService agentService = mock(AgentService.class);

    private Javalin app() {
        final ServiceRegistry registry = new ServiceRegistry();
        registry.register(AgentService.class, agentService);
        final Javalin app = Javalin.create();
        ApiExceptionHandlers.register(app);
        new AgentController(registry, ConfigFactory.empty()).registerRoutes(app, "/agent");
        return app;
    }

    @Test
    void chatStreamsEventsBack() {
        when(agentService.chat(eq("drink"), any())).thenReturn(
            new ByteArrayInputStream("data: {\"text\":\"嗨\"}\n\n".getBytes(StandardCharsets.UTF_8)));

        JavalinTest.test(app(), (server, client) -> {
            final Response response = client.post("/agent/chat/drink",
                "{\"app_name\":\"chat\",\"user_id\":\"u\",\"session_id\":\"s\",\"message\":{\"role\":\"user\",\"content\":\"哈囉\"}}");

            assertThat(response.code()).isEqualTo(200);
            assertThat(response.header("Content-Type")).startsWith("text/event-stream");
            assertThat(response.header("Cache-Control")).isEqualTo("no-cache");
            assertThat(response.body().string()).isEqualTo("data: {\"text\":\"嗨\"}\n\n");

            final ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
            verify(agentService).chat(eq("drink"), captor.capture());
            assertThat(captor.getValue().userId()).isEqualTo("u");
            assertThat(captor.getValue().message().content()).isEqualTo("哈囉");
        });
    }

    @Test
    void recommendReturnsMessageAndDrinks() {
        when(agentService.recommend(any())).thenReturn(
            new RecommendationResponse("來杯紅茶吧", List.of(new Document("name", "紅茶"))));

        JavalinTest.test(app(), (server, client) -> {
            final Response response = client.post("/agent/recommend",
                "{\"location\":[121.56,25.03],\"user_id\":\"u\",\"session_id\":\"s\","
                    + "\"response_preference_chats\":[{\"role\":\"user\",\"content\":\"簡短\"}]}");

            assertThat(response.code()).isEqualTo(200);
            final JsonNode body = MAPPER.readTree(response.body().string());
            assertThat(body.path("message").asText()).isEqualTo("來杯紅茶吧");
            assertThat(body.path("drinks").path(0).path("name").asText()).isEqualTo("紅茶");

            final ArgumentCaptor<RecommendRequest> captor = ArgumentCaptor.forClass(RecommendRequest.class);
            verify(agentService).recommend(captor.capture());
            assertThat(captor.getValue().getAppName()).isEqualTo(RecommendRequest.DEFAULT_APP_NAME);
            assertThat(captor.getValue().getResponsePreferenceChats()).hasSize(1);
        });
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Agent runtime failure for request /agent/recommend: .*")
    void agentRuntimeFailuresAreBadGateway() {
        when(agentService.recommend(any())).thenThrow(new AgentServiceException("Agent session unavailable: HTTP 500", 500));

        JavalinTest.test(app(), (server, client) -> {
            final Response response = client.post("/agent/recommend", "{\"user_id\":\"u\",\"session_id\":\"s\"}");

            assertThat(response.code()).isEqualTo(502);
            assertThat(MAPPER.readTree(response.body().string()).path("error").asText()).isEqualTo("Bad Gateway");
        });
    }
}
