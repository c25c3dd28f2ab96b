package org.drinkmap.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.bson.Document;
import org.drinkmap.driver.DriverContainer;
import org.drinkmap.driver.http.HttpClientDriver;
import org.drinkmap.driver.http.PooledHttpClient;
import org.drinkmap.service.dto.ChatMessage;
import org.drinkmap.service.dto.ChatRequest;
import org.drinkmap.service.dto.RecommendRequest;
import org.drinkmap.service.dto.RecommendationResponse;
import org.drinkmap.service.dto.SimplifiedDrink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Client of the LLM agent runtime, which keeps conversation sessions per app and user.
 * <p>
 * Endpoints used:
 * <ul>
 *   <li>{@code GET|POST {base}/apps/{app}/users/{user}/sessions/{session}}: read or create a session</li>
 *   <li>{@code POST {base}/run}: send a message; the reply is a JSON array of events, or an
 *       event stream when streaming</li>
 * </ul>
 */
public class AgentService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentService.class);

    static final int RECOMMEND_DRINK_LIMIT = 100;
    static final int PROMPT_DRINK_COUNT = 3;
    static final String FAILURE_MESSAGE =
        "抱歉，系統發生錯誤，可能是因為 LLM 服務呼叫太過頻繁，請稍後再試。如果持續發生，請聯絡開發者";
    private static final String JSON = "application/json";

    private final Supplier<PooledHttpClient> httpClientSupplier;
    private final StoreService storeService;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public AgentService(final Supplier<PooledHttpClient> httpClientSupplier, final StoreService storeService,
                        final ObjectMapper objectMapper, final String baseUrl) {
        this.httpClientSupplier = Objects.requireNonNull(httpClientSupplier, "httpClientSupplier");
        this.storeService = Objects.requireNonNull(storeService, "storeService");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Creates a service that obtains the HTTP client from the given container.
     */
    public static AgentService fromContainer(final DriverContainer container, final StoreService storeService,
                                             final ObjectMapper objectMapper, final String baseUrl) {
        Objects.requireNonNull(container, "container");
        return new AgentService(() -> container.getInstance(HttpClientDriver.NAME, PooledHttpClient.class),
            storeService, objectMapper, baseUrl);
    }

    /**
     * Reads a session, creating it when the runtime does not know it yet.
     *
     * @return The session as returned by the runtime.
     * @throws AgentServiceException if the runtime fails or answers with an error status.
     */
    public JsonNode ensureSession(final String appName, final String userId, final String sessionId) {
        final String uri = sessionUri(appName, userId, sessionId);
        final PooledHttpClient client = httpClientSupplier.get();
        HttpResponse<String> response = exchange(client, client.request(uri).GET().build());
        if (response.statusCode() == 404) {
            LOGGER.debug("Creating agent session {}/{}/{}", appName, userId, sessionId);
            response = exchange(client, client.request(uri)
                .header("Content-Type", JSON)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build());
        }
        if (response.statusCode() >= 400) {
            throw new AgentServiceException("Agent session " + appName + "/" + userId + "/" + sessionId
                + " unavailable: HTTP " + response.statusCode(), response.statusCode());
        }
        return readTree(response.body());
    }

    /**
     * Sends a message and waits for the complete reply.
     *
     * @return The raw response; the status is not checked.
     */
    public HttpResponse<String> run(final String appName, final String userId, final String sessionId,
                                    final ChatMessage message) {
        final PooledHttpClient client = httpClientSupplier.get();
        return exchange(client, runRequest(client, appName, userId, sessionId, message, false));
    }

    /**
     * Sends a message and returns the reply as it is produced.
     *
     * @return The event stream; the caller must close it.
     * @throws AgentServiceException if the runtime answers with an error status.
     */
    public InputStream stream(final String appName, final String userId, final String sessionId,
                              final ChatMessage message) {
        final PooledHttpClient client = httpClientSupplier.get();
        final HttpRequest request = runRequest(client, appName, userId, sessionId, message, true);
        final HttpResponse<InputStream> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (final IOException e) {
            throw new AgentServiceException("Agent runtime at " + baseUrl + " unreachable", e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentServiceException("Interrupted while calling the agent runtime", e);
        }
        if (response.statusCode() >= 400) {
            closeQuietly(response.body());
            throw new AgentServiceException("Agent run failed: HTTP " + response.statusCode(), response.statusCode());
        }
        return response.body();
    }

    /**
     * Forwards a chat message, making sure its session exists first.
     *
     * @param chatType The chat type from the route, used when the request does not name one.
     * @param request  The chat message.
     * @return The agent's event stream.
     */
    public InputStream chat(final String chatType, final ChatRequest request) {
        request.validate();
        LOGGER.debug("Chat of type {} for app {}",
            request.chatType() != null ? request.chatType() : chatType, request.appName());
        ensureSession(request.appName(), request.userId(), request.sessionId());
        return stream(request.appName(), request.userId(), request.sessionId(), request.message());
    }

    /**
     * Recommends drinks near the requested location.
     * <p>
     * The best few matches and the user's response style preferences are handed to the
     * recommendation agent. If the agent fails, an apology is returned instead of its text;
     * the drinks are returned either way.
     *
     * @param request The recommendation request.
     * @return The agent's recommendation and all drinks it was chosen from.
     */
    public RecommendationResponse recommend(final RecommendRequest request) {
        request.validate();
        final List<Document> drinks = storeService.listDrinks(request.toSearchRequest(), RECOMMEND_DRINK_LIMIT);
        final List<SimplifiedDrink> candidates = StoreService.simplify(
            drinks.subList(0, Math.min(PROMPT_DRINK_COUNT, drinks.size())));
        final String prompt = buildPrompt(chatsToMessage(request.getResponsePreferenceChats()), candidates);

        ensureSession(request.getAppName(), request.getUserId(), request.getSessionId());
        final HttpResponse<String> response = run(request.getAppName(), request.getUserId(),
            request.getSessionId(), new ChatMessage("user", prompt));

        if (response.statusCode() != 200) {
            LOGGER.error("Agent run for {} failed with HTTP {}: {}",
                request.getAppName(), response.statusCode(), response.body());
            return new RecommendationResponse(FAILURE_MESSAGE, drinks);
        }
        return new RecommendationResponse(extractRecommendation(response.body()), drinks);
    }

    /**
     * Renders chat turns as {@code role: content} lines.
     */
    static String chatsToMessage(final List<ChatMessage> chats) {
        if (chats == null) {
            return "";
        }
        return chats.stream()
            .map(chat -> chat.role() + ": " + chat.content())
            .collect(Collectors.joining("\n"));
    }

    String buildPrompt(final String responsePreference, final List<SimplifiedDrink> drinks) {
        final ArrayNode list = objectMapper.createArrayNode();
        for (final SimplifiedDrink drink : drinks) {
            final Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", drink.name());
            entry.put("store_name", drink.storeName());
            entry.put("description", drink.description() != null ? drink.description() : "");
            list.add(objectMapper.valueToTree(entry));
        }
        return "\n# 使用者的回應風格偏好\n" + responsePreference
            + "\n\n# 飲料清單\n" + list
            + "\n\n請依據以上資料，推薦適合的飲料給使用者。\n";
    }

    /**
     * Extracts the recommendation text from a {@code /run} reply.
     * <p>
     * The text of the last event is either a JSON object carrying
     * {@code state.final_recommendation}, a reply wrapping the text in a triple-quoted block,
     * or the plain text.
     *
     * @param body The JSON array of events.
     * @return The recommendation.
     * @throws AgentServiceException if the reply carries no text.
     */
    String extractRecommendation(final String body) {
        final JsonNode events = readTree(body);
        final JsonNode last = events.isArray() && events.size() > 0 ? events.get(events.size() - 1) : null;
        final JsonNode text = last == null ? null : last.path("content").path("parts").path(0).path("text");
        if (text == null || !text.isTextual()) {
            throw new AgentServiceException("Agent reply carries no text", 200);
        }
        final String raw = text.asText();
        try {
            final JsonNode recommendation = objectMapper.readTree(raw).path("state").path("final_recommendation");
            if (recommendation.isTextual()) {
                return recommendation.asText();
            }
        } catch (final JsonProcessingException e) {
            LOGGER.debug("Agent reply is not JSON, looking for a quoted block");
        }
        return quotedBlock(raw);
    }

    static String quotedBlock(final String raw) {
        for (final String quote : List.of("\"\"\"", "'''")) {
            final int start = raw.indexOf(quote);
            if (start >= 0) {
                final int end = raw.indexOf(quote, start + quote.length());
                final String block = end >= 0
                    ? raw.substring(start + quote.length(), end)
                    : raw.substring(start + quote.length());
                return block.strip();
            }
        }
        return raw.strip();
    }

    private HttpRequest runRequest(final PooledHttpClient client, final String appName, final String userId,
                                   final String sessionId, final ChatMessage message, final boolean streaming) {
        final ObjectNode body = objectMapper.createObjectNode();
        body.put("appName", appName);
        body.put("userId", userId);
        body.put("sessionId", sessionId);
        final ObjectNode newMessage = body.putObject("newMessage");
        newMessage.putArray("parts").addObject().put("text", message.content());
        newMessage.put("role", message.role());
        body.put("streaming", streaming);
        return client.request(baseUrl + "/run")
            .header("Content-Type", JSON)
            .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
            .build();
    }

    private String sessionUri(final String appName, final String userId, final String sessionId) {
        return baseUrl + "/apps/" + encode(appName) + "/users/" + encode(userId) + "/sessions/" + encode(sessionId);
    }

    private HttpResponse<String> exchange(final PooledHttpClient client, final HttpRequest request) {
        try {
            return client.send(request);
        } catch (final IOException e) {
            throw new AgentServiceException("Agent runtime at " + baseUrl + " unreachable", e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentServiceException("Interrupted while calling the agent runtime", e);
        }
    }

    private JsonNode readTree(final String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.nullNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (final JsonProcessingException e) {
            throw new AgentServiceException("Agent runtime returned malformed JSON", e);
        }
    }

    private static String encode(final String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void closeQuietly(final InputStream stream) {
        try {
            stream.close();
        } catch (final IOException e) {
            LOGGER.debug("Closing agent error stream failed: {}", e.getMessage());
        }
    }
}
