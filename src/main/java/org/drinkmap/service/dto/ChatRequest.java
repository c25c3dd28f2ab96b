package org.drinkmap.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the chat endpoint: one message to an agent app within a session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatRequest(
    @JsonProperty("app_name") String appName,
    @JsonProperty("user_id") String userId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("chat_type") String chatType,
    @JsonProperty("message") ChatMessage message
) {

    /**
     * @throws IllegalArgumentException if a required field is missing.
     */
    public void validate() {
        requireText("app_name", appName);
        requireText("user_id", userId);
        requireText("session_id", sessionId);
        if (message == null || message.content() == null) {
            throw new IllegalArgumentException("message with content is required");
        }
    }

    static void requireText(final String field, final String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
