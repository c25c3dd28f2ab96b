package org.drinkmap.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One chat turn.
 *
 * @param role    Who spoke, e.g. {@code user}.
 * @param content What was said.
 */
public record ChatMessage(
    @JsonProperty("role") String role,
    @JsonProperty("content") String content
) {
}
