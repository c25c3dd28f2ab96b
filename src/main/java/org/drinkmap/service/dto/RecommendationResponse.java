package org.drinkmap.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.bson.Document;

import java.util.List;

/**
 * Reply of the recommendation flow.
 *
 * @param message The recommendation text produced by the agent, or an apology on failure.
 * @param drinks  The drinks the recommendation was chosen from, in ranking order.
 */
public record RecommendationResponse(
    @JsonProperty("message") String message,
    @JsonProperty("drinks") List<Document> drinks
) {
}
