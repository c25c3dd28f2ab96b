package org.drinkmap.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The fields of a drink that a recommendation needs; keeps agent prompts small.
 */
public record SimplifiedDrink(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("store_name") String storeName,
    @JsonProperty("store_id") String storeId,
    @JsonProperty("store_url") String storeUrl
) {
}
