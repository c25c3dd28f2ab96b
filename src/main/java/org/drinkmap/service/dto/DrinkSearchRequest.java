package org.drinkmap.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.drinkmap.query.DrinkQuery;
import org.drinkmap.query.Range;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Body of the store and drink list endpoints.
 * <p>
 * {@code location} is {@code [longitude, latitude]}; every range is a two-element
 * {@code [min, max]} array. {@code platform} defaults to {@code ubereats}; an explicit
 * {@code null} searches all platforms.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DrinkSearchRequest {

    public static final String DEFAULT_PLATFORM = "ubereats";
    private static final Set<String> PLATFORMS = Set.of("ubereats", "foodpanda");

    @JsonProperty("location")
    private List<Double> location;

    @JsonProperty("drink_tags")
    private List<String> drinkTags = new ArrayList<>();

    @JsonProperty("brands")
    private List<String> brands = new ArrayList<>();

    @JsonProperty("review_count_range")
    private List<Integer> reviewCountRange;

    @JsonProperty("rating_range")
    private List<Double> ratingRange;

    @JsonProperty("distance_range")
    private List<Integer> distanceRange;

    @JsonProperty("platform")
    private String platform = DEFAULT_PLATFORM;

    public DrinkSearchRequest() {
    }

    public DrinkSearchRequest(final List<Double> location, final List<String> drinkTags, final List<String> brands) {
        this.location = location;
        this.drinkTags = drinkTags;
        this.brands = brands;
    }

    /**
     * Validates the request and converts it into a query.
     *
     * @param limit Maximum number of drinks, or null for no limit.
     * @return The query.
     * @throws IllegalArgumentException if a field is missing or malformed.
     */
    public DrinkQuery toQuery(final Integer limit) {
        if (location == null || location.size() != 2 || location.get(0) == null || location.get(1) == null) {
            throw new IllegalArgumentException("location must be [longitude, latitude]");
        }
        if (platform != null && !PLATFORMS.contains(platform)) {
            throw new IllegalArgumentException("platform must be one of " + PLATFORMS + ", got '" + platform + "'");
        }
        return DrinkQuery.builder(location.get(0), location.get(1))
            .drinkTags(drinkTags)
            .brands(brands)
            .reviewCountRange(toRange("review_count_range", reviewCountRange))
            .ratingRange(toRange("rating_range", ratingRange))
            .distanceRange(toRange("distance_range", distanceRange))
            .platform(platform)
            .limit(limit)
            .build();
    }

    private static Range toRange(final String field, final List<? extends Number> bounds) {
        if (bounds == null) {
            return null;
        }
        if (bounds.size() != 2 || bounds.get(0) == null || bounds.get(1) == null) {
            throw new IllegalArgumentException(field + " must be [min, max]");
        }
        return Range.of(bounds.get(0).doubleValue(), bounds.get(1).doubleValue());
    }

    public List<Double> getLocation() {
        return location;
    }

    public void setLocation(final List<Double> location) {
        this.location = location;
    }

    public List<String> getDrinkTags() {
        return drinkTags;
    }

    public void setDrinkTags(final List<String> drinkTags) {
        this.drinkTags = drinkTags;
    }

    public List<String> getBrands() {
        return brands;
    }

    public void setBrands(final List<String> brands) {
        this.brands = brands;
    }

    public List<Integer> getReviewCountRange() {
        return reviewCountRange;
    }

    public void setReviewCountRange(final List<Integer> reviewCountRange) {
        this.reviewCountRange = reviewCountRange;
    }

    public List<Double> getRatingRange() {
        return ratingRange;
    }

    public void setRatingRange(final List<Double> ratingRange) {
        this.ratingRange = ratingRange;
    }

    public List<Integer> getDistanceRange() {
        return distanceRange;
    }

    public void setDistanceRange(final List<Integer> distanceRange) {
        this.distanceRange = distanceRange;
    }

    public String getPlatform() {
        return platform;
    }

    public void setPlatform(final String platform) {
        this.platform = platform;
    }
}
