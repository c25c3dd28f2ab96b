package org.drinkmap.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter request for {@link GeoTextQueryEngine}. All validation happens at construction, so a
 * query that exists is one the engine can run.
 *
 * @param longitude        Longitude of the search center, in degrees.
 * @param latitude         Latitude of the search center, in degrees.
 * @param drinkTags        Text search terms for menu items; blank entries are dropped.
 * @param brands           Store name fragments, matched case-insensitively and literally.
 * @param reviewCountRange Allowed {@code rating.review_count}, or null for any.
 * @param ratingRange      Allowed {@code rating.value}, or null for any.
 * @param distanceRange    Allowed distance from the center in meters, or null for the default radius.
 * @param platform         Required platform, or null for any.
 * @param limit            Maximum number of menu items for drink searches, or null for no limit.
 */
public record DrinkQuery(
    double longitude,
    double latitude,
    List<String> drinkTags,
    List<String> brands,
    Range reviewCountRange,
    Range ratingRange,
    Range distanceRange,
    String platform,
    Integer limit
) {

    /** Search radius used when no distance range is given. */
    public static final double DEFAULT_RADIUS_KM = 5.0;

    public DrinkQuery {
        validateCoordinates(longitude, latitude);
        if (distanceRange != null && distanceRange.min() < 0) {
            throw new IllegalArgumentException("Distance range must not be negative, got " + distanceRange);
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative, got " + limit);
        }
        drinkTags = nonBlank(drinkTags);
        brands = nonBlank(brands);
    }

    public static Builder builder(final double longitude, final double latitude) {
        return new Builder(longitude, latitude);
    }

    public boolean hasTags() {
        return !drinkTags.isEmpty();
    }

    /**
     * @return The search radius: the upper bound of the distance range in kilometers, or
     *         {@link #DEFAULT_RADIUS_KM} without a range.
     */
    public double radiusKm() {
        return distanceRange == null ? DEFAULT_RADIUS_KM : distanceRange.max() / 1000.0;
    }

    /**
     * @return The lower bound of the distance range in meters if it is positive, otherwise null.
     */
    public Double minDistanceMeters() {
        return distanceRange != null && distanceRange.min() > 0 ? distanceRange.min() : null;
    }

    static void validateCoordinates(final double longitude, final double latitude) {
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Longitude must be within [-180, 180], got " + longitude);
        }
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90], got " + latitude);
        }
    }

    private static List<String> nonBlank(final List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        final List<String> result = new ArrayList<>(values.size());
        for (final String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value.trim());
            }
        }
        return List.copyOf(result);
    }

    /**
     * Builder for {@link DrinkQuery}; only the center point is mandatory.
     */
    public static final class Builder {
        private final double longitude;
        private final double latitude;
        private List<String> drinkTags = List.of();
        private List<String> brands = List.of();
        private Range reviewCountRange;
        private Range ratingRange;
        private Range distanceRange;
        private String platform;
        private Integer limit;

        private Builder(final double longitude, final double latitude) {
            this.longitude = longitude;
            this.latitude = latitude;
        }

        public Builder drinkTags(final List<String> drinkTags) {
            this.drinkTags = drinkTags;
            return this;
        }

        public Builder brands(final List<String> brands) {
            this.brands = brands;
            return this;
        }

        public Builder reviewCountRange(final Range reviewCountRange) {
            this.reviewCountRange = reviewCountRange;
            return this;
        }

        public Builder ratingRange(final Range ratingRange) {
            this.ratingRange = ratingRange;
            return this;
        }

        public Builder distanceRange(final Range distanceRange) {
            this.distanceRange = distanceRange;
            return this;
        }

        public Builder platform(final String platform) {
            this.platform = platform;
            return this;
        }

        public Builder limit(final Integer limit) {
            this.limit = limit;
            return this;
        }

        public DrinkQuery build() {
            return new DrinkQuery(longitude, latitude, drinkTags, brands,
                reviewCountRange, ratingRange, distanceRange, platform, limit);
        }
    }
}
