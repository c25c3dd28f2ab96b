package org.drinkmap.query;

import org.bson.Document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds the aggregation stages and pipelines the engine runs.
 * <p>
 * Store constraints shape every pipeline here:
 * <ul>
 *   <li>{@code $geoNear} must be the first stage of its pipeline.</li>
 *   <li>A {@code $text} match must be the first stage of its pipeline, and there can be only one.</li>
 *   <li>Therefore geo and text never share a pipeline; store pipelines start with geo, menu pipelines with text.</li>
 * </ul>
 */
public final class AggregationPipelines {

    /** Menu items cheaper than this are not offered as drinks. */
    public static final int MIN_DRINK_PRICE = 20;

    private static final String TEXT_SCORE_META = "textScore";

    private AggregationPipelines() {
        // Utility class - prevent instantiation
    }

    // ---- stages ----

    /**
     * {@code $geoNear} stage writing the distance in meters to {@code distance_in_meter}.
     *
     * @param longitude         Center longitude.
     * @param latitude          Center latitude.
     * @param radiusKm          Maximum distance in kilometers.
     * @param minDistanceMeters Minimum distance in meters, or null for none.
     * @return The stage.
     */
    public static Document geoNear(final double longitude, final double latitude,
                                   final double radiusKm, final Double minDistanceMeters) {
        final Document spec = new Document("near", new Document("type", "Point")
                .append("coordinates", List.of(longitude, latitude)))
            .append("distanceField", Fields.DISTANCE_IN_METER)
            .append("maxDistance", radiusKm * 1000);
        if (minDistanceMeters != null) {
            spec.append("minDistance", minDistanceMeters);
        }
        spec.append("spherical", true);
        return new Document("$geoNear", spec);
    }

    /**
     * {@code $match} on the text index with all tags merged into one search string.
     *
     * @param tags The tags; must not be empty.
     * @return The stage.
     */
    public static Document textSearch(final List<String> tags) {
        if (tags.isEmpty()) {
            throw new IllegalArgumentException("Text search needs at least one tag");
        }
        return match(new Document("$text", new Document("$search", String.join(" ", tags))));
    }

    /**
     * Platform equality and rating ranges as one {@code $match}. Without any applicable
     * filter the stage is the always-true {@code {$match: {$expr: true}}}.
     *
     * @param platform         Required platform, or null.
     * @param ratingRange      Allowed rating, or null.
     * @param reviewCountRange Allowed review count, or null.
     * @return The stage.
     */
    public static Document storeAttributes(final String platform, final Range ratingRange,
                                           final Range reviewCountRange) {
        final Document filter = new Document();
        if (platform != null && !platform.isEmpty()) {
            filter.append(Fields.PLATFORM, platform);
        }
        if (ratingRange != null) {
            filter.append(Fields.RATING_VALUE, between(ratingRange));
        }
        if (reviewCountRange != null) {
            filter.append(Fields.RATING_REVIEW_COUNT, between(reviewCountRange));
        }
        return match(filter.isEmpty() ? new Document("$expr", true) : filter);
    }

    /**
     * Case-insensitive OR over store names. Brands are quoted, so they match literally.
     *
     * @param brands The brand fragments; must not be empty.
     * @return The stage.
     */
    public static Document brandFilter(final List<String> brands) {
        final List<Document> alternatives = new ArrayList<>(brands.size());
        for (final String brand : brands) {
            alternatives.add(new Document(Fields.NAME,
                new Document("$regex", Pattern.quote(brand)).append("$options", "i")));
        }
        return match(new Document("$or", alternatives));
    }

    public static Document storeIdIn(final Collection<String> storeIds) {
        return match(new Document(Fields.STORE_ID, new Document("$in", new ArrayList<>(storeIds))));
    }

    /**
     * Restricts to the given stores by their full {@code (store_id, platform)} identity.
     *
     * @param keys The store keys; must not be empty.
     * @return The stage.
     */
    public static Document storeKeyIn(final Collection<StoreKey> keys) {
        final List<Document> alternatives = new ArrayList<>(keys.size());
        for (final StoreKey key : keys) {
            final Document condition = new Document(Fields.STORE_ID, key.storeId());
            if (key.platform() != null) {
                condition.append(Fields.PLATFORM, key.platform());
            }
            alternatives.add(condition);
        }
        return match(new Document("$or", alternatives));
    }

    public static Document priceFloor(final int minPrice) {
        return match(new Document(Fields.PRICE, new Document("$gte", minPrice)));
    }

    public static Document addTextScore() {
        return new Document("$addFields", new Document(Fields.TEXT_SCORE, new Document("$meta", TEXT_SCORE_META)));
    }

    public static Document sortByTextScore() {
        return new Document("$sort", new Document(Fields.TEXT_SCORE, new Document("$meta", TEXT_SCORE_META)));
    }

    public static Document limit(final int limit) {
        return new Document("$limit", limit);
    }

    public static Document storeProjection() {
        return new Document("$project", new Document("_id", 0)
            .append(Fields.STORE_ID, 1)
            .append(Fields.PLATFORM, 1)
            .append(Fields.NAME, 1)
            .append(Fields.BRAND, 1)
            .append(Fields.ADDRESS, 1)
            .append(Fields.RATING, 1)
            .append(Fields.CUISINES, 1)
            .append(Fields.SOURCE_URL, 1)
            .append(Fields.DISTANCE_IN_METER, "$" + Fields.DISTANCE_IN_METER)
            .append(Fields.DISTANCE_IN_KM, distanceInKm()));
    }

    public static Document menuItemProjection(final boolean withTextScore) {
        final Document fields = new Document("_id", 0)
            .append(Fields.ITEM_ID, 1)
            .append(Fields.STORE_ID, 1)
            .append(Fields.PLATFORM, 1)
            .append(Fields.NAME, 1)
            .append(Fields.CATEGORY, 1)
            .append(Fields.DESCRIPTION, 1)
            .append(Fields.PRICE, 1)
            .append(Fields.IMAGE_URL, 1)
            .append(Fields.IS_POPULAR, 1)
            .append(Fields.OPTIONS, 1);
        if (withTextScore) {
            fields.append(Fields.TEXT_SCORE, 1);
        }
        return new Document("$project", fields);
    }

    // ---- pipelines ----

    /**
     * Distinct {@code (store_id, platform)} pairs of menu items matching the query's tags.
     *
     * @param query A query with tags.
     * @return The pipeline for {@code menu_item}.
     */
    public static List<Document> matchingStoreKeys(final DrinkQuery query) {
        final List<Document> pipeline = new ArrayList<>();
        pipeline.add(textSearch(query.drinkTags()));
        if (query.platform() != null && !query.platform().isEmpty()) {
            pipeline.add(match(new Document(Fields.PLATFORM, query.platform())));
        }
        pipeline.add(new Document("$group", new Document("_id", new Document(Fields.STORE_ID, "$" + Fields.STORE_ID)
            .append(Fields.PLATFORM, "$" + Fields.PLATFORM))));
        pipeline.add(new Document("$project", new Document("_id", 0)
            .append(Fields.STORE_ID, "$_id." + Fields.STORE_ID)
            .append(Fields.PLATFORM, "$_id." + Fields.PLATFORM)));
        return pipeline;
    }

    /**
     * Stores around the query's center that pass its attribute and brand filters.
     *
     * @param query      The query.
     * @param restrictTo Only these stores, or null for no restriction.
     * @return The pipeline for {@code store}.
     */
    public static List<Document> storeSearch(final DrinkQuery query, final Collection<StoreKey> restrictTo) {
        final List<Document> pipeline = new ArrayList<>();
        pipeline.add(geoNear(query.longitude(), query.latitude(), query.radiusKm(), query.minDistanceMeters()));
        pipeline.add(storeAttributes(query.platform(), query.ratingRange(), query.reviewCountRange()));
        if (restrictTo != null) {
            pipeline.add(storeKeyIn(restrictTo));
        }
        if (!query.brands().isEmpty()) {
            pipeline.add(brandFilter(query.brands()));
        }
        pipeline.add(storeProjection());
        return pipeline;
    }

    /**
     * Menus of the given stores; with tags only the matching items, carrying and sorted by
     * their text score.
     *
     * @param storeIds The store ids.
     * @param tags     The tags, possibly empty.
     * @return The pipeline for {@code menu_item}.
     */
    public static List<Document> menusForStores(final Collection<String> storeIds, final List<String> tags) {
        final List<Document> pipeline = new ArrayList<>();
        final boolean withTags = !tags.isEmpty();
        if (withTags) {
            pipeline.add(textSearch(tags));
        }
        pipeline.add(storeIdIn(storeIds));
        if (withTags) {
            pipeline.add(addTextScore());
        }
        pipeline.add(menuItemProjection(withTags));
        if (withTags) {
            pipeline.add(sortByTextScore());
        }
        return pipeline;
    }

    /**
     * Drinks offered by the given stores, priced at least {@link #MIN_DRINK_PRICE}.
     *
     * @param storeIds The store ids.
     * @param tags     The tags, possibly empty.
     * @param limit    Maximum number of items, or null for no limit.
     * @return The pipeline for {@code menu_item}.
     */
    public static List<Document> drinksForStores(final Collection<String> storeIds, final List<String> tags,
                                                 final Integer limit) {
        final List<Document> pipeline = new ArrayList<>();
        final boolean withTags = !tags.isEmpty();
        if (withTags) {
            pipeline.add(textSearch(tags));
        }
        pipeline.add(priceFloor(MIN_DRINK_PRICE));
        pipeline.add(storeIdIn(storeIds));
        if (withTags) {
            pipeline.add(addTextScore());
        }
        pipeline.add(menuItemProjection(withTags));
        if (withTags) {
            pipeline.add(sortByTextScore());
        }
        if (limit != null && limit > 0) {
            pipeline.add(limit(limit));
        }
        return pipeline;
    }

    /**
     * Stores within a radius, nearest first.
     *
     * @param longitude Center longitude.
     * @param latitude  Center latitude.
     * @param radiusKm  Radius in kilometers.
     * @param limit     Maximum number of stores, or null for no limit.
     * @return The pipeline for {@code store}.
     */
    public static List<Document> nearbyStores(final double longitude, final double latitude,
                                              final double radiusKm, final Integer limit) {
        final List<Document> pipeline = new ArrayList<>();
        pipeline.add(geoNear(longitude, latitude, radiusKm, null));
        pipeline.add(storeProjection());
        if (limit != null && limit > 0) {
            pipeline.add(limit(limit));
        }
        return pipeline;
    }

    /**
     * Menu items whose name contains the term, case-insensitively.
     *
     * @param term     The literal search term.
     * @param storeIds Only items of these stores, or null/empty for all.
     * @param platform Only items of this platform, or null.
     * @param limit    Maximum number of items, or null for no limit.
     * @return The pipeline for {@code menu_item}.
     */
    public static List<Document> menuItemSearch(final String term, final Collection<String> storeIds,
                                                final String platform, final Integer limit) {
        final List<Object> conditions = new ArrayList<>();
        conditions.add(new Document("$regexMatch", new Document("input", "$" + Fields.NAME)
            .append("regex", Pattern.quote(term))
            .append("options", "i")));
        if (storeIds != null && !storeIds.isEmpty()) {
            conditions.add(new Document("$in", List.of("$" + Fields.STORE_ID, new ArrayList<>(storeIds))));
        }
        if (platform != null && !platform.isEmpty()) {
            conditions.add(new Document("$eq", List.of("$" + Fields.PLATFORM, platform)));
        }
        final Object expression = conditions.size() == 1 ? conditions.get(0) : new Document("$and", conditions);

        final List<Document> pipeline = new ArrayList<>();
        pipeline.add(match(new Document("$expr", expression)));
        pipeline.add(menuItemProjection(false));
        if (limit != null && limit > 0) {
            pipeline.add(limit(limit));
        }
        return pipeline;
    }

    private static Document match(final Document filter) {
        return new Document("$match", filter);
    }

    private static Document between(final Range range) {
        return new Document("$gte", range.minValue()).append("$lte", range.maxValue());
    }

    private static Document distanceInKm() {
        return new Document("$round", List.of(
            new Document("$divide", List.of("$" + Fields.DISTANCE_IN_METER, 1000)), 2));
    }
}
