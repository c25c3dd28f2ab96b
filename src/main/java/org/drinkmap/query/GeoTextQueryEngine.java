package org.drinkmap.query;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs geo- and tag-filtered searches over the {@code store} and {@code menu_item}
 * collections and joins their results in memory.
 * <p>
 * Every operation is a short sequence of round trips, each depending on the previous one's
 * result. An empty intermediate result ends the operation with an empty list without issuing
 * the remaining queries. Store failures propagate as {@link QueryExecutionException}; no
 * partial result is ever returned.
 * <p>
 * Thread Safety: stateless apart from the executor; safe for concurrent use if the executor is.
 */
public class GeoTextQueryEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeoTextQueryEngine.class);

    private final IDocumentQueryExecutor executor;

    public GeoTextQueryEngine(final IDocumentQueryExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Finds stores around the query's center together with their menus.
     * <p>
     * With tags, only stores that offer a matching item are returned, each carrying only its
     * matching items, ordered by descending number of matches. Without tags, every qualifying
     * store is returned with its full menu in geo order.
     *
     * @param query The search.
     * @return Store documents with a {@code menu} list.
     */
    public List<Document> findStoresWithMenu(final DrinkQuery query) {
        Objects.requireNonNull(query, "query");

        Set<StoreKey> candidates = null;
        if (query.hasTags()) {
            final List<Document> pairs = executor.aggregate(CollectionNames.MENU_ITEM,
                AggregationPipelines.matchingStoreKeys(query));
            if (pairs.isEmpty()) {
                LOGGER.debug("No menu item matches tags {}", query.drinkTags());
                return List.of();
            }
            candidates = MenuJoiner.distinctStoreKeys(pairs);
            LOGGER.debug("Tags {} matched items of {} store(s)", query.drinkTags(), candidates.size());
        }

        final List<Document> stores = executor.aggregate(CollectionNames.STORE,
            AggregationPipelines.storeSearch(query, candidates));
        if (stores.isEmpty()) {
            LOGGER.debug("No store qualifies within {} km", query.radiusKm());
            return List.of();
        }

        final Set<String> storeIds = MenuJoiner.distinctStoreIds(stores);
        final List<Document> menuItems = executor.aggregate(CollectionNames.MENU_ITEM,
            AggregationPipelines.menusForStores(storeIds, query.drinkTags()));
        LOGGER.debug("Joining {} store(s) with {} menu item(s)", stores.size(), menuItems.size());
        return MenuJoiner.attachMenus(stores, menuItems, query.hasTags());
    }

    /**
     * Finds drinks offered by stores around the query's center, each annotated with its
     * store's name, URL and brand. With tags, drinks are ordered by descending relevance.
     *
     * @param query The search.
     * @return Menu item documents with store fields attached.
     */
    public List<Document> findDrinks(final DrinkQuery query) {
        Objects.requireNonNull(query, "query");

        final List<Document> stores = executor.aggregate(CollectionNames.STORE,
            AggregationPipelines.storeSearch(query, null));
        if (stores.isEmpty()) {
            LOGGER.debug("No store qualifies within {} km, skipping menu search", query.radiusKm());
            return List.of();
        }

        final Set<String> storeIds = MenuJoiner.distinctStoreIds(stores);
        final List<Document> items = executor.aggregate(CollectionNames.MENU_ITEM,
            AggregationPipelines.drinksForStores(storeIds, query.drinkTags(), query.limit()));
        final List<Document> drinks = MenuJoiner.attachStores(items, stores, query.hasTags());
        if (drinks.size() < items.size()) {
            LOGGER.debug("Dropped {} menu item(s) without a qualifying store", items.size() - drinks.size());
        }
        return drinks;
    }

    /**
     * Lists stores within a radius, nearest first.
     *
     * @param longitude Center longitude.
     * @param latitude  Center latitude.
     * @param radiusKm  Radius in kilometers; must be positive.
     * @param limit     Maximum number of stores, or null for no limit.
     * @return Store documents.
     */
    public List<Document> findNearbyStores(final double longitude, final double latitude,
                                           final double radiusKm, final Integer limit) {
        DrinkQuery.validateCoordinates(longitude, latitude);
        if (!(radiusKm > 0) || Double.isInfinite(radiusKm)) {
            throw new IllegalArgumentException("Radius must be a positive number of kilometers, got " + radiusKm);
        }
        validateLimit(limit);
        return executor.aggregate(CollectionNames.STORE,
            AggregationPipelines.nearbyStores(longitude, latitude, radiusKm, limit));
    }

    /**
     * Lists menu items whose name contains a term, ignoring case.
     *
     * @param term     The term, matched literally.
     * @param storeIds Only items of these stores, or null for all.
     * @param platform Only items of this platform, or null for all.
     * @param limit    Maximum number of items, or null for no limit.
     * @return Menu item documents.
     */
    public List<Document> searchMenuItems(final String term, final Collection<String> storeIds,
                                          final String platform, final Integer limit) {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("Search term must not be blank");
        }
        validateLimit(limit);
        return executor.aggregate(CollectionNames.MENU_ITEM,
            AggregationPipelines.menuItemSearch(term.trim(), storeIds, platform, limit));
    }

    private static void validateLimit(final Integer limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative, got " + limit);
        }
    }
}
