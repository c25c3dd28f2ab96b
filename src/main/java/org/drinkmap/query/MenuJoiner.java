package org.drinkmap.query;

import org.bson.Document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory joins between store and menu item documents, which the document store cannot
 * do across the two collections.
 * <p>
 * All functions are pure: inputs are not modified, results are fresh documents. Sorting is
 * stable and uses only the named key, so ties keep the input order.
 */
public final class MenuJoiner {

    private MenuJoiner() {
        // Utility class - prevent instantiation
    }

    /**
     * Attaches to every store the menu items with its {@code store_id}, under {@code menu}.
     * When ranking, stores are ordered by descending number of attached items. Text scores
     * are removed from the attached items.
     *
     * @param stores    Store documents in query order.
     * @param menuItems Menu item documents.
     * @param rankByHits Whether to order stores by their number of matching items.
     * @return New store documents.
     */
    public static List<Document> attachMenus(final List<Document> stores, final List<Document> menuItems,
                                             final boolean rankByHits) {
        final Map<String, List<Document>> menuIndex = new HashMap<>();
        for (final Document item : menuItems) {
            final Document copy = new Document(item);
            copy.remove(Fields.TEXT_SCORE);
            menuIndex.computeIfAbsent(StoreKey.stringValue(item.get(Fields.STORE_ID)), k -> new ArrayList<>()).add(copy);
        }

        final List<Document> result = new ArrayList<>(stores.size());
        // Documents compare by content, so hit counts are tracked per instance.
        final Map<Document, Integer> hitCounts = new IdentityHashMap<>();
        for (final Document store : stores) {
            final List<Document> menu = menuIndex.getOrDefault(
                StoreKey.stringValue(store.get(Fields.STORE_ID)), List.of());
            final Document copy = new Document(store);
            copy.put(Fields.MENU, new ArrayList<>(menu));
            hitCounts.put(copy, menu.size());
            result.add(copy);
        }

        if (rankByHits) {
            result.sort(Comparator.comparingInt((Document d) -> hitCounts.get(d)).reversed());
        }
        return result;
    }

    /**
     * Attaches store display fields ({@code store_name}, {@code store_url}, {@code brand_name})
     * to every menu item whose {@code (store_id, platform)} matches a store. Items without a
     * matching store are dropped. When ranking, items are ordered by descending text score.
     * Text scores are removed from the result.
     *
     * @param menuItems   Menu item documents in query order.
     * @param stores      Store documents.
     * @param rankByScore Whether to order items by their text score.
     * @return New menu item documents.
     */
    public static List<Document> attachStores(final List<Document> menuItems, final List<Document> stores,
                                              final boolean rankByScore) {
        final Map<StoreKey, Document> storeIndex = new HashMap<>();
        for (final Document store : stores) {
            storeIndex.putIfAbsent(StoreKey.of(store), store);
        }

        final List<Document> joined = new ArrayList<>(menuItems.size());
        for (final Document item : menuItems) {
            final StoreKey key = StoreKey.of(item);
            final Document store = storeIndex.get(key);
            if (store == null) {
                continue;
            }
            final Document copy = new Document(item);
            copy.put(Fields.STORE_NAME, store.getString(Fields.NAME));
            copy.put(Fields.STORE_URL, StoreUrls.build(key.storeId(), key.platform()));
            copy.put(Fields.BRAND_NAME, store.getString(Fields.BRAND));
            joined.add(copy);
        }

        if (rankByScore) {
            joined.sort(Comparator.comparingDouble(MenuJoiner::textScore).reversed());
        }
        for (final Document item : joined) {
            item.remove(Fields.TEXT_SCORE);
        }
        return joined;
    }

    /**
     * @param documents Documents carrying {@code store_id}.
     * @return The distinct store ids, in first-seen order.
     */
    public static Set<String> distinctStoreIds(final List<Document> documents) {
        final Set<String> ids = new LinkedHashSet<>();
        for (final Document document : documents) {
            final String id = StoreKey.stringValue(document.get(Fields.STORE_ID));
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    /**
     * @param documents Documents carrying {@code store_id} and {@code platform}.
     * @return The distinct store keys, in first-seen order.
     */
    public static Set<StoreKey> distinctStoreKeys(final List<Document> documents) {
        final Set<StoreKey> keys = new LinkedHashSet<>();
        for (final Document document : documents) {
            final StoreKey key = StoreKey.of(document);
            if (key.storeId() != null) {
                keys.add(key);
            }
        }
        return keys;
    }

    private static double textScore(final Document item) {
        final Object score = item.get(Fields.TEXT_SCORE);
        return score instanceof Number ? ((Number) score).doubleValue() : 0.0;
    }
}
