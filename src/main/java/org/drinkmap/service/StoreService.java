package org.drinkmap.service;

import org.bson.Document;
import org.drinkmap.driver.DriverContainer;
import org.drinkmap.driver.mongo.MongoDatabaseClient;
import org.drinkmap.driver.mongo.MongoDriver;
import org.drinkmap.query.CollectionNames;
import org.drinkmap.query.DrinkQuery;
import org.drinkmap.query.Fields;
import org.drinkmap.query.GeoTextQueryEngine;
import org.drinkmap.query.IDocumentQueryExecutor;
import org.drinkmap.query.StoreKey;
import org.drinkmap.service.dto.DrinkSearchRequest;
import org.drinkmap.service.dto.SimplifiedDrink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Store, drink and catalog lookups backed by the document store.
 * <p>
 * The executor is resolved on every call, so a client that was cleaned up and re-created by
 * the driver container is picked up without restarting the service.
 */
public class StoreService {

    private static final Logger LOGGER = LoggerFactory.getLogger(StoreService.class);

    static final int CATALOG_LIMIT = 1000;
    static final int MIN_TAG_COUNT = 5;
    static final String BRAND_PLATFORM = "ubereats";

    private final Supplier<? extends IDocumentQueryExecutor> executorSupplier;

    public StoreService(final Supplier<? extends IDocumentQueryExecutor> executorSupplier) {
        this.executorSupplier = Objects.requireNonNull(executorSupplier, "executorSupplier");
    }

    /**
     * Creates a service that obtains the Mongo client from the given container.
     *
     * @param container The driver container with the {@code mongo} driver registered.
     * @return The service.
     */
    public static StoreService fromContainer(final DriverContainer container) {
        Objects.requireNonNull(container, "container");
        return new StoreService(() -> container.getInstance(MongoDriver.NAME, MongoDatabaseClient.class));
    }

    public List<Document> listStores(final DrinkSearchRequest request) {
        final DrinkQuery query = request.toQuery(null);
        try {
            return engine().findStoresWithMenu(query);
        } catch (final RuntimeException e) {
            LOGGER.error("Listing stores around ({}, {}) with tags {} failed: {}",
                query.longitude(), query.latitude(), query.drinkTags(), e.getMessage());
            throw e;
        }
    }

    /**
     * @param request The search.
     * @param limit   Maximum number of drinks, or null for no limit.
     * @return Drinks with store fields attached.
     */
    public List<Document> listDrinks(final DrinkSearchRequest request, final Integer limit) {
        final DrinkQuery query = request.toQuery(limit);
        try {
            return engine().findDrinks(query);
        } catch (final RuntimeException e) {
            LOGGER.error("Listing drinks around ({}, {}) with tags {} failed: {}",
                query.longitude(), query.latitude(), query.drinkTags(), e.getMessage());
            throw e;
        }
    }

    public List<SimplifiedDrink> listSimplifiedDrinks(final DrinkSearchRequest request, final Integer limit) {
        return simplify(listDrinks(request, limit));
    }

    public List<Document> listCompanies() {
        return catalog(CollectionNames.COMPANY, null, null, 0);
    }

    /**
     * Lists drink tags used more than five times, shortest names first. Tags of equal name
     * length keep their order of descending use.
     */
    public List<Document> listDrinkTags() {
        final List<Document> tags = new ArrayList<>(catalog(CollectionNames.DRINK_TAG,
            new Document("count", new Document("$gt", MIN_TAG_COUNT)),
            new Document("count", -1),
            CATALOG_LIMIT));
        tags.sort(Comparator.comparingInt(StoreService::nameLength));
        return tags;
    }

    /**
     * Lists chain brands present on UberEats in more than one store, largest chains first.
     */
    public List<Document> listBrands() {
        final Document filter = new Document("has_chain", true)
            .append("chain_count", new Document("$gt", 1))
            .append("platforms", BRAND_PLATFORM);
        return catalog(CollectionNames.BRAND, filter, new Document("chain_count", -1), CATALOG_LIMIT);
    }

    static List<SimplifiedDrink> simplify(final List<Document> drinks) {
        final List<SimplifiedDrink> simplified = new ArrayList<>(drinks.size());
        for (final Document drink : drinks) {
            simplified.add(new SimplifiedDrink(
                drink.get(Fields.NAME, ""),
                drink.getString(Fields.DESCRIPTION),
                null,
                drink.get(Fields.STORE_NAME, ""),
                StoreKey.of(drink).storeId(),
                drink.get(Fields.STORE_URL, "")));
        }
        return simplified;
    }

    private List<Document> catalog(final String collection, final Document filter, final Document sort,
                                   final int limit) {
        try {
            return executorSupplier.get().find(collection, filter, sort, limit);
        } catch (final RuntimeException e) {
            LOGGER.error("Listing collection '{}' failed: {}", collection, e.getMessage());
            throw e;
        }
    }

    private GeoTextQueryEngine engine() {
        return new GeoTextQueryEngine(executorSupplier.get());
    }

    private static int nameLength(final Document tag) {
        final Object name = tag.get(Fields.NAME);
        return name != null ? name.toString().length() : 0;
    }
}
