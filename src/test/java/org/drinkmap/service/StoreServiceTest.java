package org.drinkmap.service;

import org.bson.Document;
import org.drinkmap.junit.extensions.logging.ExpectLog;
import org.drinkmap.junit.extensions.logging.LogLevel;
import org.drinkmap.junit.extensions.logging.LogWatchExtension;
import org.drinkmap.query.CollectionNames;
import org.drinkmap.query.Fields;
import org.drinkmap.query.IDocumentQueryExecutor;
import org.drinkmap.query.QueryExecutionException;
import org.drinkmap.service.dto.DrinkSearchRequest;
import org.drinkmap.service.dto.SimplifiedDrink;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class StoreServiceTest {

    private final IDocumentQueryExecutor executor = mock(IDocumentQueryExecutor.class);
    private final StoreService service = new StoreService(() -> executor);

    private static DrinkSearchRequest near(final List<String> tags) {
        return new DrinkSearchRequest(List.of(121.5654, 25.0330), tags, List.of());
    }

    @Test
    void drinkTagsAreFilteredByUseAndOrderedByNameLength() {
        when(executor.find(eq(CollectionNames.DRINK_TAG), any(), any(), eq(StoreService.CATALOG_LIMIT)))
            .thenReturn(List.of(new Document("name", "珍珠奶茶").append("count", 90),
                new Document("name", "紅茶").append("count", 80),
                new Document("name", "綠茶").append("count", 70),
                new Document("name", "奶蓋烏龍").append("count", 60)));

        final List<Document> tags = service.listDrinkTags();

        assertThat(tags).extracting(d -> d.getString("name")).containsExactly("紅茶", "綠茶", "珍珠奶茶", "奶蓋烏龍");
        verify(executor).find(CollectionNames.DRINK_TAG, new Document("count", new Document("$gt", 5)),
            new Document("count", -1), StoreService.CATALOG_LIMIT);
    }

    @Test
    void brandsAreChainsOnUberEatsLargestFirst() {
        service.listBrands();

        verify(executor).find(CollectionNames.BRAND,
            new Document("has_chain", true).append("chain_count", new Document("$gt", 1)).append("platforms", "ubereats"),
            new Document("chain_count", -1), StoreService.CATALOG_LIMIT);
    }

    @Test
    void companiesAreListedUnfiltered() {
        service.listCompanies();

        verify(executor).find(CollectionNames.COMPANY, null, null, 0);
    }

    @Test
    void storesComeFromTheEngine() {
        when(executor.aggregate(eq(CollectionNames.STORE), anyList()))
            .thenReturn(List.of(new Document(Fields.STORE_ID, "s1").append(Fields.PLATFORM, "ubereats")));
        when(executor.aggregate(eq(CollectionNames.MENU_ITEM), anyList())).thenReturn(List.of());

        final List<Document> stores = service.listStores(near(List.of()));

        assertThat(stores).singleElement().satisfies(store -> assertThat(store).containsKey(Fields.MENU));
    }

    @Test
    void malformedRequestsNeverReachTheStore() {
        final DrinkSearchRequest request = near(List.of());
        request.setRatingRange(List.of(4.0));

        assertThatThrownBy(() -> service.listDrinks(request, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("rating_range");
        verifyNoInteractions(executor);
    }

    @Test
    void unknownPlatformIsRejected() {
        final DrinkSearchRequest request = near(List.of());
        request.setPlatform("lalamove");

        assertThatThrownBy(() -> service.listStores(request)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Listing drinks around .* failed: .*")
    void storeFailuresAreLoggedAndRethrown() {
        when(executor.aggregate(eq(CollectionNames.STORE), anyList()))
            .thenThrow(new QueryExecutionException(CollectionNames.STORE, new IllegalStateException("gone")));

        assertThatThrownBy(() -> service.listDrinks(near(List.of("奶茶")), 5))
            .isInstanceOf(QueryExecutionException.class);
    }

    @Test
    void simplifiedDrinksCarryTheStoreFields() {
        when(executor.aggregate(eq(CollectionNames.STORE), anyList())).thenReturn(List.of(
            new Document(Fields.STORE_ID, "s1").append(Fields.PLATFORM, "ubereats").append(Fields.NAME, "Tea One")));
        when(executor.aggregate(eq(CollectionNames.MENU_ITEM), anyList())).thenReturn(List.of(
            new Document(Fields.STORE_ID, "s1").append(Fields.PLATFORM, "ubereats").append(Fields.NAME, "紅茶")
                .append(Fields.DESCRIPTION, "無糖").append(Fields.IMAGE_URL, "https://img/1")));

        final List<SimplifiedDrink> drinks = service.listSimplifiedDrinks(near(List.of()), null);

        assertThat(drinks).containsExactly(new SimplifiedDrink("紅茶", "無糖", null, "Tea One", "s1",
            "https://www.ubereats.com/tw/store/s1"));
    }

    @Test
    void executorIsResolvedOnEveryCall() {
        final AtomicInteger lookups = new AtomicInteger();
        final StoreService counting = new StoreService(() -> {
            lookups.incrementAndGet();
            return executor;
        });

        counting.listCompanies();
        counting.listBrands();

        assertThat(lookups).hasValue(2);
    }
}
