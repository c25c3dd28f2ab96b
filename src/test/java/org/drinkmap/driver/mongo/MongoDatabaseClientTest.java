package org.drinkmap.driver.mongo;

import com.mongodb.MongoSocketReadException;
import com.mongodb.ServerAddress;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.drinkmap.junit.extensions.logging.ExpectLog;
import org.drinkmap.junit.extensions.logging.LogLevel;
import org.drinkmap.junit.extensions.logging.LogWatchExtension;
import org.drinkmap.query.QueryExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class MongoDatabaseClientTest {

    private final MongoClient client = mock(MongoClient.class);
    private final MongoDatabase database = mock(MongoDatabase.class);
    @SuppressWarnings("unchecked")
    private final MongoCollection<Document> collection = mock(MongoCollection.class);
    private MongoDatabaseClient databaseClient;

    @BeforeEach
    void setUp() {
        when(client.getDatabase("shop")).thenReturn(database);
        when(database.getCollection("store")).thenReturn(collection);
        databaseClient = new MongoDatabaseClient(client, "shop");
    }

    @Test
    @SuppressWarnings("unchecked")
    void aggregateMaterializesAllResults() {
        final List<Document> pipeline = List.of(new Document("$match", new Document()));
        final AggregateIterable<Document> iterable = mock(AggregateIterable.class);
        when(collection.aggregate(pipeline)).thenReturn(iterable);
        when(iterable.into(any())).thenAnswer(invocation -> {
            final Collection<Document> target = invocation.getArgument(0);
            target.add(new Document("store_id", "s1"));
            target.add(new Document("store_id", "s2"));
            return target;
        });

        final List<Document> result = databaseClient.aggregate("store", pipeline);

        assertThat(result).extracting(d -> d.getString("store_id")).containsExactly("s1", "s2");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Aggregation on shop.store failed: .*")
    void storeFailuresBecomeQueryExecutionExceptions() {
        when(collection.aggregate(any(List.class)))
            .thenThrow(new MongoSocketReadException("connection reset", new ServerAddress()));

        assertThatThrownBy(() -> databaseClient.aggregate("store", List.of()))
            .isInstanceOf(QueryExecutionException.class)
            .hasMessageContaining("store")
            .hasCauseInstanceOf(MongoSocketReadException.class)
            .satisfies(e -> assertThat(((QueryExecutionException) e).getCollection()).isEqualTo("store"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void findAppliesProjectionSortAndLimit() {
        final FindIterable<Document> iterable = mock(FindIterable.class, RETURNS_SELF);
        final Document filter = new Document("count", new Document("$gt", 5));
        final Document sort = new Document("count", -1);
        when(collection.find(filter)).thenReturn(iterable);
        when(iterable.into(any())).thenAnswer(invocation -> invocation.getArgument(0));

        assertThat(databaseClient.find("store", filter, sort, 10)).isEmpty();

        verify(iterable).projection(new Document("_id", 0));
        verify(iterable).sort(sort);
        verify(iterable).limit(10);
    }

    @Test
    @SuppressWarnings("unchecked")
    void findWithoutSortOrLimitLeavesThemUnset() {
        final FindIterable<Document> iterable = mock(FindIterable.class, RETURNS_SELF);
        when(collection.find(new Document())).thenReturn(iterable);
        when(iterable.into(any())).thenAnswer(invocation -> invocation.getArgument(0));

        databaseClient.find("store", null, null, 0);

        verify(iterable, never()).sort(any());
        verify(iterable, never()).limit(0);
    }

    @Test
    void closeClosesTheClient() {
        databaseClient.close();

        verify(client).close();
    }
}
