package org.drinkmap.driver.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.drinkmap.query.IDocumentQueryExecutor;
import org.drinkmap.query.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The document store client produced by {@link MongoDriver}: a {@link MongoClient} bound to a
 * default database.
 * <p>
 * Every {@link MongoException} is rethrown as {@link QueryExecutionException}; nothing is retried.
 */
public final class MongoDatabaseClient implements IDocumentQueryExecutor, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MongoDatabaseClient.class);

    private final MongoClient client;
    private final String databaseName;

    MongoDatabaseClient(final MongoClient client, final String databaseName) {
        this.client = Objects.requireNonNull(client, "client");
        this.databaseName = Objects.requireNonNull(databaseName, "databaseName");
    }

    @Override
    public List<Document> aggregate(final String collection, final List<Document> pipeline) {
        final long start = System.nanoTime();
        try {
            final List<Document> result = getCollection(collection).aggregate(pipeline).into(new ArrayList<>());
            LOGGER.debug("Aggregation on {}.{} returned {} document(s) in {} ms",
                databaseName, collection, result.size(), (System.nanoTime() - start) / 1_000_000);
            return result;
        } catch (final MongoException e) {
            LOGGER.warn("Aggregation on {}.{} failed: {}", databaseName, collection, e.getMessage());
            throw new QueryExecutionException(collection, e);
        }
    }

    @Override
    public List<Document> find(final String collection, final Document filter, final Document sort, final int limit) {
        try {
            FindIterable<Document> iterable = getCollection(collection)
                .find(filter != null ? filter : new Document())
                .projection(new Document("_id", 0));
            if (sort != null) {
                iterable = iterable.sort(sort);
            }
            if (limit > 0) {
                iterable = iterable.limit(limit);
            }
            return iterable.into(new ArrayList<>());
        } catch (final MongoException e) {
            LOGGER.warn("Find on {}.{} failed: {}", databaseName, collection, e.getMessage());
            throw new QueryExecutionException(collection, e);
        }
    }

    /**
     * @param collection The collection name.
     * @param filter     The filter; null matches everything.
     * @return The number of matching documents.
     */
    public long countDocuments(final String collection, final Document filter) {
        try {
            return getCollection(collection).countDocuments(filter != null ? filter : new Document());
        } catch (final MongoException e) {
            throw new QueryExecutionException(collection, e);
        }
    }

    /**
     * Sends {@code ping} to the admin database.
     *
     * @throws MongoException if the server does not answer.
     */
    public void ping() {
        client.getDatabase("admin").runCommand(new Document("ping", 1));
    }

    public MongoDatabase getDatabase() {
        return client.getDatabase(databaseName);
    }

    public MongoCollection<Document> getCollection(final String collection) {
        return getDatabase().getCollection(collection);
    }

    public String getDatabaseName() {
        return databaseName;
    }

    @Override
    public void close() {
        client.close();
    }
}
