package org.drinkmap.query;

import org.bson.Document;

import java.util.List;

/**
 * Read access to the document store, as far as the query engine and the services need it.
 * <p>
 * Implementations must not retry failed round trips; transport failures surface as
 * {@link QueryExecutionException}.
 */
public interface IDocumentQueryExecutor {

    /**
     * Runs an aggregation pipeline and materializes all results.
     *
     * @param collection The collection name.
     * @param pipeline   The stages, in order.
     * @return The resulting documents, in pipeline output order.
     * @throws QueryExecutionException if the store fails.
     */
    List<Document> aggregate(String collection, List<Document> pipeline);

    /**
     * Runs a plain find. The {@code _id} field is excluded from the results.
     *
     * @param collection The collection name.
     * @param filter     The filter; an empty document matches everything.
     * @param sort       The sort specification, or null for natural order.
     * @param limit      Maximum number of documents; 0 for no limit.
     * @return The matching documents.
     * @throws QueryExecutionException if the store fails.
     */
    List<Document> find(String collection, Document filter, Document sort, int limit);
}
