package org.drinkmap.query;

/**
 * Thrown when the document store fails while a query is executing. No partial result is
 * returned alongside it.
 */
public class QueryExecutionException extends RuntimeException {

    private final String collection;

    public QueryExecutionException(final String collection, final String message, final Throwable cause) {
        super(message, cause);
        this.collection = collection;
    }

    public QueryExecutionException(final String collection, final Throwable cause) {
        this(collection, "Query on collection '" + collection + "' failed: " + cause.getMessage(), cause);
    }

    /**
     * @return The collection the failing query ran against.
     */
    public String getCollection() {
        return collection;
    }
}
