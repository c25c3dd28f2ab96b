package org.drinkmap.query;

import org.bson.Document;

/**
 * Identity of a store: the same {@code store_id} may exist on several platforms.
 *
 * @param storeId  The platform-specific store id.
 * @param platform The platform, may be null for documents without one.
 */
public record StoreKey(String storeId, String platform) {

    /**
     * @param document A store or menu item document.
     * @return The key of the store the document is or belongs to.
     */
    public static StoreKey of(final Document document) {
        return new StoreKey(stringValue(document.get(Fields.STORE_ID)), stringValue(document.get(Fields.PLATFORM)));
    }

    static String stringValue(final Object value) {
        return value == null ? null : value.toString();
    }
}
