package org.drinkmap.query;

/**
 * Names of the collections the application reads.
 */
public final class CollectionNames {

    public static final String STORE = "store";
    public static final String MENU_ITEM = "menu_item";
    public static final String COMPANY = "company";
    public static final String BRAND = "brand";
    public static final String DRINK_TAG = "drink_tag";

    private CollectionNames() {
        // Utility class - prevent instantiation
    }
}
