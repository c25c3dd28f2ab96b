package org.drinkmap.query;

/**
 * Document field names shared by the pipelines, the joins and the services.
 */
public final class Fields {

    public static final String STORE_ID = "store_id";
    public static final String ITEM_ID = "item_id";
    public static final String PLATFORM = "platform";
    public static final String NAME = "name";
    public static final String BRAND = "brand";
    public static final String ADDRESS = "address";
    public static final String LOCATION = "location";
    public static final String RATING = "rating";
    public static final String RATING_VALUE = "rating.value";
    public static final String RATING_REVIEW_COUNT = "rating.review_count";
    public static final String CUISINES = "cuisines";
    public static final String SOURCE_URL = "source_url";
    public static final String CATEGORY = "category";
    public static final String DESCRIPTION = "description";
    public static final String PRICE = "price";
    public static final String IMAGE_URL = "image_url";
    public static final String IS_POPULAR = "is_popular";
    public static final String OPTIONS = "options";

    public static final String DISTANCE_IN_METER = "distance_in_meter";
    public static final String DISTANCE_IN_KM = "distance_in_km";
    public static final String MENU = "menu";
    public static final String TEXT_SCORE = "text_score";

    public static final String STORE_NAME = "store_name";
    public static final String STORE_URL = "store_url";
    public static final String BRAND_NAME = "brand_name";

    private Fields() {
        // Utility class - prevent instantiation
    }
}
