package org.drinkmap.query;

/**
 * Builds the public page URL of a store on its delivery platform.
 */
public final class StoreUrls {

    public static final String UBEREATS = "ubereats";
    public static final String FOODPANDA = "foodpanda";

    private StoreUrls() {
        // Utility class - prevent instantiation
    }

    /**
     * @param storeId  The platform-specific store id.
     * @param platform The platform name.
     * @return The store URL, or an empty string for an unknown platform or missing id.
     */
    public static String build(final String storeId, final String platform) {
        if (storeId == null || storeId.isEmpty() || platform == null) {
            return "";
        }
        switch (platform) {
            case UBEREATS:
                return "https://www.ubereats.com/tw/store/" + storeId;
            case FOODPANDA:
                return "https://www.foodpanda.com.tw/restaurant/" + storeId;
            default:
                return "";
        }
    }
}
