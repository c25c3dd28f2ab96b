package org.drinkmap.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of the recommend endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecommendRequest {

    public static final String DEFAULT_APP_NAME = "recommend";

    @JsonProperty("location")
    private List<Double> location;

    @JsonProperty("drink_tags")
    private List<String> drinkTags = new ArrayList<>();

    @JsonProperty("brands")
    private List<String> brands = new ArrayList<>();

    @JsonProperty("response_preference_chats")
    private List<ChatMessage> responsePreferenceChats = new ArrayList<>();

    @JsonProperty("drink_preference_chats")
    private List<ChatMessage> drinkPreferenceChats = new ArrayList<>();

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("app_name")
    private String appName = DEFAULT_APP_NAME;

    /**
     * @throws IllegalArgumentException if a required field is missing.
     */
    public void validate() {
        ChatRequest.requireText("user_id", userId);
        ChatRequest.requireText("session_id", sessionId);
        ChatRequest.requireText("app_name", appName);
    }

    /**
     * @return The drink search this recommendation draws from, on the default platform.
     */
    public DrinkSearchRequest toSearchRequest() {
        return new DrinkSearchRequest(location, drinkTags, brands);
    }

    public List<Double> getLocation() {
        return location;
    }

    public void setLocation(final List<Double> location) {
        this.location = location;
    }

    public List<String> getDrinkTags() {
        return drinkTags;
    }

    public void setDrinkTags(final List<String> drinkTags) {
        this.drinkTags = drinkTags;
    }

    public List<String> getBrands() {
        return brands;
    }

    public void setBrands(final List<String> brands) {
        this.brands = brands;
    }

    public List<ChatMessage> getResponsePreferenceChats() {
        return responsePreferenceChats;
    }

    public void setResponsePreferenceChats(final List<ChatMessage> responsePreferenceChats) {
        this.responsePreferenceChats = responsePreferenceChats;
    }

    public List<ChatMessage> getDrinkPreferenceChats() {
        return drinkPreferenceChats;
    }

    public void setDrinkPreferenceChats(final List<ChatMessage> drinkPreferenceChats) {
        this.drinkPreferenceChats = drinkPreferenceChats;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(final String userId) {
        this.userId = userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(final String sessionId) {
        this.sessionId = sessionId;
    }

    public String getAppName() {
        return appName;
    }

    public void setAppName(final String appName) {
        this.appName = appName;
    }
}
