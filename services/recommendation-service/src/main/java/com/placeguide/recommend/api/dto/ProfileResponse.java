package com.placeguide.recommend.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.placeguide.recommend.model.UserProfile;
import java.util.ArrayList;
import java.util.List;

public class ProfileResponse {
    @JsonProperty("user_id")
    private long userId;

    @JsonProperty("preferred_tags")
    private List<String> preferredTags;

    @JsonProperty("avoided_tags")
    private List<String> avoidedTags;

    @JsonProperty("favorite_districts")
    private List<String> favoriteDistricts;

    @JsonProperty("liked_venues")
    private int likedVenues;

    @JsonProperty("disliked_venues")
    private int dislikedVenues;

    public static ProfileResponse from(UserProfile profile) {
        ProfileResponse response = new ProfileResponse();
        response.setUserId(profile.getUserId());
        response.setPreferredTags(new ArrayList<>(profile.getPreferredTags()));
        response.setAvoidedTags(new ArrayList<>(profile.getAvoidedTags()));
        response.setFavoriteDistricts(new ArrayList<>(profile.getFavoriteDistricts()));
        response.setLikedVenues(profile.getHistory().getLikedCounts().size());
        response.setDislikedVenues(profile.getHistory().getDislikedCounts().size());
        return response;
    }

    public long getUserId() {
        return userId;
    }

    public void setUserId(long userId) {
        this.userId = userId;
    }

    public List<String> getPreferredTags() {
        return preferredTags;
    }

    public void setPreferredTags(List<String> preferredTags) {
        this.preferredTags = preferredTags;
    }

    public List<String> getAvoidedTags() {
        return avoidedTags;
    }

    public void setAvoidedTags(List<String> avoidedTags) {
        this.avoidedTags = avoidedTags;
    }

    public List<String> getFavoriteDistricts() {
        return favoriteDistricts;
    }

    public void setFavoriteDistricts(List<String> favoriteDistricts) {
        this.favoriteDistricts = favoriteDistricts;
    }

    public int getLikedVenues() {
        return likedVenues;
    }

    public void setLikedVenues(int likedVenues) {
        this.likedVenues = likedVenues;
    }

    public int getDislikedVenues() {
        return dislikedVenues;
    }

    public void setDislikedVenues(int dislikedVenues) {
        this.dislikedVenues = dislikedVenues;
    }
}
