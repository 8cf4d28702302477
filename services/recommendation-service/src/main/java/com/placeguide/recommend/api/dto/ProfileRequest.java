package com.placeguide.recommend.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class ProfileRequest {
    @JsonProperty("preferred_tags")
    private List<String> preferredTags;

    @JsonProperty("avoided_tags")
    private List<String> avoidedTags;

    @JsonProperty("favorite_districts")
    private List<String> favoriteDistricts;

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
}
