package com.placeguide.recommend.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class InteractionRequest {
    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("venue_id")
    private Long venueId;

    private String type;

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public Long getVenueId() {
        return venueId;
    }

    public void setVenueId(Long venueId) {
        this.venueId = venueId;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }
}
