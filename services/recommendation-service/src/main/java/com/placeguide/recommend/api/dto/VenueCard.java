package com.placeguide.recommend.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.Venue;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class VenueCard {
    private long id;
    private int rank;
    private String name;
    private String city;
    private String district;
    private String address;
    private Double lat;
    private Double lon;
    private Double rating;

    @JsonProperty("reviews_count")
    private int reviewsCount;

    @JsonProperty("ratings_count")
    private int ratingsCount;

    @JsonProperty("working_hours")
    private String workingHours;

    private String website;
    private String phone;
    private List<String> tags;

    @JsonProperty("distance_meters")
    private Double distanceMeters;

    private Double similarity;
    private Double score;

    public static VenueCard from(Candidate candidate, int rank) {
        Venue venue = candidate.getVenue();
        VenueCard card = new VenueCard();
        card.setId(venue.getId());
        card.setRank(rank);
        card.setName(venue.getName());
        card.setCity(venue.getCity());
        card.setDistrict(venue.getDistrict());
        card.setAddress(venue.getAddress());
        if (venue.getLocation() != null) {
            card.setLat(venue.getLocation().latitude());
            card.setLon(venue.getLocation().longitude());
        }
        card.setRating(venue.getRating());
        card.setReviewsCount(venue.getReviewsCount());
        card.setRatingsCount(venue.getRatingsCount());
        card.setWorkingHours(venue.getWorkingHours());
        card.setWebsite(venue.getWebsite());
        card.setPhone(venue.getPhone());
        card.setTags(venue.getTags());
        card.setDistanceMeters(candidate.getDistanceMeters());
        card.setSimilarity(candidate.getSimilarity());
        card.setScore(candidate.getScore());
        return card;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public int getRank() {
        return rank;
    }

    public void setRank(int rank) {
        this.rank = rank;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getDistrict() {
        return district;
    }

    public void setDistrict(String district) {
        this.district = district;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public Double getLat() {
        return lat;
    }

    public void setLat(Double lat) {
        this.lat = lat;
    }

    public Double getLon() {
        return lon;
    }

    public void setLon(Double lon) {
        this.lon = lon;
    }

    public Double getRating() {
        return rating;
    }

    public void setRating(Double rating) {
        this.rating = rating;
    }

    public int getReviewsCount() {
        return reviewsCount;
    }

    public void setReviewsCount(int reviewsCount) {
        this.reviewsCount = reviewsCount;
    }

    public int getRatingsCount() {
        return ratingsCount;
    }

    public void setRatingsCount(int ratingsCount) {
        this.ratingsCount = ratingsCount;
    }

    public String getWorkingHours() {
        return workingHours;
    }

    public void setWorkingHours(String workingHours) {
        this.workingHours = workingHours;
    }

    public String getWebsite() {
        return website;
    }

    public void setWebsite(String website) {
        this.website = website;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public Double getDistanceMeters() {
        return distanceMeters;
    }

    public void setDistanceMeters(Double distanceMeters) {
        this.distanceMeters = distanceMeters;
    }

    public Double getSimilarity() {
        return similarity;
    }

    public void setSimilarity(Double similarity) {
        this.similarity = similarity;
    }

    public Double getScore() {
        return score;
    }

    public void setScore(Double score) {
        this.score = score;
    }
}
