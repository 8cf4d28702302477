package com.placeguide.recommend.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public final class Venue {
    private final long id;
    private final String name;
    private final String city;
    private final String district;
    private final String address;
    private final GeoPoint location;
    private final Double rating;
    private final int reviewsCount;
    private final int ratingsCount;
    private final String workingHours;
    private final String website;
    private final String phone;
    private final List<String> tags;
    private final Set<String> normalizedTags;

    private Venue(Builder builder) {
        if (builder.rating != null && (builder.rating < 0.0 || builder.rating > 5.0)) {
            throw new IllegalArgumentException("rating out of range: " + builder.rating);
        }
        this.id = builder.id;
        this.name = builder.name;
        this.city = builder.city;
        this.district = builder.district;
        this.address = builder.address;
        this.location = builder.location;
        this.rating = builder.rating;
        this.reviewsCount = Math.max(0, builder.reviewsCount);
        this.ratingsCount = Math.max(0, builder.ratingsCount);
        this.workingHours = builder.workingHours;
        this.website = builder.website;
        this.phone = builder.phone;
        List<String> distinct = new ArrayList<>();
        for (String tag : builder.tags) {
            if (tag != null && !tag.isBlank() && !distinct.contains(tag.trim())) {
                distinct.add(tag.trim());
            }
        }
        this.tags = Collections.unmodifiableList(distinct);
        this.normalizedTags = Collections.unmodifiableSet(Tags.normalizeAll(distinct));
    }

    public static Builder builder(long id) {
        return new Builder(id);
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getCity() {
        return city;
    }

    public String getDistrict() {
        return district;
    }

    public String getAddress() {
        return address;
    }

    public GeoPoint getLocation() {
        return location;
    }

    public Double getRating() {
        return rating;
    }

    public int getReviewsCount() {
        return reviewsCount;
    }

    public int getRatingsCount() {
        return ratingsCount;
    }

    public String getWorkingHours() {
        return workingHours;
    }

    public String getWebsite() {
        return website;
    }

    public String getPhone() {
        return phone;
    }

    public List<String> getTags() {
        return tags;
    }

    public Set<String> getNormalizedTags() {
        return normalizedTags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Venue)) {
            return false;
        }
        return id == ((Venue) o).id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Venue{id=" + id + ", name='" + name + "', district='" + district + "'}";
    }

    public static final class Builder {
        private final long id;
        private String name;
        private String city;
        private String district;
        private String address;
        private GeoPoint location;
        private Double rating;
        private int reviewsCount;
        private int ratingsCount;
        private String workingHours;
        private String website;
        private String phone;
        private List<String> tags = List.of();

        private Builder(long id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder district(String district) {
            this.district = district;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder location(GeoPoint location) {
            this.location = location;
            return this;
        }

        public Builder rating(Double rating) {
            this.rating = rating;
            return this;
        }

        public Builder reviewsCount(int reviewsCount) {
            this.reviewsCount = reviewsCount;
            return this;
        }

        public Builder ratingsCount(int ratingsCount) {
            this.ratingsCount = ratingsCount;
            return this;
        }

        public Builder workingHours(String workingHours) {
            this.workingHours = workingHours;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags == null ? List.of() : tags;
            return this;
        }

        public Venue build() {
            return new Venue(this);
        }
    }
}
