package com.placeguide.recommend.store.jdbc;

import com.placeguide.recommend.model.GeoPoint;
import com.placeguide.recommend.model.Venue;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.RowMapper;

public class VenueRowMapper implements RowMapper<Venue> {

    @Override
    public Venue mapRow(ResultSet rs, int rowNum) throws SQLException {
        return Venue.builder(rs.getLong("id"))
            .name(rs.getString("name"))
            .city(rs.getString("city"))
            .district(rs.getString("district"))
            .address(rs.getString("address"))
            .location(readPoint(rs))
            .rating(readRating(rs))
            .reviewsCount(rs.getInt("reviews_count"))
            .ratingsCount(rs.getInt("ratings_count"))
            .workingHours(rs.getString("working_hours"))
            .website(rs.getString("website"))
            .phone(rs.getString("phone"))
            .tags(readTags(rs.getArray("tags_array")))
            .build();
    }

    static List<String> readTags(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        Object raw = array.getArray();
        if (!(raw instanceof Object[])) {
            return List.of();
        }
        List<String> tags = new ArrayList<>();
        for (Object value : (Object[]) raw) {
            if (value != null) {
                tags.add(value.toString());
            }
        }
        return tags;
    }

    private GeoPoint readPoint(ResultSet rs) throws SQLException {
        double lat = rs.getDouble("lat");
        if (rs.wasNull()) {
            return null;
        }
        double lon = rs.getDouble("lon");
        if (rs.wasNull()) {
            return null;
        }
        return new GeoPoint(lat, lon);
    }

    private Double readRating(ResultSet rs) throws SQLException {
        double rating = rs.getDouble("rating");
        if (rs.wasNull() || rating < 0.0 || rating > 5.0) {
            return null;
        }
        return rating;
    }
}
