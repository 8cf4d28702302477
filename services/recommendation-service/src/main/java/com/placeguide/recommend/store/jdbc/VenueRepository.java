package com.placeguide.recommend.store.jdbc;

import com.placeguide.recommend.model.GeoPoint;
import com.placeguide.recommend.model.Venue;
import com.placeguide.recommend.store.VenueDistance;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class VenueRepository {
    static final String VENUE_COLUMNS = "SELECT p.id, p.name, p.city, p.district, p.address, p.rating, "
        + "p.reviews_count, p.ratings_count, p.working_hours, p.website, p.phone, "
        + "ST_Y(p.location::geometry) AS lat, ST_X(p.location::geometry) AS lon, p.tags_array";

    static final String NEARBY_SQL = VENUE_COLUMNS + ", "
        + "ST_Distance(p.location, ST_SetSRID(ST_MakePoint(?, ?), 4326)::geography) AS distance_meters "
        + "FROM places_with_tags p "
        + "WHERE p.location IS NOT NULL AND COALESCE(p.rating, 0) >= ? "
        + "AND ST_DWithin(p.location, ST_SetSRID(ST_MakePoint(?, ?), 4326)::geography, ?) "
        + "ORDER BY p.rating DESC NULLS LAST, distance_meters ASC "
        + "LIMIT ?";

    private final JdbcTemplate jdbcTemplate;
    private final VenueRowMapper venueRowMapper = new VenueRowMapper();

    public VenueRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<VenueDistance> findNearby(GeoPoint point, int radiusMeters, double minRating, int limit) {
        return jdbcTemplate.query(
            NEARBY_SQL,
            (rs, rowNum) -> new VenueDistance(venueRowMapper.mapRow(rs, rowNum), rs.getDouble("distance_meters")),
            point.longitude(),
            point.latitude(),
            minRating,
            point.longitude(),
            point.latitude(),
            radiusMeters,
            limit
        );
    }

    public Map<Long, Venue> findByIds(Collection<Long> ids) {
        Map<Long, Venue> venues = new LinkedHashMap<>();
        if (ids == null || ids.isEmpty()) {
            return venues;
        }
        StringJoiner placeholders = new StringJoiner(", ");
        for (int i = 0; i < ids.size(); i++) {
            placeholders.add("?");
        }
        List<Venue> rows = jdbcTemplate.query(
            VENUE_COLUMNS + " FROM places_with_tags p WHERE p.id IN (" + placeholders + ")",
            venueRowMapper,
            ids.toArray()
        );
        for (Venue venue : rows) {
            venues.put(venue.getId(), venue);
        }
        return venues;
    }

    public List<String> listTags() {
        return jdbcTemplate.queryForList("SELECT name FROM tags ORDER BY name", String.class);
    }

    public List<String> listDistricts() {
        return jdbcTemplate.queryForList(
            "SELECT DISTINCT district FROM places WHERE district IS NOT NULL AND district <> '' ORDER BY district",
            String.class
        );
    }
}
