package com.placeguide.recommend.store.jdbc;

import com.placeguide.recommend.model.InteractionHistory;
import com.placeguide.recommend.model.InteractionType;
import com.placeguide.recommend.model.UserProfile;
import com.placeguide.recommend.store.ProfileStore;
import java.sql.PreparedStatement;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcProfileStore implements ProfileStore {
    static final String SELECT_PROFILE_SQL = "SELECT telegram_id, preferred_tags, avoided_tags, favorite_districts "
        + "FROM user_profiles WHERE telegram_id = ?";
    static final String INTERACTION_COUNTS_SQL = "SELECT place_id, interaction_type, COUNT(*) AS cnt "
        + "FROM user_interactions WHERE telegram_id = ? GROUP BY place_id, interaction_type";
    static final String UPSERT_PROFILE_SQL = "INSERT INTO user_profiles "
        + "(telegram_id, preferred_tags, avoided_tags, favorite_districts) VALUES (?, ?, ?, ?) "
        + "ON CONFLICT (telegram_id) DO UPDATE SET preferred_tags = EXCLUDED.preferred_tags, "
        + "avoided_tags = EXCLUDED.avoided_tags, favorite_districts = EXCLUDED.favorite_districts, "
        + "updated_at = CURRENT_TIMESTAMP";
    static final String INSERT_INTERACTION_SQL = "INSERT INTO user_interactions "
        + "(telegram_id, place_id, interaction_type) VALUES (?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;

    public JdbcProfileStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<UserProfile> findProfile(long userId) {
        try {
            List<StoredPreferences> rows = jdbcTemplate.query(
                SELECT_PROFILE_SQL,
                (rs, rowNum) -> new StoredPreferences(
                    VenueRowMapper.readTags(rs.getArray("preferred_tags")),
                    VenueRowMapper.readTags(rs.getArray("avoided_tags")),
                    VenueRowMapper.readTags(rs.getArray("favorite_districts"))
                ),
                userId
            );
            if (rows.isEmpty()) {
                return Optional.empty();
            }
            StoredPreferences stored = rows.get(0);
            return Optional.of(new UserProfile(
                userId,
                stored.preferredTags(),
                stored.avoidedTags(),
                stored.favoriteDistricts(),
                loadHistory(userId)
            ));
        } catch (DataAccessException e) {
            throw JdbcErrors.translate("profile read", e);
        }
    }

    @Override
    public void saveProfile(UserProfile profile) {
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(UPSERT_PROFILE_SQL);
                ps.setLong(1, profile.getUserId());
                ps.setArray(2, connection.createArrayOf("text", toArray(profile.getPreferredTags())));
                ps.setArray(3, connection.createArrayOf("text", toArray(profile.getAvoidedTags())));
                ps.setArray(4, connection.createArrayOf("text", toArray(profile.getFavoriteDistricts())));
                return ps;
            });
        } catch (DataAccessException e) {
            throw JdbcErrors.translate("profile write", e);
        }
    }

    @Override
    public void appendInteraction(long userId, long venueId, InteractionType type) {
        try {
            jdbcTemplate.update(INSERT_INTERACTION_SQL, userId, venueId, type.code());
        } catch (DataAccessException e) {
            throw JdbcErrors.translate("interaction append", e);
        }
    }

    private InteractionHistory loadHistory(long userId) {
        Map<Long, Integer> liked = new HashMap<>();
        Map<Long, Integer> disliked = new HashMap<>();
        jdbcTemplate.query(INTERACTION_COUNTS_SQL, (RowCallbackHandler) rs -> {
            InteractionType type = InteractionType.fromCode(rs.getString("interaction_type"));
            if (type == InteractionType.LIKED) {
                liked.put(rs.getLong("place_id"), rs.getInt("cnt"));
            } else if (type == InteractionType.DISLIKED) {
                disliked.put(rs.getLong("place_id"), rs.getInt("cnt"));
            }
        }, userId);
        return new InteractionHistory(liked, disliked);
    }

    private static Object[] toArray(Set<String> values) {
        return values.toArray(new Object[0]);
    }

    private record StoredPreferences(
        List<String> preferredTags,
        List<String> avoidedTags,
        List<String> favoriteDistricts
    ) {}
}
