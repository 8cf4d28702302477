package com.placeguide.recommend.query;

import com.placeguide.recommend.api.dto.TurnRequest;
import com.placeguide.recommend.model.GeoPoint;
import com.placeguide.recommend.model.Query;
import com.placeguide.recommend.model.QueryMode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class QueryResolver {
    private final LandmarkGazetteer gazetteer;

    public QueryResolver(LandmarkGazetteer gazetteer) {
        this.gazetteer = gazetteer;
    }

    public Query resolve(TurnRequest request) {
        if (request == null) {
            throw new InvalidTurnRequestException("request body is required");
        }
        QueryMode requested = null;
        if (request.getMode() != null && !request.getMode().isBlank()) {
            requested = QueryMode.fromValue(request.getMode());
            if (requested == null) {
                throw new InvalidTurnRequestException("unknown mode: " + request.getMode());
            }
        }
        if (request.getRadiusMeters() != null && request.getRadiusMeters() <= 0) {
            throw new InvalidTurnRequestException("radius_meters must be positive");
        }
        if (request.getMinRating() != null && (request.getMinRating() < 0.0 || request.getMinRating() > 5.0)) {
            throw new InvalidTurnRequestException("min_rating must be within [0, 5]");
        }

        GeoPoint point = resolvePoint(request);
        List<String> tags = cleanTags(request.getTags());
        String text = request.getText() == null ? null : request.getText().trim();
        if ((text == null || text.isEmpty()) && !tags.isEmpty()) {
            text = String.join(" ", tags);
        }
        boolean hasText = text != null && !text.isEmpty();
        boolean hasPoint = point != null;

        QueryMode mode = requested == null ? infer(hasText, hasPoint) : downgrade(requested, hasText, hasPoint);
        switch (mode) {
            case CLARIFY:
                return Query.clarify();
            case GEO:
                return new Query(mode, point, null, tags, request.getRadiusMeters(), request.getMinRating());
            case SEMANTIC:
                return new Query(mode, null, text, tags, request.getRadiusMeters(), request.getMinRating());
            default:
                return new Query(mode, point, text, tags, request.getRadiusMeters(), request.getMinRating());
        }
    }

    private GeoPoint resolvePoint(TurnRequest request) {
        Double lat = request.getLat();
        Double lon = request.getLon();
        if ((lat == null) != (lon == null)) {
            throw new InvalidTurnRequestException("lat and lon must be provided together");
        }
        if (lat != null) {
            try {
                return new GeoPoint(lat, lon);
            } catch (IllegalArgumentException e) {
                throw new InvalidTurnRequestException(e.getMessage());
            }
        }
        return gazetteer.resolve(request.getLocation()).orElse(null);
    }

    private static QueryMode infer(boolean hasText, boolean hasPoint) {
        if (hasText && hasPoint) {
            return QueryMode.HYBRID;
        }
        if (hasPoint) {
            return QueryMode.GEO;
        }
        if (hasText) {
            return QueryMode.SEMANTIC;
        }
        return QueryMode.CLARIFY;
    }

    private static QueryMode downgrade(QueryMode requested, boolean hasText, boolean hasPoint) {
        switch (requested) {
            case HYBRID:
                if (hasText && hasPoint) {
                    return QueryMode.HYBRID;
                }
                return hasPoint ? QueryMode.GEO : hasText ? QueryMode.SEMANTIC : QueryMode.CLARIFY;
            case GEO:
                return hasPoint ? QueryMode.GEO : QueryMode.CLARIFY;
            case SEMANTIC:
                return hasText ? QueryMode.SEMANTIC : QueryMode.CLARIFY;
            default:
                return QueryMode.CLARIFY;
        }
    }

    private static List<String> cleanTags(List<String> tags) {
        List<String> cleaned = new ArrayList<>();
        if (tags == null) {
            return cleaned;
        }
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                cleaned.add(tag.trim());
            }
        }
        return cleaned;
    }
}
