package com.placeguide.recommend.store.qdrant;

import com.fasterxml.jackson.databind.JsonNode;
import com.placeguide.recommend.model.Venue;
import java.util.ArrayList;
import java.util.List;

public class QdrantHit {
    private final long id;
    private final double score;
    private final JsonNode payload;

    public QdrantHit(long id, double score, JsonNode payload) {
        this.id = id;
        this.score = score;
        this.payload = payload;
    }

    public long getId() {
        return id;
    }

    public double getScore() {
        return score;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public Venue toVenue() {
        Venue.Builder builder = Venue.builder(id);
        if (payload == null || payload.isMissingNode() || payload.isNull()) {
            return builder.build();
        }
        JsonNode rating = payload.path("rating");
        Double ratingValue = rating.isNumber() ? rating.asDouble() : null;
        if (ratingValue != null && (ratingValue < 0.0 || ratingValue > 5.0)) {
            ratingValue = null;
        }
        return builder
            .name(textOrNull(payload.path("name")))
            .district(textOrNull(payload.path("district")))
            .rating(ratingValue)
            .reviewsCount(payload.path("reviews_count").asInt(0))
            .tags(parseTags(payload.path("tags")))
            .build();
    }

    private static List<String> parseTags(JsonNode node) {
        List<String> tags = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode tag : node) {
                if (tag.isTextual()) {
                    tags.add(tag.asText());
                }
            }
        } else if (node.isTextual()) {
            for (String part : node.asText().split(",")) {
                if (!part.isBlank()) {
                    tags.add(part.trim());
                }
            }
        }
        return tags;
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }
}
