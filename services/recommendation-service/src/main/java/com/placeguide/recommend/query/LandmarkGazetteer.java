package com.placeguide.recommend.query;

import com.placeguide.recommend.model.GeoPoint;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class LandmarkGazetteer {
    private final Map<String, GeoPoint> landmarks = new LinkedHashMap<>();

    public LandmarkGazetteer() {
        landmarks.put("красная площадь", new GeoPoint(55.7539, 37.6208));
        landmarks.put("чистые пруды", new GeoPoint(55.7642, 37.6430));
        landmarks.put("пушкинская", new GeoPoint(55.7657, 37.6039));
        landmarks.put("тверская", new GeoPoint(55.7658, 37.6050));
        landmarks.put("кремл", new GeoPoint(55.7520, 37.6175));
        landmarks.put("арбат", new GeoPoint(55.7503, 37.5892));
        landmarks.put("центр", new GeoPoint(55.7558, 37.6173));
        landmarks.put("москв", new GeoPoint(55.7558, 37.6173));
    }

    public Optional<GeoPoint> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT).replace('ё', 'е');
        for (Map.Entry<String, GeoPoint> entry : landmarks.entrySet()) {
            if (normalized.contains(entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
