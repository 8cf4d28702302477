package com.placeguide.recommend.embed;

import com.placeguide.recommend.cache.CacheKeys;
import com.placeguide.recommend.cache.TtlCache;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class EmbeddingCacheService {
    private final EmbeddingProperties properties;
    private final TtlCache<List<Double>> cache;

    public EmbeddingCacheService(EmbeddingProperties properties) {
        this.properties = properties;
        this.cache = new TtlCache<>(properties.getCache().getMaxEntries());
    }

    public boolean isEnabled() {
        return properties.getCache() != null && properties.getCache().isEnabled();
    }

    public Optional<List<Double>> get(String text) {
        String key = buildKey(text);
        return key == null ? Optional.empty() : cache.get(key);
    }

    public void put(String text, List<Double> vector) {
        String key = buildKey(text);
        if (key == null || vector == null || vector.isEmpty()) {
            return;
        }
        cache.put(key, List.copyOf(vector), properties.getCache().getTtlMs());
    }

    private String buildKey(String text) {
        if (!isEnabled() || text == null) {
            return null;
        }
        String normalized = text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return null;
        }
        int maxLength = properties.getCache().getMaxTextLength();
        if (maxLength > 0 && normalized.length() > maxLength) {
            return null;
        }
        return CacheKeys.of("embed", properties.getMode().name(), properties.getModel(), CacheKeys.sha256(normalized));
    }
}
