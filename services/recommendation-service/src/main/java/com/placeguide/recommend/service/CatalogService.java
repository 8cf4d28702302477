package com.placeguide.recommend.service;

import com.placeguide.recommend.cache.TtlCache;
import com.placeguide.recommend.store.jdbc.JdbcErrors;
import com.placeguide.recommend.store.jdbc.VenueRepository;
import java.util.List;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class CatalogService {
    private static final String TAGS_KEY = "catalog:tags";
    private static final String DISTRICTS_KEY = "catalog:districts";

    private final VenueRepository venueRepository;
    private final TtlCache<List<String>> cache = new TtlCache<>(8);
    private final long ttlMs;

    public CatalogService(
        VenueRepository venueRepository,
        @Value("${recommend.catalog.ttl-ms:300000}") long ttlMs
    ) {
        this.venueRepository = venueRepository;
        this.ttlMs = ttlMs;
    }

    public List<String> listTags() {
        return cached(TAGS_KEY, "tag catalog", venueRepository::listTags);
    }

    public List<String> listDistricts() {
        return cached(DISTRICTS_KEY, "district catalog", venueRepository::listDistricts);
    }

    private List<String> cached(String key, String operation, Supplier<List<String>> loader) {
        return cache.getOrLoad(key, ttlMs, () -> {
            try {
                return List.copyOf(loader.get());
            } catch (DataAccessException e) {
                throw JdbcErrors.translate(operation, e);
            }
        });
    }
}
