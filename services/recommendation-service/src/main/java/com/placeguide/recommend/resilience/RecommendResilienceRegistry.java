package com.placeguide.recommend.resilience;

import org.springframework.stereotype.Component;

@Component
public class RecommendResilienceRegistry {
    private final CircuitBreaker geoBreaker;
    private final CircuitBreaker vectorBreaker;
    private final CircuitBreaker embedBreaker;

    public RecommendResilienceRegistry(RecommendResilienceProperties properties) {
        this.geoBreaker = new CircuitBreaker("geo", properties.getGeoFailureThreshold(), properties.getGeoOpenMs());
        this.vectorBreaker = new CircuitBreaker(
            "vector",
            properties.getVectorFailureThreshold(),
            properties.getVectorOpenMs()
        );
        this.embedBreaker = new CircuitBreaker(
            "embed",
            properties.getEmbedFailureThreshold(),
            properties.getEmbedOpenMs()
        );
    }

    public CircuitBreaker getGeoBreaker() {
        return geoBreaker;
    }

    public CircuitBreaker getVectorBreaker() {
        return vectorBreaker;
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }
}
