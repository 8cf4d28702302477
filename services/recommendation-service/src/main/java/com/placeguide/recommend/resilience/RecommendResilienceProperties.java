package com.placeguide.recommend.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "recommend.resilience")
public class RecommendResilienceProperties {
    private int geoFailureThreshold = 3;
    private long geoOpenMs = 15000;
    private int vectorFailureThreshold = 3;
    private long vectorOpenMs = 30000;
    private int embedFailureThreshold = 3;
    private long embedOpenMs = 30000;

    public int getGeoFailureThreshold() {
        return geoFailureThreshold;
    }

    public void setGeoFailureThreshold(int geoFailureThreshold) {
        this.geoFailureThreshold = geoFailureThreshold;
    }

    public long getGeoOpenMs() {
        return geoOpenMs;
    }

    public void setGeoOpenMs(long geoOpenMs) {
        this.geoOpenMs = geoOpenMs;
    }

    public int getVectorFailureThreshold() {
        return vectorFailureThreshold;
    }

    public void setVectorFailureThreshold(int vectorFailureThreshold) {
        this.vectorFailureThreshold = vectorFailureThreshold;
    }

    public long getVectorOpenMs() {
        return vectorOpenMs;
    }

    public void setVectorOpenMs(long vectorOpenMs) {
        this.vectorOpenMs = vectorOpenMs;
    }

    public int getEmbedFailureThreshold() {
        return embedFailureThreshold;
    }

    public void setEmbedFailureThreshold(int embedFailureThreshold) {
        this.embedFailureThreshold = embedFailureThreshold;
    }

    public long getEmbedOpenMs() {
        return embedOpenMs;
    }

    public void setEmbedOpenMs(long embedOpenMs) {
        this.embedOpenMs = embedOpenMs;
    }
}
