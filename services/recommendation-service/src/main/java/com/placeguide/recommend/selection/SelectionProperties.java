package com.placeguide.recommend.selection;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "recommend.selection")
public class SelectionProperties {
    private int minResults = 3;
    private int maxResults = 7;
    private int maxPerDistrict = 2;
    private int relaxedMaxPerDistrict = 3;
    private double tagOverlapThreshold = 0.8;

    public int getMinResults() {
        return minResults;
    }

    public void setMinResults(int minResults) {
        this.minResults = minResults;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public int getMaxPerDistrict() {
        return maxPerDistrict;
    }

    public void setMaxPerDistrict(int maxPerDistrict) {
        this.maxPerDistrict = maxPerDistrict;
    }

    public int getRelaxedMaxPerDistrict() {
        return relaxedMaxPerDistrict;
    }

    public void setRelaxedMaxPerDistrict(int relaxedMaxPerDistrict) {
        this.relaxedMaxPerDistrict = relaxedMaxPerDistrict;
    }

    public double getTagOverlapThreshold() {
        return tagOverlapThreshold;
    }

    public void setTagOverlapThreshold(double tagOverlapThreshold) {
        this.tagOverlapThreshold = tagOverlapThreshold;
    }

    public void validate() {
        if (minResults < 0 || maxResults < 1 || minResults > maxResults) {
            throw new IllegalStateException(
                "recommend.selection requires 0 <= min-results <= max-results, got " + minResults + ".." + maxResults
            );
        }
        if (maxPerDistrict < 1 || relaxedMaxPerDistrict < maxPerDistrict) {
            throw new IllegalStateException("recommend.selection district caps must satisfy 1 <= strict <= relaxed");
        }
        if (tagOverlapThreshold < 0.0 || tagOverlapThreshold > 1.0) {
            throw new IllegalStateException("recommend.selection.tag-overlap-threshold must be within [0,1]");
        }
    }
}
