package com.placeguide.recommend.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "recommend.retrieval")
public class RetrievalProperties {
    public static final int HARD_CANDIDATE_CAP = 50;

    private int maxCandidates = HARD_CANDIDATE_CAP;
    private int defaultRadiusMeters = 5000;
    private double defaultMinRating = 0.0;
    private int tagOverfetchFactor = 3;
    private int hybridRankConstant = 60;

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public void setMaxCandidates(int maxCandidates) {
        this.maxCandidates = maxCandidates;
    }

    public int getDefaultRadiusMeters() {
        return defaultRadiusMeters;
    }

    public void setDefaultRadiusMeters(int defaultRadiusMeters) {
        this.defaultRadiusMeters = defaultRadiusMeters;
    }

    public double getDefaultMinRating() {
        return defaultMinRating;
    }

    public void setDefaultMinRating(double defaultMinRating) {
        this.defaultMinRating = defaultMinRating;
    }

    public int getTagOverfetchFactor() {
        return tagOverfetchFactor;
    }

    public void setTagOverfetchFactor(int tagOverfetchFactor) {
        this.tagOverfetchFactor = tagOverfetchFactor;
    }

    public int getHybridRankConstant() {
        return hybridRankConstant;
    }

    public void setHybridRankConstant(int hybridRankConstant) {
        this.hybridRankConstant = hybridRankConstant;
    }

    public int boundLimit(int requested) {
        int cap = Math.max(1, Math.min(maxCandidates, HARD_CANDIDATE_CAP));
        if (requested <= 0) {
            return cap;
        }
        return Math.min(requested, cap);
    }

    public int fetchLimit(int limit, boolean tagFiltered) {
        return tagFiltered ? limit * Math.max(1, tagOverfetchFactor) : limit;
    }
}
