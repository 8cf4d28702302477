package com.placeguide.recommend.scoring;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "recommend.scoring")
public class ScoringProperties {
    private double preferredTagWeight = 0.1;
    private int preferredTagCap = 3;
    private double avoidedTagWeight = 0.35;
    private double favoriteDistrictWeight = 0.15;
    private double dislikedVenuePenalty = 1.0;

    public double getPreferredTagWeight() {
        return preferredTagWeight;
    }

    public void setPreferredTagWeight(double preferredTagWeight) {
        this.preferredTagWeight = preferredTagWeight;
    }

    public int getPreferredTagCap() {
        return preferredTagCap;
    }

    public void setPreferredTagCap(int preferredTagCap) {
        this.preferredTagCap = preferredTagCap;
    }

    public double getAvoidedTagWeight() {
        return avoidedTagWeight;
    }

    public void setAvoidedTagWeight(double avoidedTagWeight) {
        this.avoidedTagWeight = avoidedTagWeight;
    }

    public double getFavoriteDistrictWeight() {
        return favoriteDistrictWeight;
    }

    public void setFavoriteDistrictWeight(double favoriteDistrictWeight) {
        this.favoriteDistrictWeight = favoriteDistrictWeight;
    }

    public double getDislikedVenuePenalty() {
        return dislikedVenuePenalty;
    }

    public void setDislikedVenuePenalty(double dislikedVenuePenalty) {
        this.dislikedVenuePenalty = dislikedVenuePenalty;
    }

    /**
     * A single avoided tag must outweigh the largest possible preferred-tag boost.
     */
    public void validate() {
        if (preferredTagWeight < 0.0 || avoidedTagWeight < 0.0 || favoriteDistrictWeight < 0.0
            || dislikedVenuePenalty < 0.0) {
            throw new IllegalStateException("recommend.scoring weights must be non-negative");
        }
        if (preferredTagCap < 1) {
            throw new IllegalStateException("recommend.scoring.preferred-tag-cap must be at least 1");
        }
        if (avoidedTagWeight <= preferredTagWeight * preferredTagCap) {
            throw new IllegalStateException(
                "recommend.scoring.avoided-tag-weight (" + avoidedTagWeight
                    + ") must exceed preferred-tag-weight * preferred-tag-cap ("
                    + preferredTagWeight * preferredTagCap + ")"
            );
        }
    }
}
