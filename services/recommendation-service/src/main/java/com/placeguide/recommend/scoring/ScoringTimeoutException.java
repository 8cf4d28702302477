package com.placeguide.recommend.scoring;

public class ScoringTimeoutException extends RuntimeException {
    public ScoringTimeoutException(String message) {
        super(message);
    }
}
