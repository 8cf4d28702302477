package com.placeguide.recommend.selection;

public class SelectionTimeoutException extends RuntimeException {
    public SelectionTimeoutException(String message) {
        super(message);
    }
}
