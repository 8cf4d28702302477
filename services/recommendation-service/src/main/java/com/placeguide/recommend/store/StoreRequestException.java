package com.placeguide.recommend.store;

public class StoreRequestException extends RuntimeException {
    public StoreRequestException(String message) {
        super(message);
    }

    public StoreRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
