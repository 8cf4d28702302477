package com.placeguide.recommend.orchestration;

public class ProfileUnavailableException extends RuntimeException {
    public ProfileUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
