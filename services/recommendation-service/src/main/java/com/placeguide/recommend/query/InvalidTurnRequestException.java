package com.placeguide.recommend.query;

public class InvalidTurnRequestException extends RuntimeException {
    public InvalidTurnRequestException(String message) {
        super(message);
    }
}
