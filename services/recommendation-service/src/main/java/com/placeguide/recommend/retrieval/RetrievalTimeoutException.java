package com.placeguide.recommend.retrieval;

public class RetrievalTimeoutException extends RuntimeException {
    public RetrievalTimeoutException(String message) {
        super(message);
    }
}
