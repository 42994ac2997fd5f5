package com.microshop.orderservice.exception;

/**
 * Exception thrown when an order references a user that user-service does not know
 * HTTP Status: 400 Bad Request
 */
public class UserValidationException extends RuntimeException {

    private final Long userId;

    public UserValidationException(Long userId) {
        super("User does not exist: " + userId);
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }
}
