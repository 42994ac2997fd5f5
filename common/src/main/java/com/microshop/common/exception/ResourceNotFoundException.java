package com.microshop.common.exception;

/**
 * Exception thrown when a requested entity does not exist
 * HTTP Status: 404 Not Found (set in GlobalExceptionHandler)
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
