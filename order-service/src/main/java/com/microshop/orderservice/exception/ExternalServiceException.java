package com.microshop.orderservice.exception;

/**
 * Exception thrown when communication with external services fails
 * For example: user-service is unreachable, times out or returns a malformed body
 * HTTP Status: 502 Bad Gateway
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
