package com.socialnet.exception;

/**
 * Exception thrown when a requested resource does not exist.
 *
 * GlobalExceptionHandler maps this to HTTP 404 Not Found.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException of(String resourceType, Object id) {
        return new ResourceNotFoundException(String.format("%s '%s' not found.", resourceType, id));
    }
}
