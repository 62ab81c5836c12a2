package com.socialnet.exception;

/**
 * Exception thrown when creating a resource would violate a uniqueness rule
 * (email or username already taken).
 *
 * GlobalExceptionHandler maps this to HTTP 409 Conflict.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public static DuplicateResourceException emailTaken(String email) {
        return new DuplicateResourceException(String.format("Email '%s' is already registered.", email));
    }

    public static DuplicateResourceException usernameTaken(String username) {
        return new DuplicateResourceException(String.format("Username '%s' is already taken.", username));
    }
}
