package com.socialnet.exception;

/**
 * Exception thrown when an uploaded file cannot be written to the media store.
 *
 * GlobalExceptionHandler maps this to HTTP 500 Internal Server Error.
 */
public class MediaStorageException extends RuntimeException {

    public MediaStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
