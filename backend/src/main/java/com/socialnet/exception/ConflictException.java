package com.socialnet.exception;

/**
 * Exception thrown when an action conflicts with the current state of a relation,
 * e.g. following oneself, following a profile twice or liking a post twice.
 *
 * GlobalExceptionHandler maps this to HTTP 409 Conflict.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public static ConflictException selfFollow() {
        return new ConflictException("You cannot follow or unfollow yourself.");
    }

    public static ConflictException alreadyFollowing(String username) {
        return new ConflictException(String.format("You are already following '%s'.", username));
    }

    public static ConflictException alreadyLiked(Long postId) {
        return new ConflictException(String.format("You already liked post '%s'.", postId));
    }
}
