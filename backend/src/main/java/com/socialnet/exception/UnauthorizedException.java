package com.socialnet.exception;

/**
 * Exception thrown when an authenticated user acts on a resource they do not own.
 *
 * Authentication failures (missing or invalid JWT) are 401 and handled by Spring
 * Security; this exception covers the 403 case, e.g. deleting another user's post
 * or reading another user's job.
 *
 * GlobalExceptionHandler maps this to HTTP 403 Forbidden with RFC 7807 format.
 *
 * @see com.socialnet.exception.GlobalExceptionHandler
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }

    /**
     * Constructs a new UnauthorizedException for accessing another user's resource.
     *
     * @param resourceType the type of resource (e.g., "post", "job")
     * @param resourceId the ID of the resource
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException accessDenied(String resourceType, String resourceId) {
        return new UnauthorizedException(
                String.format("Access denied to %s '%s'. You do not have permission to access this resource.",
                        resourceType, resourceId)
        );
    }

    /**
     * Constructs a new UnauthorizedException for insufficient permissions.
     *
     * @param action the action that was attempted (e.g., "delete")
     * @param resourceType the type of resource
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException insufficientPermissions(String action, String resourceType) {
        return new UnauthorizedException(
                String.format("Insufficient permissions to %s %s.", action, resourceType)
        );
    }
}
