package com.socialnet.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST API endpoints.
 *
 * Converts exceptions thrown by controllers and services into RFC 7807
 * (Problem Details for HTTP APIs) responses.
 *
 * <p>RFC 7807 Response Format:
 * <pre>
 * {
 *   "type": "https://api.socialnet.com/errors/job-submission-failed",
 *   "title": "Job Submission Failed",
 *   "status": 503,
 *   "detail": "Job queue is unavailable; CREATE_POST job was not submitted. Please try again later.",
 *   "instance": "/api/posts",
 *   "timestamp": "2024-02-26T10:30:00"
 * }
 * </pre>
 *
 * <p>Handled Exception Categories:
 * <ul>
 *   <li>Authentication errors (401): bad credentials, invalid or revoked refresh token</li>
 *   <li>Authorization errors (403): not the owner, not staff</li>
 *   <li>Validation errors (400): invalid body, past schedule time, malformed ids</li>
 *   <li>Not found errors (404): unknown post, job, profile or schedule</li>
 *   <li>Conflict errors (409): email or username already taken, self-follow, double follow or like</li>
 *   <li>Upload errors (413, 500): file too large, media store not writable</li>
 *   <li>Job submission errors (503): queue backend unreachable</li>
 *   <li>Server errors (500): unexpected internal errors</li>
 * </ul>
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7807">RFC 7807</a>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String BASE_ERROR_URI = "https://api.socialnet.com/errors";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;

    /**
     * Handles JobSubmissionException - the job could not be recorded.
     * Mapped to HTTP 503 Service Unavailable; the client may retry.
     */
    @ExceptionHandler(JobSubmissionException.class)
    public ResponseEntity<ProblemDetail> handleJobSubmissionException(
            JobSubmissionException ex,
            WebRequest request
    ) {
        log.error("Job submission failed: kind={}, error={}", ex.getKind(), ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Job Submission Failed",
                ex.getMessage(),
                request,
                "job-submission-failed"
        );
        if (ex.getKind() != null) {
            problemDetail.setProperty("jobKind", ex.getKind().name());
        }

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problemDetail);
    }

    /**
     * Handles UnauthorizedException - authenticated user lacks ownership.
     * Mapped to HTTP 403 Forbidden.
     */
    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ProblemDetail> handleUnauthorizedException(
            UnauthorizedException ex,
            WebRequest request
    ) {
        log.warn("Authorization failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.FORBIDDEN,
                "Access Denied",
                ex.getMessage(),
                request,
                "access-denied"
        );

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problemDetail);
    }

    /**
     * Handles AccessDeniedException raised by {@code @PreAuthorize}.
     * Unauthenticated requests never reach here (the entry point answers 401),
     * so this is always an authenticated user without the required role.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDeniedException(
            AccessDeniedException ex,
            WebRequest request
    ) {
        log.warn("Access denied: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.FORBIDDEN,
                "Access Denied",
                "You do not have the role required to access this resource.",
                request,
                "access-denied"
        );

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problemDetail);
    }

    /**
     * Handles BadCredentialsException - wrong password or unusable refresh token.
     * Mapped to HTTP 401 Unauthorized.
     */
    @ExceptionHandler(BadCredentialsException.class)
    public ResponseEntity<ProblemDetail> handleBadCredentialsException(
            BadCredentialsException ex,
            WebRequest request
    ) {
        log.warn("Authentication failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.UNAUTHORIZED,
                "Authentication Failed",
                ex.getMessage(),
                request,
                "authentication-failed"
        );

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problemDetail);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            WebRequest request
    ) {
        log.debug("Resource not found: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.NOT_FOUND,
                "Resource Not Found",
                ex.getMessage(),
                request,
                "resource-not-found"
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ProblemDetail> handleDuplicateResourceException(
            DuplicateResourceException ex,
            WebRequest request
    ) {
        log.warn("Duplicate resource: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.CONFLICT,
                "Duplicate Resource",
                ex.getMessage(),
                request,
                "duplicate-resource"
        );

        return ResponseEntity.status(HttpStatus.CONFLICT).body(problemDetail);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ProblemDetail> handleConflictException(
            ConflictException ex,
            WebRequest request
    ) {
        log.warn("Conflict: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.CONFLICT,
                "Conflict",
                ex.getMessage(),
                request,
                "conflict"
        );

        return ResponseEntity.status(HttpStatus.CONFLICT).body(problemDetail);
    }

    /**
     * Handles MaxUploadSizeExceededException - multipart body over the configured limit.
     * Mapped to HTTP 413 Payload Too Large.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ProblemDetail> handleMaxUploadSizeExceededException(
            MaxUploadSizeExceededException ex,
            WebRequest request
    ) {
        log.warn("Upload rejected: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.PAYLOAD_TOO_LARGE,
                "File Too Large",
                "The uploaded file exceeds the maximum allowed size.",
                request,
                "file-too-large"
        );

        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(problemDetail);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ProblemDetail> handleMissingPartException(
            MissingServletRequestPartException ex,
            WebRequest request
    ) {
        log.warn("Multipart request without part '{}'", ex.getRequestPartName());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Missing File",
                String.format("Multipart part '%s' is required.", ex.getRequestPartName()),
                request,
                "missing-file"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(MediaStorageException.class)
    public ResponseEntity<ProblemDetail> handleMediaStorageException(
            MediaStorageException ex,
            WebRequest request
    ) {
        log.error("Media storage failed: {}", ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Media Storage Failed",
                "The uploaded file could not be stored. Please try again later.",
                request,
                "media-storage-failed"
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    /**
     * Handles MethodArgumentNotValidException - bean validation failures.
     * Mapped to HTTP 400 Bad Request with per-field messages in "errors".
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidationException(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        log.warn("Request validation failed: {}", ex.getMessage());

        Map<String, String> validationErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                validationErrors.put(error.getField(), error.getDefaultMessage()));

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                "Request validation failed. Please check the 'errors' property for details.",
                request,
                "validation-failed"
        );

        problemDetail.setProperty("errors", validationErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("Request body parsing failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                "The request body is malformed or contains invalid JSON. Please check your request format.",
                request,
                "invalid-request-body"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            WebRequest request
    ) {
        log.warn("Invalid path or query parameter: name={}, value={}", ex.getName(), ex.getValue());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Parameter",
                String.format("Parameter '%s' has an invalid value.", ex.getName()),
                request,
                "invalid-parameter"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles IllegalArgumentException - rejected input from the service layer,
     * e.g. a scheduled time in the past or a schedule with both interval and cron.
     * Mapped to HTTP 400 Bad Request.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        log.warn("Invalid argument: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                ex.getMessage(),
                request,
                "invalid-argument"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Fallback handler for all unhandled exceptions. Logs the stack trace and
     * returns a generic 500 with an error id for correlation.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnhandledException(
            Exception ex,
            WebRequest request
    ) {
        String errorId = generateErrorId();
        log.error("Unexpected error occurred: errorId={}, message={}", errorId, ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later or contact support if the issue persists.",
                request,
                "internal-error"
        );

        problemDetail.setProperty("errorId", errorId);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    /**
     * Creates a ProblemDetail object with RFC 7807 compliant fields.
     *
     * @param status the HTTP status code
     * @param title a short, human-readable title
     * @param detail a detailed explanation
     * @param request the web request context
     * @param errorType the error type identifier for the type URI
     * @return a populated ProblemDetail object
     */
    private ProblemDetail createProblemDetail(
            HttpStatus status,
            String title,
            String detail,
            WebRequest request,
            String errorType
    ) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);

        problemDetail.setType(URI.create(String.format("%s/%s", BASE_ERROR_URI, errorType)));
        problemDetail.setTitle(title);

        String description = request.getDescription(false);
        if (description != null && description.startsWith("uri=")) {
            problemDetail.setInstance(URI.create(description.substring(4)));
        }

        problemDetail.setProperty("timestamp", LocalDateTime.now().format(TIMESTAMP_FORMATTER));

        return problemDetail;
    }

    private String generateErrorId() {
        return String.format("ERR-%d", System.currentTimeMillis());
    }
}
