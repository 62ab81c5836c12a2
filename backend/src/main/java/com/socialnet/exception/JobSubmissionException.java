package com.socialnet.exception;

import com.socialnet.jobs.JobKind;

/**
 * Exception thrown when a job cannot be recorded in the queue backend.
 *
 * Raised synchronously by {@code JobQueueClient.enqueue}; when it is thrown no
 * job row exists. Callers decide whether to surface it (REST → 503) or skip
 * (scheduler tick).
 *
 * @see com.socialnet.service.JobQueueClient
 * @see com.socialnet.exception.GlobalExceptionHandler
 */
public class JobSubmissionException extends RuntimeException {

    private final JobKind kind;

    public JobSubmissionException(JobKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets the kind of job that could not be submitted.
     *
     * @return the job kind
     */
    public JobKind getKind() {
        return kind;
    }

    /**
     * Constructs a new JobSubmissionException for an unreachable queue backend.
     *
     * @param kind the job kind being submitted
     * @param cause the underlying data access failure
     * @return a JobSubmissionException with a formatted message
     */
    public static JobSubmissionException queueUnavailable(JobKind kind, Throwable cause) {
        return new JobSubmissionException(
                kind,
                String.format("Job queue is unavailable; %s job was not submitted. Please try again later.", kind),
                cause
        );
    }
}
