package com.socialnet.entity;

import com.socialnet.jobs.JobKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * ScheduledJob entity, the durable record of one unit of deferred work.
 *
 * The scheduled_jobs table is the queue backend: JobQueueClient inserts rows,
 * DueJobDispatcher reads due rows and hands their ids to the worker pool, and
 * JobExecutor moves each row through its lifecycle.
 *
 * Status transitions: PENDING → RUNNING → DONE/FAILED. Every transition is a
 * conditional update on the current status, so a row never moves backwards and a
 * row that reached DONE is never claimed again.
 *
 * Retries never reopen a row. A retry is a new PENDING row pointing at the failed
 * one through {@code retryOf}, with {@code attempt} incremented.
 *
 * Database Table: scheduled_jobs
 */
@Entity
@Table(name = "scheduled_jobs", indexes = {
    @Index(name = "idx_job_status_eta", columnList = "status, eta"),
    @Index(name = "idx_job_submitted_by", columnList = "submitted_by"),
    @Index(name = "idx_job_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJob {

    public static final int MAX_PAYLOAD_LENGTH = 10000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Kind of work; selects the payload type and the handler.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 30, updatable = false)
    private JobKind kind;

    /**
     * JSON encoding of the kind's payload class.
     */
    @Column(name = "payload", nullable = false, length = MAX_PAYLOAD_LENGTH, updatable = false)
    private String payload;

    /**
     * Earliest time the job may start. No worker claims the row before this.
     */
    @Column(name = "eta", nullable = false, updatable = false)
    private LocalDateTime eta;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status = JobStatus.PENDING;

    /**
     * 1-based attempt number within a retry chain.
     */
    @Column(name = "attempt", nullable = false, updatable = false)
    private Integer attempt = 1;

    /**
     * Total attempts allowed for the chain this job belongs to.
     */
    @Column(name = "max_attempts", nullable = false, updatable = false)
    private Integer maxAttempts = 1;

    /**
     * Id of the failed job this one retries, null for a first attempt.
     */
    @Column(name = "retry_of", updatable = false)
    private UUID retryOf;

    /**
     * User that submitted the job, null for system-submitted jobs.
     */
    @Column(name = "submitted_by", updatable = false)
    private UUID submittedBy;

    /**
     * Name of the periodic schedule that enqueued the job, null otherwise.
     */
    @Column(name = "schedule_name", length = 100, updatable = false)
    private String scheduleName;

    /**
     * Last time the job id was published to the worker pool.
     */
    @Column(name = "dispatched_at")
    private LocalDateTime dispatchedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "error_log", columnDefinition = "TEXT")
    private String errorLog;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Constructor for a new first-attempt job.
     *
     * @param kind the job kind
     * @param payload the serialized payload
     * @param eta earliest execution time
     * @param maxAttempts total attempts allowed, at least 1
     */
    public ScheduledJob(JobKind kind, String payload, LocalDateTime eta, int maxAttempts) {
        this.kind = kind;
        this.payload = payload;
        this.eta = eta;
        this.status = JobStatus.PENDING;
        this.attempt = 1;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Job lifecycle states.
     */
    public enum JobStatus {
        /**
         * Waiting for its eta and for a worker to claim it.
         */
        PENDING,

        /**
         * Claimed by a worker; the handler is executing.
         */
        RUNNING,

        /**
         * Handler completed. Terminal.
         */
        DONE,

        /**
         * Handler raised. Terminal; the error is kept in error_log.
         */
        FAILED;

        public boolean isTerminal() {
            return this == DONE || this == FAILED;
        }
    }

    /**
     * Check whether another attempt may follow this one.
     *
     * @return true if the retry chain still has attempts left
     */
    public boolean hasAttemptsLeft() {
        return this.attempt < this.maxAttempts;
    }
}
