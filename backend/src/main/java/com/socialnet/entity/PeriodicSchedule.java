package com.socialnet.entity;

import com.socialnet.jobs.JobKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.springframework.scheduling.support.CronExpression;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Persisted definition of a periodic job, read by PeriodicJobScheduler on every tick.
 *
 * A schedule fires either every {@code intervalSeconds} or on a Spring cron
 * expression; exactly one of the two is set. Edits made through the REST API take
 * effect on the next tick without a restart.
 *
 * Database Table: periodic_schedules
 */
@Entity
@Table(name = "periodic_schedules", indexes = {
    @Index(name = "idx_schedule_name", columnList = "name", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PeriodicSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_kind", nullable = false, length = 30)
    private JobKind jobKind;

    @Column(name = "interval_seconds")
    private Long intervalSeconds;

    /**
     * Six-field Spring cron expression (second minute hour day month weekday).
     */
    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    @Column(name = "enabled", nullable = false)
    private Boolean enabled = true;

    /**
     * Time of the last successful enqueue. Untouched when an enqueue fails.
     */
    @Column(name = "last_enqueued_at")
    private LocalDateTime lastEnqueuedAt;

    @Column(name = "last_job_id")
    private UUID lastJobId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Constructor for an enabled interval schedule.
     *
     * @param name unique schedule name
     * @param jobKind kind of job to enqueue
     * @param intervalSeconds seconds between enqueues
     */
    public PeriodicSchedule(String name, JobKind jobKind, long intervalSeconds) {
        this.name = name;
        this.jobKind = jobKind;
        this.intervalSeconds = intervalSeconds;
        this.enabled = true;
    }

    /**
     * Compute whether this schedule should enqueue a job at {@code now}.
     *
     * Interval schedules that never ran are due immediately. Cron schedules that
     * never ran are due once the first fire time after creation has passed. A cron
     * expression with no future match (e.g. February 30th) is never due.
     *
     * @param now current time
     * @return true if a job should be enqueued
     */
    public boolean isDue(LocalDateTime now) {
        if (!Boolean.TRUE.equals(enabled)) {
            return false;
        }
        if (!hasRun()) {
            return true;
        }
        LocalDateTime next = nextFireTime();
        return next != null && !next.isAfter(now);
    }

    /**
     * Next time this schedule fires.
     *
     * @return the next fire time, or null when the schedule never ran (it fires on
     *         the next tick) or its cron expression never matches again
     */
    public LocalDateTime nextFireTime() {
        if (!hasRun()) {
            return null;
        }
        if (cronExpression != null) {
            return CronExpression.parse(cronExpression).next(lastEnqueuedAt != null ? lastEnqueuedAt : createdAt);
        }
        return lastEnqueuedAt.plusSeconds(intervalSeconds);
    }

    /**
     * Whether there is a reference time to compute the next fire time from. Cron
     * schedules count their creation time; interval schedules only a past enqueue.
     */
    private boolean hasRun() {
        if (cronExpression != null) {
            return lastEnqueuedAt != null || createdAt != null;
        }
        return lastEnqueuedAt != null;
    }

    /**
     * Record a successful enqueue.
     *
     * @param enqueuedAt time of the enqueue
     * @param jobId id of the enqueued job
     */
    public void markEnqueued(LocalDateTime enqueuedAt, UUID jobId) {
        this.lastEnqueuedAt = enqueuedAt;
        this.lastJobId = jobId;
    }
}
