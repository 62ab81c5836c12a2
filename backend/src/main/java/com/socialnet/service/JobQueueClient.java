package com.socialnet.service;

import com.socialnet.entity.ScheduledJob;
import com.socialnet.exception.JobSubmissionException;
import com.socialnet.jobs.JobKind;
import com.socialnet.jobs.JobPayload;
import com.socialnet.jobs.JobPayloadCodec;
import com.socialnet.repository.ScheduledJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Task queue client: records a unit of deferred work in the queue backend.
 *
 * Enqueue Flow:
 * 1. Validate kind, payload type and eta
 * 2. Encode the payload as JSON
 * 3. Insert a PENDING row in scheduled_jobs (attempt 1)
 * 4. Return the job id
 *
 * The insert is a single flushed save, so when the backend is unreachable the call
 * fails with {@link JobSubmissionException} and no row exists. The worker pool
 * picks the row up once its eta has passed; nothing is published here.
 *
 * @see com.socialnet.worker.DueJobDispatcher
 * @see com.socialnet.worker.JobExecutor
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobQueueClient {

    private final ScheduledJobRepository jobRepository;
    private final JobPayloadCodec payloadCodec;
    private final Clock clock;

    @Value("${app.jobs.retry.max-attempts:1}")
    private int maxAttempts;

    /**
     * Enqueue a job for execution at or after {@code eta}.
     *
     * @param kind the job kind
     * @param payload payload of the kind's payload type
     * @param eta earliest execution time; null means now
     * @return the new job's id
     * @throws IllegalArgumentException if the payload does not match the kind or
     *         a CREATE_POST eta is in the past
     * @throws JobSubmissionException if the queue backend is unreachable
     */
    public UUID enqueue(JobKind kind, JobPayload payload, LocalDateTime eta) {
        return enqueue(kind, payload, eta, null, null);
    }

    /**
     * Enqueue a job with submitter and schedule attribution.
     *
     * @param kind the job kind
     * @param payload payload of the kind's payload type
     * @param eta earliest execution time; null means now
     * @param submittedBy id of the submitting user, or null
     * @param scheduleName name of the periodic schedule, or null
     * @return the new job's id
     */
    public UUID enqueue(JobKind kind, JobPayload payload, LocalDateTime eta, UUID submittedBy, String scheduleName) {
        if (kind == null) {
            throw new IllegalArgumentException("Job kind cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Job payload cannot be null");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime effectiveEta = eta != null ? eta : now;
        if (kind.requiresFutureEta() && effectiveEta.isBefore(now)) {
            log.warn("Rejected job with past eta: kind={}, eta={}, now={}", kind, effectiveEta, now);
            throw new IllegalArgumentException("Scheduled time must not be in the past: " + effectiveEta);
        }

        ScheduledJob job = new ScheduledJob(kind, payloadCodec.encode(kind, payload), effectiveEta, maxAttempts);
        job.setSubmittedBy(submittedBy);
        job.setScheduleName(scheduleName);

        UUID jobId = save(job).getId();
        log.info("Job enqueued: jobId={}, kind={}, eta={}, submittedBy={}, schedule={}",
                jobId, kind, effectiveEta, submittedBy, scheduleName);
        return jobId;
    }

    /**
     * Enqueue the next attempt of a failed job. The new row carries the same kind,
     * payload and attribution, with attempt + 1 and retryOf pointing at the failed row.
     *
     * @param failed the failed job
     * @param eta when the retry may start
     * @return the retry job's id
     * @throws JobSubmissionException if the queue backend is unreachable
     */
    public UUID enqueueRetry(ScheduledJob failed, LocalDateTime eta) {
        ScheduledJob retry = new ScheduledJob(failed.getKind(), failed.getPayload(), eta, failed.getMaxAttempts());
        retry.setAttempt(failed.getAttempt() + 1);
        retry.setRetryOf(failed.getId());
        retry.setSubmittedBy(failed.getSubmittedBy());
        retry.setScheduleName(failed.getScheduleName());

        UUID jobId = save(retry).getId();
        log.info("Retry enqueued: jobId={}, retryOf={}, kind={}, attempt={}/{}, eta={}",
                jobId, failed.getId(), failed.getKind(), retry.getAttempt(), retry.getMaxAttempts(), eta);
        return jobId;
    }

    private ScheduledJob save(ScheduledJob job) {
        try {
            return jobRepository.saveAndFlush(job);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to record job in queue backend: kind={}, error={}", job.getKind(), e.getMessage());
            throw JobSubmissionException.queueUnavailable(job.getKind(), e);
        }
    }
}
