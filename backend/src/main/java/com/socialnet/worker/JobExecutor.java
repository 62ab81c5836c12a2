package com.socialnet.worker;

import com.socialnet.entity.ScheduledJob;
import com.socialnet.entity.ScheduledJob.JobStatus;
import com.socialnet.exception.JobSubmissionException;
import com.socialnet.jobs.JobHandlerRegistry;
import com.socialnet.jobs.JobOutcome;
import com.socialnet.jobs.JobPayload;
import com.socialnet.jobs.JobPayloadCodec;
import com.socialnet.repository.ScheduledJobRepository;
import com.socialnet.service.JobQueueClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Executes a single job on the calling worker thread.
 *
 * Execution Flow:
 * 1. Claim: conditional update PENDING → RUNNING where eta ≤ now
 * 2. Load the claimed row and decode its payload
 * 3. Dispatch to the handler registered for the job's kind
 * 4. Finish: conditional update RUNNING → DONE, or RUNNING → FAILED with the error
 * 5. On failure, enqueue the next attempt if the job's retry budget allows it
 *
 * A failed claim means the job is unknown, not yet due, or owned by another worker
 * (or by an earlier run); nothing is executed and SKIPPED is returned. Because the
 * claim only ever matches PENDING rows, a DONE job is never executed again.
 *
 * Database errors while claiming or finishing propagate to the caller.
 *
 * @see com.socialnet.messaging.JobDispatchConsumer
 * @see com.socialnet.jobs.JobHandlerRegistry
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobExecutor {

    private static final int MAX_ERROR_LOG_LENGTH = 4000;

    private final ScheduledJobRepository jobRepository;
    private final JobHandlerRegistry handlerRegistry;
    private final JobPayloadCodec payloadCodec;
    private final JobQueueClient jobQueueClient;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    /**
     * Claim and run the job with the given id.
     *
     * @param jobId the job to run
     * @return the outcome of this call
     */
    public JobOutcome execute(UUID jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("Job id cannot be null");
        }

        // Step 1: Claim
        int claimed = jobRepository.claim(jobId, LocalDateTime.now(clock));
        if (claimed == 0) {
            log.debug("Job not claimable, skipping: jobId={}", jobId);
            return JobOutcome.SKIPPED;
        }

        // Step 2: Load the claimed row
        ScheduledJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("Claimed job disappeared: " + jobId));
        log.info("Job started: jobId={}, kind={}, attempt={}/{}",
                jobId, job.getKind(), job.getAttempt(), job.getMaxAttempts());

        // Step 3: Decode and dispatch
        try {
            JobPayload payload = payloadCodec.decode(job.getKind(), job.getPayload());
            handlerRegistry.dispatch(job.getKind(), payload);
        } catch (Exception e) {
            return fail(job, e);
        }

        // Step 4: Finish
        int finished = jobRepository.finish(jobId, JobStatus.DONE, LocalDateTime.now(clock), null);
        if (finished == 0) {
            log.warn("Job was no longer RUNNING when completing: jobId={}", jobId);
        }
        log.info("Job completed: jobId={}, kind={}", jobId, job.getKind());
        return JobOutcome.DONE;
    }

    private JobOutcome fail(ScheduledJob job, Exception error) {
        LocalDateTime now = LocalDateTime.now(clock);
        log.error("Job failed: jobId={}, kind={}, attempt={}/{}, error={}",
                job.getId(), job.getKind(), job.getAttempt(), job.getMaxAttempts(), error.getMessage(), error);

        jobRepository.finish(job.getId(), JobStatus.FAILED, now, describe(error));

        // Step 5: Retry with backoff, as a new row
        if (retryPolicy.shouldRetry(job)) {
            LocalDateTime retryEta = retryPolicy.nextEta(job, now);
            try {
                jobQueueClient.enqueueRetry(job, retryEta);
            } catch (JobSubmissionException e) {
                log.error("Could not enqueue retry, job stays FAILED: jobId={}, error={}",
                        job.getId(), e.getMessage());
            }
        }
        return JobOutcome.FAILED;
    }

    private String describe(Exception error) {
        String message = error.getClass().getSimpleName() + ": " + error.getMessage();
        return message.length() > MAX_ERROR_LOG_LENGTH ? message.substring(0, MAX_ERROR_LOG_LENGTH) : message;
    }
}
