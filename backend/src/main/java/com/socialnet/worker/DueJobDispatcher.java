package com.socialnet.worker;

import com.socialnet.entity.ScheduledJob;
import com.socialnet.messaging.JobDispatchProducer;
import com.socialnet.repository.ScheduledJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Polls the queue backend for due jobs and hands their ids to the worker pool.
 *
 * A job is due when it is PENDING and its eta has passed. Each published job is
 * stamped with dispatchedAt; if the message is lost (broker restart, TTL, DLQ) the
 * job is published again once the redispatch window has elapsed. Duplicate
 * deliveries are harmless because JobExecutor claims atomically.
 *
 * Runs only in processes with the worker role.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.jobs.worker.enabled", havingValue = "true", matchIfMissing = true)
public class DueJobDispatcher {

    private static final String LOOP_NAME = "due-job-dispatcher";

    private final ScheduledJobRepository jobRepository;
    private final JobDispatchProducer producer;
    private final ConnectivityGuard connectivityGuard;
    private final Clock clock;

    @Value("${app.jobs.worker.batch-size:100}")
    private int batchSize;

    @Value("${app.jobs.worker.redispatch-after-seconds:300}")
    private long redispatchAfterSeconds;

    @Scheduled(fixedDelayString = "${app.jobs.worker.poll-interval-ms:1000}")
    public void poll() {
        try {
            dispatchDueJobs();
            connectivityGuard.recordSuccess();
        } catch (Exception e) {
            if (!connectivityGuard.recordFailure(LOOP_NAME, e)) {
                log.error("Due job dispatch failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Publish one batch of due jobs.
     *
     * @return number of jobs published
     */
    public int dispatchDueJobs() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<ScheduledJob> due = jobRepository.findDueForDispatch(
                now, now.minusSeconds(redispatchAfterSeconds), batchSize);
        if (due.isEmpty()) {
            return 0;
        }

        int dispatched = 0;
        for (ScheduledJob job : due) {
            producer.sendJob(job.getId());
            jobRepository.markDispatched(job.getId(), now);
            dispatched++;
        }
        log.info("Dispatched due jobs: count={}", dispatched);
        return dispatched;
    }
}
