package com.socialnet.scheduler;

import com.socialnet.entity.PeriodicSchedule;
import com.socialnet.exception.JobSubmissionException;
import com.socialnet.repository.PeriodicScheduleRepository;
import com.socialnet.service.JobQueueClient;
import com.socialnet.worker.ConnectivityGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Enqueues periodic jobs from the persisted schedule table.
 *
 * Tick Flow:
 * 1. Reload all enabled schedules
 * 2. For each schedule due at {@code now}, enqueue its job kind with a fresh payload
 * 3. On success, record lastEnqueuedAt / lastJobId
 * 4. On a failed enqueue, log and leave the schedule untouched so the next tick retries
 *
 * Meant to run in a single process; duplicate enqueues from a second scheduler
 * are absorbed by the idempotent periodic handlers.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.jobs.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class PeriodicJobScheduler {

    private static final String LOOP_NAME = "periodic-job-scheduler";

    private final PeriodicScheduleRepository scheduleRepository;
    private final JobQueueClient jobQueueClient;
    private final ConnectivityGuard connectivityGuard;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.jobs.scheduler.tick-interval-ms:10000}")
    public void run() {
        try {
            tick();
            connectivityGuard.recordSuccess();
        } catch (Exception e) {
            if (!connectivityGuard.recordFailure(LOOP_NAME, e)) {
                log.error("Scheduler tick failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Run one scheduler tick.
     *
     * @return number of jobs enqueued
     */
    public int tick() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<PeriodicSchedule> schedules = scheduleRepository.findByEnabledTrueOrderByNameAsc();

        int enqueued = 0;
        for (PeriodicSchedule schedule : schedules) {
            if (!schedule.isDue(now)) {
                continue;
            }
            try {
                UUID jobId = jobQueueClient.enqueue(schedule.getJobKind(),
                        schedule.getJobKind().periodicPayload(schedule.getName()), now, null, schedule.getName());
                schedule.markEnqueued(now, jobId);
                scheduleRepository.save(schedule);
                enqueued++;
                log.info("Periodic job enqueued: schedule={}, kind={}, jobId={}",
                        schedule.getName(), schedule.getJobKind(), jobId);
            } catch (JobSubmissionException e) {
                log.warn("Periodic enqueue failed, retrying next tick: schedule={}, error={}",
                        schedule.getName(), e.getMessage());
            }
        }
        return enqueued;
    }
}
