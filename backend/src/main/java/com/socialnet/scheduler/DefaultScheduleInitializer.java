package com.socialnet.scheduler;

import com.socialnet.entity.PeriodicSchedule;
import com.socialnet.jobs.JobKind;
import com.socialnet.repository.PeriodicScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Seeds the built-in schedules on startup. Existing rows are left alone so runtime
 * edits survive restarts.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.jobs.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class DefaultScheduleInitializer implements ApplicationRunner {

    public static final String TOKEN_CLEANUP_SCHEDULE = "cleanup-blacklisted-tokens";

    private final PeriodicScheduleRepository scheduleRepository;

    @Value("${app.jobs.scheduler.token-cleanup-interval-seconds:86400}")
    private long tokenCleanupIntervalSeconds;

    @Override
    public void run(ApplicationArguments args) {
        if (scheduleRepository.existsByName(TOKEN_CLEANUP_SCHEDULE)) {
            log.debug("Schedule already present: {}", TOKEN_CLEANUP_SCHEDULE);
            return;
        }
        scheduleRepository.save(new PeriodicSchedule(
                TOKEN_CLEANUP_SCHEDULE, JobKind.CLEANUP_TOKENS, tokenCleanupIntervalSeconds));
        log.info("Seeded schedule: name={}, interval={}s", TOKEN_CLEANUP_SCHEDULE, tokenCleanupIntervalSeconds);
    }
}
