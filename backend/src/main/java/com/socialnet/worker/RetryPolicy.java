package com.socialnet.worker;

import com.socialnet.entity.ScheduledJob;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Exponential backoff for failed jobs that still have attempts left.
 *
 * delay(attempt) = base * 2^(attempt - 1), capped at max. The attempt budget
 * itself is stored on each job row ({@code maxAttempts}), fixed at submission.
 */
@Component
public class RetryPolicy {

    private final Duration baseBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(
            @Value("${app.jobs.retry.base-backoff-seconds:30}") long baseBackoffSeconds,
            @Value("${app.jobs.retry.max-backoff-seconds:3600}") long maxBackoffSeconds
    ) {
        this.baseBackoff = Duration.ofSeconds(Math.max(0, baseBackoffSeconds));
        this.maxBackoff = Duration.ofSeconds(Math.max(baseBackoffSeconds, maxBackoffSeconds));
    }

    public boolean shouldRetry(ScheduledJob failed) {
        return failed.hasAttemptsLeft();
    }

    /**
     * Backoff before the attempt following {@code attempt}.
     *
     * @param attempt 1-based number of the attempt that failed
     * @return the delay
     */
    public Duration backoff(int attempt) {
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        Duration delay = baseBackoff.multipliedBy(1L << exponent);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    public LocalDateTime nextEta(ScheduledJob failed, LocalDateTime now) {
        return now.plus(backoff(failed.getAttempt()));
    }
}
