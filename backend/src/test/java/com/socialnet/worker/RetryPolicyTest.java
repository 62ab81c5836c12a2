package com.socialnet.worker;

import com.socialnet.entity.ScheduledJob;
import com.socialnet.jobs.JobKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy Unit Tests")
class RetryPolicyTest {

    private final RetryPolicy retryPolicy = new RetryPolicy(30, 300);

    @Test
    @DisplayName("backoff should double per attempt and stop at the cap")
    void testBackoff() {
        assertEquals(Duration.ofSeconds(30), retryPolicy.backoff(1));
        assertEquals(Duration.ofSeconds(60), retryPolicy.backoff(2));
        assertEquals(Duration.ofSeconds(240), retryPolicy.backoff(4));
        assertEquals(Duration.ofSeconds(300), retryPolicy.backoff(5));
        assertEquals(Duration.ofSeconds(300), retryPolicy.backoff(1000));
    }

    @Test
    @DisplayName("shouldRetry should follow the job's own attempt budget")
    void testShouldRetry() {
        ScheduledJob job = new ScheduledJob(JobKind.CLEANUP_TOKENS, "{}", LocalDateTime.now(), 2);
        assertTrue(retryPolicy.shouldRetry(job));

        job.setAttempt(2);
        assertFalse(retryPolicy.shouldRetry(job));
    }

    @Test
    @DisplayName("a single-attempt job is never retried")
    void testShouldRetry_DefaultBudget() {
        ScheduledJob job = new ScheduledJob(JobKind.CREATE_POST, "{}", LocalDateTime.now(), 1);
        assertFalse(retryPolicy.shouldRetry(job));
    }
}
