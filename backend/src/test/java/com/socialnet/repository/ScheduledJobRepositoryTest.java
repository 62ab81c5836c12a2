package com.socialnet.repository;

import com.socialnet.entity.ScheduledJob;
import com.socialnet.entity.ScheduledJob.JobStatus;
import com.socialnet.jobs.JobKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Repository tests for the conditional updates that make job execution
 * at-most-once per row.
 */
@DataJpaTest
@DisplayName("ScheduledJobRepository Tests")
class ScheduledJobRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2030, 1, 1, 12, 0);

    @Autowired
    private ScheduledJobRepository jobRepository;

    @Test
    @DisplayName("claim should only succeed once and only after the eta")
    void testClaim() {
        // Arrange
        UUID jobId = save(NOW.plusMinutes(5)).getId();

        // Act & Assert
        assertEquals(0, jobRepository.claim(jobId, NOW));
        assertEquals(1, jobRepository.claim(jobId, NOW.plusMinutes(5)));
        assertEquals(0, jobRepository.claim(jobId, NOW.plusMinutes(6)));

        ScheduledJob claimed = jobRepository.findById(jobId).orElseThrow();
        assertEquals(JobStatus.RUNNING, claimed.getStatus());
        assertEquals(NOW.plusMinutes(5), claimed.getStartedAt());
    }

    @Test
    @DisplayName("finish should move a RUNNING job to its terminal status once")
    void testFinish() {
        // Arrange
        UUID jobId = save(NOW).getId();
        jobRepository.claim(jobId, NOW);

        // Act
        int first = jobRepository.finish(jobId, JobStatus.FAILED, NOW.plusSeconds(1), "IllegalStateException: x");
        int second = jobRepository.finish(jobId, JobStatus.DONE, NOW.plusSeconds(2), null);

        // Assert
        assertEquals(1, first);
        assertEquals(0, second);
        ScheduledJob finished = jobRepository.findById(jobId).orElseThrow();
        assertEquals(JobStatus.FAILED, finished.getStatus());
        assertEquals("IllegalStateException: x", finished.getErrorLog());
        assertEquals(NOW.plusSeconds(1), finished.getCompletedAt());
        assertThrows(IllegalArgumentException.class,
                () -> jobRepository.finish(jobId, JobStatus.RUNNING, NOW, null));
    }

    @Test
    @DisplayName("findDueForDispatch should return due, undispatched PENDING jobs oldest first")
    void testFindDueForDispatch() {
        // Arrange
        ScheduledJob older = save(NOW.minusMinutes(10));
        ScheduledJob newer = save(NOW.minusMinutes(1));
        save(NOW.plusMinutes(1));
        ScheduledJob dispatched = save(NOW.minusMinutes(5));
        jobRepository.markDispatched(dispatched.getId(), NOW.minusSeconds(30));
        ScheduledJob running = save(NOW.minusMinutes(3));
        jobRepository.claim(running.getId(), NOW);

        // Act
        List<UUID> due = jobRepository.findDueForDispatch(NOW, NOW.minusSeconds(300), 10).stream()
                .map(ScheduledJob::getId)
                .collect(Collectors.toList());

        // Assert
        assertEquals(List.of(older.getId(), newer.getId()), due);
    }

    @Test
    @DisplayName("a dispatched job becomes due again after the redispatch window")
    void testFindDueForDispatch_Redispatch() {
        // Arrange
        ScheduledJob job = save(NOW.minusMinutes(20));
        jobRepository.markDispatched(job.getId(), NOW.minusMinutes(10));

        // Act
        List<ScheduledJob> due = jobRepository.findDueForDispatch(NOW, NOW.minusSeconds(300), 10);

        // Assert
        assertEquals(1, due.size());
        assertEquals(job.getId(), due.get(0).getId());
    }

    private ScheduledJob save(LocalDateTime eta) {
        return jobRepository.saveAndFlush(new ScheduledJob(JobKind.CLEANUP_TOKENS, "{\"triggeredBy\":\"t\"}", eta, 1));
    }
}
