package com.socialnet.scheduler;

import com.socialnet.entity.PeriodicSchedule;
import com.socialnet.exception.JobSubmissionException;
import com.socialnet.jobs.CleanupTokensPayload;
import com.socialnet.jobs.JobKind;
import com.socialnet.repository.PeriodicScheduleRepository;
import com.socialnet.service.JobQueueClient;
import com.socialnet.support.MutableClock;
import com.socialnet.worker.ConnectivityGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PeriodicJobScheduler.
 *
 * Tests the tick cycle including:
 * - Enqueueing due schedules with their periodic payload
 * - Leaving a schedule untouched when its enqueue fails
 * - Reporting loop health to the connectivity guard
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PeriodicJobScheduler Unit Tests")
class PeriodicJobSchedulerTest {

    private static final LocalDateTime START = LocalDateTime.of(2030, 1, 1, 12, 0);

    @Mock
    private PeriodicScheduleRepository scheduleRepository;

    @Mock
    private JobQueueClient jobQueueClient;

    @Mock
    private ConnectivityGuard connectivityGuard;

    private MutableClock clock;
    private PeriodicJobScheduler scheduler;
    private PeriodicSchedule schedule;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        scheduler = new PeriodicJobScheduler(scheduleRepository, jobQueueClient, connectivityGuard, clock);
        schedule = new PeriodicSchedule("cleanup", JobKind.CLEANUP_TOKENS, 3600);
    }

    @Test
    @DisplayName("tick should enqueue a due schedule and record the enqueue")
    void testTick_EnqueuesDue() {
        // Arrange
        UUID jobId = UUID.randomUUID();
        when(scheduleRepository.findByEnabledTrueOrderByNameAsc()).thenReturn(List.of(schedule));
        when(jobQueueClient.enqueue(eq(JobKind.CLEANUP_TOKENS), eq(new CleanupTokensPayload("cleanup")),
                eq(START), isNull(), eq("cleanup"))).thenReturn(jobId);

        // Act
        int enqueued = scheduler.tick();

        // Assert
        assertEquals(1, enqueued);
        assertEquals(START, schedule.getLastEnqueuedAt());
        assertEquals(jobId, schedule.getLastJobId());
        verify(scheduleRepository).save(schedule);
    }

    @Test
    @DisplayName("tick should skip schedules that are not yet due")
    void testTick_NotDue() {
        // Arrange
        schedule.markEnqueued(START.minusMinutes(10), UUID.randomUUID());
        when(scheduleRepository.findByEnabledTrueOrderByNameAsc()).thenReturn(List.of(schedule));

        // Act & Assert
        assertEquals(0, scheduler.tick());
        verifyNoInteractions(jobQueueClient);
    }

    @Test
    @DisplayName("a failed enqueue followed by a successful tick yields exactly one job")
    void testTick_FailureThenRecovery() {
        // Arrange
        UUID jobId = UUID.randomUUID();
        when(scheduleRepository.findByEnabledTrueOrderByNameAsc()).thenReturn(List.of(schedule));
        when(jobQueueClient.enqueue(eq(JobKind.CLEANUP_TOKENS), any(), any(), isNull(), eq("cleanup")))
                .thenThrow(JobSubmissionException.queueUnavailable(JobKind.CLEANUP_TOKENS,
                        new DataAccessResourceFailureException("down")))
                .thenReturn(jobId);

        // Act
        int firstTick = scheduler.tick();
        clock.advance(Duration.ofSeconds(10));
        int secondTick = scheduler.tick();
        clock.advance(Duration.ofSeconds(10));
        int thirdTick = scheduler.tick();

        // Assert
        assertEquals(0, firstTick);
        assertEquals(1, secondTick);
        assertEquals(0, thirdTick);
        assertEquals(START.plusSeconds(10), schedule.getLastEnqueuedAt());
        verify(jobQueueClient, times(2)).enqueue(any(), any(), any(), any(), any());
        verify(scheduleRepository, times(1)).save(schedule);
    }

    @Test
    @DisplayName("run should report a failing schedule table to the guard")
    void testRun_RepositoryDown() {
        // Arrange
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("down");
        when(scheduleRepository.findByEnabledTrueOrderByNameAsc()).thenThrow(failure);
        when(connectivityGuard.recordFailure("periodic-job-scheduler", failure)).thenReturn(true);

        // Act
        scheduler.run();

        // Assert
        verify(connectivityGuard, never()).recordSuccess();
    }
}
