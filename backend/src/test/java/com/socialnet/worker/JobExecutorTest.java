package com.socialnet.worker;

import com.socialnet.entity.ScheduledJob;
import com.socialnet.entity.ScheduledJob.JobStatus;
import com.socialnet.exception.JobSubmissionException;
import com.socialnet.jobs.CleanupTokensPayload;
import com.socialnet.jobs.JobHandlerRegistry;
import com.socialnet.jobs.JobKind;
import com.socialnet.jobs.JobOutcome;
import com.socialnet.jobs.JobPayloadCodec;
import com.socialnet.repository.ScheduledJobRepository;
import com.socialnet.service.JobQueueClient;
import com.socialnet.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobExecutor.
 *
 * Tests the claim → run → finish cycle including:
 * - Skipping jobs that cannot be claimed
 * - Recording DONE and FAILED outcomes
 * - Enqueueing a retry only while attempts remain
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("JobExecutor Unit Tests")
class JobExecutorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2030, 1, 1, 12, 0);

    @Mock
    private ScheduledJobRepository jobRepository;

    @Mock
    private JobHandlerRegistry handlerRegistry;

    @Mock
    private JobPayloadCodec payloadCodec;

    @Mock
    private JobQueueClient jobQueueClient;

    private JobExecutor executor;
    private ScheduledJob job;
    private CleanupTokensPayload payload;

    @BeforeEach
    void setUp() {
        executor = new JobExecutor(jobRepository, handlerRegistry, payloadCodec, jobQueueClient,
                new RetryPolicy(30, 3600), new MutableClock(NOW));

        job = new ScheduledJob(JobKind.CLEANUP_TOKENS, "{}", NOW, 1);
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.RUNNING);
        payload = new CleanupTokensPayload("schedule");
    }

    @Test
    @DisplayName("execute should skip a job that cannot be claimed")
    void testExecute_NotClaimable() {
        // Arrange
        when(jobRepository.claim(job.getId(), NOW)).thenReturn(0);

        // Act
        JobOutcome outcome = executor.execute(job.getId());

        // Assert
        assertEquals(JobOutcome.SKIPPED, outcome);
        verifyNoInteractions(handlerRegistry);
        verify(jobRepository, never()).finish(any(), any(), any(), any());
    }

    @Test
    @DisplayName("execute should run the handler and mark the job DONE")
    void testExecute_Success() {
        // Arrange
        when(jobRepository.claim(job.getId(), NOW)).thenReturn(1);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        when(payloadCodec.decode(JobKind.CLEANUP_TOKENS, "{}")).thenReturn(payload);
        when(jobRepository.finish(job.getId(), JobStatus.DONE, NOW, null)).thenReturn(1);

        // Act
        JobOutcome outcome = executor.execute(job.getId());

        // Assert
        assertEquals(JobOutcome.DONE, outcome);
        verify(handlerRegistry).dispatch(JobKind.CLEANUP_TOKENS, payload);
    }

    @Test
    @DisplayName("execute should mark the job FAILED with the error and not retry when attempts are exhausted")
    void testExecute_FailureWithoutRetry() {
        // Arrange
        when(jobRepository.claim(job.getId(), NOW)).thenReturn(1);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        when(payloadCodec.decode(JobKind.CLEANUP_TOKENS, "{}")).thenReturn(payload);
        doThrow(new IllegalArgumentException("boom")).when(handlerRegistry).dispatch(JobKind.CLEANUP_TOKENS, payload);

        // Act
        JobOutcome outcome = executor.execute(job.getId());

        // Assert
        assertEquals(JobOutcome.FAILED, outcome);
        verify(jobRepository).finish(job.getId(), JobStatus.FAILED, NOW, "IllegalArgumentException: boom");
        verifyNoInteractions(jobQueueClient);
    }

    @Test
    @DisplayName("execute should enqueue a backed-off retry while attempts remain")
    void testExecute_FailureWithRetry() {
        // Arrange
        job.setMaxAttempts(3);
        when(jobRepository.claim(job.getId(), NOW)).thenReturn(1);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        when(payloadCodec.decode(JobKind.CLEANUP_TOKENS, "{}")).thenReturn(payload);
        doThrow(new IllegalStateException("down")).when(handlerRegistry).dispatch(JobKind.CLEANUP_TOKENS, payload);

        // Act
        executor.execute(job.getId());

        // Assert
        verify(jobRepository).finish(eq(job.getId()), eq(JobStatus.FAILED), eq(NOW), startsWith("IllegalStateException"));
        verify(jobQueueClient).enqueueRetry(job, NOW.plusSeconds(30));
    }

    @Test
    @DisplayName("execute should keep the job FAILED when the retry cannot be enqueued")
    void testExecute_RetryEnqueueFails() {
        // Arrange
        job.setMaxAttempts(2);
        when(jobRepository.claim(job.getId(), NOW)).thenReturn(1);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        when(payloadCodec.decode(JobKind.CLEANUP_TOKENS, "{}")).thenReturn(payload);
        doThrow(new IllegalStateException("down")).when(handlerRegistry).dispatch(JobKind.CLEANUP_TOKENS, payload);
        when(jobQueueClient.enqueueRetry(any(), any()))
                .thenThrow(JobSubmissionException.queueUnavailable(JobKind.CLEANUP_TOKENS, new RuntimeException()));

        // Act & Assert
        assertEquals(JobOutcome.FAILED, executor.execute(job.getId()));
    }

    @Test
    @DisplayName("execute should fail a job whose payload cannot be decoded")
    void testExecute_UndecodablePayload() {
        // Arrange
        when(jobRepository.claim(job.getId(), NOW)).thenReturn(1);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        when(payloadCodec.decode(JobKind.CLEANUP_TOKENS, "{}")).thenThrow(new IllegalStateException("bad json"));

        // Act
        JobOutcome outcome = executor.execute(job.getId());

        // Assert
        assertEquals(JobOutcome.FAILED, outcome);
        verifyNoInteractions(handlerRegistry);
        verify(jobRepository, never()).finish(any(), eq(JobStatus.DONE), any(), isNull());
    }
}
