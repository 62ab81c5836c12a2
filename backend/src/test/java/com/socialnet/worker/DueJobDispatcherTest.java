package com.socialnet.worker;

import com.socialnet.entity.ScheduledJob;
import com.socialnet.jobs.JobKind;
import com.socialnet.messaging.JobDispatchProducer;
import com.socialnet.repository.ScheduledJobRepository;
import com.socialnet.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.test.util.ReflectionTestUtils;

import java.net.ConnectException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DueJobDispatcher Unit Tests")
class DueJobDispatcherTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2030, 1, 1, 12, 0);

    @Mock
    private ScheduledJobRepository jobRepository;

    @Mock
    private JobDispatchProducer producer;

    @Mock
    private ConnectivityGuard connectivityGuard;

    private DueJobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new DueJobDispatcher(jobRepository, producer, connectivityGuard, new MutableClock(NOW));
        ReflectionTestUtils.setField(dispatcher, "batchSize", 100);
        ReflectionTestUtils.setField(dispatcher, "redispatchAfterSeconds", 300L);
    }

    @Test
    @DisplayName("dispatchDueJobs should publish and stamp every due job")
    void testDispatchDueJobs() {
        // Arrange
        ScheduledJob first = job();
        ScheduledJob second = job();
        when(jobRepository.findDueForDispatch(NOW, NOW.minusSeconds(300), 100)).thenReturn(List.of(first, second));

        // Act
        int dispatched = dispatcher.dispatchDueJobs();

        // Assert
        assertEquals(2, dispatched);
        verify(producer).sendJob(first.getId());
        verify(producer).sendJob(second.getId());
        verify(jobRepository).markDispatched(first.getId(), NOW);
        verify(jobRepository).markDispatched(second.getId(), NOW);
    }

    @Test
    @DisplayName("a job is not stamped when publishing it fails")
    void testDispatchDueJobs_PublishFails() {
        // Arrange
        ScheduledJob due = job();
        when(jobRepository.findDueForDispatch(NOW, NOW.minusSeconds(300), 100)).thenReturn(List.of(due));
        doThrow(new AmqpConnectException(new ConnectException("refused"))).when(producer).sendJob(due.getId());

        // Act
        dispatcher.poll();

        // Assert
        verify(jobRepository, never()).markDispatched(any(), any());
        verify(connectivityGuard).recordFailure(eq("due-job-dispatcher"), any(AmqpConnectException.class));
        verify(connectivityGuard, never()).recordSuccess();
    }

    @Test
    @DisplayName("poll should report success to the guard")
    void testPoll_Success() {
        // Arrange
        when(jobRepository.findDueForDispatch(any(), any(), eq(100))).thenReturn(List.of());

        // Act
        dispatcher.poll();

        // Assert
        verify(connectivityGuard).recordSuccess();
        verifyNoInteractions(producer);
    }

    private static ScheduledJob job() {
        ScheduledJob job = new ScheduledJob(JobKind.CLEANUP_TOKENS, "{}", NOW, 1);
        job.setId(UUID.randomUUID());
        return job;
    }
}
