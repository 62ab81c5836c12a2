package com.socialnet.service;

import com.socialnet.entity.ScheduledJob;
import com.socialnet.exception.ResourceNotFoundException;
import com.socialnet.exception.UnauthorizedException;
import com.socialnet.jobs.JobKind;
import com.socialnet.repository.ScheduledJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobStatusService Unit Tests")
class JobStatusServiceTest {

    @Mock
    private ScheduledJobRepository jobRepository;

    @InjectMocks
    private JobStatusService jobStatusService;

    private ScheduledJob job;
    private UUID submitter;

    @BeforeEach
    void setUp() {
        submitter = UUID.randomUUID();
        job = new ScheduledJob(JobKind.CREATE_POST, "{}", LocalDateTime.of(2030, 1, 1, 9, 0), 1);
        job.setId(UUID.randomUUID());
        job.setSubmittedBy(submitter);
    }

    @Test
    @DisplayName("the submitter and staff can read a job")
    void testGetJob_Allowed() {
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        assertEquals("PENDING", jobStatusService.getJob(job.getId(), submitter, false).getStatus());
        assertEquals("CREATE_POST", jobStatusService.getJob(job.getId(), UUID.randomUUID(), true).getKind());
    }

    @Test
    @DisplayName("another user cannot read a job")
    void testGetJob_OtherUser() {
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        assertThrows(UnauthorizedException.class,
                () -> jobStatusService.getJob(job.getId(), UUID.randomUUID(), false));
    }

    @Test
    @DisplayName("an unknown job id is not found")
    void testGetJob_Unknown() {
        UUID unknown = UUID.randomUUID();
        when(jobRepository.findById(unknown)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> jobStatusService.getJob(unknown, submitter, true));
    }
}
