package com.socialnet.service;

import com.socialnet.dto.response.JobStatusResponse;
import com.socialnet.entity.ScheduledJob;
import com.socialnet.exception.ResourceNotFoundException;
import com.socialnet.exception.UnauthorizedException;
import com.socialnet.repository.ScheduledJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Read access to job status. Only the submitter or a staff user may see a job.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobStatusService {

    private final ScheduledJobRepository jobRepository;

    @Transactional(readOnly = true)
    public JobStatusResponse getJob(UUID jobId, UUID userId, boolean staff) {
        ScheduledJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> ResourceNotFoundException.of("Job", jobId));

        if (!staff && !userId.equals(job.getSubmittedBy())) {
            log.warn("Job status access denied: jobId={}, requester={}", jobId, userId);
            throw UnauthorizedException.accessDenied("job", jobId.toString());
        }
        return JobStatusResponse.from(job);
    }
}
