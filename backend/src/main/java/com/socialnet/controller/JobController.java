package com.socialnet.controller;

import com.socialnet.dto.response.JobStatusResponse;
import com.socialnet.security.CurrentUser;
import com.socialnet.service.JobStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Job status lookup. Visible to the submitting user and to staff.
 *
 * Endpoint: GET /api/jobs/{id}
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobStatusService jobStatusService;

    @GetMapping("/{id}")
    public ResponseEntity<JobStatusResponse> getJob(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(jobStatusService.getJob(
                id, CurrentUser.id(authentication), CurrentUser.isStaff(authentication)));
    }
}
