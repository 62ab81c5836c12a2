package com.socialnet.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO returned with 202 Accepted when a post is scheduled.
 *
 * The client can follow the job through GET /api/jobs/{jobId}.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "jobId": "3f2a...",
 *   "status": "PENDING",
 *   "scheduledAt": "2030-01-01T09:00:00",
 *   "message": "Post scheduled for publication"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledPostResponse {

    private UUID jobId;

    private String status;

    private LocalDateTime scheduledAt;

    private String message;
}
