package com.socialnet.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.socialnet.entity.ScheduledJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Status view of a scheduled job, for GET /api/jobs/{id}.
 *
 * Example JSON response (failed job):
 * <pre>
 * {
 *   "id": "3f2a...",
 *   "kind": "CREATE_POST",
 *   "status": "FAILED",
 *   "eta": "2030-01-01T09:00:00",
 *   "attempt": 1,
 *   "maxAttempts": 1,
 *   "errorLog": "IllegalArgumentException: Author profile '42' not found."
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

    private UUID id;

    private String kind;

    private String status;

    private LocalDateTime eta;

    private Integer attempt;

    private Integer maxAttempts;

    private UUID retryOf;

    private String scheduleName;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private String errorLog;

    public static JobStatusResponse from(ScheduledJob job) {
        return JobStatusResponse.builder()
                .id(job.getId())
                .kind(job.getKind().name())
                .status(job.getStatus().name())
                .eta(job.getEta())
                .attempt(job.getAttempt())
                .maxAttempts(job.getMaxAttempts())
                .retryOf(job.getRetryOf())
                .scheduleName(job.getScheduleName())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .errorLog(job.getErrorLog())
                .build();
    }
}
