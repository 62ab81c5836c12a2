package com.socialnet.dto.request;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Runtime edit of a periodic schedule.
 *
 * Exactly one of {@code intervalSeconds} and {@code cronExpression} must be set;
 * {@code enabled} is optional and left unchanged when null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateScheduleRequest {

    @Positive(message = "Interval must be positive")
    private Long intervalSeconds;

    @Size(max = 100, message = "Cron expression must be at most 100 characters")
    private String cronExpression;

    private Boolean enabled;
}
