package com.socialnet.dto.response;

import com.socialnet.entity.PeriodicSchedule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a periodic schedule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {

    private String name;

    private String jobKind;

    private Long intervalSeconds;

    private String cronExpression;

    private Boolean enabled;

    private LocalDateTime lastEnqueuedAt;

    private UUID lastJobId;

    private LocalDateTime nextFireTime;

    public static ScheduleResponse from(PeriodicSchedule schedule) {
        return ScheduleResponse.builder()
                .name(schedule.getName())
                .jobKind(schedule.getJobKind().name())
                .intervalSeconds(schedule.getIntervalSeconds())
                .cronExpression(schedule.getCronExpression())
                .enabled(schedule.getEnabled())
                .lastEnqueuedAt(schedule.getLastEnqueuedAt())
                .lastJobId(schedule.getLastJobId())
                .nextFireTime(schedule.nextFireTime())
                .build();
    }
}
