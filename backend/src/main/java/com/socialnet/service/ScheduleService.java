package com.socialnet.service;

import com.socialnet.dto.request.UpdateScheduleRequest;
import com.socialnet.dto.response.ScheduleResponse;
import com.socialnet.entity.PeriodicSchedule;
import com.socialnet.exception.ResourceNotFoundException;
import com.socialnet.repository.PeriodicScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Administration of periodic schedules.
 *
 * Changes are persisted only; PeriodicJobScheduler reloads the table on every tick,
 * so an edit takes effect on the next tick in every scheduler process.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduleService {

    private final PeriodicScheduleRepository scheduleRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<ScheduleResponse> listSchedules() {
        return scheduleRepository.findAllByOrderByNameAsc().stream()
                .map(ScheduleResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * Replace the timing of a schedule and optionally toggle it.
     *
     * @param name schedule name
     * @param request exactly one of interval and cron, plus optional enabled flag
     * @return the updated schedule
     * @throws ResourceNotFoundException if no schedule has this name
     * @throws IllegalArgumentException if both or neither timing is given, or the
     *         cron expression does not parse or never fires again
     */
    @Transactional
    public ScheduleResponse updateSchedule(String name, UpdateScheduleRequest request) {
        PeriodicSchedule schedule = scheduleRepository.findByName(name)
                .orElseThrow(() -> ResourceNotFoundException.of("Schedule", name));

        boolean hasInterval = request.getIntervalSeconds() != null;
        boolean hasCron = request.getCronExpression() != null && !request.getCronExpression().isBlank();
        if (hasInterval == hasCron) {
            throw new IllegalArgumentException("Exactly one of intervalSeconds and cronExpression must be set.");
        }

        if (hasCron) {
            String cron = request.getCronExpression().trim();
            if (!CronExpression.isValidExpression(cron)) {
                throw new IllegalArgumentException("Invalid cron expression: " + cron);
            }
            if (CronExpression.parse(cron).next(LocalDateTime.now(clock)) == null) {
                throw new IllegalArgumentException("Cron expression never fires: " + cron);
            }
            schedule.setCronExpression(cron);
            schedule.setIntervalSeconds(null);
        } else {
            if (request.getIntervalSeconds() <= 0) {
                throw new IllegalArgumentException("Interval must be positive.");
            }
            schedule.setIntervalSeconds(request.getIntervalSeconds());
            schedule.setCronExpression(null);
        }
        if (request.getEnabled() != null) {
            schedule.setEnabled(request.getEnabled());
        }

        PeriodicSchedule saved = scheduleRepository.save(schedule);
        log.info("Schedule updated: name={}, interval={}, cron={}, enabled={}",
                name, saved.getIntervalSeconds(), saved.getCronExpression(), saved.getEnabled());
        return ScheduleResponse.from(saved);
    }
}
