package com.socialnet.controller;

import com.socialnet.dto.request.UpdateScheduleRequest;
import com.socialnet.dto.response.ScheduleResponse;
import com.socialnet.service.ScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Staff-only administration of periodic schedules.
 *
 * Example request:
 * <pre>
 * PUT /api/schedules/cleanup-blacklisted-tokens
 * {
 *   "cronExpression": "0 0 3 * * *",
 *   "enabled": true
 * }
 * </pre>
 *
 * Error Responses:
 * - 400 Bad Request: Both or neither of interval and cron given, invalid cron
 * - 403 Forbidden: Caller is not staff
 * - 404 Not Found: Unknown schedule name
 */
@RestController
@RequestMapping("/api/schedules")
@RequiredArgsConstructor
@Slf4j
@PreAuthorize("hasRole('ADMIN')")
public class ScheduleController {

    private final ScheduleService scheduleService;

    @GetMapping
    public ResponseEntity<List<ScheduleResponse>> listSchedules() {
        return ResponseEntity.ok(scheduleService.listSchedules());
    }

    @PutMapping("/{name}")
    public ResponseEntity<ScheduleResponse> updateSchedule(@PathVariable String name,
                                                           @Valid @RequestBody UpdateScheduleRequest request) {
        log.info("Schedule update requested: {}", name);
        return ResponseEntity.ok(scheduleService.updateSchedule(name, request));
    }
}
