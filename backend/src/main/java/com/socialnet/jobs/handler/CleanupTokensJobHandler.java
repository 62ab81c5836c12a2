package com.socialnet.jobs.handler;

import com.socialnet.jobs.CleanupTokensPayload;
import com.socialnet.jobs.JobHandler;
import com.socialnet.jobs.JobKind;
import com.socialnet.service.TokenBlacklistService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Deletes blacklisted tokens whose natural expiry has passed. Idempotent, so
 * duplicate runs from overlapping schedulers are harmless.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CleanupTokensJobHandler implements JobHandler<CleanupTokensPayload> {

    private final TokenBlacklistService tokenBlacklistService;
    private final Clock clock;

    @Override
    public JobKind kind() {
        return JobKind.CLEANUP_TOKENS;
    }

    @Override
    public Class<CleanupTokensPayload> payloadType() {
        return CleanupTokensPayload.class;
    }

    @Override
    public void handle(CleanupTokensPayload payload) {
        int deleted = tokenBlacklistService.purgeExpired(LocalDateTime.now(clock));
        log.info("Token cleanup finished: deleted={}, triggeredBy={}", deleted, payload.getTriggeredBy());
    }
}
