package com.socialnet.jobs;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of a CLEANUP_TOKENS job. The job needs no input; the field records
 * what enqueued it (a schedule name or "manual").
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CleanupTokensPayload implements JobPayload {

    private String triggeredBy;
}
