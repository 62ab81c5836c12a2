package com.socialnet.jobs;

/**
 * The closed set of job kinds, each bound to its payload type.
 *
 * Adding a kind means adding a payload class here and a {@link JobHandler} bean;
 * {@link JobHandlerRegistry} refuses to start while a kind has no handler.
 */
public enum JobKind {

    /**
     * Publish a post at a future time.
     */
    CREATE_POST(CreatePostPayload.class, false),

    /**
     * Delete blacklisted tokens whose natural expiry has passed.
     */
    CLEANUP_TOKENS(CleanupTokensPayload.class, true);

    private final Class<? extends JobPayload> payloadType;
    private final boolean periodic;

    JobKind(Class<? extends JobPayload> payloadType, boolean periodic) {
        this.payloadType = payloadType;
        this.periodic = periodic;
    }

    public Class<? extends JobPayload> getPayloadType() {
        return payloadType;
    }

    /**
     * Whether a periodic schedule may enqueue this kind without caller input.
     */
    public boolean isPeriodic() {
        return periodic;
    }

    /**
     * Whether submission must reject an eta in the past.
     */
    public boolean requiresFutureEta() {
        return this == CREATE_POST;
    }

    /**
     * Payload used when a periodic schedule enqueues this kind.
     *
     * @param scheduleName the schedule firing
     * @return the payload
     * @throws IllegalStateException if this kind cannot run periodically
     */
    public JobPayload periodicPayload(String scheduleName) {
        if (this == CLEANUP_TOKENS) {
            return new CleanupTokensPayload(scheduleName);
        }
        throw new IllegalStateException("Job kind " + this + " cannot be scheduled periodically");
    }
}
