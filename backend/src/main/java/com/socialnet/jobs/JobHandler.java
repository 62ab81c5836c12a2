package com.socialnet.jobs;

/**
 * Executes jobs of one {@link JobKind}.
 *
 * Any exception thrown from {@link #handle} marks the job FAILED with the
 * exception message in its error log.
 *
 * @param <P> the payload type of the handled kind
 */
public interface JobHandler<P extends JobPayload> {

    JobKind kind();

    /**
     * Payload class this handler accepts. Must equal {@code kind().getPayloadType()}.
     */
    Class<P> payloadType();

    void handle(P payload);

    /**
     * Narrow a decoded payload to {@code P} and handle it.
     *
     * @throws ClassCastException if the payload is not a {@code P}
     */
    default void handleDecoded(JobPayload payload) {
        handle(payloadType().cast(payload));
    }
}
