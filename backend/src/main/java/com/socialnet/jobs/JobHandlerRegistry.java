package com.socialnet.jobs;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatch table from {@link JobKind} to its {@link JobHandler}.
 *
 * Built once from every JobHandler bean. Startup fails if a kind has no handler,
 * more than one, or a handler whose payload class differs from its kind's.
 */
@Component
@Slf4j
public class JobHandlerRegistry {

    private final Map<JobKind, JobHandler<? extends JobPayload>> handlers = new EnumMap<>(JobKind.class);

    public JobHandlerRegistry(List<JobHandler<? extends JobPayload>> handlerBeans) {
        for (JobHandler<? extends JobPayload> handler : handlerBeans) {
            if (handler.payloadType() != handler.kind().getPayloadType()) {
                throw new IllegalStateException("Handler " + handler.getClass().getSimpleName()
                        + " accepts " + handler.payloadType().getSimpleName()
                        + " but job kind " + handler.kind() + " carries "
                        + handler.kind().getPayloadType().getSimpleName());
            }
            JobHandler<? extends JobPayload> previous = handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for job kind " + handler.kind()
                        + ": " + previous.getClass().getSimpleName()
                        + " and " + handler.getClass().getSimpleName());
            }
        }
        for (JobKind kind : JobKind.values()) {
            if (!handlers.containsKey(kind)) {
                throw new IllegalStateException("No handler registered for job kind " + kind);
            }
        }
        log.info("Job handler registry initialized: kinds={}", handlers.keySet());
    }

    /**
     * Run the handler for {@code kind} with an already decoded payload.
     *
     * @param kind the job kind
     * @param payload payload instance of {@code kind.getPayloadType()}
     * @throws IllegalArgumentException if the payload type does not match the kind
     */
    public void dispatch(JobKind kind, JobPayload payload) {
        if (!kind.getPayloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName()
                    + " does not match job kind " + kind);
        }
        handlers.get(kind).handleDecoded(payload);
    }
}
