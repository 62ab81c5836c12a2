package com.socialnet.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialnet.entity.ScheduledJob;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of job payloads for the scheduled_jobs.payload column.
 */
@Component
@RequiredArgsConstructor
public class JobPayloadCodec {

    private final ObjectMapper objectMapper;

    /**
     * Encode a payload after checking it belongs to {@code kind}.
     *
     * @throws IllegalArgumentException if the payload does not match the kind,
     *         cannot be serialized, or is too large for the column
     */
    public String encode(JobKind kind, JobPayload payload) {
        if (!kind.getPayloadType().isInstance(payload)) {
            throw new IllegalArgumentException(String.format("Job kind %s expects payload %s but got %s",
                    kind, kind.getPayloadType().getSimpleName(), payload.getClass().getSimpleName()));
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload for job kind " + kind + " is not serializable: "
                    + e.getOriginalMessage(), e);
        }
        if (json.length() > ScheduledJob.MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException(String.format("Payload for job kind %s exceeds %d characters",
                    kind, ScheduledJob.MAX_PAYLOAD_LENGTH));
        }
        return json;
    }

    /**
     * Decode a stored payload into the kind's payload type.
     *
     * @throws IllegalStateException if the stored JSON does not match the payload type
     */
    public JobPayload decode(JobKind kind, String json) {
        try {
            return objectMapper.readValue(json, kind.getPayloadType());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload for job kind " + kind + " cannot be decoded: "
                    + e.getOriginalMessage(), e);
        }
    }
}
