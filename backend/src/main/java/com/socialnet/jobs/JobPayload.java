package com.socialnet.jobs;

/**
 * Marker for the strongly-typed payload of a {@link JobKind}.
 *
 * Implementations are plain Jackson-serializable beans; the JSON form is what
 * gets stored in scheduled_jobs.payload.
 */
public interface JobPayload {
}
