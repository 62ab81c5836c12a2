package com.socialnet.jobs;

/**
 * Result of a single {@code JobExecutor.execute} call.
 */
public enum JobOutcome {
    /** The handler ran and the job is DONE. */
    DONE,
    /** The handler raised and the job is FAILED. */
    FAILED,
    /** The job was not claimable (unknown, not yet due, or already claimed/finished). */
    SKIPPED
}
