package org.multibench.scheduler;

/**
 * Job state as reported by a scheduler, before translation into a run status.
 */
public enum RawJobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    /** The scheduler no longer knows the job, or reported a state outside this set. */
    UNKNOWN
}
