package org.multibench.scheduler;

import java.util.Objects;

/**
 * Opaque scheduler-assigned job identifier.
 */
public record JobHandle(String jobId) {
    public JobHandle {
        Objects.requireNonNull(jobId, "jobId");
        if (jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }
    }

    @Override
    public String toString() {
        return jobId;
    }
}
