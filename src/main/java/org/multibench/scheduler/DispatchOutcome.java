package org.multibench.scheduler;

import java.util.Objects;
import java.util.Optional;
import org.multibench.matrix.RunInstance;

/**
 * Result of handing one run instance to the dispatcher.
 */
public record DispatchOutcome(RunInstance instance, Kind kind, JobHandle handle, String error) {
    public DispatchOutcome {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(kind, "kind");
    }

    static DispatchOutcome submitted(final RunInstance instance, final JobHandle handle) {
        return new DispatchOutcome(instance, Kind.SUBMITTED, Objects.requireNonNull(handle, "handle"), null);
    }

    static DispatchOutcome dryRun(final RunInstance instance) {
        return new DispatchOutcome(instance, Kind.DRY_RUN, null, null);
    }

    static DispatchOutcome skipped(final RunInstance instance, final Kind kind, final String reason) {
        return new DispatchOutcome(instance, kind, null, reason);
    }

    static DispatchOutcome failed(final RunInstance instance, final String error) {
        return new DispatchOutcome(instance, Kind.FAILED, null, error);
    }

    public Optional<JobHandle> jobHandle() {
        return Optional.ofNullable(handle);
    }

    public boolean isFailure() {
        return kind == Kind.FAILED;
    }

    public enum Kind {
        SUBMITTED,
        DRY_RUN,
        /** Results (or a submission) already exist and the write mode is no-clobber. */
        SKIPPED_EXISTING,
        /** The instance already holds a live job. */
        SKIPPED_LIVE,
        FAILED
    }
}
