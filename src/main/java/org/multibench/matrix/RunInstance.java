package org.multibench.matrix;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.multibench.plan.RunConfiguration;

/**
 * One concrete point of a bench expansion: resolved configuration, rerun index and deterministic identifier.
 *
 * <p>Identity fields are immutable. Lifecycle status and the scheduler job id change during the record flow and
 * are guarded by this instance's monitor.
 */
public final class RunInstance {
    private final String id;
    private final String benchName;
    private final Map<String, String> axisValues;
    private final RunConfiguration configuration;
    private final int rerunIndex;

    private RunStatus status;
    private String jobId;

    RunInstance(
        String benchName,
        Map<String, String> axisValues,
        RunConfiguration configuration,
        int rerunIndex
    ) {
        this.benchName = Objects.requireNonNull(benchName, "benchName");
        this.axisValues = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(axisValues, "axisValues")));
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.rerunIndex = rerunIndex;
        this.id = RunIdentifiers.of(benchName, this.axisValues, rerunIndex);
        this.status = RunStatus.PENDING;
    }

    /**
     * Rebuilds an instance from persisted data. The identifier is recomputed and must match the stored one.
     */
    public static RunInstance restore(
        String expectedId,
        String benchName,
        Map<String, String> axisValues,
        RunConfiguration configuration,
        int rerunIndex,
        RunStatus status,
        String jobId
    ) {
        RunInstance instance = new RunInstance(benchName, axisValues, configuration, rerunIndex);
        if (expectedId != null && !expectedId.equals(instance.id)) {
            throw new IllegalArgumentException(
                "stored run id '" + expectedId + "' does not match its configuration (" + instance.id + ")"
            );
        }
        instance.status = Objects.requireNonNull(status, "status");
        instance.jobId = jobId;
        return instance;
    }

    public String id() {
        return id;
    }

    public String benchName() {
        return benchName;
    }

    public Map<String, String> axisValues() {
        return axisValues;
    }

    public RunConfiguration configuration() {
        return configuration;
    }

    public int rerunIndex() {
        return rerunIndex;
    }

    public GroupKey groupKey() {
        return new GroupKey(benchName, axisValues);
    }

    public synchronized RunStatus status() {
        return status;
    }

    public synchronized Optional<String> jobId() {
        return Optional.ofNullable(jobId);
    }

    public synchronized boolean hasLiveJob() {
        return jobId != null && !status.isTerminal();
    }

    /**
     * Records the scheduler job id after a successful submission and moves the instance to {@code SUBMITTED}.
     */
    public synchronized void markSubmitted(String submittedJobId) {
        Objects.requireNonNull(submittedJobId, "submittedJobId");
        transitionTo(RunStatus.SUBMITTED);
        this.jobId = submittedJobId;
    }

    public synchronized void transitionTo(RunStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("run " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    /**
     * Applies {@code next} if the transition is legal; returns whether the status changed.
     */
    public synchronized boolean tryTransitionTo(RunStatus next) {
        if (status == next || !status.canTransitionTo(next)) {
            return false;
        }
        status = next;
        return true;
    }

    /**
     * Returns the instance to {@code PENDING} so that it can be dispatched again; used only for explicit overwrite.
     */
    public synchronized void resetForResubmission() {
        status = RunStatus.PENDING;
        jobId = null;
    }

    @Override
    public String toString() {
        return "RunInstance{" + id + ", status=" + status() + "}";
    }
}
