package org.multibench.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.multibench.scheduler.DispatchOutcome;
import org.multibench.scheduler.WaitResult;
import org.multibench.store.PersistOutcome;

/**
 * What a record invocation did: dispatch outcomes, persistence results and per-bench or per-run errors.
 */
public final class RecordSummary {
    private final String planName;
    private final Map<String, String> benchErrors = new LinkedHashMap<>();
    private final List<DispatchOutcome> outcomes = new ArrayList<>();
    private final Map<String, PersistOutcome> persisted = new LinkedHashMap<>();
    private final Map<String, String> runErrors = new LinkedHashMap<>();
    private WaitResult waitResult;

    RecordSummary(final String planName) {
        this.planName = planName;
    }

    void benchFailed(final String benchName, final String error) {
        benchErrors.put(benchName, error);
    }

    void dispatched(final List<DispatchOutcome> dispatchOutcomes) {
        outcomes.addAll(dispatchOutcomes);
        for (final DispatchOutcome outcome : dispatchOutcomes) {
            if (outcome.isFailure()) {
                runErrors.put(outcome.instance().id(), outcome.error());
            }
        }
    }

    void persisted(final String runId, final PersistOutcome outcome) {
        persisted.put(runId, outcome);
    }

    void runFailed(final String runId, final String error) {
        runErrors.put(runId, error);
    }

    void waited(final WaitResult result) {
        this.waitResult = result;
    }

    public String planName() {
        return planName;
    }

    public Map<String, String> benchErrors() {
        return Collections.unmodifiableMap(benchErrors);
    }

    public List<DispatchOutcome> outcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public Map<String, PersistOutcome> persistOutcomes() {
        return Collections.unmodifiableMap(persisted);
    }

    public Map<String, String> runErrors() {
        return Collections.unmodifiableMap(runErrors);
    }

    public Optional<WaitResult> waitResult() {
        return Optional.ofNullable(waitResult);
    }

    public long count(final DispatchOutcome.Kind kind) {
        return outcomes.stream().filter(outcome -> outcome.kind() == kind).count();
    }

    /**
     * True when nothing went through: no instance was submitted, rendered or already present.
     */
    public boolean totalFailure() {
        if (outcomes.isEmpty()) {
            return !benchErrors.isEmpty();
        }
        return outcomes.stream().allMatch(DispatchOutcome::isFailure);
    }
}
