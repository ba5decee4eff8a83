package org.multibench.scheduler;

import java.util.List;
import java.util.Objects;
import org.multibench.matrix.RunInstance;

/**
 * How a blocking wait ended, with the instances that were still not terminal at that point.
 */
public record WaitResult(Outcome outcome, List<RunInstance> unfinished) {
    public WaitResult {
        Objects.requireNonNull(outcome, "outcome");
        unfinished = unfinished == null ? List.of() : List.copyOf(unfinished);
    }

    public boolean allTerminal() {
        return outcome == Outcome.ALL_TERMINAL;
    }

    public enum Outcome {
        ALL_TERMINAL,
        TIMED_OUT,
        ABORTED
    }
}
