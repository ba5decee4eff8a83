package org.multibench.matrix;

/**
 * Lifecycle of a run instance: {@code PENDING -> SUBMITTED -> RUNNING -> COMPLETED | FAILED | CANCELLED}.
 */
public enum RunStatus {
    PENDING,
    SUBMITTED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(RunStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == this) {
            return true;
        }
        return switch (this) {
            case PENDING -> next == SUBMITTED || next == FAILED || next == CANCELLED;
            case SUBMITTED -> next != PENDING;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }
}
