package org.multibench.scheduler;

/**
 * A status query or cancel request could not be completed.
 */
public final class SchedulerQueryException extends Exception {
    public SchedulerQueryException(final String message) {
        super(message);
    }

    public SchedulerQueryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
