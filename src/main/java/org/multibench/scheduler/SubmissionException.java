package org.multibench.scheduler;

/**
 * The scheduler rejected a submission or returned something that is not a job handle.
 */
public final class SubmissionException extends Exception {
    public SubmissionException(final String message) {
        super(message);
    }

    public SubmissionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
