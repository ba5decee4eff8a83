package org.multibench.store;

import java.io.IOException;

/**
 * Failure to read or write one run's stored data. Scoped to a single run identifier.
 */
public final class StoreException extends IOException {
    private final String runId;

    public StoreException(final String runId, final String message, final Throwable cause) {
        super("run " + runId + ": " + message, cause);
        this.runId = runId;
    }

    public StoreException(final String runId, final String message) {
        this(runId, message, null);
    }

    public String runId() {
        return runId;
    }
}
