package org.multibench.store;

public enum PersistOutcome {
    WRITTEN,
    OVERWRITTEN,
    SKIPPED_EXISTING
}
