package org.multibench.store;

/**
 * Policy for persisting a run whose directory already exists.
 */
public enum WriteMode {
    /** Keep whatever is already recorded; the new write is skipped. */
    NO_CLOBBER,
    /** Replace the recorded run. */
    OVERWRITE
}
