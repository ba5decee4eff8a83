package org.multibench.store;

import java.util.Objects;
import org.multibench.matrix.RunInstance;

/**
 * A run read back from the store: the reconstructed instance plus its captured artifacts.
 */
public record StoredRun(RunInstance instance, RunArtifacts artifacts) {
    public StoredRun {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(artifacts, "artifacts");
    }
}
