package org.multibench.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Captured output of one run. Absent artifacts are {@code null} (or missing from {@link #files()}),
 * which is distinct from an artifact that exists but is empty.
 */
public record RunArtifacts(String stdout, String stderr, Map<String, String> files, Integer exitCode) {
    public RunArtifacts {
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public static RunArtifacts empty() {
        return new RunArtifacts(null, null, Map.of(), null);
    }

    public Optional<String> stdoutText() {
        return Optional.ofNullable(stdout);
    }

    public Optional<String> stderrText() {
        return Optional.ofNullable(stderr);
    }

    public Optional<String> file(final String name) {
        return Optional.ofNullable(files.get(name));
    }

    public Optional<Integer> exitCodeValue() {
        return Optional.ofNullable(exitCode);
    }
}
