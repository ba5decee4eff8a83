package org.multibench.report;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record PlanReport(String planName, List<BenchReport> benches) {
    public PlanReport {
        Objects.requireNonNull(planName, "planName");
        benches = benches == null ? List.of() : List.copyOf(benches);
    }

    public Optional<BenchReport> bench(final String benchName) {
        for (final BenchReport bench : benches) {
            if (bench.benchName().equals(benchName)) {
                return Optional.of(bench);
            }
        }
        return Optional.empty();
    }
}
