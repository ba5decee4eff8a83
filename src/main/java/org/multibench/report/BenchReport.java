package org.multibench.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.multibench.matrix.GroupKey;
import org.multibench.matrix.RunStatus;
import org.multibench.metrics.AggregatedMetric;
import org.multibench.plan.MetricDefinition;

/**
 * Aggregated results of one bench: every configuration of its expansion, each with a summary per metric or none
 * when no rerun produced a value.
 */
public record BenchReport(
        String benchName,
        List<GroupKey> groups,
        List<MetricDefinition> metrics,
        List<AggregatedMetric> aggregates,
        Map<RunStatus, Integer> statusCounts,
        Map<String, Object> plots,
        String error) {
    public BenchReport {
        Objects.requireNonNull(benchName, "benchName");
        groups = groups == null ? List.of() : List.copyOf(groups);
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        aggregates = aggregates == null ? List.of() : List.copyOf(aggregates);
        statusCounts = statusCounts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(statusCounts));
        plots = plots == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(plots));
    }

    /**
     * Report for a bench that could not be expanded.
     */
    public static BenchReport failed(final String benchName, final String error) {
        return new BenchReport(benchName, List.of(), List.of(), List.of(), Map.of(), Map.of(), error);
    }

    public Optional<AggregatedMetric> aggregate(final GroupKey group, final String metricName) {
        for (final AggregatedMetric aggregate : aggregates) {
            if (aggregate.groupKey().equals(group) && aggregate.metricName().equals(metricName)) {
                return Optional.of(aggregate);
            }
        }
        return Optional.empty();
    }

    public int runCount() {
        int total = 0;
        for (final int count : statusCounts.values()) {
            total += count;
        }
        return total;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
