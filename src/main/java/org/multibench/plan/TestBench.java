package org.multibench.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One experiment definition: base configuration, sweep axes, rerun count, metrics and pass-through plot specs.
 */
public record TestBench(
        String name,
        boolean enabled,
        RunConfiguration baseConfiguration,
        List<VariableAxis> axes,
        int reruns,
        List<MetricDefinition> metrics,
        Map<String, Object> plots) {
    public TestBench {
        name = Objects.requireNonNull(name, "name").trim();
        baseConfiguration = Objects.requireNonNull(baseConfiguration, "baseConfiguration");
        axes = List.copyOf(Objects.requireNonNull(axes, "axes"));
        metrics = List.copyOf(Objects.requireNonNull(metrics, "metrics"));
        plots = plots == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(plots));
    }

    public static TestBench of(
            final String name,
            final RunConfiguration baseConfiguration,
            final List<VariableAxis> axes,
            final int reruns,
            final List<MetricDefinition> metrics) {
        return new TestBench(name, true, baseConfiguration, axes, reruns, metrics, Map.of());
    }

    static TestBench fromMap(final Map<String, Object> root, final String path, final List<String> problems) {
        final String name = ConfigValues.requireText(root.get("name"), path + ".name");
        final boolean enabled = ConfigValues.optionalBoolean(root.get("enabled"), true, path + ".enabled");
        final RunConfiguration config = RunConfiguration.fromMap(
                ConfigValues.asStringMap(root.get("config"), path + ".config"), path + ".config");

        final List<Object> rawAxes = ConfigValues.asOptionalList(root.get("axes"), path + ".axes");
        final List<VariableAxis> axes = new ArrayList<>(rawAxes.size());
        for (int i = 0; i < rawAxes.size(); i++) {
            final String axisPath = path + ".axes[" + i + "]";
            axes.add(VariableAxis.fromMap(ConfigValues.asStringMap(rawAxes.get(i), axisPath), axisPath));
        }

        final int reruns = ConfigValues.requireInt(root.getOrDefault("reruns", 1), path + ".reruns");

        final List<Object> rawMetrics = ConfigValues.asOptionalList(root.get("metrics"), path + ".metrics");
        final List<MetricDefinition> metrics = new ArrayList<>(rawMetrics.size());
        for (int i = 0; i < rawMetrics.size(); i++) {
            final String metricPath = path + ".metrics[" + i + "]";
            MetricDefinition.fromMap(ConfigValues.asStringMap(rawMetrics.get(i), metricPath), metricPath, problems)
                    .ifPresent(metrics::add);
        }

        final Map<String, Object> plots = ConfigValues.asOptionalMap(root.get("plots"), path + ".plots");
        return new TestBench(name, enabled, config, axes, reruns, metrics, plots);
    }

    public Optional<MetricDefinition> metric(final String metricName) {
        for (final MetricDefinition metric : metrics) {
            if (metric.name().equals(metricName)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }

    /**
     * Number of run instances this bench expands to: reruns times the product of the axis sizes.
     */
    public long expansionSize() {
        long combinations = 1L;
        for (final VariableAxis axis : axes) {
            combinations *= axis.size();
        }
        return combinations * Math.max(0, reruns);
    }
}
