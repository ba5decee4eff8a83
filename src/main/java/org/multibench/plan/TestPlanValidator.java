package org.multibench.plan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static validator for {@link TestPlan}. Collects every issue instead of stopping at the first one.
 */
public final class TestPlanValidator {
    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

    private TestPlanValidator() {}

    public static void validateOrThrow(final TestPlan plan) {
        final List<String> errors = validate(plan);
        if (!errors.isEmpty()) {
            throw new ConfigException(errors);
        }
    }

    public static List<String> validate(final TestPlan plan) {
        Objects.requireNonNull(plan, "plan");
        final List<String> errors = new ArrayList<>();
        if (plan.name().isEmpty()) {
            errors.add("name must not be blank");
        }
        if (plan.benches().isEmpty()) {
            errors.add("benches must not be empty");
        }

        final Set<String> seenBenches = new HashSet<>();
        for (int i = 0; i < plan.benches().size(); i++) {
            final TestBench bench = plan.benches().get(i);
            final String path = "benches[" + i + "]";
            if (!seenBenches.add(bench.name())) {
                errors.add(path + ".name duplicates bench '" + bench.name() + "'");
            }
            validateBench(path, bench, errors);
        }
        return List.copyOf(errors);
    }

    private static void validateBench(final String path, final TestBench bench, final List<String> errors) {
        if (bench.name().isEmpty()) {
            errors.add(path + ".name must not be blank");
        } else if (!NAME_PATTERN.matcher(bench.name()).matches()) {
            errors.add(path + ".name must start with a letter or digit and contain only letters, digits, dot, underscore or hyphen");
        }
        if (bench.reruns() <= 0) {
            errors.add(path + ".reruns must be > 0 (actual: " + bench.reruns() + ")");
        }

        final Set<String> axisNames = new LinkedHashSet<>();
        for (int i = 0; i < bench.axes().size(); i++) {
            final VariableAxis axis = bench.axes().get(i);
            final String axisPath = path + ".axes[" + i + "]";
            if (axis.name().isEmpty()) {
                errors.add(axisPath + ".name must not be blank");
            } else if (!axisNames.add(axis.name())) {
                errors.add(axisPath + ".name duplicates axis '" + axis.name() + "'");
            }
            if (axis.values().isEmpty()) {
                errors.add(axisPath + ".values must not be empty");
            }
            final Set<String> seenValues = new HashSet<>();
            for (final String value : axis.values()) {
                if (!seenValues.add(value)) {
                    errors.add(axisPath + ".values contains duplicate value '" + value + "'");
                }
            }
        }

        final Set<String> known = new HashSet<>(bench.baseConfiguration().variables().keySet());
        known.addAll(axisNames);
        for (final Map.Entry<String, String> template : bench.baseConfiguration().templates().entrySet()) {
            for (final String placeholder : TemplatePlaceholders.names(template.getValue())) {
                if (!known.contains(placeholder)) {
                    errors.add(path + ".config." + template.getKey()
                            + " references unknown variable '{" + placeholder + "}'");
                }
            }
        }

        final Set<String> metricNames = new HashSet<>();
        for (int i = 0; i < bench.metrics().size(); i++) {
            final MetricDefinition metric = bench.metrics().get(i);
            final String metricPath = path + ".metrics[" + i + "]";
            if (metric.name().isEmpty()) {
                errors.add(metricPath + ".name must not be blank");
            } else if (!metricNames.add(metric.name())) {
                errors.add(metricPath + ".name duplicates metric '" + metric.name() + "'");
            }
            if (metric.captureGroupCount() != 1) {
                errors.add(metricPath + ".pattern must have exactly one capture group (actual: "
                        + metric.captureGroupCount() + ")");
            }
        }
    }
}
