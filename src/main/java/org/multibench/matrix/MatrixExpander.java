package org.multibench.matrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.multibench.plan.RunConfiguration;
import org.multibench.plan.TestBench;
import org.multibench.plan.TestPlan;
import org.multibench.plan.VariableAxis;

/**
 * Expands a bench into its run instances: the Cartesian product of the axes (declaration order, last axis varying
 * fastest) times the rerun count. Pure; the same bench always yields the same identifiers in the same order.
 */
public final class MatrixExpander {
    private MatrixExpander() {}

    public static List<RunInstance> expand(TestBench bench) {
        Objects.requireNonNull(bench, "bench");
        if (bench.reruns() <= 0) {
            throw new IllegalArgumentException("bench '" + bench.name() + "': reruns must be > 0");
        }

        List<Map<String, String>> combinations = combinations(bench.axes());
        List<RunInstance> instances = new ArrayList<>(combinations.size() * bench.reruns());
        for (Map<String, String> combination : combinations) {
            RunConfiguration resolved = resolve(bench, combination);
            for (int rerun = 0; rerun < bench.reruns(); rerun++) {
                instances.add(new RunInstance(bench.name(), combination, resolved, rerun));
            }
        }
        return List.copyOf(instances);
    }

    /**
     * Expands every enabled bench of the plan, in plan order.
     */
    public static Map<String, List<RunInstance>> expand(TestPlan plan) {
        Objects.requireNonNull(plan, "plan");
        Map<String, List<RunInstance>> expanded = new LinkedHashMap<>();
        Set<String> seenIds = new HashSet<>();
        for (TestBench bench : plan.enabledBenches()) {
            List<RunInstance> instances = expand(bench);
            for (RunInstance instance : instances) {
                if (!seenIds.add(instance.id())) {
                    throw new IllegalStateException("duplicate run id in plan '" + plan.name() + "': " + instance.id());
                }
            }
            expanded.put(bench.name(), instances);
        }
        return expanded;
    }

    /**
     * Axis-value combinations in expansion order. A bench without axes has exactly one, empty, combination.
     */
    public static List<Map<String, String>> combinations(List<VariableAxis> axes) {
        Objects.requireNonNull(axes, "axes");
        List<Map<String, String>> combinations = new ArrayList<>();
        combinations.add(new LinkedHashMap<>());
        for (VariableAxis axis : axes) {
            List<Map<String, String>> next = new ArrayList<>(combinations.size() * axis.size());
            for (Map<String, String> prefix : combinations) {
                for (String value : axis.values()) {
                    Map<String, String> combination = new LinkedHashMap<>(prefix);
                    combination.put(axis.name(), value);
                    next.add(combination);
                }
            }
            combinations = next;
        }
        List<Map<String, String>> frozen = new ArrayList<>(combinations.size());
        for (Map<String, String> combination : combinations) {
            frozen.add(Collections.unmodifiableMap(combination));
        }
        return List.copyOf(frozen);
    }

    // Axis values take precedence over base variables of the same name.
    private static RunConfiguration resolve(TestBench bench, Map<String, String> combination) {
        RunConfiguration base = bench.baseConfiguration();
        Map<String, String> values = new LinkedHashMap<>(base.variables());
        values.putAll(combination);
        TemplateRenderer renderer = new TemplateRenderer(bench.name(), values);
        return base.mapTemplates(values, renderer::render);
    }
}
