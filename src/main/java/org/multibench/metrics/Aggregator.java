package org.multibench.metrics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.multibench.matrix.GroupKey;
import org.multibench.plan.MetricDefinition;
import org.multibench.plan.MetricType;

/**
 * Combines the reruns of each configuration into one summary per metric.
 */
public final class Aggregator {
    private Aggregator() {}

    /**
     * Aggregates the values of {@code definition} grouped by configuration, in first-seen group order. Groups with
     * no present value are left out.
     */
    public static List<AggregatedMetric> aggregate(List<ExtractedMetric> extracted, MetricDefinition definition) {
        Objects.requireNonNull(extracted, "extracted");
        Objects.requireNonNull(definition, "definition");
        Map<GroupKey, List<MetricValue>> groups = new LinkedHashMap<>();
        for (ExtractedMetric metric : extracted) {
            if (!metric.metricName().equals(definition.name())) {
                continue;
            }
            groups.computeIfAbsent(metric.groupKey(), key -> new ArrayList<>()).add(metric.value());
        }

        List<AggregatedMetric> aggregated = new ArrayList<>();
        for (Map.Entry<GroupKey, List<MetricValue>> group : groups.entrySet()) {
            AggregatedMetric summary = definition.type() == MetricType.NUMERIC
                ? numeric(group.getKey(), definition.name(), group.getValue())
                : textual(group.getKey(), definition.name(), group.getValue());
            if (summary != null) {
                aggregated.add(summary);
            }
        }
        return aggregated;
    }

    /**
     * Mean and sample standard deviation (n - 1 denominator, 0 for fewer than two values) in one Welford pass.
     * Values are scaled by a power of two first, so values near {@code Double.MAX_VALUE} do not overflow the mean.
     */
    static Moments moments(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty");
        }
        double scale = scaleOf(values);
        double mean = 0.0;
        double squares = 0.0;
        int count = 0;
        for (double value : values) {
            double scaled = value / scale;
            count++;
            double delta = scaled - mean;
            mean += delta / count;
            squares += delta * (scaled - mean);
        }
        double deviation = count < 2 ? 0.0 : Math.sqrt(squares / (count - 1)) * scale;
        return new Moments(mean * scale, deviation);
    }

    private static double scaleOf(List<Double> values) {
        double largest = 0.0;
        for (double value : values) {
            largest = Math.max(largest, Math.abs(value));
        }
        return largest == 0.0 ? 1.0 : Math.scalb(1.0, Math.getExponent(largest));
    }

    private static AggregatedMetric numeric(GroupKey key, String metricName, List<MetricValue> values) {
        List<Double> present = new ArrayList<>();
        for (MetricValue value : values) {
            if (value.kind() == MetricValue.Kind.NUMERIC) {
                present.add(value.numericValue());
            }
        }
        if (present.isEmpty()) {
            return null;
        }
        Moments moments = moments(present);
        return new AggregatedMetric(
            key,
            metricName,
            MetricType.NUMERIC,
            present.size(),
            MetricValue.numeric(moments.mean()),
            moments.deviation()
        );
    }

    private static AggregatedMetric textual(GroupKey key, String metricName, List<MetricValue> values) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        int present = 0;
        for (MetricValue value : values) {
            if (value.kind() == MetricValue.Kind.TEXTUAL) {
                counts.merge(value.textValue(), 1, Integer::sum);
                present++;
            }
        }
        if (present == 0) {
            return null;
        }
        String mode = null;
        int best = 0;
        // strictly greater keeps the first-seen value on ties
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                mode = entry.getKey();
                best = entry.getValue();
            }
        }
        return new AggregatedMetric(key, metricName, MetricType.TEXTUAL, present, MetricValue.textual(mode), 0.0);
    }

    record Moments(double mean, double deviation) {}
}
