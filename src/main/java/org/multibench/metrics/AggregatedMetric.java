package org.multibench.metrics;

import java.util.Objects;
import org.multibench.matrix.GroupKey;
import org.multibench.plan.MetricType;

/**
 * Summary of one metric over the reruns of one configuration.
 *
 * @param count number of reruns that contributed a present value
 * @param central mean for numeric metrics, most frequent value for textual ones
 * @param dispersion sample standard deviation for numeric metrics with at least two values, otherwise 0
 */
public record AggregatedMetric(
    GroupKey groupKey,
    String metricName,
    MetricType type,
    int count,
    MetricValue central,
    double dispersion
) {
    public AggregatedMetric {
        Objects.requireNonNull(groupKey, "groupKey");
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(central, "central");
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        if (!central.isPresent()) {
            throw new IllegalArgumentException("central value must be present");
        }
    }

    public double mean() {
        return central.numericValue();
    }
}
