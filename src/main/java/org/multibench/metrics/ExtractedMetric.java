package org.multibench.metrics;

import java.util.Objects;
import org.multibench.matrix.GroupKey;
import org.multibench.matrix.RunInstance;

public record ExtractedMetric(RunInstance instance, String metricName, MetricValue value) {
    public ExtractedMetric {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(value, "value");
    }

    public GroupKey groupKey() {
        return instance.groupKey();
    }
}
