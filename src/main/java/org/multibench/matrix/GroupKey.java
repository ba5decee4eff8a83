package org.multibench.matrix;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration identity of a run instance with the rerun index left out; reruns share one key.
 */
public record GroupKey(String benchName, Map<String, String> axisValues) {
    public GroupKey {
        benchName = Objects.requireNonNull(benchName, "benchName");
        axisValues = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(axisValues, "axisValues")));
    }

    /**
     * Human readable label such as {@code threads=4, size=1024}; {@code base} when the bench has no axes.
     */
    public String label() {
        if (axisValues.isEmpty()) {
            return "base";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : axisValues.entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
        }
        return sb.toString();
    }
}
