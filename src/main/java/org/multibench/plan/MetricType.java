package org.multibench.plan;

import java.util.Locale;

/**
 * Declared value type of a metric; decides how captured text is coerced.
 */
public enum MetricType {
    NUMERIC("numeric"),
    TEXTUAL("textual");

    private final String value;

    MetricType(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    static MetricType fromText(final String rawValue, final String fieldName) {
        final String value = rawValue == null ? "" : rawValue.trim().toLowerCase(Locale.ROOT);
        for (final MetricType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
                fieldName + " must be one of: numeric|textual (actual: " + rawValue + ")");
    }
}
