package org.multibench.report;

import java.util.Locale;

public enum ReportFormat {
    TEXT("text"),
    JSON("json"),
    CSV("csv");

    private final String value;

    ReportFormat(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ReportFormat fromText(final String rawValue) {
        if (rawValue == null) {
            return TEXT;
        }
        final String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        for (final ReportFormat format : values()) {
            if (format.value.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("unsupported report format: " + rawValue + " (expected text, json or csv)");
    }
}
