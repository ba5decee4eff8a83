package org.multibench.plan;

import java.util.Locale;
import java.util.Objects;

/**
 * Captured artifact a metric pattern is applied to: standard output, standard error or a named output file.
 */
public record MetricTarget(Kind kind, String fileName) {
    public static final MetricTarget STDOUT = new MetricTarget(Kind.STDOUT, null);
    public static final MetricTarget STDERR = new MetricTarget(Kind.STDERR, null);

    private static final String FILE_PREFIX = "file:";

    public MetricTarget {
        kind = Objects.requireNonNull(kind, "kind");
        if (kind == Kind.FILE) {
            if (fileName == null || fileName.isBlank()) {
                throw new IllegalArgumentException("file target requires a file name");
            }
            fileName = fileName.trim();
        } else if (fileName != null) {
            throw new IllegalArgumentException(kind.name().toLowerCase(Locale.ROOT) + " target takes no file name");
        }
    }

    public static MetricTarget file(final String fileName) {
        return new MetricTarget(Kind.FILE, fileName);
    }

    static MetricTarget fromText(final String rawValue, final String fieldName) {
        if (rawValue == null) {
            return STDOUT;
        }
        final String value = rawValue.trim();
        final String lower = value.toLowerCase(Locale.ROOT);
        if ("stdout".equals(lower)) {
            return STDOUT;
        }
        if ("stderr".equals(lower)) {
            return STDERR;
        }
        if (lower.startsWith(FILE_PREFIX) && value.length() > FILE_PREFIX.length()) {
            return file(value.substring(FILE_PREFIX.length()));
        }
        throw new IllegalArgumentException(
                fieldName + " must be one of: stdout|stderr|file:<name> (actual: " + rawValue + ")");
    }

    public String value() {
        return switch (kind) {
            case STDOUT -> "stdout";
            case STDERR -> "stderr";
            case FILE -> FILE_PREFIX + fileName;
        };
    }

    public enum Kind {
        STDOUT,
        STDERR,
        FILE
    }
}
