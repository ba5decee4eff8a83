package org.multibench.plan;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration errors. Raised before anything is dispatched.
 */
public final class ConfigException extends IllegalArgumentException {
    private final List<String> errors;

    public ConfigException(final List<String> errors) {
        super(formatMessage(errors));
        this.errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    }

    public ConfigException(final String error, final Throwable cause) {
        super(formatMessage(List.of(error)), cause);
        this.errors = List.of(error);
    }

    public List<String> errors() {
        return errors;
    }

    private static String formatMessage(final List<String> errors) {
        final List<String> normalized = List.copyOf(Objects.requireNonNull(errors, "errors"));
        if (normalized.isEmpty()) {
            return "test plan configuration is invalid";
        }
        final StringBuilder sb = new StringBuilder();
        sb.append("test plan configuration is invalid (")
                .append(normalized.size())
                .append(" issue(s))");
        for (final String error : normalized) {
            sb.append('\n').append("- ").append(error);
        }
        return sb.toString();
    }
}
