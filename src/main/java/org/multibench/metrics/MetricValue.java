package org.multibench.metrics;

import java.util.Objects;
import java.util.Optional;

/**
 * Value of one metric for one run: a number, a text, or missing with a reason.
 */
public final class MetricValue {
    private final Kind kind;
    private final double number;
    private final String text;
    private final MissingReason missingReason;
    private final String detail;

    private MetricValue(Kind kind, double number, String text, MissingReason missingReason, String detail) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.missingReason = missingReason;
        this.detail = detail;
    }

    public static MetricValue numeric(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("numeric metric value must be finite: " + value);
        }
        return new MetricValue(Kind.NUMERIC, value, null, null, null);
    }

    public static MetricValue textual(String value) {
        return new MetricValue(Kind.TEXTUAL, Double.NaN, Objects.requireNonNull(value, "value"), null, null);
    }

    public static MetricValue missing(MissingReason reason) {
        return missing(reason, null);
    }

    public static MetricValue missing(MissingReason reason, String detail) {
        return new MetricValue(Kind.MISSING, Double.NaN, null, Objects.requireNonNull(reason, "reason"), detail);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isPresent() {
        return kind != Kind.MISSING;
    }

    public double numericValue() {
        if (kind != Kind.NUMERIC) {
            throw new IllegalStateException("metric value is " + kind + ", not NUMERIC");
        }
        return number;
    }

    public String textValue() {
        if (kind != Kind.TEXTUAL) {
            throw new IllegalStateException("metric value is " + kind + ", not TEXTUAL");
        }
        return text;
    }

    public Optional<MissingReason> missingReason() {
        return Optional.ofNullable(missingReason);
    }

    public Optional<String> detail() {
        return Optional.ofNullable(detail);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MetricValue that)) {
            return false;
        }
        return kind == that.kind
            && Double.compare(number, that.number) == 0
            && Objects.equals(text, that.text)
            && missingReason == that.missingReason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, text, missingReason);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NUMERIC:
                return Double.toString(number);
            case TEXTUAL:
                return text;
            default:
                return "missing(" + missingReason + ")";
        }
    }

    public enum Kind {
        NUMERIC,
        TEXTUAL,
        MISSING
    }

    public enum MissingReason {
        /** The run did not reach {@code COMPLETED}. */
        NOT_COMPLETED,
        /** The targeted output stream or file was not captured. */
        ARTIFACT_ABSENT,
        NO_MATCH,
        /** The captured text could not be converted to the declared type. */
        COERCION_FAILED
    }
}
