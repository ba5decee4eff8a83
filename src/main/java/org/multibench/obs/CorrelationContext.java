package org.multibench.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event: the plan, and optionally the bench,
 * run instance and scheduler job the event belongs to.
 */
public final class CorrelationContext {
    private final String plan;
    private final String bench;
    private final String runId;
    private final String jobId;

    private CorrelationContext(Builder builder) {
        this.plan = requireText(builder.plan, "plan");
        this.bench = normalize(builder.bench);
        this.runId = normalize(builder.runId);
        this.jobId = normalize(builder.jobId);
    }

    public static CorrelationContext forPlan(String plan) {
        return builder(plan).build();
    }

    public static CorrelationContext forBench(String plan, String bench) {
        return builder(plan).bench(bench).build();
    }

    public static Builder builder(String plan) {
        return new Builder(plan);
    }

    public String plan() {
        return plan;
    }

    public Optional<String> bench() {
        return Optional.ofNullable(bench);
    }

    public Optional<String> runId() {
        return Optional.ofNullable(runId);
    }

    public Optional<String> jobId() {
        return Optional.ofNullable(jobId);
    }

    /**
     * Derives a context for one run instance of this context's bench.
     */
    public CorrelationContext withRun(String bench, String runId, String jobId) {
        return builder(plan).bench(bench).runId(runId).jobId(jobId).build();
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("plan", plan);
        if (bench != null) {
            fields.put("bench", bench);
        }
        if (runId != null) {
            fields.put("runId", runId);
        }
        if (jobId != null) {
            fields.put("jobId", jobId);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String plan;
        private String bench;
        private String runId;
        private String jobId;

        private Builder(String plan) {
            this.plan = Objects.requireNonNull(plan, "plan");
        }

        public Builder bench(String bench) {
            this.bench = bench;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
