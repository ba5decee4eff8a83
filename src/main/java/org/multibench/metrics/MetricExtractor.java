package org.multibench.metrics;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.stream.Collectors;
import org.multibench.matrix.RunInstance;
import org.multibench.matrix.RunStatus;
import org.multibench.obs.CorrelationContext;
import org.multibench.obs.JsonLinesLogger;
import org.multibench.plan.MetricDefinition;
import org.multibench.plan.MetricTarget;
import org.multibench.store.RunArtifacts;
import org.multibench.store.StoredRun;

/**
 * Applies metric definitions to captured run output. Per-run data problems become {@link MetricValue#missing}
 * values, never exceptions.
 */
public final class MetricExtractor {
    private final JsonLinesLogger logger;
    private final CorrelationContext planContext;

    public MetricExtractor(JsonLinesLogger logger, CorrelationContext planContext) {
        this.logger = logger == null ? JsonLinesLogger.discarding() : logger;
        this.planContext = Objects.requireNonNull(planContext, "planContext");
    }

    public MetricValue extract(StoredRun run, MetricDefinition definition) {
        return extract(run.instance(), run.artifacts(), definition);
    }

    public MetricValue extract(RunInstance instance, RunArtifacts artifacts, MetricDefinition definition) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(artifacts, "artifacts");
        Objects.requireNonNull(definition, "definition");
        if (instance.status() != RunStatus.COMPLETED) {
            return MetricValue.missing(MetricValue.MissingReason.NOT_COMPLETED, instance.status().name());
        }
        Optional<String> content = target(artifacts, definition.target());
        if (content.isEmpty()) {
            return MetricValue.missing(MetricValue.MissingReason.ARTIFACT_ABSENT, definition.target().value());
        }
        Matcher matcher = definition.pattern().matcher(content.get());
        if (!matcher.find() || matcher.group(1) == null) {
            return MetricValue.missing(MetricValue.MissingReason.NO_MATCH);
        }
        String captured = matcher.group(1).trim();
        switch (definition.type()) {
            case NUMERIC:
                return coerceNumeric(instance, definition, captured);
            case TEXTUAL:
            default:
                return MetricValue.textual(captured);
        }
    }

    /**
     * Every definition against every run. Runs are processed in parallel; the result is ordered by run, then by
     * definition.
     */
    public List<ExtractedMetric> extractAll(List<StoredRun> runs, List<MetricDefinition> definitions) {
        return runs.parallelStream()
            .flatMap(run -> definitions.stream()
                .map(definition -> new ExtractedMetric(run.instance(), definition.name(), extract(run, definition))))
            .collect(Collectors.toList());
    }

    static Optional<String> target(RunArtifacts artifacts, MetricTarget target) {
        switch (target.kind()) {
            case STDOUT:
                return artifacts.stdoutText();
            case STDERR:
                return artifacts.stderrText();
            case FILE:
            default:
                return artifacts.file(target.fileName());
        }
    }

    private MetricValue coerceNumeric(RunInstance instance, MetricDefinition definition, String captured) {
        double value;
        try {
            value = Double.parseDouble(captured);
        } catch (NumberFormatException exception) {
            value = Double.NaN;
        }
        if (Double.isFinite(value)) {
            return MetricValue.numeric(value);
        }
        logger.warn(
            "metric value is not numeric",
            planContext.withRun(instance.benchName(), instance.id(), instance.jobId().orElse(null)),
            Map.of("metric", definition.name(), "captured", captured)
        );
        return MetricValue.missing(MetricValue.MissingReason.COERCION_FAILED, captured);
    }
}
