package org.multibench.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.multibench.matrix.MatrixExpander;
import org.multibench.matrix.RunInstance;
import org.multibench.matrix.RunStatus;
import org.multibench.obs.CorrelationContext;
import org.multibench.obs.StructuredJsonLinesLogger;
import org.multibench.plan.MetricDefinition;
import org.multibench.plan.MetricTarget;
import org.multibench.plan.RunConfiguration;
import org.multibench.plan.TestBench;
import org.multibench.plan.VariableAxis;
import org.multibench.store.RunArtifacts;
import org.multibench.store.StoredRun;

class MetricExtractorTest {
    private static final MetricDefinition TIME = MetricDefinition.numeric("time_s", "real\\s+([0-9.eE+-]+)", MetricTarget.STDERR);
    private static final MetricDefinition SOLVER = MetricDefinition.textual("solver", "solver=\\s*(\\S+)", MetricTarget.STDOUT);
    private static final MetricDefinition RATE = MetricDefinition.numeric("rate", "^rate=(.+)$", MetricTarget.file("result.txt"));

    private final MetricExtractor extractor = new MetricExtractor(null, CorrelationContext.forPlan("metrics"));

    @Test
    void extractsFirstMatchFromTheTargetedArtifact() {
        RunInstance run = completed(0);
        RunArtifacts artifacts = new RunArtifacts(
                "solver= cg\nsolver=gmres\n",
                "user 0.1\nreal 12.5\nreal 99\n",
                Map.of("result.txt", "header\nrate=3.5e2\n"),
                0);

        assertEquals(MetricValue.numeric(12.5), extractor.extract(run, artifacts, TIME));
        assertEquals(MetricValue.textual("cg"), extractor.extract(run, artifacts, SOLVER));
        assertEquals(MetricValue.numeric(350.0), extractor.extract(run, artifacts, RATE));
    }

    @Test
    void runsThatDidNotCompleteHaveNoValue() {
        RunInstance failed = instances().get(0);
        failed.markSubmitted("1");
        failed.transitionTo(RunStatus.FAILED);

        MetricValue value = extractor.extract(failed, new RunArtifacts("", "real 1.0", Map.of(), 1), TIME);

        assertFalse(value.isPresent());
        assertEquals(Optional.of(MetricValue.MissingReason.NOT_COMPLETED), value.missingReason());
    }

    @Test
    void absentArtifactIsDistinguishedFromNoMatch() {
        RunInstance run = completed(0);

        MetricValue absent = extractor.extract(run, new RunArtifacts("out", null, Map.of(), 0), TIME);
        MetricValue noMatch = extractor.extract(run, new RunArtifacts("out", "", Map.of(), 0), TIME);
        MetricValue noFile = extractor.extract(run, new RunArtifacts("out", "", Map.of(), 0), RATE);

        assertEquals(Optional.of(MetricValue.MissingReason.ARTIFACT_ABSENT), absent.missingReason());
        assertEquals(Optional.of(MetricValue.MissingReason.NO_MATCH), noMatch.missingReason());
        assertEquals(Optional.of(MetricValue.MissingReason.ARTIFACT_ABSENT), noFile.missingReason());
    }

    @Test
    void nonNumericCaptureIsMissingAndLoggedAsWarning() {
        ByteArrayOutputStream logOutput = new ByteArrayOutputStream();
        MetricExtractor logging = new MetricExtractor(
                new StructuredJsonLinesLogger(logOutput), CorrelationContext.forPlan("metrics"));
        RunInstance run = completed(1);

        MetricValue value = logging.extract(run, new RunArtifacts("", null, Map.of("result.txt", "rate=fast\n"), 0), RATE);

        assertEquals(Optional.of(MetricValue.MissingReason.COERCION_FAILED), value.missingReason());
        assertEquals(Optional.of("fast"), value.detail());
        String[] lines = logOutput.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(1, lines.length);
        Document event = Document.parse(lines[0]);
        assertEquals("WARN", event.getString("level"));
        assertEquals(run.id(), event.getString("runId"));
        assertEquals("rate", event.getString("metric"));
    }

    @Test
    void infinityIsNotANumericValue() {
        MetricDefinition anything = MetricDefinition.numeric("x", "x=(\\S+)", MetricTarget.STDOUT);

        MetricValue value = extractor.extract(completed(0), new RunArtifacts("x=Infinity", null, Map.of(), 0), anything);

        assertEquals(Optional.of(MetricValue.MissingReason.COERCION_FAILED), value.missingReason());
    }

    @Test
    void extractAllKeepsRunThenDefinitionOrder() {
        List<RunInstance> instances = instances();
        List<StoredRun> runs = List.of(
                new StoredRun(completed(instances.get(0)), new RunArtifacts("solver=a", "real 1", Map.of(), 0)),
                new StoredRun(completed(instances.get(1)), new RunArtifacts("solver=b", "real 2", Map.of(), 0)));

        List<ExtractedMetric> extracted = extractor.extractAll(runs, List.of(TIME, SOLVER));

        assertEquals(4, extracted.size());
        assertEquals("time_s", extracted.get(0).metricName());
        assertEquals(MetricValue.textual("a"), extracted.get(1).value());
        assertEquals(MetricValue.numeric(2.0), extracted.get(2).value());
        assertEquals(instances.get(1).groupKey(), extracted.get(3).groupKey());
        assertTrue(extracted.get(3).value().isPresent());
    }

    static List<RunInstance> instances() {
        TestBench bench = TestBench.of(
                "extract",
                RunConfiguration.of(Map.of(), "", "./app {n}"),
                List.of(VariableAxis.of("n", "1", "2")),
                1,
                List.of());
        return MatrixExpander.expand(bench);
    }

    private static RunInstance completed(int index) {
        return completed(instances().get(index));
    }

    private static RunInstance completed(RunInstance instance) {
        instance.markSubmitted("job-" + instance.id().hashCode());
        instance.transitionTo(RunStatus.COMPLETED);
        return instance;
    }
}
