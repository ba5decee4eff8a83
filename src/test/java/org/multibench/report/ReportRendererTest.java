package org.multibench.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.multibench.matrix.GroupKey;
import org.multibench.matrix.RunStatus;
import org.multibench.metrics.AggregatedMetric;
import org.multibench.metrics.MetricValue;
import org.multibench.plan.MetricDefinition;
import org.multibench.plan.MetricTarget;
import org.multibench.plan.MetricType;

class ReportRendererTest {
    private static final MetricDefinition TIME = MetricDefinition.numeric("time_s", "real\\s+(\\S+)", MetricTarget.STDERR);
    private static final MetricDefinition SOLVER = MetricDefinition.textual("solver", "solver=(\\S+)", MetricTarget.STDOUT);
    private static final GroupKey ONE = new GroupKey("scaling", Map.of("threads", "1"));
    private static final GroupKey TWO = new GroupKey("scaling", Map.of("threads", "2"));

    @Test
    void textTableShowsMeanDeviationAndNoData() {
        String text = ReportRenderer.render(report(), ReportFormat.TEXT);

        assertTrue(text.startsWith("Test plan: study\n"), text);
        assertTrue(text.contains("== scaling (4 runs, completed=3, failed=1)\n"), text);
        assertTrue(text.contains("threads=1     | 12 ± 2 (n=3) | cg (n=3)"), text);
        assertTrue(text.contains("threads=2     | " + ReportRenderer.NO_DATA), text);
        assertFalse(text.contains("threads=2     | 0"), text);
    }

    @Test
    void jsonUsesNullForConfigurationsWithoutData() {
        Document json = Document.parse(ReportRenderer.render(report(), ReportFormat.JSON));

        assertEquals("study", json.getString("plan"));
        Document bench = json.getList("benches", Document.class).get(0);
        assertEquals(4, bench.getInteger("runs"));
        assertEquals(1, bench.get("statuses", Document.class).getInteger("FAILED"));

        List<Document> groups = bench.getList("groups", Document.class);
        Document first = groups.get(0).get("metrics", Document.class);
        assertEquals(12.0, first.get("time_s", Document.class).getDouble("mean"), 1e-9);
        assertEquals("cg", first.get("solver", Document.class).getString("mode"));

        Document second = groups.get(1).get("metrics", Document.class);
        assertTrue(second.containsKey("time_s"));
        assertNull(second.get("time_s"));
        assertEquals("2", groups.get(1).get("axisValues", Document.class).getString("threads"));
        assertEquals("threads", bench.get("plots", Document.class).get("speedup", Document.class).getString("x"));
    }

    @Test
    void csvLeavesNoDataCellsEmptyWithZeroCount() {
        String[] lines = ReportRenderer.render(report(), ReportFormat.CSV).split("\n");

        assertEquals("bench,configuration,metric,type,count,central,dispersion", lines[0]);
        assertEquals("scaling,threads=1,time_s,numeric,3,12,2", lines[1]);
        assertEquals("scaling,threads=1,solver,textual,3,cg,0", lines[2]);
        assertEquals("scaling,threads=2,time_s,numeric,0,,", lines[3]);
        assertEquals("scaling,threads=2,solver,textual,0,,", lines[4]);
    }

    @Test
    void csvQuotesLabelsContainingCommas() {
        GroupKey pair = new GroupKey("grid", orderedMap("x", "1", "y", "2"));
        BenchReport bench = new BenchReport(
                "grid", List.of(pair), List.of(TIME), List.of(), Map.of(RunStatus.PENDING, 1), Map.of(), null);

        String csv = ReportRenderer.renderCsv(new PlanReport("p", List.of(bench)));

        assertTrue(csv.contains("grid,\"x=1, y=2\",time_s,numeric,0,,\n"), csv);
    }

    @Test
    void infiniteDispersionIsRenderedInsteadOfFailing() {
        AggregatedMetric huge = new AggregatedMetric(
                ONE, TIME.name(), MetricType.NUMERIC, 2, MetricValue.numeric(1e308), Double.POSITIVE_INFINITY);
        BenchReport bench = new BenchReport(
                "scaling", List.of(ONE), List.of(TIME), List.of(huge), Map.of(RunStatus.COMPLETED, 2), Map.of(), null);
        PlanReport report = new PlanReport("p", List.of(bench));

        assertTrue(ReportRenderer.renderText(report).contains(" ± Infinity (n=2)"));
        assertTrue(ReportRenderer.renderCsv(report).contains("scaling,threads=1,time_s,numeric,2,1"));
        assertTrue(ReportRenderer.renderCsv(report).contains(",Infinity\n"));
        assertFalse(ReportRenderer.renderJson(report).isEmpty());
    }

    @Test
    void failedBenchIsRenderedWithItsError() {
        PlanReport report = new PlanReport("p", List.of(BenchReport.failed("broken", "run references '{x}'")));

        assertTrue(ReportRenderer.renderText(report).contains("== broken (error)\n  run references '{x}'\n"));
        Document bench = Document.parse(ReportRenderer.renderJson(report)).getList("benches", Document.class).get(0);
        assertEquals("run references '{x}'", bench.getString("error"));
    }

    @Test
    void numbersUseSixSignificantDigits() {
        assertEquals("0", ReportRenderer.formatNumber(0.0));
        assertEquals("3.14159", ReportRenderer.formatNumber(Math.PI));
        assertEquals("1234570", ReportRenderer.formatNumber(1234567.0));
        assertEquals("0.5", ReportRenderer.formatNumber(0.5));
        assertEquals("Infinity", ReportRenderer.formatNumber(Double.POSITIVE_INFINITY));
        assertEquals("NaN", ReportRenderer.formatNumber(Double.NaN));
    }

    @Test
    void formatNamesAreParsedCaseInsensitively() {
        assertEquals(ReportFormat.CSV, ReportFormat.fromText(" CSV "));
        assertEquals(ReportFormat.TEXT, ReportFormat.fromText(null));
        assertThrows(IllegalArgumentException.class, () -> ReportFormat.fromText("xml"));
    }

    private static PlanReport report() {
        Map<RunStatus, Integer> statuses = new LinkedHashMap<>();
        statuses.put(RunStatus.COMPLETED, 3);
        statuses.put(RunStatus.FAILED, 1);
        List<AggregatedMetric> aggregates = List.of(
                new AggregatedMetric(ONE, "time_s", MetricType.NUMERIC, 3, MetricValue.numeric(12.0), 2.0),
                new AggregatedMetric(ONE, "solver", MetricType.TEXTUAL, 3, MetricValue.textual("cg"), 0.0));
        BenchReport bench = new BenchReport(
                "scaling",
                List.of(ONE, TWO),
                List.of(TIME, SOLVER),
                aggregates,
                statuses,
                Map.of("speedup", Map.of("x", "threads", "y", "time_s")),
                null);
        return new PlanReport("study", List.of(bench));
    }

    private static Map<String, String> orderedMap(String k1, String v1, String k2, String v2) {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(k1, v1);
        map.put(k2, v2);
        return map;
    }
}
