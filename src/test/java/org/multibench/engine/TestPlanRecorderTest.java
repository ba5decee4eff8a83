package org.multibench.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.multibench.matrix.GroupKey;
import org.multibench.matrix.RunStatus;
import org.multibench.metrics.AggregatedMetric;
import org.multibench.plan.MetricDefinition;
import org.multibench.plan.MetricTarget;
import org.multibench.plan.RunConfiguration;
import org.multibench.plan.TestBench;
import org.multibench.plan.TestPlan;
import org.multibench.plan.TestPlanLoader;
import org.multibench.report.BenchReport;
import org.multibench.report.PlanReport;
import org.multibench.scheduler.DispatchOutcome;
import org.multibench.scheduler.FakeBatchScheduler;
import org.multibench.scheduler.PollSchedule;
import org.multibench.scheduler.RetryPolicy;
import org.multibench.store.PersistOutcome;
import org.multibench.store.ResultStore;
import org.multibench.store.WriteMode;

class TestPlanRecorderTest {
    private static final Pattern THREADS = Pattern.compile("--threads (\\d+)");
    private static final Pattern RERUN = Pattern.compile("__r(\\d+)");

    @TempDir
    Path tempDir;

    @Test
    void recordsWaitsAndReportsTheScalingStudy() throws Exception {
        FakeBatchScheduler scheduler = new FakeBatchScheduler().autoComplete(TestPlanRecorderTest::solverOutput);
        ResultStore store = new ResultStore(tempDir.resolve("results"));
        TestPlan plan = TestPlanLoader.load(fixture("scaling.yaml"));

        RecordSummary summary = new TestPlanRecorder(scheduler, store, null).record(plan, waiting());

        assertEquals(6, summary.count(DispatchOutcome.Kind.SUBMITTED));
        assertTrue(summary.waitResult().orElseThrow().allTerminal());
        assertEquals(6, summary.persistOutcomes().size());
        assertTrue(summary.persistOutcomes().values().stream().allMatch(outcome -> outcome == PersistOutcome.WRITTEN));
        assertFalse(summary.totalFailure());
        assertEquals(6, store.listRunIds().size());

        PlanReport report = new TestPlanReporter(store, null).report(plan);
        BenchReport bench = report.bench("strong-scaling").orElseThrow();
        assertEquals(3, bench.groups().size());
        assertEquals(6, bench.runCount());
        assertEquals(Map.of(RunStatus.COMPLETED, 6), bench.statusCounts());

        GroupKey fourThreads = new GroupKey("strong-scaling", Map.of("threads", "4"));
        AggregatedMetric time = bench.aggregate(fourThreads, "time_s").orElseThrow();
        assertEquals(2, time.count());
        assertEquals(2.1, time.mean(), 1e-9);
        assertTrue(time.dispersion() > 0.0);
        assertEquals("cg", bench.aggregate(fourThreads, "solver").orElseThrow().central().textValue());
        assertEquals(3, bench.aggregates().stream().filter(aggregate -> aggregate.metricName().equals("time_s")).count());
    }

    @Test
    void rejectedSubmissionsDoNotStopTheirSiblings() throws Exception {
        FakeBatchScheduler scheduler = new FakeBatchScheduler()
                .autoComplete(TestPlanRecorderTest::solverOutput)
                .rejectWhen(script -> script.toString().contains("threads=2"));
        ResultStore store = new ResultStore(tempDir);
        TestPlan plan = TestPlanLoader.load(fixture("scaling.yaml"));

        RecordSummary summary = new TestPlanRecorder(scheduler, store, null).record(plan, waiting());

        assertEquals(4, summary.count(DispatchOutcome.Kind.SUBMITTED));
        assertEquals(2, summary.count(DispatchOutcome.Kind.FAILED));
        assertEquals(2, summary.runErrors().size());
        assertFalse(summary.totalFailure());

        BenchReport bench = new TestPlanReporter(store, null).report(plan).bench("strong-scaling").orElseThrow();
        assertEquals(Integer.valueOf(4), bench.statusCounts().get(RunStatus.COMPLETED));
        assertEquals(Integer.valueOf(2), bench.statusCounts().get(RunStatus.FAILED));
        GroupKey twoThreads = new GroupKey("strong-scaling", Map.of("threads", "2"));
        assertTrue(bench.aggregate(twoThreads, "time_s").isEmpty());
    }

    @Test
    void everySubmissionRejectedIsATotalFailure() throws Exception {
        FakeBatchScheduler scheduler = new FakeBatchScheduler().rejectWhen(script -> true);
        TestPlan plan = TestPlanLoader.load(fixture("scaling.yaml"));

        RecordSummary summary = new TestPlanRecorder(scheduler, new ResultStore(tempDir), null)
                .record(plan, RecordOptions.defaults());

        assertEquals(6, summary.count(DispatchOutcome.Kind.FAILED));
        assertTrue(summary.totalFailure());
    }

    @Test
    void noClobberRecordLeavesExistingResultsAlone() throws Exception {
        FakeBatchScheduler scheduler = new FakeBatchScheduler().autoComplete(TestPlanRecorderTest::solverOutput);
        ResultStore store = new ResultStore(tempDir);
        TestPlan plan = TestPlanLoader.load(fixture("scaling.yaml"));
        TestPlanRecorder recorder = new TestPlanRecorder(scheduler, store, null);
        recorder.record(plan, waiting());
        PlanReport before = new TestPlanReporter(store, null).report(plan);

        RecordSummary second = recorder.record(plan, waiting().withWriteMode(WriteMode.NO_CLOBBER));

        assertEquals(6, second.count(DispatchOutcome.Kind.SKIPPED_EXISTING));
        assertEquals(6, scheduler.submittedScripts().size());
        assertFalse(second.totalFailure());
        assertEquals(before, new TestPlanReporter(store, null).report(plan));
    }

    @Test
    void dryRunRendersEveryScriptWithoutSubmitting() throws Exception {
        FakeBatchScheduler scheduler = new FakeBatchScheduler();
        ResultStore store = new ResultStore(tempDir);
        ByteArrayOutputStream printed = new ByteArrayOutputStream();
        TestPlan plan = TestPlanLoader.load(fixture("scaling.yaml"));

        RecordSummary summary = new TestPlanRecorder(scheduler, store, null).record(
                plan, RecordOptions.defaults().withDryRun(true, new PrintStream(printed, true, StandardCharsets.UTF_8)));

        assertEquals(6, summary.count(DispatchOutcome.Kind.DRY_RUN));
        assertTrue(scheduler.submittedScripts().isEmpty());
        assertTrue(store.listRunIds().isEmpty());
        String output = printed.toString(StandardCharsets.UTF_8);
        assertEquals(6, output.split("#!/bin/bash", -1).length - 1);
        assertTrue(output.contains("time -p ./solver --threads 2 --size 1024"));
        assertTrue(output.contains("make SIZE=1024"));
    }

    @Test
    void benchWithUnresolvedTemplateIsReportedWhileOthersRun() throws Exception {
        FakeBatchScheduler scheduler = new FakeBatchScheduler();
        TestBench broken = TestBench.of(
                "broken", RunConfiguration.of(Map.of(), "", "./app {missing}"), List.of(), 1, List.of());
        TestBench fine = TestBench.of(
                "fine",
                RunConfiguration.of(Map.of(), "", "./app"),
                List.of(),
                2,
                List.of(MetricDefinition.numeric("t", "t=(\\d+)", MetricTarget.STDOUT)));

        RecordSummary summary = new TestPlanRecorder(scheduler, new ResultStore(tempDir), null)
                .record(TestPlan.of("mixed", List.of(broken, fine)), RecordOptions.defaults());

        assertTrue(summary.benchErrors().get("broken").contains("{missing}"));
        assertEquals(2, summary.count(DispatchOutcome.Kind.SUBMITTED));
        assertFalse(summary.totalFailure());
    }

    static FakeBatchScheduler.JobOutput solverOutput(String script) {
        Matcher threads = THREADS.matcher(script);
        Matcher rerun = RERUN.matcher(script);
        if (!threads.find() || !rerun.find()) {
            return FakeBatchScheduler.JobOutput.failure(2, "unexpected script");
        }
        double seconds = 8.0 / Integer.parseInt(threads.group(1)) + 0.2 * Integer.parseInt(rerun.group(1));
        return FakeBatchScheduler.JobOutput.success(
                "solver=cg\niterations=40\n", String.format(Locale.ROOT, "real %.2f\nuser 0.01\nsys 0.00\n", seconds));
    }

    static RecordOptions waiting() {
        return RecordOptions.defaults()
                .withWait(true, Duration.ofSeconds(30))
                .withPolling(PollSchedule.fixed(Duration.ofMillis(10)), RetryPolicy.immediate(2));
    }

    static Path fixture(String name) throws Exception {
        return Path.of(TestPlanRecorderTest.class.getResource("/plans/" + name).toURI());
    }
}
