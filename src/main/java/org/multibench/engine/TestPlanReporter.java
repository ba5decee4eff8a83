package org.multibench.engine;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.multibench.matrix.GroupKey;
import org.multibench.matrix.MatrixExpander;
import org.multibench.matrix.RunInstance;
import org.multibench.matrix.RunStatus;
import org.multibench.matrix.TemplateException;
import org.multibench.metrics.AggregatedMetric;
import org.multibench.metrics.Aggregator;
import org.multibench.metrics.ExtractedMetric;
import org.multibench.metrics.MetricExtractor;
import org.multibench.obs.CorrelationContext;
import org.multibench.obs.JsonLinesLogger;
import org.multibench.plan.MetricDefinition;
import org.multibench.plan.TestBench;
import org.multibench.plan.TestPlan;
import org.multibench.report.BenchReport;
import org.multibench.report.PlanReport;
import org.multibench.store.PersistOutcome;
import org.multibench.store.ResultStore;
import org.multibench.store.RunArtifacts;
import org.multibench.store.StoreException;
import org.multibench.store.StoredRun;
import org.multibench.store.WriteMode;

/**
 * Report flow: reads recorded runs back from the store, extracts metrics and aggregates them per configuration.
 * Never talks to a scheduler. Jobs that finished after their record call returned are harvested from their
 * staging workspace first.
 */
public final class TestPlanReporter {
    private final ResultStore store;
    private final JsonLinesLogger logger;

    public TestPlanReporter(ResultStore store, JsonLinesLogger logger) {
        this.store = Objects.requireNonNull(store, "store");
        this.logger = logger == null ? JsonLinesLogger.discarding() : logger;
    }

    public PlanReport report(TestPlan plan) {
        Objects.requireNonNull(plan, "plan");
        List<BenchReport> benches = new ArrayList<>();
        for (TestBench bench : plan.enabledBenches()) {
            benches.add(reportBench(plan.name(), bench));
        }
        return new PlanReport(plan.name(), benches);
    }

    public BenchReport reportBench(String planName, TestBench bench) {
        CorrelationContext benchContext = CorrelationContext.forBench(planName, bench.name());
        List<RunInstance> instances;
        try {
            instances = MatrixExpander.expand(bench);
        } catch (TemplateException exception) {
            logger.error("bench expansion failed", benchContext, Map.of("error", exception.getMessage()));
            return BenchReport.failed(bench.name(), exception.getMessage());
        }

        List<StoredRun> runs = new ArrayList<>(instances.size());
        Map<RunStatus, Integer> statusCounts = new EnumMap<>(RunStatus.class);
        for (RunInstance instance : instances) {
            StoredRun run = readRun(benchContext, instance);
            runs.add(run);
            statusCounts.merge(run.instance().status(), 1, Integer::sum);
        }

        MetricExtractor extractor = new MetricExtractor(logger, CorrelationContext.forPlan(planName));
        List<ExtractedMetric> extracted = extractor.extractAll(runs, bench.metrics());
        List<AggregatedMetric> aggregates = new ArrayList<>();
        for (MetricDefinition definition : bench.metrics()) {
            aggregates.addAll(Aggregator.aggregate(extracted, definition));
        }

        List<GroupKey> groups = new ArrayList<>();
        for (RunInstance instance : instances) {
            if (!groups.contains(instance.groupKey())) {
                groups.add(instance.groupKey());
            }
        }
        logger.info(
            "bench reported",
            benchContext,
            Map.of("runs", runs.size(), "groups", groups.size(), "aggregates", aggregates.size())
        );
        return new BenchReport(
            bench.name(),
            groups,
            bench.metrics(),
            aggregates,
            new LinkedHashMap<>(statusCounts),
            bench.plots(),
            null
        );
    }

    // A staged workspace only outlives a persisted run when a later overwriting record dispatched it again, so a
    // finished staged run replaces the stored one. Unrecorded runs are reported as PENDING with no artifacts.
    private StoredRun readRun(CorrelationContext benchContext, RunInstance instance) {
        CorrelationContext context = benchContext.withRun(instance.benchName(), instance.id(), null);
        try {
            Optional<PersistOutcome> harvested = store.harvest(instance, WriteMode.OVERWRITE);
            if (harvested.isPresent()) {
                logger.info("harvested finished run", context, Map.of("outcome", harvested.get().name()));
            }
            Optional<StoredRun> stored = store.load(instance.id());
            if (stored.isPresent()) {
                return stored.get();
            }
        } catch (StoreException exception) {
            logger.error("stored run could not be read", context, Map.of("error", String.valueOf(exception.getMessage())));
        }
        return new StoredRun(instance, RunArtifacts.empty());
    }
}
