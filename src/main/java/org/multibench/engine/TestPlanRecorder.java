package org.multibench.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.multibench.matrix.MatrixExpander;
import org.multibench.matrix.RunInstance;
import org.multibench.matrix.TemplateException;
import org.multibench.obs.CorrelationContext;
import org.multibench.obs.JsonLinesLogger;
import org.multibench.plan.ConfigException;
import org.multibench.plan.TestBench;
import org.multibench.plan.TestPlan;
import org.multibench.scheduler.BatchScheduler;
import org.multibench.scheduler.BatchScriptRenderer;
import org.multibench.scheduler.DispatchOutcome;
import org.multibench.scheduler.JobDispatcher;
import org.multibench.scheduler.JobLifecycleTracker;
import org.multibench.scheduler.WaitResult;
import org.multibench.store.PersistOutcome;
import org.multibench.store.ResultStore;
import org.multibench.store.RunArtifacts;
import org.multibench.store.StoreException;

/**
 * Record flow: expand every enabled bench, dispatch the instances and, when asked to wait, track them to a terminal
 * status and move their outputs into the result store. Rejected submissions are stored as failed runs right away.
 * Runs left unfinished stay staged and are picked up by a later report.
 */
public final class TestPlanRecorder {
    private final BatchScheduler scheduler;
    private final ResultStore store;
    private final JsonLinesLogger logger;
    private final AtomicReference<JobLifecycleTracker> activeTracker = new AtomicReference<>();
    private final AtomicBoolean abortRequested = new AtomicBoolean();

    public TestPlanRecorder(BatchScheduler scheduler, ResultStore store, JsonLinesLogger logger) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.store = Objects.requireNonNull(store, "store");
        this.logger = logger == null ? JsonLinesLogger.discarding() : logger;
    }

    public RecordSummary record(TestPlan plan, RecordOptions options) throws InterruptedException {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(options, "options");
        CorrelationContext planContext = CorrelationContext.forPlan(plan.name());
        RecordSummary summary = new RecordSummary(plan.name());
        logger.info(
            "record started",
            planContext,
            Map.of("scheduler", scheduler.name(), "dryRun", options.dryRun(), "writeMode", options.writeMode().name())
        );

        List<RunInstance> instances = new ArrayList<>();
        for (TestBench bench : plan.enabledBenches()) {
            try {
                List<RunInstance> expanded = MatrixExpander.expand(bench);
                instances.addAll(expanded);
                logger.info("bench expanded", CorrelationContext.forBench(plan.name(), bench.name()), Map.of("instances", expanded.size()));
            } catch (TemplateException exception) {
                summary.benchFailed(bench.name(), exception.getMessage());
                logger.error(
                    "bench expansion failed",
                    CorrelationContext.forBench(plan.name(), bench.name()),
                    Map.of("error", exception.getMessage())
                );
            }
        }

        List<DispatchOutcome> outcomes;
        try (JobDispatcher dispatcher = JobDispatcher.builder(scheduler, store, planContext)
            .renderer(renderer(plan))
            .logger(logger)
            .writeMode(options.writeMode())
            .dryRun(options.dryRun(), options.dryRunOut())
            .parallelism(options.parallelism())
            .build()) {
            outcomes = dispatcher.dispatchAll(instances);
        }
        summary.dispatched(outcomes);

        List<RunInstance> submitted = new ArrayList<>();
        for (DispatchOutcome outcome : outcomes) {
            if (outcome.kind() == DispatchOutcome.Kind.SUBMITTED) {
                submitted.add(outcome.instance());
            } else if (outcome.isFailure() && !options.dryRun()) {
                // a rejected submission is a FAILED run with no output
                persist(outcome.instance(), RunArtifacts.empty(), options, planContext, summary);
            }
        }

        if (options.waitForCompletion() && !submitted.isEmpty()) {
            JobLifecycleTracker tracker = new JobLifecycleTracker(
                scheduler,
                store,
                logger,
                planContext,
                options.pollSchedule(),
                options.retryPolicy()
            );
            tracker.trackAll(submitted);
            activeTracker.set(tracker);
            if (abortRequested.getAndSet(false)) {
                tracker.abortWait();
            }
            try {
                WaitResult result = tracker.waitUntilTerminal(options.timeout());
                summary.waited(result);
            } finally {
                activeTracker.set(null);
                abortRequested.set(false);
            }
            for (RunInstance instance : submitted) {
                if (instance.status().isTerminal()) {
                    persistStaged(instance, options, planContext, summary);
                }
            }
        }

        logger.info(
            "record finished",
            planContext,
            Map.of(
                "submitted", summary.count(DispatchOutcome.Kind.SUBMITTED),
                "dryRun", summary.count(DispatchOutcome.Kind.DRY_RUN),
                "skipped", summary.count(DispatchOutcome.Kind.SKIPPED_EXISTING) + summary.count(DispatchOutcome.Kind.SKIPPED_LIVE),
                "failed", summary.count(DispatchOutcome.Kind.FAILED),
                "benchErrors", summary.benchErrors().size()
            )
        );
        return summary;
    }

    /**
     * Wakes a blocking wait of a record call in progress on another thread. A record call that has not reached its
     * wait yet polls once and returns. Finished runs are still persisted.
     */
    public void abort() {
        abortRequested.set(true);
        JobLifecycleTracker tracker = activeTracker.get();
        if (tracker != null) {
            tracker.abortWait();
        }
    }

    private void persistStaged(
        RunInstance instance,
        RecordOptions options,
        CorrelationContext planContext,
        RecordSummary summary
    ) {
        RunArtifacts artifacts;
        try {
            artifacts = store.collectStaged(instance);
        } catch (StoreException exception) {
            summary.runFailed(instance.id(), exception.getMessage());
            logger.error(
                "staged output could not be collected",
                planContext.withRun(instance.benchName(), instance.id(), instance.jobId().orElse(null)),
                Map.of("error", String.valueOf(exception.getMessage()))
            );
            return;
        }
        persist(instance, artifacts, options, planContext, summary);
    }

    private void persist(
        RunInstance instance,
        RunArtifacts artifacts,
        RecordOptions options,
        CorrelationContext planContext,
        RecordSummary summary
    ) {
        CorrelationContext context = planContext.withRun(instance.benchName(), instance.id(), instance.jobId().orElse(null));
        try {
            PersistOutcome outcome = store.persist(instance, artifacts, options.writeMode());
            if (outcome != PersistOutcome.SKIPPED_EXISTING) {
                store.discardStaged(instance.id());
            }
            summary.persisted(instance.id(), outcome);
            logger.info("run persisted", context, Map.of("status", instance.status().name(), "outcome", outcome.name()));
        } catch (StoreException exception) {
            summary.runFailed(instance.id(), exception.getMessage());
            logger.error("run could not be persisted", context, Map.of("error", String.valueOf(exception.getMessage())));
        }
    }

    private static BatchScriptRenderer renderer(TestPlan plan) {
        Optional<Path> templateFile = plan.submissionTemplateFile();
        if (templateFile.isEmpty()) {
            return BatchScriptRenderer.defaultTemplate();
        }
        try {
            return BatchScriptRenderer.fromFile(templateFile.get());
        } catch (IOException exception) {
            throw new ConfigException("submission template cannot be read: " + templateFile.get(), exception);
        } catch (IllegalArgumentException exception) {
            throw new ConfigException("submission template is invalid: " + exception.getMessage(), exception);
        }
    }
}
