package org.multibench.scheduler;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.multibench.matrix.RunInstance;
import org.multibench.matrix.RunStatus;
import org.multibench.obs.CorrelationContext;
import org.multibench.obs.JsonLinesLogger;
import org.multibench.store.ResultStore;
import org.multibench.store.RunWorkspace;
import org.multibench.store.WriteMode;

/**
 * Renders run instances into batch scripts and submits them, or prints them in dry-run mode.
 *
 * <p>Submissions run concurrently on a fixed pool owned by the dispatcher. A failed submission marks only its own
 * instance {@code FAILED}.
 */
public final class JobDispatcher implements AutoCloseable {
    private final BatchScheduler scheduler;
    private final BatchScriptRenderer renderer;
    private final ResultStore store;
    private final JsonLinesLogger logger;
    private final CorrelationContext planContext;
    private final WriteMode writeMode;
    private final boolean dryRun;
    private final PrintStream dryRunOut;
    private final ExecutorService executor;

    private JobDispatcher(final Builder builder) {
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
        this.renderer = Objects.requireNonNull(builder.renderer, "renderer");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.logger = builder.logger == null ? JsonLinesLogger.discarding() : builder.logger;
        this.planContext = Objects.requireNonNull(builder.planContext, "planContext");
        this.writeMode = builder.writeMode;
        this.dryRun = builder.dryRun;
        this.dryRunOut = builder.dryRunOut == null ? System.out : builder.dryRunOut;
        if (builder.parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        this.executor = Executors.newFixedThreadPool(builder.parallelism);
    }

    public static Builder builder(final BatchScheduler scheduler, final ResultStore store, final CorrelationContext planContext) {
        return new Builder(scheduler, store, planContext);
    }

    public DispatchOutcome dispatch(final RunInstance instance) {
        Objects.requireNonNull(instance, "instance");
        final CorrelationContext context = planContext.withRun(instance.benchName(), instance.id(), null);
        final RunWorkspace workspace = store.workspace(instance.id());

        if (instance.status() != RunStatus.PENDING) {
            if (writeMode != WriteMode.OVERWRITE) {
                final boolean live = instance.hasLiveJob();
                logger.info("run was already dispatched; not resubmitting", context, Map.of("status", instance.status().name()));
                return DispatchOutcome.skipped(
                    instance,
                    live ? DispatchOutcome.Kind.SKIPPED_LIVE : DispatchOutcome.Kind.SKIPPED_EXISTING,
                    live ? "live job " + instance.jobId().orElse("") : "status " + instance.status());
            }
            instance.resetForResubmission();
        }
        final BatchScriptRenderer.RenderedScript script;
        try {
            if (writeMode == WriteMode.NO_CLOBBER && !dryRun) {
                if (store.exists(instance.id())) {
                    logger.info("run already recorded; skipping", context);
                    return DispatchOutcome.skipped(instance, DispatchOutcome.Kind.SKIPPED_EXISTING, "results exist");
                }
                if (!workspace.claim()) {
                    logger.info("run already claimed or submitted by another invocation; skipping", context);
                    return DispatchOutcome.skipped(instance, DispatchOutcome.Kind.SKIPPED_EXISTING, "submission exists");
                }
            } else if (writeMode == WriteMode.OVERWRITE && !dryRun) {
                cancelSupersededJob(workspace, context);
                store.discardStaged(instance.id());
                // an overwrite proceeds regardless; the claim only keeps concurrent no-clobber invocations out
                workspace.claim();
            }
            script = renderer.render(instance, workspace);
            for (final String warning : script.warnings()) {
                logger.warn(warning, context);
            }
            workspace.writeScript(script.content());
        } catch (final IOException exception) {
            releaseClaim(workspace, context);
            return fail(instance, context, "failed to prepare run workspace: " + exception.getMessage());
        }

        if (dryRun) {
            synchronized (dryRunOut) {
                dryRunOut.println("# ---- " + instance.id() + " (" + workspace.scriptFile() + ")");
                dryRunOut.println(script.content());
            }
            logger.info("dry run: script rendered, not submitted", context, Map.of("script", workspace.scriptFile().toString()));
            return DispatchOutcome.dryRun(instance);
        }

        final JobHandle handle;
        try {
            handle = scheduler.submit(workspace.scriptFile());
        } catch (final SubmissionException exception) {
            releaseClaim(workspace, context);
            return fail(instance, context, exception.getMessage());
        }
        instance.markSubmitted(handle.jobId());
        final CorrelationContext jobContext = context.withRun(instance.benchName(), instance.id(), handle.jobId());
        try {
            workspace.writeSubmissionRecord(handle.jobId());
        } catch (final IOException exception) {
            logger.warn("job submitted but its submission record could not be written", jobContext,
                Map.of("error", String.valueOf(exception.getMessage())));
        }
        logger.info("job submitted", jobContext, Map.of("scheduler", scheduler.name()));
        return DispatchOutcome.submitted(instance, handle);
    }

    /**
     * Dispatches every instance on the pool and returns outcomes in input order once all have completed.
     */
    public List<DispatchOutcome> dispatchAll(final List<RunInstance> instances) throws InterruptedException {
        final List<Future<DispatchOutcome>> futures = new ArrayList<>(instances.size());
        for (final RunInstance instance : instances) {
            futures.add(executor.submit(() -> dispatch(instance)));
        }
        final List<DispatchOutcome> outcomes = new ArrayList<>(instances.size());
        for (int i = 0; i < futures.size(); i++) {
            final RunInstance instance = instances.get(i);
            try {
                outcomes.add(futures.get(i).get());
            } catch (final ExecutionException exception) {
                final CorrelationContext context = planContext.withRun(instance.benchName(), instance.id(), null);
                outcomes.add(fail(instance, context, "unexpected dispatch failure: " + exception.getCause()));
            } catch (final InterruptedException exception) {
                for (final Future<DispatchOutcome> future : futures) {
                    future.cancel(true);
                }
                throw exception;
            }
        }
        return outcomes;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (final InterruptedException exception) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // a job submitted by an earlier invocation would otherwise keep writing into the re-created workspace
    private void cancelSupersededJob(final RunWorkspace workspace, final CorrelationContext context) throws IOException {
        final Optional<String> previousJob = workspace.submittedJobId();
        if (previousJob.isEmpty() || workspace.hasExitArtifact()) {
            return;
        }
        try {
            scheduler.cancel(new JobHandle(previousJob.get()));
            logger.info("cancelled superseded job", context, Map.of("previousJobId", previousJob.get()));
        } catch (final SchedulerQueryException exception) {
            logger.warn("superseded job could not be cancelled", context,
                Map.of("previousJobId", previousJob.get(), "error", String.valueOf(exception.getMessage())));
        }
    }

    private void releaseClaim(final RunWorkspace workspace, final CorrelationContext context) {
        if (dryRun) {
            return;
        }
        try {
            workspace.releaseClaim();
        } catch (final IOException exception) {
            logger.warn("claim of an unsubmitted run could not be released", context,
                Map.of("error", String.valueOf(exception.getMessage())));
        }
    }

    private DispatchOutcome fail(final RunInstance instance, final CorrelationContext context, final String error) {
        instance.tryTransitionTo(RunStatus.FAILED);
        logger.error("submission failed", context, Map.of("error", String.valueOf(error)));
        return DispatchOutcome.failed(instance, error);
    }

    public static final class Builder {
        private final BatchScheduler scheduler;
        private final ResultStore store;
        private final CorrelationContext planContext;
        private BatchScriptRenderer renderer;
        private JsonLinesLogger logger;
        private WriteMode writeMode = WriteMode.OVERWRITE;
        private boolean dryRun;
        private PrintStream dryRunOut;
        private int parallelism = 4;

        private Builder(final BatchScheduler scheduler, final ResultStore store, final CorrelationContext planContext) {
            this.scheduler = scheduler;
            this.store = store;
            this.planContext = planContext;
        }

        public Builder renderer(final BatchScriptRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public Builder logger(final JsonLinesLogger logger) {
            this.logger = logger;
            return this;
        }

        public Builder writeMode(final WriteMode writeMode) {
            this.writeMode = Objects.requireNonNull(writeMode, "writeMode");
            return this;
        }

        public Builder dryRun(final boolean dryRun, final PrintStream out) {
            this.dryRun = dryRun;
            this.dryRunOut = out;
            return this;
        }

        public Builder parallelism(final int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public JobDispatcher build() {
            if (renderer == null) {
                renderer = BatchScriptRenderer.defaultTemplate();
            }
            return new JobDispatcher(this);
        }
    }
}
