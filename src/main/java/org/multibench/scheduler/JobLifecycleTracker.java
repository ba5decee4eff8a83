package org.multibench.scheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.multibench.matrix.RunInstance;
import org.multibench.matrix.RunStatus;
import org.multibench.obs.CorrelationContext;
import org.multibench.obs.JsonLinesLogger;
import org.multibench.store.ResultStore;

/**
 * Tracks submitted run instances until they reach a terminal status.
 *
 * <p>Each {@link #poll()} issues a single batched status query for every tracked, non-terminal job. A blocking
 * {@link #waitUntilTerminal(Duration)} alternates polls with latch waits on the poll schedule, so
 * {@link #abortWait()} wakes it immediately.
 */
public final class JobLifecycleTracker {
    private final BatchScheduler scheduler;
    private final ResultStore store;
    private final JsonLinesLogger logger;
    private final CorrelationContext planContext;
    private final PollSchedule schedule;
    private final RetryPolicy retryPolicy;
    private final Map<String, RunInstance> tracked = new LinkedHashMap<>();
    private final Object pollLock = new Object();
    private final AtomicReference<CountDownLatch> abortSignal = new AtomicReference<>(new CountDownLatch(1));
    private final AtomicBoolean abortRequested = new AtomicBoolean();

    public JobLifecycleTracker(
        BatchScheduler scheduler,
        ResultStore store,
        JsonLinesLogger logger,
        CorrelationContext planContext,
        PollSchedule schedule,
        RetryPolicy retryPolicy
    ) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.store = Objects.requireNonNull(store, "store");
        this.logger = logger == null ? JsonLinesLogger.discarding() : logger;
        this.planContext = Objects.requireNonNull(planContext, "planContext");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    /**
     * Starts tracking an instance that holds a job handle.
     */
    public void track(RunInstance instance) {
        Objects.requireNonNull(instance, "instance");
        if (instance.jobId().isEmpty()) {
            throw new IllegalArgumentException("run " + instance.id() + " has no job handle to track");
        }
        synchronized (tracked) {
            tracked.putIfAbsent(instance.id(), instance);
        }
    }

    public void trackAll(Collection<RunInstance> instances) {
        for (RunInstance instance : instances) {
            track(instance);
        }
    }

    public List<RunInstance> tracked() {
        synchronized (tracked) {
            return List.copyOf(tracked.values());
        }
    }

    public List<RunInstance> unfinished() {
        List<RunInstance> unfinished = new ArrayList<>();
        for (RunInstance instance : tracked()) {
            if (!instance.status().isTerminal()) {
                unfinished.add(instance);
            }
        }
        return unfinished;
    }

    /**
     * Queries the scheduler once for all non-terminal tracked jobs and applies the translated statuses.
     *
     * @return number of instances whose status changed
     */
    public int poll() {
        synchronized (pollLock) {
            Map<JobHandle, RunInstance> live = new LinkedHashMap<>();
            for (RunInstance instance : unfinished()) {
                Optional<String> jobId = instance.jobId();
                if (jobId.isPresent()) {
                    live.put(new JobHandle(jobId.get()), instance);
                }
            }
            if (live.isEmpty()) {
                return 0;
            }

            Optional<Map<JobHandle, RawJobStatus>> statuses = queryWithRetry(live);
            if (statuses.isEmpty()) {
                return 0;
            }

            int changed = 0;
            for (Map.Entry<JobHandle, RunInstance> entry : live.entrySet()) {
                RunInstance instance = entry.getValue();
                RawJobStatus raw = statuses.get().getOrDefault(entry.getKey(), RawJobStatus.UNKNOWN);
                RunStatus previous = instance.status();
                RunStatus next = translate(instance, raw);
                if (instance.tryTransitionTo(next)) {
                    changed++;
                    logger.info(
                        "run status changed",
                        runContext(instance),
                        Map.of("from", previous.name(), "to", next.name(), "schedulerStatus", raw.name())
                    );
                }
            }
            return changed;
        }
    }

    /**
     * Polls until every tracked instance is terminal, the timeout elapses, {@link #abortWait()} is called or the
     * calling thread is interrupted.
     */
    public WaitResult waitUntilTerminal(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        CountDownLatch signal = new CountDownLatch(1);
        abortSignal.set(signal);
        if (abortRequested.getAndSet(false)) {
            signal.countDown();
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        int pollIndex = 0;
        while (true) {
            poll();
            List<RunInstance> unfinished = unfinished();
            if (unfinished.isEmpty()) {
                return new WaitResult(WaitResult.Outcome.ALL_TERMINAL, List.of());
            }
            if (signal.getCount() == 0) {
                abortRequested.set(false);
                logger.info("wait aborted", planContext, Map.of("unfinished", unfinished.size()));
                return new WaitResult(WaitResult.Outcome.ABORTED, unfinished);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                logger.warn("wait timed out", planContext, Map.of("unfinished", unfinished.size()));
                return new WaitResult(WaitResult.Outcome.TIMED_OUT, unfinished);
            }
            long interval = Math.min(schedule.intervalAfter(pollIndex++).toNanos(), remaining);
            if (signal.await(interval, TimeUnit.NANOSECONDS)) {
                abortRequested.set(false);
                logger.info("wait aborted", planContext, Map.of("unfinished", unfinished.size()));
                return new WaitResult(WaitResult.Outcome.ABORTED, unfinished);
            }
        }
    }

    /**
     * Wakes the current blocking wait, which then returns {@link WaitResult.Outcome#ABORTED}. Without a wait in
     * progress the request is kept and the next wait returns after its first poll.
     */
    public void abortWait() {
        abortRequested.set(true);
        abortSignal.get().countDown();
    }

    /**
     * Cancels one instance. Returns {@code false} when it was already terminal.
     */
    public boolean cancel(RunInstance instance) {
        Objects.requireNonNull(instance, "instance");
        if (!instance.tryTransitionTo(RunStatus.CANCELLED)) {
            return false;
        }
        CorrelationContext context = runContext(instance);
        logger.info("run cancelled", context);
        Optional<String> jobId = instance.jobId();
        if (jobId.isPresent()) {
            try {
                scheduler.cancel(new JobHandle(jobId.get()));
            } catch (SchedulerQueryException exception) {
                logger.warn("scheduler cancel request failed", context, Map.of("error", String.valueOf(exception.getMessage())));
            }
        }
        return true;
    }

    public int cancelAll() {
        int cancelled = 0;
        for (RunInstance instance : unfinished()) {
            if (cancel(instance)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    // UNKNOWN means the scheduler has forgotten the job; the exit artifact written by the job script decides.
    RunStatus translate(RunInstance instance, RawJobStatus raw) {
        switch (raw) {
            case PENDING:
                return RunStatus.SUBMITTED;
            case RUNNING:
                return RunStatus.RUNNING;
            case COMPLETED:
                return RunStatus.COMPLETED;
            case FAILED:
                return RunStatus.FAILED;
            default:
                try {
                    Optional<Integer> exitCode = store.workspace(instance.id()).readExitCode();
                    return exitCode.isPresent() && exitCode.get() == 0 ? RunStatus.COMPLETED : RunStatus.FAILED;
                } catch (IOException exception) {
                    logger.warn(
                        "exit artifact unreadable; treating run as failed",
                        runContext(instance),
                        Map.of("error", String.valueOf(exception.getMessage()))
                    );
                    return RunStatus.FAILED;
                }
        }
    }

    private Optional<Map<JobHandle, RawJobStatus>> queryWithRetry(Map<JobHandle, RunInstance> live) {
        CountDownLatch signal = abortSignal.get();
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                return Optional.of(scheduler.queryStatus(live.keySet()));
            } catch (SchedulerQueryException exception) {
                logger.warn(
                    "status query failed",
                    planContext,
                    Map.of("attempt", attempt, "maxAttempts", retryPolicy.maxAttempts(), "error", String.valueOf(exception.getMessage()))
                );
            }
            if (attempt == retryPolicy.maxAttempts()) {
                break;
            }
            try {
                if (signal.await(retryPolicy.delayBeforeRetry(attempt).toNanos(), TimeUnit.NANOSECONDS)) {
                    break;
                }
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.error("status poll skipped; keeping last known statuses", planContext, Map.of("jobs", live.size()));
        return Optional.empty();
    }

    private CorrelationContext runContext(RunInstance instance) {
        return planContext.withRun(instance.benchName(), instance.id(), instance.jobId().orElse(null));
    }
}
