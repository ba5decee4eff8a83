package org.multibench.engine;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Objects;
import org.multibench.scheduler.PollSchedule;
import org.multibench.scheduler.RetryPolicy;
import org.multibench.store.WriteMode;

/**
 * Settings of one record invocation.
 */
public record RecordOptions(
        WriteMode writeMode,
        boolean dryRun,
        boolean waitForCompletion,
        Duration timeout,
        int parallelism,
        PollSchedule pollSchedule,
        RetryPolicy retryPolicy,
        PrintStream dryRunOut) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(48);
    public static final int DEFAULT_PARALLELISM = 4;

    public RecordOptions {
        Objects.requireNonNull(writeMode, "writeMode");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(pollSchedule, "pollSchedule");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        dryRunOut = dryRunOut == null ? System.out : dryRunOut;
    }

    /**
     * Overwrite, submit for real, do not wait.
     */
    public static RecordOptions defaults() {
        return new RecordOptions(
            WriteMode.OVERWRITE,
            false,
            false,
            DEFAULT_TIMEOUT,
            DEFAULT_PARALLELISM,
            PollSchedule.backOff(),
            RetryPolicy.defaults(),
            System.out);
    }

    public RecordOptions withWriteMode(final WriteMode mode) {
        return new RecordOptions(mode, dryRun, waitForCompletion, timeout, parallelism, pollSchedule, retryPolicy, dryRunOut);
    }

    public RecordOptions withDryRun(final boolean enabled, final PrintStream out) {
        return new RecordOptions(writeMode, enabled, waitForCompletion, timeout, parallelism, pollSchedule, retryPolicy, out);
    }

    public RecordOptions withWait(final boolean enabled, final Duration waitTimeout) {
        return new RecordOptions(writeMode, dryRun, enabled, waitTimeout, parallelism, pollSchedule, retryPolicy, dryRunOut);
    }

    public RecordOptions withParallelism(final int threads) {
        return new RecordOptions(writeMode, dryRun, waitForCompletion, timeout, threads, pollSchedule, retryPolicy, dryRunOut);
    }

    public RecordOptions withPolling(final PollSchedule schedule, final RetryPolicy retry) {
        return new RecordOptions(writeMode, dryRun, waitForCompletion, timeout, parallelism, schedule, retry, dryRunOut);
    }
}
