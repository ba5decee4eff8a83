package org.multibench.scheduler;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slurm adapter: {@code sbatch} to submit, one {@code squeue} call per status batch, {@code scancel} to cancel.
 */
public final class SlurmScheduler implements BatchScheduler {
    static final Pattern JOB_ID = Pattern.compile("Submitted batch job (\\d+)");
    static final String UNQUEUED_MESSAGE = "Invalid job id specified";
    private static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(60);

    private static final Map<String, RawJobStatus> STATES = Map.ofEntries(
        Map.entry("PENDING", RawJobStatus.PENDING),
        Map.entry("CONFIGURING", RawJobStatus.PENDING),
        Map.entry("REQUEUED", RawJobStatus.PENDING),
        Map.entry("REQUEUE_HOLD", RawJobStatus.PENDING),
        Map.entry("REQUEUE_FED", RawJobStatus.PENDING),
        Map.entry("RESV_DEL_HOLD", RawJobStatus.PENDING),
        Map.entry("SUSPENDED", RawJobStatus.PENDING),
        Map.entry("RUNNING", RawJobStatus.RUNNING),
        Map.entry("COMPLETING", RawJobStatus.RUNNING),
        Map.entry("STAGE_OUT", RawJobStatus.RUNNING),
        Map.entry("SIGNALING", RawJobStatus.RUNNING),
        Map.entry("RESIZING", RawJobStatus.RUNNING),
        Map.entry("COMPLETED", RawJobStatus.COMPLETED),
        Map.entry("FAILED", RawJobStatus.FAILED),
        Map.entry("CANCELLED", RawJobStatus.FAILED),
        Map.entry("TIMEOUT", RawJobStatus.FAILED),
        Map.entry("NODE_FAIL", RawJobStatus.FAILED),
        Map.entry("OUT_OF_MEMORY", RawJobStatus.FAILED),
        Map.entry("BOOT_FAIL", RawJobStatus.FAILED),
        Map.entry("DEADLINE", RawJobStatus.FAILED),
        Map.entry("PREEMPTED", RawJobStatus.FAILED),
        Map.entry("REVOKED", RawJobStatus.FAILED),
        Map.entry("SPECIAL_EXIT", RawJobStatus.FAILED)
    );

    private final CommandRunner runner;
    private final Duration commandTimeout;

    public SlurmScheduler() {
        this(new ProcessCommandRunner(), DEFAULT_COMMAND_TIMEOUT);
    }

    public SlurmScheduler(final CommandRunner runner, final Duration commandTimeout) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.commandTimeout = Objects.requireNonNull(commandTimeout, "commandTimeout");
    }

    @Override
    public String name() {
        return "slurm";
    }

    @Override
    public JobHandle submit(final Path script) throws SubmissionException {
        final CommandResult result;
        try {
            result = runner.run(List.of("sbatch", script.toString()), commandTimeout);
        } catch (final IOException exception) {
            throw new SubmissionException("sbatch could not be run: " + exception.getMessage(), exception);
        } catch (final InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new SubmissionException("interrupted while submitting " + script, exception);
        }
        if (!result.succeeded()) {
            throw new SubmissionException(
                "sbatch exited with code " + result.exitCode() + ": " + result.stderr().trim());
        }
        return parseSubmission(result.stdout());
    }

    @Override
    public Map<JobHandle, RawJobStatus> queryStatus(final Set<JobHandle> handles) throws SchedulerQueryException {
        final Map<JobHandle, RawJobStatus> statuses = new LinkedHashMap<>();
        if (handles.isEmpty()) {
            return statuses;
        }
        final List<String> ids = new ArrayList<>(handles.size());
        for (final JobHandle handle : handles) {
            ids.add(handle.jobId());
        }

        final CommandResult result;
        try {
            result = runner.run(List.of("squeue", "-h", "-o", "%i %T", "-j", String.join(",", ids)), commandTimeout);
        } catch (final IOException exception) {
            throw new SchedulerQueryException("squeue could not be run: " + exception.getMessage(), exception);
        } catch (final InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new SchedulerQueryException("interrupted while querying job status", exception);
        }

        final Map<String, RawJobStatus> reported;
        if (result.succeeded()) {
            reported = parseQueue(result.stdout());
        } else if (result.stderr().contains(UNQUEUED_MESSAGE) || result.stdout().contains(UNQUEUED_MESSAGE)) {
            // none of the jobs is in the queue any more
            reported = Map.of();
        } else {
            throw new SchedulerQueryException(
                "squeue exited with code " + result.exitCode() + ": " + result.stderr().trim());
        }
        for (final JobHandle handle : handles) {
            statuses.put(handle, reported.getOrDefault(handle.jobId(), RawJobStatus.UNKNOWN));
        }
        return statuses;
    }

    @Override
    public void cancel(final JobHandle handle) throws SchedulerQueryException {
        final CommandResult result;
        try {
            result = runner.run(List.of("scancel", handle.jobId()), commandTimeout);
        } catch (final IOException exception) {
            throw new SchedulerQueryException("scancel could not be run: " + exception.getMessage(), exception);
        } catch (final InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new SchedulerQueryException("interrupted while cancelling job " + handle, exception);
        }
        if (!result.succeeded()) {
            throw new SchedulerQueryException(
                "scancel exited with code " + result.exitCode() + ": " + result.stderr().trim());
        }
    }

    static JobHandle parseSubmission(final String sbatchOutput) throws SubmissionException {
        final Matcher matcher = JOB_ID.matcher(sbatchOutput == null ? "" : sbatchOutput);
        if (!matcher.find()) {
            throw new SubmissionException("sbatch output does not contain a job id: " + sbatchOutput);
        }
        return new JobHandle(matcher.group(1));
    }

    /**
     * Parses {@code squeue -h -o "%i %T"} output: one {@code <jobId> <STATE>} pair per line.
     */
    static Map<String, RawJobStatus> parseQueue(final String squeueOutput) {
        final Map<String, RawJobStatus> statuses = new LinkedHashMap<>();
        if (squeueOutput == null) {
            return statuses;
        }
        for (final String line : squeueOutput.split("\\R")) {
            final String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            final String[] pieces = trimmed.split("\\s+", 2);
            final String state = pieces.length < 2 ? "" : pieces[1].trim().toUpperCase(Locale.ROOT);
            statuses.put(pieces[0], translate(state));
        }
        return statuses;
    }

    static RawJobStatus translate(final String slurmState) {
        // squeue may append a reason, e.g. "CANCELLED by 1234"
        final String state = slurmState.split("\\s+", 2)[0];
        return STATES.getOrDefault(state, RawJobStatus.UNKNOWN);
    }
}
