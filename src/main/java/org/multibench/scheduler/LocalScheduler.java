package org.multibench.scheduler;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.multibench.store.RunWorkspace;

/**
 * Runs each submitted script as a child process of this JVM. The process writes its streams next to the script,
 * where the store expects a job's staged output.
 *
 * <p>A finished job is reported with its exit status once and then forgotten, like a job that has left the
 * {@code squeue} listing. Later queries answer {@link RawJobStatus#UNKNOWN} and the job's exit artifact decides.
 */
public final class LocalScheduler implements BatchScheduler {
    private final List<String> shell;
    private final Map<String, Process> processes = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public LocalScheduler() {
        this(List.of("bash"));
    }

    public LocalScheduler(final List<String> shell) {
        this.shell = List.copyOf(Objects.requireNonNull(shell, "shell"));
        if (this.shell.isEmpty()) {
            throw new IllegalArgumentException("shell must not be empty");
        }
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public JobHandle submit(final Path script) throws SubmissionException {
        final Path absoluteScript = script.toAbsolutePath();
        final Path directory = absoluteScript.getParent();
        final List<String> command = new ArrayList<>(shell);
        command.add(absoluteScript.toString());
        final Process process;
        try {
            process = new ProcessBuilder(command)
                .directory(directory.toFile())
                .redirectOutput(directory.resolve(RunWorkspace.STDOUT_FILE).toFile())
                .redirectError(directory.resolve(RunWorkspace.STDERR_FILE).toFile())
                .start();
        } catch (final IOException exception) {
            throw new SubmissionException("failed to start " + absoluteScript + ": " + exception.getMessage(), exception);
        }
        final JobHandle handle = new JobHandle("local-" + sequence.incrementAndGet());
        processes.put(handle.jobId(), process);
        return handle;
    }

    @Override
    public Map<JobHandle, RawJobStatus> queryStatus(final Set<JobHandle> handles) {
        final Map<JobHandle, RawJobStatus> statuses = new LinkedHashMap<>();
        for (final JobHandle handle : handles) {
            final Process process = processes.get(handle.jobId());
            if (process == null) {
                statuses.put(handle, RawJobStatus.UNKNOWN);
            } else if (process.isAlive()) {
                statuses.put(handle, RawJobStatus.RUNNING);
            } else {
                processes.remove(handle.jobId(), process);
                statuses.put(handle, process.exitValue() == 0 ? RawJobStatus.COMPLETED : RawJobStatus.FAILED);
            }
        }
        return statuses;
    }

    @Override
    public void cancel(final JobHandle handle) throws SchedulerQueryException {
        final Process process = processes.get(handle.jobId());
        if (process == null) {
            throw new SchedulerQueryException("unknown local job " + handle);
        }
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
