package org.multibench.scheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs a short-lived scheduler client command ({@code sbatch}, {@code squeue}, ...) to completion.
 */
@FunctionalInterface
public interface CommandRunner {
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
