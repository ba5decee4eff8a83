package org.multibench.scheduler;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Both streams are drained concurrently so that a chatty
 * command cannot block on a full pipe.
 */
public final class ProcessCommandRunner implements CommandRunner {
    @Override
    public CommandResult run(final List<String> command, final Duration timeout) throws IOException, InterruptedException {
        final Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();
        final CompletableFuture<String> stdout = drain(process.getInputStream());
        final CompletableFuture<String> stderr = drain(process.getErrorStream());

        final boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            throw new IOException("command timed out after " + timeout + ": " + String.join(" ", command));
        }
        return new CommandResult(process.exitValue(), await(stdout), await(stderr));
    }

    private static CompletableFuture<String> drain(final InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (final IOException exception) {
                throw new UncheckedIOException(exception);
            }
        });
    }

    private static String await(final CompletableFuture<String> output) throws IOException, InterruptedException {
        try {
            return output.get();
        } catch (final ExecutionException exception) {
            if (exception.getCause() instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            throw new IOException("failed to read command output", exception.getCause());
        }
    }
}
