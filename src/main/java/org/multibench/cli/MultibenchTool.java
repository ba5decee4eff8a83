package org.multibench.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.multibench.engine.RecordOptions;
import org.multibench.engine.RecordSummary;
import org.multibench.engine.TestPlanRecorder;
import org.multibench.engine.TestPlanReporter;
import org.multibench.obs.JsonLinesLogger;
import org.multibench.obs.StructuredJsonLinesLogger;
import org.multibench.plan.ConfigException;
import org.multibench.plan.TestPlan;
import org.multibench.plan.TestPlanLoader;
import org.multibench.report.PlanReport;
import org.multibench.report.ReportFormat;
import org.multibench.report.ReportRenderer;
import org.multibench.scheduler.BatchScheduler;
import org.multibench.scheduler.DispatchOutcome;
import org.multibench.scheduler.LocalScheduler;
import org.multibench.scheduler.SlurmScheduler;
import org.multibench.store.ResultStore;
import org.multibench.store.WriteMode;

/**
 * Command-line entry point.
 *
 * <pre>
 * record      --plan=&lt;path&gt; [--results-dir=&lt;dir&gt;] [--scheduler=slurm|local] [--dry-run] [--no-clobber]
 *             [--wait] [--timeout=&lt;duration&gt;] [--parallelism=&lt;n&gt;] [--log-file=&lt;path&gt;]
 * report      --plan=&lt;path&gt; [--results-dir=&lt;dir&gt;] [--format=text|json|csv] [--output=&lt;path&gt;]
 * interactive --plan=&lt;path&gt; [--results-dir=&lt;dir&gt;]
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 invalid plan or total failure, 2 usage error.
 */
public final class MultibenchTool {
    static final String RESULTS_DIR_ENV = "MULTIBENCH_RESULTS_DIR";
    static final String SCHEDULER_ENV = "MULTIBENCH_SCHEDULER";
    static final String DEFAULT_RESULTS_DIR = "results";
    static final String DEFAULT_LOG_FILE = "multibench.log.jsonl";

    private static final Pattern SHORT_DURATION = Pattern.compile("^(\\d+)\\s*([smhd])$");
    private static final List<String> COMMANDS = List.of("record", "report", "interactive");
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private MultibenchTool() {}

    public static void main(final String[] args) {
        final int exitCode = run(args, System.in, System.out, System.err, System.getenv());
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        return run(args, InputStream.nullInputStream(), out, err, Map.of());
    }

    static int run(
            final String[] args,
            final InputStream in,
            final PrintStream out,
            final PrintStream err,
            final Map<String, String> environment) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");
        Objects.requireNonNull(environment, "environment");

        final Config config;
        try {
            config = parseArgs(args, environment);
        } catch (final IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 2;
        }

        if (config.help()) {
            printUsage(out);
            return 0;
        }

        final TestPlan plan;
        try {
            plan = TestPlanLoader.load(config.planPath());
        } catch (final ConfigException e) {
            err.println(e.getMessage());
            return 1;
        } catch (final IOException e) {
            err.println("failed to read test plan: " + e.getMessage());
            return 1;
        }

        final Path logFile = config.logFile() == null
                ? config.resultsDir().resolve(DEFAULT_LOG_FILE)
                : config.logFile();
        try (JsonLinesLogger logger = StructuredJsonLinesLogger.appendingTo(logFile)) {
            final ResultStore store = new ResultStore(config.resultsDir());
            switch (config.command()) {
                case "record":
                    return record(plan, config, store, logger, out, err);
                case "report":
                    return report(plan, config, store, logger, out);
                default:
                    final BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
                    new InteractiveConsole(config.planPath(), new TestPlanReporter(store, logger), reader, out).run();
                    return 0;
            }
        } catch (final ConfigException e) {
            err.println(e.getMessage());
            return 1;
        } catch (final IOException | RuntimeException e) {
            err.println("multibench " + config.command() + " failed: " + e.getMessage());
            return 1;
        }
    }

    private static int record(
            final TestPlan plan,
            final Config config,
            final ResultStore store,
            final JsonLinesLogger logger,
            final PrintStream out,
            final PrintStream err) {
        final RecordOptions options = RecordOptions.defaults()
                .withWriteMode(config.noClobber() ? WriteMode.NO_CLOBBER : WriteMode.OVERWRITE)
                .withDryRun(config.dryRun(), out)
                .withWait(config.waitForCompletion(), config.timeout())
                .withParallelism(config.parallelism());
        final TestPlanRecorder recorder = new TestPlanRecorder(scheduler(config.scheduler()), store, logger);
        final CountDownLatch finished = new CountDownLatch(1);
        final Thread shutdownHook = abortOnShutdown(recorder, finished, SHUTDOWN_GRACE);
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        final RecordSummary summary;
        try {
            summary = recorder.record(plan, options);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("record interrupted");
            return 1;
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                err.println("shutting down: unfinished jobs stay staged for a later report");
            }
        }

        out.println("Recorded test plan " + summary.planName());
        out.println("- results: " + store.root());
        out.println("- submitted: " + summary.count(DispatchOutcome.Kind.SUBMITTED));
        if (config.dryRun()) {
            out.println("- dry run: " + summary.count(DispatchOutcome.Kind.DRY_RUN));
        }
        out.println("- skipped: " + (summary.count(DispatchOutcome.Kind.SKIPPED_EXISTING)
                + summary.count(DispatchOutcome.Kind.SKIPPED_LIVE)));
        out.println("- failed: " + summary.count(DispatchOutcome.Kind.FAILED));
        summary.waitResult().ifPresent(result -> out.println("- wait: " + result.outcome().name().toLowerCase(Locale.ROOT)
                + " (" + result.unfinished().size() + " unfinished)"));
        if (!summary.persistOutcomes().isEmpty()) {
            out.println("- persisted: " + summary.persistOutcomes().size());
        }
        for (final Map.Entry<String, String> error : summary.benchErrors().entrySet()) {
            err.println("bench " + error.getKey() + ": " + error.getValue());
        }
        for (final Map.Entry<String, String> error : summary.runErrors().entrySet()) {
            err.println("run " + error.getKey() + ": " + error.getValue());
        }
        return summary.totalFailure() ? 1 : 0;
    }

    private static int report(
            final TestPlan plan,
            final Config config,
            final ResultStore store,
            final JsonLinesLogger logger,
            final PrintStream out) throws IOException {
        final PlanReport report = new TestPlanReporter(store, logger).report(plan);
        final String rendered = ReportRenderer.render(report, config.format());
        if (config.output() == null) {
            out.print(rendered);
            out.flush();
            return 0;
        }
        final Path parent = config.output().toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(config.output(), rendered, StandardCharsets.UTF_8);
        out.println("Report written to " + config.output().toAbsolutePath().normalize());
        return 0;
    }

    private static BatchScheduler scheduler(final String name) {
        if ("local".equals(name)) {
            return new LocalScheduler();
        }
        return new SlurmScheduler();
    }

    private static Config parseArgs(final String[] args, final Map<String, String> environment) {
        if (args.length == 0) {
            throw new IllegalArgumentException("a command is required");
        }
        if ("--help".equals(args[0]) || "-h".equals(args[0])) {
            return Config.helpOnly();
        }
        final String command = args[0];
        if (!COMMANDS.contains(command)) {
            throw new IllegalArgumentException("unknown command: " + command);
        }
        final boolean recording = "record".equals(command);
        final boolean reporting = "report".equals(command);

        Path planPath = null;
        Path resultsDir = null;
        String scheduler = null;
        boolean dryRun = false;
        boolean noClobber = false;
        boolean waitForCompletion = false;
        Duration timeout = RecordOptions.DEFAULT_TIMEOUT;
        int parallelism = RecordOptions.DEFAULT_PARALLELISM;
        Path logFile = null;
        ReportFormat format = ReportFormat.TEXT;
        Path output = null;
        boolean help = false;

        for (final String arg : Arrays.asList(args).subList(1, args.length)) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                help = true;
            } else if (arg.startsWith("--plan=")) {
                planPath = Path.of(valueAfterPrefix(arg, "--plan="));
            } else if (arg.startsWith("--results-dir=")) {
                resultsDir = Path.of(valueAfterPrefix(arg, "--results-dir="));
            } else if (arg.startsWith("--log-file=")) {
                logFile = Path.of(valueAfterPrefix(arg, "--log-file="));
            } else if (recording && arg.startsWith("--scheduler=")) {
                scheduler = valueAfterPrefix(arg, "--scheduler=");
            } else if (recording && "--dry-run".equals(arg)) {
                dryRun = true;
            } else if (recording && "--no-clobber".equals(arg)) {
                noClobber = true;
            } else if (recording && "--wait".equals(arg)) {
                waitForCompletion = true;
            } else if (recording && arg.startsWith("--timeout=")) {
                timeout = parseDuration(valueAfterPrefix(arg, "--timeout="));
            } else if (recording && arg.startsWith("--parallelism=")) {
                parallelism = parsePositiveInt(valueAfterPrefix(arg, "--parallelism="), "--parallelism");
            } else if (reporting && arg.startsWith("--format=")) {
                format = ReportFormat.fromText(valueAfterPrefix(arg, "--format="));
            } else if (reporting && arg.startsWith("--output=")) {
                output = Path.of(valueAfterPrefix(arg, "--output="));
            } else {
                throw new IllegalArgumentException("unknown argument for " + command + ": " + arg);
            }
        }

        if (help) {
            return Config.helpOnly();
        }
        if (planPath == null) {
            throw new IllegalArgumentException("--plan=<path> is required");
        }
        if (resultsDir == null) {
            final String fromEnvironment = environment.get(RESULTS_DIR_ENV);
            resultsDir = Path.of(fromEnvironment == null || fromEnvironment.isBlank() ? DEFAULT_RESULTS_DIR : fromEnvironment.trim());
        }
        if (recording) {
            if (scheduler == null) {
                final String fromEnvironment = environment.get(SCHEDULER_ENV);
                scheduler = fromEnvironment == null || fromEnvironment.isBlank() ? "slurm" : fromEnvironment.trim();
            }
            scheduler = scheduler.toLowerCase(Locale.ROOT);
            if (!"slurm".equals(scheduler) && !"local".equals(scheduler)) {
                throw new IllegalArgumentException("unsupported scheduler: " + scheduler + " (expected slurm or local)");
            }
        }
        return new Config(command, planPath, resultsDir, scheduler, dryRun, noClobber, waitForCompletion, timeout,
                parallelism, logFile, format, output, false);
    }

    /**
     * Hook that stops a record call from waiting on its jobs when the JVM is asked to exit, then gives it up to
     * {@code grace} to store the runs that already finished.
     */
    static Thread abortOnShutdown(final TestPlanRecorder recorder, final CountDownLatch finished, final Duration grace) {
        return new Thread(() -> {
            recorder.abort();
            try {
                finished.await(grace.toMillis(), TimeUnit.MILLISECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "multibench-shutdown");
    }

    /**
     * Accepts {@code 90s}, {@code 30m}, {@code 48h}, {@code 2d} or an ISO-8601 duration such as {@code PT1H30M}.
     */
    static Duration parseDuration(final String raw) {
        final Duration duration;
        try {
            duration = parseDurationText(raw.trim());
            // waits measure their deadline in nanoseconds
            duration.toNanos();
        } catch (final ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("--timeout is out of range: " + raw, e);
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("--timeout must not be negative");
        }
        return duration;
    }

    private static Duration parseDurationText(final String text) {
        final Matcher matcher = SHORT_DURATION.matcher(text.toLowerCase(Locale.ROOT));
        if (matcher.matches()) {
            final long amount = Long.parseLong(matcher.group(1));
            switch (matcher.group(2)) {
                case "s":
                    return Duration.ofSeconds(amount);
                case "m":
                    return Duration.ofMinutes(amount);
                case "h":
                    return Duration.ofHours(amount);
                default:
                    return Duration.ofDays(amount);
            }
        }
        try {
            return Duration.parse(text.toUpperCase(Locale.ROOT));
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException("--timeout must be a duration like 90s, 30m, 48h or PT1H: " + text, e);
        }
    }

    private static int parsePositiveInt(final String raw, final String name) {
        final int value;
        try {
            value = Integer.parseInt(raw);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + raw, e);
        }
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return value;
    }

    private static String valueAfterPrefix(final String arg, final String prefix) {
        final String value = arg.substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException(prefix + " must have a value");
        }
        return value;
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: multibench <record|report|interactive> --plan=<path> [options]");
        stream.println("  --plan=<path>            Test plan YAML/JSON (required)");
        stream.println("  --results-dir=<dir>      Result store root (default: $" + RESULTS_DIR_ENV + " or results)");
        stream.println("  --log-file=<path>        JSON-lines log (default: <results-dir>/" + DEFAULT_LOG_FILE + ")");
        stream.println("record:");
        stream.println("  --scheduler=slurm|local  Batch scheduler (default: $" + SCHEDULER_ENV + " or slurm)");
        stream.println("  --dry-run                Print rendered job scripts instead of submitting");
        stream.println("  --no-clobber             Skip runs that already have results or a submission");
        stream.println("  --wait                   Block until every job is finished, then store results");
        stream.println("  --timeout=<duration>     Maximum wait (default: 48h)");
        stream.println("  --parallelism=<n>        Concurrent submissions (default: " + RecordOptions.DEFAULT_PARALLELISM + ")");
        stream.println("report:");
        stream.println("  --format=text|json|csv   Output format (default: text)");
        stream.println("  --output=<path>          Write the report to a file instead of stdout");
        stream.println("interactive:");
        stream.println("  commands: list, show <bench>, reload, quit");
        stream.println("  --help                   Show usage");
    }

    private record Config(
            String command,
            Path planPath,
            Path resultsDir,
            String scheduler,
            boolean dryRun,
            boolean noClobber,
            boolean waitForCompletion,
            Duration timeout,
            int parallelism,
            Path logFile,
            ReportFormat format,
            Path output,
            boolean help) {
        static Config helpOnly() {
            return new Config("help", null, null, null, false, false, false, null, 0, null, null, null, true);
        }
    }
}
