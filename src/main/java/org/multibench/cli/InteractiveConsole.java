package org.multibench.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.multibench.engine.TestPlanReporter;
import org.multibench.plan.ConfigException;
import org.multibench.plan.TestBench;
import org.multibench.plan.TestPlan;
import org.multibench.plan.TestPlanLoader;
import org.multibench.report.BenchReport;
import org.multibench.report.PlanReport;
import org.multibench.report.ReportRenderer;

/**
 * Line-based browser over the report of one plan: {@code list}, {@code show <bench>}, {@code reload},
 * {@code help}, {@code quit}.
 */
final class InteractiveConsole {
    private static final String PROMPT = "multibench> ";

    private final Path planPath;
    private final TestPlanReporter reporter;
    private final BufferedReader in;
    private final PrintStream out;

    private TestPlan plan;
    private PlanReport report;

    InteractiveConsole(
            final Path planPath,
            final TestPlanReporter reporter,
            final BufferedReader in,
            final PrintStream out) {
        this.planPath = Objects.requireNonNull(planPath, "planPath");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Loads the plan and serves commands until {@code quit} or end of input.
     */
    void run() throws IOException {
        load();
        out.println("Test plan " + plan.name() + " (" + plan.benches().size() + " benches). Type 'help' for commands.");
        while (true) {
            out.print(PROMPT);
            out.flush();
            final String line = in.readLine();
            if (line == null) {
                out.println();
                return;
            }
            final String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            final String[] parts = trimmed.split("\\s+", 2);
            final String command = parts[0].toLowerCase(Locale.ROOT);
            final String argument = parts.length > 1 ? parts[1].trim() : "";
            switch (command) {
                case "quit":
                case "exit":
                    return;
                case "help":
                    printHelp();
                    break;
                case "list":
                    list();
                    break;
                case "show":
                    show(argument);
                    break;
                case "reload":
                    reload();
                    break;
                default:
                    out.println("unknown command: " + command + " (type 'help')");
                    break;
            }
        }
    }

    private void load() throws IOException {
        plan = TestPlanLoader.load(planPath);
        report = reporter.report(plan);
    }

    private void reload() throws IOException {
        try {
            load();
            out.println("reloaded " + plan.name());
        } catch (final ConfigException exception) {
            out.println(exception.getMessage());
            out.println("keeping the previously loaded plan");
        }
    }

    private void list() {
        for (final TestBench bench : plan.benches()) {
            final Optional<BenchReport> benchReport = report.bench(bench.name());
            final StringBuilder line = new StringBuilder("  ").append(bench.name());
            if (!bench.enabled()) {
                line.append("  [disabled]");
            } else if (benchReport.isPresent() && benchReport.get().errorMessage().isPresent()) {
                line.append("  [error]");
            } else if (benchReport.isPresent()) {
                line.append("  runs=").append(benchReport.get().runCount())
                    .append(" configurations=").append(benchReport.get().groups().size())
                    .append(" metrics=").append(bench.metrics().size());
            }
            out.println(line);
        }
    }

    private void show(final String benchName) {
        if (benchName.isEmpty()) {
            out.println("usage: show <bench>");
            return;
        }
        final Optional<BenchReport> benchReport = report.bench(benchName);
        if (benchReport.isEmpty()) {
            out.println("no enabled bench named '" + benchName + "'");
            return;
        }
        out.print(ReportRenderer.renderBenchText(benchReport.get()));
    }

    private void printHelp() {
        out.println("  list            list benches with run and configuration counts");
        out.println("  show <bench>    print the aggregated metrics of a bench");
        out.println("  reload          re-read the plan and the stored results");
        out.println("  quit            leave");
    }
}
