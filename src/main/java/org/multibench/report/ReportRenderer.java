package org.multibench.report;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.Document;
import org.bson.json.JsonWriterSettings;
import org.multibench.matrix.GroupKey;
import org.multibench.matrix.RunStatus;
import org.multibench.metrics.AggregatedMetric;
import org.multibench.metrics.MetricValue;
import org.multibench.plan.MetricDefinition;
import org.multibench.plan.MetricType;

/**
 * Renders aggregated results as a plain-text table, JSON or CSV. A configuration without any value for a metric
 * is shown as {@code no data} (text), {@code null} (JSON) or empty cells with count 0 (CSV), never as zero.
 */
public final class ReportRenderer {
    public static final String NO_DATA = "no data";
    private static final JsonWriterSettings JSON = JsonWriterSettings.builder().indent(true).build();
    private static final MathContext DISPLAY_PRECISION = new MathContext(6);

    private ReportRenderer() {}

    public static String render(final PlanReport report, final ReportFormat format) {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(format, "format");
        switch (format) {
            case JSON:
                return renderJson(report);
            case CSV:
                return renderCsv(report);
            case TEXT:
            default:
                return renderText(report);
        }
    }

    public static String renderText(final PlanReport report) {
        final StringBuilder sb = new StringBuilder();
        sb.append("Test plan: ").append(report.planName()).append('\n');
        for (final BenchReport bench : report.benches()) {
            sb.append('\n');
            sb.append(renderBenchText(bench));
        }
        return sb.toString();
    }

    public static String renderBenchText(final BenchReport bench) {
        final StringBuilder sb = new StringBuilder();
        sb.append("== ").append(bench.benchName());
        if (bench.errorMessage().isPresent()) {
            sb.append(" (error)\n");
            sb.append("  ").append(bench.errorMessage().get()).append('\n');
            return sb.toString();
        }
        sb.append(" (").append(bench.runCount()).append(" runs");
        for (final Map.Entry<RunStatus, Integer> entry : bench.statusCounts().entrySet()) {
            sb.append(", ").append(entry.getKey().name().toLowerCase(Locale.ROOT)).append('=').append(entry.getValue());
        }
        sb.append(")\n");

        final List<String> header = new ArrayList<>();
        header.add("configuration");
        for (final MetricDefinition metric : bench.metrics()) {
            header.add(metric.name());
        }
        final List<List<String>> rows = new ArrayList<>();
        rows.add(header);
        for (final GroupKey group : bench.groups()) {
            final List<String> row = new ArrayList<>();
            row.add(group.label());
            for (final MetricDefinition metric : bench.metrics()) {
                row.add(bench.aggregate(group, metric.name()).map(ReportRenderer::textCell).orElse(NO_DATA));
            }
            rows.add(row);
        }

        final int[] widths = new int[header.size()];
        for (final List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        for (int r = 0; r < rows.size(); r++) {
            final List<String> row = rows.get(r);
            final StringBuilder line = new StringBuilder("  ");
            for (int i = 0; i < row.size(); i++) {
                if (i > 0) {
                    line.append(" | ");
                }
                line.append(pad(row.get(i), widths[i]));
            }
            sb.append(line.toString().stripTrailing()).append('\n');
            if (r == 0) {
                final StringBuilder rule = new StringBuilder("  ");
                for (int i = 0; i < widths.length; i++) {
                    if (i > 0) {
                        rule.append("-+-");
                    }
                    rule.append("-".repeat(widths[i]));
                }
                sb.append(rule).append('\n');
            }
        }
        return sb.toString();
    }

    public static String renderJson(final PlanReport report) {
        final List<Document> benches = new ArrayList<>();
        for (final BenchReport bench : report.benches()) {
            final Document benchDocument = new Document();
            benchDocument.put("name", bench.benchName());
            if (bench.errorMessage().isPresent()) {
                benchDocument.put("error", bench.errorMessage().get());
                benches.add(benchDocument);
                continue;
            }
            final Document statuses = new Document();
            for (final Map.Entry<RunStatus, Integer> entry : bench.statusCounts().entrySet()) {
                statuses.put(entry.getKey().name(), entry.getValue());
            }
            benchDocument.put("runs", bench.runCount());
            benchDocument.put("statuses", statuses);

            final List<Document> groups = new ArrayList<>();
            for (final GroupKey group : bench.groups()) {
                final Document metrics = new Document();
                for (final MetricDefinition metric : bench.metrics()) {
                    final Optional<AggregatedMetric> aggregate = bench.aggregate(group, metric.name());
                    metrics.put(metric.name(), aggregate.map(ReportRenderer::jsonAggregate).orElse(null));
                }
                final Document groupDocument = new Document();
                groupDocument.put("label", group.label());
                groupDocument.put("axisValues", new Document(new LinkedHashMap<String, Object>(group.axisValues())));
                groupDocument.put("metrics", metrics);
                groups.add(groupDocument);
            }
            benchDocument.put("groups", groups);
            benchDocument.put("plots", new Document(bench.plots()));
            benches.add(benchDocument);
        }
        final Document root = new Document();
        root.put("plan", report.planName());
        root.put("benches", benches);
        return root.toJson(JSON);
    }

    public static String renderCsv(final PlanReport report) {
        final StringBuilder sb = new StringBuilder();
        sb.append("bench,configuration,metric,type,count,central,dispersion\n");
        for (final BenchReport bench : report.benches()) {
            for (final GroupKey group : bench.groups()) {
                for (final MetricDefinition metric : bench.metrics()) {
                    final Optional<AggregatedMetric> aggregate = bench.aggregate(group, metric.name());
                    final List<String> cells = new ArrayList<>();
                    cells.add(bench.benchName());
                    cells.add(group.label());
                    cells.add(metric.name());
                    cells.add(metric.type().value());
                    if (aggregate.isPresent()) {
                        cells.add(Integer.toString(aggregate.get().count()));
                        cells.add(centralText(aggregate.get()));
                        cells.add(formatNumber(aggregate.get().dispersion()));
                    } else {
                        cells.add("0");
                        cells.add("");
                        cells.add("");
                    }
                    appendCsvRow(sb, cells);
                }
            }
        }
        return sb.toString();
    }

    static String formatNumber(final double value) {
        if (value == 0.0) {
            return "0";
        }
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        return new BigDecimal(value).round(DISPLAY_PRECISION).stripTrailingZeros().toPlainString();
    }

    private static String textCell(final AggregatedMetric aggregate) {
        if (aggregate.type() == MetricType.TEXTUAL) {
            return aggregate.central().textValue() + " (n=" + aggregate.count() + ")";
        }
        return formatNumber(aggregate.mean()) + " ± " + formatNumber(aggregate.dispersion()) + " (n=" + aggregate.count() + ")";
    }

    private static String centralText(final AggregatedMetric aggregate) {
        final MetricValue central = aggregate.central();
        return central.kind() == MetricValue.Kind.NUMERIC ? formatNumber(central.numericValue()) : central.textValue();
    }

    private static Document jsonAggregate(final AggregatedMetric aggregate) {
        final Document document = new Document();
        document.put("type", aggregate.type().value());
        document.put("count", aggregate.count());
        if (aggregate.type() == MetricType.NUMERIC) {
            document.put("mean", aggregate.mean());
        } else {
            document.put("mode", aggregate.central().textValue());
        }
        document.put("dispersion", aggregate.dispersion());
        return document;
    }

    private static void appendCsvRow(final StringBuilder sb, final List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(csvCell(cells.get(i)));
        }
        sb.append('\n');
    }

    private static String csvCell(final String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    private static String pad(final String value, final int width) {
        if (value.length() >= width) {
            return value;
        }
        return value + " ".repeat(width - value.length());
    }
}
