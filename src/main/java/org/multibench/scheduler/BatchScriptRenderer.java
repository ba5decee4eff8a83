package org.multibench.scheduler;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.multibench.matrix.RunInstance;
import org.multibench.plan.RunConfiguration;
import org.multibench.store.RunWorkspace;

/**
 * Renders a run instance into batch script text by filling the {@code {{slot}}} markers of a submission template.
 *
 * <p>Slots: {@code directives}, {@code moduleLoads}, {@code environment}, {@code directory}, {@code build},
 * {@code run}, {@code post}, {@code runId}, {@code instantiation}, {@code stdoutPath}, {@code stderrPath},
 * {@code outputDir}, {@code exitCodePath}.
 */
public final class BatchScriptRenderer {
    public static final String DEFAULT_TEMPLATE_RESOURCE = "slurm-job.sh.template";
    static final String TIME_COMMAND = "time -p ";

    private static final Pattern SLOT = Pattern.compile("\\{\\{([A-Za-z]+)}}");
    private static final Set<String> SLOTS = Set.of(
        "directives",
        "moduleLoads",
        "environment",
        "directory",
        "build",
        "run",
        "post",
        "runId",
        "instantiation",
        "stdoutPath",
        "stderrPath",
        "outputDir",
        "exitCodePath"
    );
    // Placement of these is owned by the engine.
    private static final Set<String> RESERVED_DIRECTIVES = Set.of("output", "error");

    private final String template;

    private BatchScriptRenderer(final String template) {
        this.template = Objects.requireNonNull(template, "template");
        final Matcher matcher = SLOT.matcher(template);
        while (matcher.find()) {
            if (!SLOTS.contains(matcher.group(1))) {
                throw new IllegalArgumentException("unknown submission template slot: {{" + matcher.group(1) + "}}");
            }
        }
    }

    public static BatchScriptRenderer fromTemplate(final String template) {
        return new BatchScriptRenderer(template);
    }

    public static BatchScriptRenderer fromFile(final Path templateFile) throws IOException {
        return new BatchScriptRenderer(Files.readString(templateFile, StandardCharsets.UTF_8));
    }

    public static BatchScriptRenderer defaultTemplate() {
        try (InputStream in = BatchScriptRenderer.class.getResourceAsStream(DEFAULT_TEMPLATE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("missing classpath resource " + DEFAULT_TEMPLATE_RESOURCE);
            }
            return new BatchScriptRenderer(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (final IOException exception) {
            throw new IllegalStateException("failed to read " + DEFAULT_TEMPLATE_RESOURCE, exception);
        }
    }

    public RenderedScript render(final RunInstance instance, final RunWorkspace workspace) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(workspace, "workspace");
        final RunConfiguration configuration = instance.configuration();
        final List<String> warnings = new ArrayList<>();

        final Map<String, String> slots = new LinkedHashMap<>();
        slots.put("directives", directives(instance, workspace, warnings));
        slots.put("moduleLoads", moduleLoads(configuration.moduleLoads()));
        slots.put("environment", environment(configuration.environment()));
        slots.put("directory", configuration.directory() == null ? "" : "cd " + doubleQuoted(configuration.directory()));
        slots.put("build", configuration.buildCommand());
        slots.put("run", runLine(configuration));
        slots.put("post", post(configuration.postCommands()));
        slots.put("runId", singleQuotedBody(instance.id()));
        slots.put("instantiation", singleQuotedBody(instantiation(instance.axisValues())));
        slots.put("stdoutPath", workspace.stdoutFile().toString());
        slots.put("stderrPath", workspace.stderrFile().toString());
        slots.put("outputDir", singleQuotedBody(workspace.outputsDirectory().toString()));
        slots.put("exitCodePath", singleQuotedBody(workspace.exitCodeFile().toString()));

        final Matcher matcher = SLOT.matcher(template);
        final StringBuilder sb = new StringBuilder(template.length() + 256);
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(slots.get(matcher.group(1))));
        }
        matcher.appendTail(sb);
        return new RenderedScript(sb.toString(), warnings);
    }

    /**
     * Run instantiation as echoed into the job output, e.g. {@code threads=4,size=1024}.
     */
    static String instantiation(final Map<String, String> axisValues) {
        if (axisValues.isEmpty()) {
            return "base";
        }
        final StringBuilder sb = new StringBuilder();
        for (final Map.Entry<String, String> entry : axisValues.entrySet()) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue().replace("/", "").replace(' ', '_'));
        }
        return sb.toString();
    }

    private static String directives(
            final RunInstance instance,
            final RunWorkspace workspace,
            final List<String> warnings) {
        final StringBuilder sb = new StringBuilder();
        final Map<String, String> directives = instance.configuration().directives();
        for (final Map.Entry<String, String> entry : directives.entrySet()) {
            if (RESERVED_DIRECTIVES.contains(entry.getKey())) {
                warnings.add("directive '" + entry.getKey() + "' is ignored; job output is always captured by the engine");
                continue;
            }
            sb.append("#SBATCH --").append(entry.getKey()).append('=').append(entry.getValue()).append('\n');
        }
        if (!directives.containsKey("job-name")) {
            sb.append("#SBATCH --job-name=").append(instance.id()).append('\n');
        }
        sb.append("#SBATCH --output=").append(workspace.stdoutFile()).append('\n');
        sb.append("#SBATCH --error=").append(workspace.stderrFile());
        return sb.toString();
    }

    private static String moduleLoads(final List<String> modules) {
        if (modules.isEmpty()) {
            return "";
        }
        return "echo '=== MODULE LOADS ==='\nmodule purge\nmodule load " + String.join(" ", modules);
    }

    private static String environment(final Map<String, String> environment) {
        if (environment.isEmpty()) {
            return "";
        }
        final StringBuilder sb = new StringBuilder("echo '=== ENVIRONMENT VARIABLES ==='");
        for (final Map.Entry<String, String> entry : environment.entrySet()) {
            sb.append('\n').append("export ").append(entry.getKey()).append('=').append(doubleQuoted(entry.getValue()));
            sb.append('\n').append("echo '").append(singleQuotedBody(entry.getKey() + "=" + entry.getValue())).append('\'');
        }
        return sb.toString();
    }

    private static String runLine(final RunConfiguration configuration) {
        if (configuration.args() == null) {
            return TIME_COMMAND + configuration.runCommand();
        }
        return TIME_COMMAND + configuration.runCommand() + " " + configuration.args();
    }

    private static String post(final List<String> postCommands) {
        if (postCommands.isEmpty()) {
            return "";
        }
        return "echo '===== POST RUN ====='\n" + String.join("\n", postCommands);
    }

    // Keeps $VAR expansion while protecting spaces.
    private static String doubleQuoted(final String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("`", "\\`") + "\"";
    }

    private static String singleQuotedBody(final String value) {
        return value.replace("'", "'\\''");
    }

    /**
     * Script text plus non-fatal problems found while rendering it.
     */
    public record RenderedScript(String content, List<String> warnings) {
        public RenderedScript {
            Objects.requireNonNull(content, "content");
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }
}
