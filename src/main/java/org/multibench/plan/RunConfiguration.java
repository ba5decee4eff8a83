package org.multibench.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Program configuration of a bench: template variables plus the command templates that make up one batch job.
 *
 * <p>The same type describes both the base configuration (templates may contain {@code {name}} placeholders)
 * and a resolved configuration of a run instance (every placeholder substituted).
 */
public record RunConfiguration(
        Map<String, String> variables,
        String buildCommand,
        String runCommand,
        String args,
        String directory,
        List<String> moduleLoads,
        Map<String, String> environment,
        Map<String, String> directives,
        List<String> postCommands) {
    public RunConfiguration {
        variables = copyOf(variables);
        buildCommand = buildCommand == null ? "" : buildCommand;
        runCommand = Objects.requireNonNull(runCommand, "runCommand");
        if (runCommand.isBlank()) {
            throw new IllegalArgumentException("runCommand must not be blank");
        }
        moduleLoads = moduleLoads == null ? List.of() : List.copyOf(moduleLoads);
        environment = copyOf(environment);
        directives = copyOf(directives);
        postCommands = postCommands == null ? List.of() : List.copyOf(postCommands);
    }

    public static RunConfiguration of(
            final Map<String, String> variables,
            final String buildCommand,
            final String runCommand) {
        return new RunConfiguration(variables, buildCommand, runCommand, null, null, null, null, null, null);
    }

    static RunConfiguration fromMap(final Map<String, Object> root, final String path) {
        return new RunConfiguration(
                ConfigValues.asTextMap(root.get("variables"), path + ".variables"),
                ConfigValues.optionalText(root.get("build"), path + ".build"),
                ConfigValues.requireText(root.get("run"), path + ".run"),
                ConfigValues.optionalText(root.get("args"), path + ".args"),
                ConfigValues.optionalText(root.get("directory"), path + ".directory"),
                ConfigValues.asTextList(root.get("moduleLoads"), path + ".moduleLoads"),
                ConfigValues.asTextMap(root.get("environment"), path + ".environment"),
                ConfigValues.asTextMap(root.get("directives"), path + ".directives"),
                ConfigValues.asTextList(root.get("postCommands"), path + ".postCommands"));
    }

    /**
     * Every template string of this configuration keyed by its document path, in a stable order.
     * Variables are values, not templates, and are not included.
     */
    public Map<String, String> templates() {
        final Map<String, String> templates = new LinkedHashMap<>();
        templates.put("build", buildCommand);
        templates.put("run", runCommand);
        if (args != null) {
            templates.put("args", args);
        }
        if (directory != null) {
            templates.put("directory", directory);
        }
        for (int i = 0; i < moduleLoads.size(); i++) {
            templates.put("moduleLoads[" + i + "]", moduleLoads.get(i));
        }
        for (final Map.Entry<String, String> entry : environment.entrySet()) {
            templates.put("environment." + entry.getKey(), entry.getValue());
        }
        for (final Map.Entry<String, String> entry : directives.entrySet()) {
            templates.put("directives." + entry.getKey(), entry.getValue());
        }
        for (int i = 0; i < postCommands.size(); i++) {
            templates.put("postCommands[" + i + "]", postCommands.get(i));
        }
        return Collections.unmodifiableMap(templates);
    }

    /**
     * Rewrites every template through {@code render}, which receives the template path and text.
     */
    public RunConfiguration mapTemplates(
            final Map<String, String> resolvedVariables,
            final BiFunction<String, String, String> render) {
        Objects.requireNonNull(render, "render");
        final Map<String, String> environmentOut = new LinkedHashMap<>();
        for (final Map.Entry<String, String> entry : environment.entrySet()) {
            environmentOut.put(entry.getKey(), render.apply("environment." + entry.getKey(), entry.getValue()));
        }
        final Map<String, String> directivesOut = new LinkedHashMap<>();
        for (final Map.Entry<String, String> entry : directives.entrySet()) {
            directivesOut.put(entry.getKey(), render.apply("directives." + entry.getKey(), entry.getValue()));
        }
        return new RunConfiguration(
                resolvedVariables,
                render.apply("build", buildCommand),
                render.apply("run", runCommand),
                args == null ? null : render.apply("args", args),
                directory == null ? null : render.apply("directory", directory),
                mapList("moduleLoads", moduleLoads, render),
                environmentOut,
                directivesOut,
                mapList("postCommands", postCommands, render));
    }

    private static List<String> mapList(
            final String path,
            final List<String> source,
            final BiFunction<String, String, String> render) {
        final List<String> mapped = new ArrayList<>(source.size());
        for (int i = 0; i < source.size(); i++) {
            mapped.add(render.apply(path + "[" + i + "]", source.get(i)));
        }
        return mapped;
    }

    private static Map<String, String> copyOf(final Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
