package org.multibench.plan;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Named extraction rule: a pattern with exactly one capture group, the artifact it reads and the value type.
 */
public record MetricDefinition(String name, Pattern pattern, MetricTarget target, MetricType type) {
    public MetricDefinition {
        name = Objects.requireNonNull(name, "name").trim();
        pattern = Objects.requireNonNull(pattern, "pattern");
        target = Objects.requireNonNull(target, "target");
        type = Objects.requireNonNull(type, "type");
    }

    public static MetricDefinition numeric(final String name, final String regex, final MetricTarget target) {
        return new MetricDefinition(name, Pattern.compile(regex, Pattern.MULTILINE), target, MetricType.NUMERIC);
    }

    public static MetricDefinition textual(final String name, final String regex, final MetricTarget target) {
        return new MetricDefinition(name, Pattern.compile(regex, Pattern.MULTILINE), target, MetricType.TEXTUAL);
    }

    /**
     * Parses one metric entry. Shape errors throw; an invalid pattern, target or type is added to {@code problems}
     * so that a single load reports all of them, and the entry is then dropped.
     */
    static Optional<MetricDefinition> fromMap(
            final Map<String, Object> root, final String path, final List<String> problems) {
        final String name = ConfigValues.requireText(root.get("name"), path + ".name");
        final String regex = ConfigValues.requireText(root.get("pattern"), path + ".pattern");
        final String rawTarget = ConfigValues.optionalText(root.get("target"), path + ".target");
        final String rawType = ConfigValues.optionalText(
                root.getOrDefault("type", MetricType.NUMERIC.value()), path + ".type");

        final int problemsBefore = problems.size();
        Pattern pattern = null;
        try {
            pattern = Pattern.compile(regex, Pattern.MULTILINE);
        } catch (final PatternSyntaxException exception) {
            problems.add(path + ".pattern is not a valid regular expression: " + exception.getDescription());
        }
        MetricTarget target = null;
        try {
            target = MetricTarget.fromText(rawTarget, path + ".target");
        } catch (final IllegalArgumentException exception) {
            problems.add(exception.getMessage());
        }
        MetricType type = null;
        try {
            type = MetricType.fromText(rawType, path + ".type");
        } catch (final IllegalArgumentException exception) {
            problems.add(exception.getMessage());
        }
        if (problems.size() > problemsBefore) {
            return Optional.empty();
        }
        return Optional.of(new MetricDefinition(name, pattern, target, type));
    }

    public int captureGroupCount() {
        return pattern.matcher("").groupCount();
    }
}
