package org.multibench.plan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonInvalidOperationException;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads test plan documents (JSON or YAML) and validates them.
 */
public final class TestPlanLoader {
    private TestPlanLoader() {}

    public static TestPlan load(final Path planPath) throws IOException {
        Objects.requireNonNull(planPath, "planPath");
        final Path normalized = planPath.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            throw new ConfigException(List.of("plan path does not exist: " + normalized));
        }
        if (!Files.isRegularFile(normalized)) {
            throw new ConfigException(List.of("plan path must be a file: " + normalized));
        }

        final String content = Files.readString(normalized, StandardCharsets.UTF_8);
        return parse(content, normalized.getFileName().toString(), normalized.getParent());
    }

    public static TestPlan parse(final String content, final String sourceName, final Path baseDirectory) {
        Objects.requireNonNull(content, "content");
        final String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        final Map<String, Object> root;
        try {
            if (normalizedName.endsWith(".yaml") || normalizedName.endsWith(".yml")) {
                root = parseYaml(content);
            } else {
                root = new LinkedHashMap<>(Document.parse(content));
            }
        } catch (final YAMLException | JsonParseException | BsonInvalidOperationException exception) {
            throw new ConfigException("plan document could not be parsed: " + exception.getMessage(), exception);
        }

        final List<String> errors = new ArrayList<>();
        final TestPlan plan;
        try {
            plan = TestPlan.fromMap(root, baseDirectory, errors);
        } catch (final ConfigException exception) {
            throw exception;
        } catch (final IllegalArgumentException exception) {
            throw new ConfigException(exception.getMessage(), exception);
        }
        errors.addAll(TestPlanValidator.validate(plan));
        if (!errors.isEmpty()) {
            throw new ConfigException(errors);
        }
        return plan;
    }

    private static Map<String, Object> parseYaml(final String content) {
        final Object root = new Yaml().load(content);
        if (root == null) {
            throw new ConfigException(List.of("plan document is empty"));
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new ConfigException(List.of("plan document root must be an object"));
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return normalized;
    }
}
