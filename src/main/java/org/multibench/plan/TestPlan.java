package org.multibench.plan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Top-level named, ordered collection of test benches.
 */
public record TestPlan(String name, Path submissionTemplate, List<TestBench> benches) {
    public TestPlan {
        name = Objects.requireNonNull(name, "name").trim();
        benches = List.copyOf(Objects.requireNonNull(benches, "benches"));
    }

    public static TestPlan of(final String name, final List<TestBench> benches) {
        return new TestPlan(name, null, benches);
    }

    /**
     * Builds the plan from a parsed document. Value errors that do not stop parsing are appended to {@code problems}.
     */
    static TestPlan fromMap(final Map<String, Object> root, final Path baseDirectory, final List<String> problems) {
        Objects.requireNonNull(root, "root");
        final String name = ConfigValues.requireText(root.get("name"), "name");
        final String templateText = ConfigValues.optionalText(root.get("submissionTemplate"), "submissionTemplate");
        Path template = null;
        if (templateText != null) {
            template = Path.of(templateText);
            if (!template.isAbsolute() && baseDirectory != null) {
                template = baseDirectory.resolve(template).normalize();
            }
        }

        final List<Object> rawBenches = ConfigValues.asList(root.get("benches"), "benches");
        final List<TestBench> benches = new ArrayList<>(rawBenches.size());
        for (int i = 0; i < rawBenches.size(); i++) {
            final String path = "benches[" + i + "]";
            benches.add(TestBench.fromMap(ConfigValues.asStringMap(rawBenches.get(i), path), path, problems));
        }
        return new TestPlan(name, template, benches);
    }

    public Optional<Path> submissionTemplateFile() {
        return Optional.ofNullable(submissionTemplate);
    }

    public List<TestBench> enabledBenches() {
        final List<TestBench> enabled = new ArrayList<>(benches.size());
        for (final TestBench bench : benches) {
            if (bench.enabled()) {
                enabled.add(bench);
            }
        }
        return List.copyOf(enabled);
    }

    public Optional<TestBench> bench(final String benchName) {
        for (final TestBench bench : benches) {
            if (bench.name().equals(benchName)) {
                return Optional.of(bench);
            }
        }
        return Optional.empty();
    }
}
