package org.multibench.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestPlanLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void loadsYamlPlanWithAxesMetricsAndDisabledBench() throws Exception {
        TestPlan plan = TestPlanLoader.load(fixture("scaling.yaml"));

        assertEquals("scaling-study", plan.name());
        assertEquals(2, plan.benches().size());
        assertEquals(1, plan.enabledBenches().size());
        assertFalse(plan.bench("weak-scaling").orElseThrow().enabled());

        TestBench bench = plan.enabledBenches().get(0);
        assertEquals("strong-scaling", bench.name());
        assertEquals(2, bench.reruns());
        assertEquals(List.of("1", "2", "4"), bench.axes().get(0).values());
        assertEquals(6L, bench.expansionSize());
        assertEquals(Map.of("size", "1024"), bench.baseConfiguration().variables());
        assertEquals("1", bench.baseConfiguration().directives().get("nodes"));
        assertEquals(List.of("gcc/12"), bench.baseConfiguration().moduleLoads());

        MetricDefinition time = bench.metric("time_s").orElseThrow();
        assertEquals(MetricType.NUMERIC, time.type());
        assertEquals(MetricTarget.STDERR, time.target());
        assertTrue(time.pattern().matcher("real 1.25").find());

        MetricDefinition solver = bench.metric("solver").orElseThrow();
        assertEquals(MetricType.TEXTUAL, solver.type());
        assertEquals(MetricTarget.STDOUT, solver.target());

        assertTrue(bench.plots().containsKey("speedup"));
    }

    @Test
    void loadsJsonPlanAndResolvesTemplateRelativeToPlanDirectory() throws Exception {
        Path planFile = tempDir.resolve("single.json");
        Files.copy(fixture("single.json"), planFile);

        TestPlan plan = TestPlanLoader.load(planFile);

        assertEquals("smoke", plan.name());
        assertEquals(
                tempDir.toAbsolutePath().normalize().resolve("templates/job.sh"),
                plan.submissionTemplateFile().orElseThrow());
        TestBench bench = plan.benches().get(0);
        assertEquals(3, bench.reruns());
        assertTrue(bench.axes().isEmpty());
        assertEquals(MetricTarget.file("result.txt"), bench.metric("throughput").orElseThrow().target());
    }

    @Test
    void reportsEveryValidationIssueAtOnce() throws Exception {
        ConfigException error = assertThrows(ConfigException.class, () -> TestPlanLoader.load(fixture("invalid.yaml")));

        List<String> errors = error.errors();
        assertEquals(5, errors.size(), errors.toString());
        assertTrue(errors.contains("benches[0].reruns must be > 0 (actual: 0)"));
        assertTrue(errors.contains("benches[0].axes[0].values contains duplicate value '1'"));
        assertTrue(errors.contains("benches[0].config.run references unknown variable '{missing}'"));
        assertTrue(errors.contains("benches[0].metrics[0].pattern must have exactly one capture group (actual: 0)"));
        assertTrue(errors.contains("benches[1].name duplicates bench 'one'"));
        assertTrue(error.getMessage().startsWith("test plan configuration is invalid (5 issue(s))"));
    }

    @Test
    void rejectsMissingFile() {
        ConfigException error = assertThrows(
                ConfigException.class, () -> TestPlanLoader.load(tempDir.resolve("absent.yaml")));
        assertTrue(error.errors().get(0).startsWith("plan path does not exist"));
    }

    @Test
    void rejectsUnparsableDocument() throws Exception {
        Path planFile = tempDir.resolve("broken.json");
        Files.writeString(planFile, "{\"name\": ", StandardCharsets.UTF_8);

        ConfigException error = assertThrows(ConfigException.class, () -> TestPlanLoader.load(planFile));
        assertTrue(error.errors().get(0).startsWith("plan document could not be parsed"));
    }

    @Test
    void rejectsWrongShapesWithFieldPath() {
        String yaml = String.join("\n",
                "name: shapes",
                "benches:",
                "  - name: b",
                "    config: not-an-object");

        ConfigException error = assertThrows(
                ConfigException.class, () -> TestPlanLoader.parse(yaml, "plan.yaml", null));
        assertEquals(List.of("benches[0].config must be an object"), error.errors());
    }

    @Test
    void rejectsUnknownMetricTarget() {
        String yaml = String.join("\n",
                "name: targets",
                "benches:",
                "  - name: b",
                "    config:",
                "      run: ./app",
                "    metrics:",
                "      - name: m",
                "        pattern: 'x=(\\d+)'",
                "        target: socket");

        ConfigException error = assertThrows(
                ConfigException.class, () -> TestPlanLoader.parse(yaml, "plan.yml", null));
        assertTrue(error.errors().get(0).contains("benches[0].metrics[0].target must be one of"));
    }

    @Test
    void reportsEveryBadMetricFieldTogetherWithValidationErrors() {
        String yaml = String.join("\n",
                "name: metrics",
                "benches:",
                "  - name: b",
                "    reruns: 0",
                "    config:",
                "      run: ./app",
                "    metrics:",
                "      - name: broken-regex",
                "        pattern: 'x=(\\d+'",
                "      - name: bad-target",
                "        pattern: 'y=(\\d+)'",
                "        target: socket",
                "        type: boolean",
                "      - name: good",
                "        pattern: 'z=(\\d+)'");

        ConfigException error = assertThrows(
                ConfigException.class, () -> TestPlanLoader.parse(yaml, "plan.yaml", null));
        List<String> errors = error.errors();
        assertEquals(4, errors.size(), errors.toString());
        assertTrue(errors.get(0).startsWith("benches[0].metrics[0].pattern is not a valid regular expression"));
        assertTrue(errors.get(1).startsWith("benches[0].metrics[1].target must be one of"));
        assertTrue(errors.get(2).startsWith("benches[0].metrics[1].type must be one of: numeric|textual"));
        assertEquals("benches[0].reruns must be > 0 (actual: 0)", errors.get(3));
    }

    @Test
    void rejectsFractionalAndOversizedRerunCounts() {
        for (String reruns : List.of("3.7", "1e10", "10000000000")) {
            String json = "{\"name\": \"p\", \"benches\": [{\"name\": \"b\", \"reruns\": " + reruns
                    + ", \"config\": {\"run\": \"./app\"}}]}";

            ConfigException error = assertThrows(
                    ConfigException.class, () -> TestPlanLoader.parse(json, "plan.json", null), reruns);
            assertEquals(1, error.errors().size(), error.errors().toString());
            assertTrue(error.errors().get(0).startsWith("benches[0].reruns must be an integer")
                    || error.errors().get(0).startsWith("benches[0].reruns is out of range"), error.errors().toString());
        }
    }

    @Test
    void emptyYamlDocumentIsRejected() {
        ConfigException error = assertThrows(ConfigException.class, () -> TestPlanLoader.parse("", "plan.yaml", null));
        assertEquals(List.of("plan document is empty"), error.errors());
    }

    static Path fixture(String name) throws URISyntaxException {
        return Path.of(TestPlanLoaderTest.class.getResource("/plans/" + name).toURI());
    }
}
