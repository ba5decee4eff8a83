package org.multibench.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.multibench.engine.TestPlanReporter;
import org.multibench.store.ResultStore;

class InteractiveConsoleTest {
    @TempDir
    Path tempDir;

    @Test
    void listsShowsAndRejectsUnknownCommands() throws Exception {
        final String output = session("list\nshow strong-scaling\nshow weak-scaling\nshow\nplot\nhelp\nquit\nlist\n");

        assertTrue(output.contains("multibench> "));
        assertTrue(output.contains("strong-scaling  runs=6 configurations=3 metrics=2"));
        assertTrue(output.contains("no data"));
        assertTrue(output.contains("no enabled bench named 'weak-scaling'"));
        assertTrue(output.contains("usage: show <bench>"));
        assertTrue(output.contains("unknown command: plot (type 'help')"));
        assertTrue(output.contains("reload          re-read the plan and the stored results"));
        // nothing is read after quit
        assertEquals(output.indexOf("runs=6"), output.lastIndexOf("runs=6"));
    }

    @Test
    void reloadKeepsPreviousPlanWhenTheFileBecomesInvalid() throws Exception {
        final Path plan = tempDir.resolve("plan.yaml");
        Files.copy(fixture("scaling.yaml"), plan);
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        final BufferedReader in = new BufferedReader(new StringReader("reload\nreload\n")) {
            private int lines;

            @Override
            public String readLine() throws IOException {
                if (++lines == 2) {
                    Files.writeString(plan, "name: [unclosed", StandardCharsets.UTF_8);
                }
                return super.readLine();
            }
        };

        new InteractiveConsole(plan, reporter(), in, new PrintStream(outBytes, true, StandardCharsets.UTF_8)).run();

        final String output = outBytes.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("reloaded scaling-study"));
        assertTrue(output.contains("keeping the previously loaded plan"));
    }

    private String session(final String commands) throws Exception {
        final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        new InteractiveConsole(
                fixture("scaling.yaml"),
                reporter(),
                new BufferedReader(new StringReader(commands)),
                new PrintStream(outBytes, true, StandardCharsets.UTF_8)).run();
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private TestPlanReporter reporter() {
        return new TestPlanReporter(new ResultStore(tempDir.resolve("results")), null);
    }

    private static Path fixture(final String name) throws Exception {
        return Path.of(InteractiveConsoleTest.class.getResource("/plans/" + name).toURI());
    }
}
