package org.multibench.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.bson.Document;
import org.bson.json.JsonParseException;

/**
 * Staging directory of one live job: the rendered script, the raw output streams the job writes, its exit code
 * file and an {@code outputs/} directory for named output files.
 */
public final class RunWorkspace {
    public static final String SCRIPT_FILE = "job.sh";
    public static final String STDOUT_FILE = "stdout.log";
    public static final String STDERR_FILE = "stderr.log";
    public static final String EXIT_CODE_FILE = "exit_code";
    public static final String OUTPUTS_DIR = "outputs";
    public static final String SUBMISSION_FILE = "submission.json";
    public static final String CLAIM_FILE = "claim";

    private final String runId;
    private final Path directory;

    RunWorkspace(final String runId, final Path directory) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public String runId() {
        return runId;
    }

    public Path directory() {
        return directory;
    }

    public Path scriptFile() {
        return directory.resolve(SCRIPT_FILE);
    }

    public Path stdoutFile() {
        return directory.resolve(STDOUT_FILE);
    }

    public Path stderrFile() {
        return directory.resolve(STDERR_FILE);
    }

    public Path exitCodeFile() {
        return directory.resolve(EXIT_CODE_FILE);
    }

    public Path outputsDirectory() {
        return directory.resolve(OUTPUTS_DIR);
    }

    public Path submissionFile() {
        return directory.resolve(SUBMISSION_FILE);
    }

    public Path claimFile() {
        return directory.resolve(CLAIM_FILE);
    }

    /**
     * Creates the staging directory and its {@code outputs/} subdirectory.
     */
    public RunWorkspace prepare() throws IOException {
        Files.createDirectories(outputsDirectory());
        return this;
    }

    public boolean exists() {
        return Files.isDirectory(directory);
    }

    public void writeScript(final String content) throws IOException {
        prepare();
        Files.writeString(scriptFile(), content, StandardCharsets.UTF_8);
    }

    /**
     * Records that a job was submitted for this run, so that a later invocation does not submit it again.
     */
    public void writeSubmissionRecord(final String jobId) throws IOException {
        prepare();
        final Document record = new Document();
        record.put("runId", runId);
        record.put("jobId", jobId);
        record.put("submittedAt", Instant.now().toString());
        Files.writeString(submissionFile(), record.toJson(), StandardCharsets.UTF_8);
    }

    /**
     * Atomically takes ownership of this run for one submission. Returns false when another invocation already
     * claimed or submitted it.
     */
    public boolean claim() throws IOException {
        prepare();
        if (hasSubmissionRecord()) {
            return false;
        }
        try {
            Files.createFile(claimFile());
            return true;
        } catch (final FileAlreadyExistsException exception) {
            return false;
        }
    }

    /**
     * Gives up a claim whose submission never happened, so a later no-clobber invocation can retry the run.
     */
    public void releaseClaim() throws IOException {
        Files.deleteIfExists(claimFile());
    }

    public boolean hasSubmissionRecord() {
        return Files.isRegularFile(submissionFile());
    }

    /**
     * Job id from the submission record, if one was written and is readable.
     */
    public Optional<String> submittedJobId() throws IOException {
        if (!hasSubmissionRecord()) {
            return Optional.empty();
        }
        try {
            final Document record = Document.parse(Files.readString(submissionFile(), StandardCharsets.UTF_8));
            return Optional.ofNullable(record.getString("jobId"));
        } catch (final JsonParseException | ClassCastException exception) {
            return Optional.empty();
        }
    }

    public boolean hasExitArtifact() {
        return Files.isRegularFile(exitCodeFile());
    }

    /**
     * Exit code written by the job script. Empty when the file is absent or does not hold an integer yet.
     */
    public Optional<Integer> readExitCode() throws IOException {
        if (!hasExitArtifact()) {
            return Optional.empty();
        }
        final String text = Files.readString(exitCodeFile(), StandardCharsets.UTF_8).trim();
        try {
            return Optional.of(Integer.parseInt(text));
        } catch (final NumberFormatException exception) {
            return Optional.empty();
        }
    }
}
