package org.multibench.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.bson.json.JsonWriterSettings;
import org.multibench.matrix.RunInstance;
import org.multibench.matrix.RunStatus;
import org.multibench.plan.RunConfiguration;

/**
 * Run-keyed result directory.
 *
 * <pre>
 * &lt;root&gt;/&lt;runId&gt;/status.json
 * &lt;root&gt;/&lt;runId&gt;/stdout.log
 * &lt;root&gt;/&lt;runId&gt;/stderr.log
 * &lt;root&gt;/&lt;runId&gt;/files/&lt;name&gt;
 * &lt;root&gt;/.staging/&lt;runId&gt;/...   live job workspace
 * </pre>
 *
 * <p>A run directory only ever appears through an atomic rename of a fully written temporary directory, so
 * readers never observe a partially persisted run and a no-clobber write cannot replace a concurrent one.
 */
public final class ResultStore {
    public static final String STATUS_FILE = "status.json";
    static final String STDOUT_FILE = "stdout.log";
    static final String STDERR_FILE = "stderr.log";
    static final String FILES_DIR = "files";
    static final String STAGING_DIR = ".staging";
    private static final String TEMP_PREFIX = ".tmp-";
    private static final JsonWriterSettings STATUS_JSON = JsonWriterSettings.builder().indent(true).build();

    private final Path root;

    public ResultStore(final Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path runDirectory(final String runId) {
        return root.resolve(requireRunId(runId));
    }

    public RunWorkspace workspace(final String runId) {
        return new RunWorkspace(runId, root.resolve(STAGING_DIR).resolve(requireRunId(runId)));
    }

    public boolean exists(final String runId) {
        return Files.isRegularFile(runDirectory(runId).resolve(STATUS_FILE));
    }

    public PersistOutcome persist(final RunInstance instance, final RunArtifacts artifacts, final WriteMode mode)
            throws StoreException {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(artifacts, "artifacts");
        Objects.requireNonNull(mode, "mode");
        final String runId = instance.id();
        final Path target = runDirectory(runId);
        if (mode == WriteMode.NO_CLOBBER && Files.exists(target)) {
            return PersistOutcome.SKIPPED_EXISTING;
        }

        Path temp = null;
        try {
            Files.createDirectories(root);
            temp = Files.createTempDirectory(root, TEMP_PREFIX + runId + "-");
            writeRun(temp, instance, artifacts);

            if (mode == WriteMode.NO_CLOBBER) {
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
                    return PersistOutcome.WRITTEN;
                } catch (final IOException moveFailure) {
                    if (!Files.exists(target)) {
                        throw moveFailure;
                    }
                    // another writer got there first
                    deleteRecursively(temp);
                    return PersistOutcome.SKIPPED_EXISTING;
                }
            }

            final boolean existed = Files.exists(target);
            if (existed) {
                final Path discarded = root.resolve(TEMP_PREFIX + "old-" + UUID.randomUUID());
                Files.move(target, discarded, StandardCopyOption.ATOMIC_MOVE);
                deleteRecursively(discarded);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            return existed ? PersistOutcome.OVERWRITTEN : PersistOutcome.WRITTEN;
        } catch (final IOException exception) {
            final StoreException failure = new StoreException(runId, "failed to persist run", exception);
            if (temp != null) {
                try {
                    deleteRecursively(temp);
                } catch (final IOException cleanupFailure) {
                    failure.addSuppressed(cleanupFailure);
                }
            }
            throw failure;
        }
    }

    /**
     * Reads a persisted run back without any scheduler interaction.
     */
    public Optional<StoredRun> load(final String runId) throws StoreException {
        final Path directory = runDirectory(runId);
        final Path statusFile = directory.resolve(STATUS_FILE);
        if (!Files.isRegularFile(statusFile)) {
            return Optional.empty();
        }
        try {
            final Document status = Document.parse(Files.readString(statusFile, StandardCharsets.UTF_8));
            final RunInstance instance = restoreInstance(runId, status);
            final Map<String, String> files = readFiles(directory.resolve(FILES_DIR));
            final RunArtifacts artifacts = new RunArtifacts(
                readIfPresent(directory.resolve(STDOUT_FILE)),
                readIfPresent(directory.resolve(STDERR_FILE)),
                files,
                status.getInteger("exitCode"));
            return Optional.of(new StoredRun(instance, artifacts));
        } catch (final IOException exception) {
            throw new StoreException(runId, "failed to read stored run", exception);
        } catch (final JsonParseException | IllegalArgumentException | ClassCastException exception) {
            throw new StoreException(runId, "status record is invalid: " + exception.getMessage(), exception);
        }
    }

    /**
     * Reads the staging workspace of {@code instance} into artifacts; absent files stay absent.
     */
    public RunArtifacts collectStaged(final RunInstance instance) throws StoreException {
        final RunWorkspace workspace = workspace(instance.id());
        try {
            return new RunArtifacts(
                readIfPresent(workspace.stdoutFile()),
                readIfPresent(workspace.stderrFile()),
                readFiles(workspace.outputsDirectory()),
                workspace.readExitCode().orElse(null));
        } catch (final IOException exception) {
            throw new StoreException(instance.id(), "failed to collect staged outputs", exception);
        }
    }

    public void discardStaged(final String runId) throws StoreException {
        try {
            deleteRecursively(workspace(runId).directory());
        } catch (final IOException exception) {
            throw new StoreException(runId, "failed to delete staging workspace", exception);
        }
    }

    /**
     * Persists a staged run whose job has finished (its exit artifact exists), deriving the final status from the
     * recorded exit code. Returns empty when there is nothing finished to harvest.
     */
    public Optional<PersistOutcome> harvest(final RunInstance instance, final WriteMode mode) throws StoreException {
        final RunWorkspace workspace = workspace(instance.id());
        if (!workspace.hasExitArtifact()) {
            return Optional.empty();
        }
        if (mode == WriteMode.NO_CLOBBER && exists(instance.id())) {
            return Optional.of(PersistOutcome.SKIPPED_EXISTING);
        }
        final RunArtifacts artifacts = collectStaged(instance);
        final RunStatus status = Integer.valueOf(0).equals(artifacts.exitCode()) ? RunStatus.COMPLETED : RunStatus.FAILED;
        final String jobId;
        try {
            jobId = workspace.submittedJobId().orElse(null);
        } catch (final IOException exception) {
            throw new StoreException(instance.id(), "failed to read submission record", exception);
        }
        final RunInstance finished = RunInstance.restore(
            instance.id(),
            instance.benchName(),
            instance.axisValues(),
            instance.configuration(),
            instance.rerunIndex(),
            status,
            jobId);
        final PersistOutcome outcome = persist(finished, artifacts, mode);
        if (outcome != PersistOutcome.SKIPPED_EXISTING) {
            discardStaged(instance.id());
        }
        return Optional.of(outcome);
    }

    /**
     * Identifiers of every persisted run, sorted.
     */
    public List<String> listRunIds() throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        final List<String> runIds = new ArrayList<>();
        try (Stream<Path> children = Files.list(root)) {
            children
                .filter(path -> !path.getFileName().toString().startsWith("."))
                .filter(path -> Files.isRegularFile(path.resolve(STATUS_FILE)))
                .map(path -> path.getFileName().toString())
                .sorted()
                .forEach(runIds::add);
        }
        return runIds;
    }

    private static void writeRun(final Path directory, final RunInstance instance, final RunArtifacts artifacts)
            throws IOException {
        if (artifacts.stdout() != null) {
            Files.writeString(directory.resolve(STDOUT_FILE), artifacts.stdout(), StandardCharsets.UTF_8);
        }
        if (artifacts.stderr() != null) {
            Files.writeString(directory.resolve(STDERR_FILE), artifacts.stderr(), StandardCharsets.UTF_8);
        }
        if (!artifacts.files().isEmpty()) {
            final Path filesDirectory = Files.createDirectories(directory.resolve(FILES_DIR));
            for (final Map.Entry<String, String> entry : artifacts.files().entrySet()) {
                final Path file = filesDirectory.resolve(entry.getKey()).normalize();
                if (!file.getParent().equals(filesDirectory)) {
                    throw new IOException("output file name must be a plain file name: " + entry.getKey());
                }
                Files.writeString(file, entry.getValue(), StandardCharsets.UTF_8);
            }
        }
        Files.writeString(
            directory.resolve(STATUS_FILE),
            statusDocument(instance, artifacts).toJson(STATUS_JSON),
            StandardCharsets.UTF_8);
    }

    static Document statusDocument(final RunInstance instance, final RunArtifacts artifacts) {
        final RunConfiguration configuration = instance.configuration();
        final Document config = new Document();
        config.put("variables", new Document(new LinkedHashMap<String, Object>(configuration.variables())));
        config.put("build", configuration.buildCommand());
        config.put("run", configuration.runCommand());
        config.put("args", configuration.args());
        config.put("directory", configuration.directory());
        config.put("moduleLoads", configuration.moduleLoads());
        config.put("environment", new Document(new LinkedHashMap<String, Object>(configuration.environment())));
        config.put("directives", new Document(new LinkedHashMap<String, Object>(configuration.directives())));
        config.put("postCommands", configuration.postCommands());

        final Document status = new Document();
        status.put("runId", instance.id());
        status.put("bench", instance.benchName());
        status.put("axisValues", new Document(new LinkedHashMap<String, Object>(instance.axisValues())));
        status.put("rerun", instance.rerunIndex());
        status.put("status", instance.status().name());
        status.put("jobId", instance.jobId().orElse(null));
        status.put("exitCode", artifacts.exitCode());
        status.put("files", new ArrayList<>(artifacts.files().keySet()));
        status.put("recordedAt", Instant.now().toString());
        status.put("configuration", config);
        return status;
    }

    private static RunInstance restoreInstance(final String runId, final Document status) {
        final Document config = status.get("configuration", Document.class);
        if (config == null) {
            throw new IllegalArgumentException("configuration is missing");
        }
        final RunConfiguration configuration = new RunConfiguration(
            textMap(config.get("variables", Document.class)),
            config.getString("build"),
            config.getString("run"),
            config.getString("args"),
            config.getString("directory"),
            textList(config.getList("moduleLoads", String.class)),
            textMap(config.get("environment", Document.class)),
            textMap(config.get("directives", Document.class)),
            textList(config.getList("postCommands", String.class)));
        final Integer rerun = status.getInteger("rerun");
        final String statusName = status.getString("status");
        if (rerun == null || statusName == null) {
            throw new IllegalArgumentException("rerun and status are required");
        }
        return RunInstance.restore(
            runId,
            status.getString("bench"),
            textMap(status.get("axisValues", Document.class)),
            configuration,
            rerun,
            RunStatus.valueOf(statusName),
            status.getString("jobId"));
    }

    private static Map<String, String> textMap(final Document document) {
        final Map<String, String> values = new LinkedHashMap<>();
        if (document == null) {
            return values;
        }
        for (final Map.Entry<String, Object> entry : document.entrySet()) {
            values.put(entry.getKey(), String.valueOf(entry.getValue()));
        }
        return values;
    }

    private static List<String> textList(final List<String> values) {
        return values == null ? List.of() : values;
    }

    private static Map<String, String> readFiles(final Path directory) throws IOException {
        final Map<String, String> files = new LinkedHashMap<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        final List<Path> entries = new ArrayList<>();
        try (Stream<Path> children = Files.list(directory)) {
            children.filter(Files::isRegularFile).sorted().forEach(entries::add);
        }
        for (final Path entry : entries) {
            files.put(entry.getFileName().toString(), readText(entry));
        }
        return files;
    }

    private static String readIfPresent(final Path file) throws IOException {
        return Files.isRegularFile(file) ? readText(file) : null;
    }

    // Lenient decoding: a job may be killed mid-write.
    private static String readText(final Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    static void deleteRecursively(final Path target) throws IOException {
        if (!Files.exists(target)) {
            return;
        }
        final List<Path> paths;
        try (Stream<Path> walk = Files.walk(target)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (final UncheckedIOException exception) {
            throw exception.getCause();
        }
        for (final Path path : paths) {
            Files.deleteIfExists(path);
        }
    }

    private static String requireRunId(final String runId) {
        Objects.requireNonNull(runId, "runId");
        if (runId.isBlank() || runId.startsWith(".") || runId.contains("/") || runId.contains("\\")) {
            throw new IllegalArgumentException("invalid run id: " + runId);
        }
        return runId;
    }
}
