package com.specforge.core.runstate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.RunStateException;
import com.specforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-based persistence of run documents.
 *
 * <p>Layout under a base directory:
 * <pre>
 * &lt;baseDir&gt;/&lt;runId&gt;/run.json                    run document, replaced wholesale
 * &lt;baseDir&gt;/&lt;runId&gt;/logs.jsonl                  event log, see {@link RunEventLog}
 * &lt;baseDir&gt;/&lt;runId&gt;/artifacts/&lt;step&gt;/done.json   per-step checkpoint
 * </pre>
 *
 * <p>{@code run.json} is always written to a temporary file and moved into place, so a
 * resuming reader sees either the previous or the next complete document. One writer
 * per run directory is assumed; distinct runs share nothing but the base directory.
 *
 * @since 1.0.0
 */
public class RunStateStore {

    private static final Logger log = LoggerFactory.getLogger(RunStateStore.class);

    public static final String RUN_FILE = "run.json";
    public static final String ARTIFACTS_DIR = "artifacts";
    public static final String CHECKPOINT_FILE = "done.json";

    private static final List<String> REQUIRED_KEYS = List.of(
        "version", "run_id", "created_at", "spec_path", "spec_hash", "status", "steps");
    private static final int MAX_CREATE_ATTEMPTS = 5;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RunStateStore() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public RunStateStore(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
            .copy()
            .enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Returns the current time as an ISO-8601 string from this store's clock.
     *
     * @return timestamp
     */
    public String now() {
        return clock.instant().toString();
    }

    /**
     * Hashes specification content with SHA-256.
     *
     * @param content raw bytes
     * @return lower-case hex digest
     */
    public static String hashSpec(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Hashes specification text encoded as UTF-8.
     *
     * @param content text
     * @return lower-case hex digest
     */
    public static String hashSpec(String content) {
        return hashSpec(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates a uniquely named run directory.
     *
     * @param baseDir directory holding runs; created if missing
     * @return run id and path
     * @throws RunStateException if the directory cannot be created
     */
    public RunDirectory createRunDir(Path baseDir) {
        return createRunDir(baseDir, null);
    }

    /**
     * Creates a run directory with an explicit or generated id.
     *
     * <p>A generated id that collides with an existing directory is regenerated; an explicit
     * one that collides is an error.
     *
     * @param baseDir directory holding runs
     * @param runId explicit id, or null to generate one
     * @return run id and path
     * @throws RunStateException if the directory cannot be created
     */
    public RunDirectory createRunDir(Path baseDir, String runId) {
        Path base = baseDir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(base);
            for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
                String id = runId != null ? runId : RunIds.generate(clock.instant());
                try {
                    Path dir = Files.createDirectory(base.resolve(id));
                    log.debug("Created run directory {}", dir);
                    return new RunDirectory(id, dir);
                } catch (FileAlreadyExistsException e) {
                    if (runId != null) {
                        throw new RunStateException(ErrorCode.RUN_STATE_IO, "Run directory already exists: " + e.getFile(), e);
                    }
                    log.debug("Run id {} already taken, retrying", id);
                }
            }
        } catch (IOException e) {
            throw new RunStateException(ErrorCode.RUN_STATE_IO, "Cannot create run directory under " + base, e);
        }
        throw new RunStateException(ErrorCode.RUN_STATE_IO, "Could not allocate a unique run directory under " + base);
    }

    /**
     * Starts a new run: creates its directory, hashes the specification and writes the
     * initial document with every step pending.
     *
     * @param specPath specification file
     * @param options base directory, optional run id, steps and config
     * @return run directory and initial state
     * @throws RunStateException if the specification cannot be read or the run cannot be written
     */
    public RunRecord initRunState(Path specPath, RunInitOptions options) {
        Path absoluteSpec = specPath.toAbsolutePath().normalize();
        String specHash;
        try {
            specHash = hashSpec(Files.readAllBytes(absoluteSpec));
        } catch (IOException e) {
            throw new RunStateException(ErrorCode.RUN_STATE_IO, "Cannot read specification " + absoluteSpec, e);
        }

        RunDirectory runDir = createRunDir(options.baseDir(), options.runId());
        RunState state = RunState.initial(runDir.runId(), absoluteSpec.toString(), specHash,
            options.steps(), options.config(), now());
        saveRunState(runDir.path(), state);
        log.info("Initialized run {} for {}", runDir.runId(), absoluteSpec);
        return new RunRecord(runDir.path(), state);
    }

    /**
     * Loads and validates a run document.
     *
     * @param runDir run directory
     * @return run state
     * @throws RunStateException RUN_NOT_FOUND if absent, RUN_STATE_INVALID if corrupt
     */
    public RunState loadRunState(Path runDir) {
        Path file = runDir.resolve(RUN_FILE);
        if (!Files.isRegularFile(file)) {
            throw new RunStateException(ErrorCode.RUN_NOT_FOUND, RUN_FILE + " not found in " + runDir);
        }
        JsonNode tree;
        try {
            tree = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new RunStateException(ErrorCode.RUN_STATE_INVALID, "Cannot decode " + file, e);
        }

        List<String> problems = validateRunState(tree);
        if (!problems.isEmpty()) {
            throw new RunStateException(ErrorCode.RUN_STATE_INVALID,
                "Invalid run document " + file + ": " + String.join("; ", problems));
        }
        try {
            return objectMapper.treeToValue(tree, RunState.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RunStateException(ErrorCode.RUN_STATE_INVALID, "Invalid run document " + file, e);
        }
    }

    /**
     * Replaces the run document atomically.
     *
     * @param runDir run directory
     * @param state document to write
     * @throws RunStateException if the write fails; the previous document is intact in that case
     */
    public void saveRunState(Path runDir, RunState state) {
        try {
            FileUtils.writeAtomically(runDir.resolve(RUN_FILE), objectMapper.writeValueAsBytes(state));
        } catch (IOException e) {
            throw new RunStateException(ErrorCode.RUN_STATE_IO, "Cannot write " + RUN_FILE + " in " + runDir, e);
        }
    }

    /**
     * Checks a decoded document for required keys and the supported schema version.
     *
     * @param document decoded JSON
     * @return problems found, empty when valid
     */
    public List<String> validateRunState(JsonNode document) {
        List<String> problems = new ArrayList<>();
        if (document == null || !document.isObject()) {
            problems.add("Run state must be an object");
            return problems;
        }
        ObjectNode object = (ObjectNode) document;
        for (String key : REQUIRED_KEYS) {
            if (!object.has(key)) {
                problems.add("Missing required key: " + key);
            }
        }
        if (object.path("version").asInt(-1) != RunState.SCHEMA_VERSION) {
            problems.add("Unsupported schema version: " + object.path("version"));
        }
        if (object.has("steps") && !object.get("steps").isObject()) {
            problems.add("Steps must be an object map");
        }
        return problems;
    }

    /**
     * Lists every readable run under a base directory, oldest first.
     *
     * <p>Unreadable or invalid run directories are logged and skipped.
     *
     * @param baseDir directory holding runs
     * @return run states
     */
    public List<RunState> listRunStates(Path baseDir) {
        return listRuns(baseDir).stream().map(RunRecord::state).toList();
    }

    /**
     * Lists every readable run under a base directory with its location, oldest first.
     *
     * @param baseDir directory holding runs
     * @return run records
     */
    public List<RunRecord> listRuns(Path baseDir) {
        if (!Files.isDirectory(baseDir)) {
            return List.of();
        }
        List<RunRecord> runs = new ArrayList<>();
        try (Stream<Path> children = Files.list(baseDir)) {
            for (Path dir : children.filter(Files::isDirectory).toList()) {
                if (!Files.isRegularFile(dir.resolve(RUN_FILE))) {
                    continue;
                }
                try {
                    runs.add(new RunRecord(dir, loadRunState(dir)));
                } catch (RunStateException e) {
                    log.warn("Skipping run directory {}: {}", dir, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new RunStateException(ErrorCode.RUN_STATE_IO, "Cannot list runs in " + baseDir, e);
        }
        runs.sort(Comparator.comparing((RunRecord run) -> run.state().createdAt())
            .thenComparing(run -> run.state().runId()));
        return runs;
    }

    /**
     * Finds the most recently created run for a specification path.
     *
     * @param baseDir directory holding runs
     * @param specPath specification file
     * @return latest run, or empty
     */
    public Optional<RunRecord> findLatestRunForSpec(Path baseDir, Path specPath) {
        String absoluteSpec = specPath.toAbsolutePath().normalize().toString();
        List<RunRecord> matching = listRuns(baseDir).stream()
            .filter(run -> run.state().specPath().equals(absoluteSpec))
            .toList();
        return matching.isEmpty() ? Optional.empty() : Optional.of(matching.get(matching.size() - 1));
    }

    /**
     * Writes the completion checkpoint of a step: {@code artifacts/<step>/done.json}.
     *
     * @param runDir run directory
     * @param step step name
     * @param outputs step outputs
     * @return checkpoint path
     * @throws RunStateException if the checkpoint cannot be written
     */
    public Path writeCheckpoint(Path runDir, String step, Map<String, String> outputs) {
        Path checkpoint = runDir.resolve(ARTIFACTS_DIR).resolve(step).resolve(CHECKPOINT_FILE);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("step", step);
        payload.put("completed_at", now());
        payload.put("outputs", outputs == null ? Map.of() : outputs);
        try {
            FileUtils.writeAtomically(checkpoint, objectMapper.writeValueAsBytes(payload));
        } catch (IOException e) {
            throw new RunStateException(ErrorCode.RUN_STATE_IO, "Cannot write checkpoint for step " + step, e);
        }
        return checkpoint;
    }
}
