package com.specforge.core.runstate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.RunStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RunStateStore}.
 */
class RunStateStoreTest {

    private static final List<String> STEPS = List.of("validate", "analyze", "finalize");

    @TempDir
    Path tempDir;

    private RunStateStore store;
    private Path runsDir;
    private Path specFile;

    @BeforeEach
    void setUp() throws IOException {
        store = new RunStateStore(new ObjectMapper(),
            Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));
        runsDir = tempDir.resolve("runs");
        specFile = tempDir.resolve("spec.md");
        Files.writeString(specFile, "# Overview\n\nExport orders.\n");
    }

    @Test
    void hashSpec_sameContent_isStable() {
        assertThat(RunStateStore.hashSpec("abc")).isEqualTo(RunStateStore.hashSpec("abc"));
        assertThat(RunStateStore.hashSpec("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void hashSpec_singleByteChange_changesHash() {
        byte[] original = "maturity: 3".getBytes();
        byte[] mutated = original.clone();
        mutated[mutated.length - 1] = '4';

        assertThat(RunStateStore.hashSpec(mutated)).isNotEqualTo(RunStateStore.hashSpec(original));
    }

    @Test
    void hashSpec_anySingleByteFlip_changesHash() {
        Random random = new Random(20260301L);
        for (int i = 0; i < 200; i++) {
            byte[] original = new byte[1 + random.nextInt(4096)];
            random.nextBytes(original);
            byte[] mutated = original.clone();
            int offset = random.nextInt(mutated.length);
            mutated[offset] ^= (byte) (1 + random.nextInt(255));

            assertThat(RunStateStore.hashSpec(mutated))
                .as("flip at offset %d of %d bytes", offset, original.length)
                .isNotEqualTo(RunStateStore.hashSpec(original));
        }
    }

    @Test
    void initRunState_writesPendingStepsInOrder() {
        RunRecord run = store.initRunState(specFile, new RunInitOptions(runsDir, null, STEPS, null));

        assertThat(run.runDir()).isDirectory();
        assertThat(run.runDir().resolve(RunStateStore.RUN_FILE)).isRegularFile();
        assertThat(run.runDir().getFileName().toString()).startsWith("20260301-101530-");
        assertThat(run.state().status()).isEqualTo(RunStatus.INITIALIZED);
        assertThat(run.state().steps()).containsOnlyKeys(STEPS);
        assertThat(run.state().steps().keySet()).containsExactlyElementsOf(STEPS);
        assertThat(run.state().steps().values()).allSatisfy(step -> assertThat(step.status()).isEqualTo(StepStatus.PENDING));
        assertThat(run.state().specPath()).isEqualTo(specFile.toAbsolutePath().normalize().toString());
        assertThat(run.state().createdAt()).isEqualTo("2026-03-01T10:15:30Z");
    }

    @Test
    void saveRunState_thenLoad_returnsEqualState() {
        RunRecord run = store.initRunState(specFile, new RunInitOptions(runsDir, "run-1", STEPS, null));
        String now = store.now();
        RunState updated = run.state()
            .withStep("validate", run.state().step("validate").start(now).complete(now, Map.of("agent_ready", "true")), now)
            .withStep("analyze", run.state().step("analyze").start(now).fail(now, ErrorCode.PHASE_FAILED, "boom"), now)
            .withStatus(RunStatus.FAILED, now);

        store.saveRunState(run.runDir(), updated);

        RunState loaded = store.loadRunState(run.runDir());
        assertThat(loaded).isEqualTo(updated);
        assertThat(loaded.step("analyze").errorCode()).isEqualTo("phase.failed");
        assertThat(loaded.stepsIn(StepStatus.COMPLETED)).containsExactly("validate");
    }

    @Test
    void createRunDir_explicitIdTaken_throws() {
        store.createRunDir(runsDir, "fixed");

        assertThatThrownBy(() -> store.createRunDir(runsDir, "fixed"))
            .isInstanceOf(RunStateException.class)
            .hasMessageContaining("already exists");
    }

    @Test
    void createRunDir_generatedIds_areUnique() {
        RunDirectory first = store.createRunDir(runsDir);
        RunDirectory second = store.createRunDir(runsDir);

        assertThat(first.runId()).isNotEqualTo(second.runId());
    }

    @Test
    void loadRunState_missingFile_throwsNotFound() {
        assertThatThrownBy(() -> store.loadRunState(tempDir.resolve("absent")))
            .isInstanceOf(RunStateException.class)
            .satisfies(e -> assertThat(((RunStateException) e).getErrorCode()).isEqualTo(ErrorCode.RUN_NOT_FOUND));
    }

    @Test
    void loadRunState_unsupportedVersion_throwsInvalid() throws IOException {
        Path runDir = Files.createDirectories(runsDir.resolve("old"));
        Files.writeString(runDir.resolve(RunStateStore.RUN_FILE), """
            {"version": 7, "run_id": "old", "created_at": "x", "spec_path": "s", "spec_hash": "h",
             "status": "completed", "steps": {}}
            """);

        assertThatThrownBy(() -> store.loadRunState(runDir))
            .isInstanceOf(RunStateException.class)
            .hasMessageContaining("Unsupported schema version")
            .satisfies(e -> assertThat(((RunStateException) e).getErrorCode()).isEqualTo(ErrorCode.RUN_STATE_INVALID));
    }

    @Test
    void validateRunState_missingKeys_listsEach() throws IOException {
        List<String> problems = store.validateRunState(new ObjectMapper().readTree("{\"version\": 1}"));

        assertThat(problems).contains("Missing required key: run_id", "Missing required key: steps");
    }

    @Test
    void listRuns_skipsCorruptDirectories() throws IOException {
        store.initRunState(specFile, new RunInitOptions(runsDir, "good", STEPS, null));
        Path corrupt = Files.createDirectories(runsDir.resolve("corrupt"));
        Files.writeString(corrupt.resolve(RunStateStore.RUN_FILE), "{not json");

        assertThat(store.listRunStates(runsDir)).extracting(RunState::runId).containsExactly("good");
    }

    @Test
    void findLatestRunForSpec_returnsNewestMatchingRun() throws IOException {
        Path other = tempDir.resolve("other.md");
        Files.writeString(other, "# Other\n");
        store.initRunState(specFile, new RunInitOptions(runsDir, "a-first", STEPS, null));
        store.initRunState(specFile, new RunInitOptions(runsDir, "b-second", STEPS, null));
        store.initRunState(other, new RunInitOptions(runsDir, "c-other", STEPS, null));

        Optional<RunRecord> latest = store.findLatestRunForSpec(runsDir, specFile);

        assertThat(latest).map(run -> run.state().runId()).contains("b-second");
        assertThat(store.findLatestRunForSpec(tempDir.resolve("nowhere"), specFile)).isEmpty();
    }

    @Test
    void writeCheckpoint_writesOutputsUnderArtifacts() throws IOException {
        RunRecord run = store.initRunState(specFile, new RunInitOptions(runsDir, "run-1", STEPS, null));

        Path checkpoint = store.writeCheckpoint(run.runDir(), "validate", Map.of("agent_ready", "true"));

        assertThat(checkpoint).isEqualTo(run.runDir().resolve("artifacts/validate/done.json"));
        assertThat(Files.readString(checkpoint)).contains("\"agent_ready\" : \"true\"");
    }
}
