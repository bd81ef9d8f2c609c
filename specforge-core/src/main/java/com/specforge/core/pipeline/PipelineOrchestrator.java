package com.specforge.core.pipeline;

import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.PipelineAbortedException;
import com.specforge.core.error.SpecForgeException;
import com.specforge.core.model.Specification;
import com.specforge.core.parser.SpecParser;
import com.specforge.core.runstate.LogEntry;
import com.specforge.core.runstate.RunConfig;
import com.specforge.core.runstate.RunEventLog;
import com.specforge.core.runstate.RunInitOptions;
import com.specforge.core.runstate.RunRecord;
import com.specforge.core.runstate.RunState;
import com.specforge.core.runstate.RunStateStore;
import com.specforge.core.runstate.RunStatus;
import com.specforge.core.runstate.StepState;
import com.specforge.core.runstate.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs registered phases against a specification and records progress in a resumable run.
 *
 * <p>Phases execute one at a time in registry order. After every phase transition the whole
 * {@code run.json} document is rewritten, a line is appended to the run's event log and, on
 * completion, a checkpoint is written under {@code artifacts/<phase>/done.json}. A failed
 * phase fails only the phases that depend on it, directly or transitively; independent
 * phases still run. The run ends {@code completed}, {@code failed}, {@code stopped}
 * (after {@code stopAfter}) or {@code aborted} (cancellation between phases).
 *
 * <p>With {@link PipelineOptions#resume()} the latest unfinished run of the same specification
 * is continued: completed and skipped phases are not re-run, failed or interrupted phases are
 * retried. A run whose recorded specification hash differs from the current content is not
 * resumed; a fresh run starts instead.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PipelineOrchestrator orchestrator = new PipelineOrchestrator(DefaultPhases.create(ai, true));
 * PipelineResult result = orchestrator.run(specPath, PipelineOptions.builder(runsDir).build());
 * }</pre>
 *
 * @since 1.0.0
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String REASON_NOT_APPLICABLE = "not-applicable";
    static final String REASON_DRY_RUN = "dry-run";
    static final String REASON_BEFORE_FROM_STEP = "before-from-step";

    private final PhaseRegistry registry;
    private final SpecParser parser;
    private final RunStateStore store;
    private final RunEventLog eventLog;

    public PipelineOrchestrator(PhaseRegistry registry) {
        this(registry, new SpecParser(), new RunStateStore(), new RunEventLog());
    }

    public PipelineOrchestrator(PhaseRegistry registry, SpecParser parser, RunStateStore store, RunEventLog eventLog) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
    }

    /**
     * Filters registered phases by their applicability strategies.
     *
     * @param spec parsed specification
     * @param skipFlags caller skip flags
     * @return applicable phases in execution order
     */
    public List<Phase> getApplicablePhases(Specification spec, Set<SkipFlag> skipFlags) {
        ApplicabilityContext context = ApplicabilityContext.of(spec, skipFlags);
        return registry.phases().stream()
            .filter(phase -> phase.applicability().test(context))
            .toList();
    }

    /**
     * Reports progress of the latest run of a specification.
     *
     * @param specPath specification file
     * @param baseDir directory holding runs
     * @return status, or empty if the specification has no run
     */
    public Optional<PipelineStatus> status(Path specPath, Path baseDir) {
        return store.findLatestRunForSpec(baseDir, specPath).map(PipelineStatus::of);
    }

    /**
     * Runs the pipeline.
     *
     * @param specPath specification file
     * @param options invocation options
     * @return final run state and the phases executed by this call
     * @throws IOException if the specification cannot be read
     * @throws com.specforge.core.error.InvalidPhaseException if {@code fromStep} or {@code stopAfter} names no phase
     * @throws com.specforge.core.error.RunStateException if the run document cannot be written
     */
    public PipelineResult run(Path specPath, PipelineOptions options) throws IOException {
        Path absoluteSpec = specPath.toAbsolutePath().normalize();
        int fromIndex = options.fromStep() == null ? 0 : registry.indexOf(options.fromStep());
        if (options.stopAfter() != null) {
            registry.indexOf(options.stopAfter());
        }

        Specification spec = parser.parse(absoluteSpec);
        Set<String> applicable = getApplicablePhases(spec, options.skipFlags()).stream()
            .map(Phase::name)
            .collect(Collectors.toSet());

        Optional<RunRecord> resumable = findResumable(absoluteSpec, options);
        Execution execution = resumable
            .map(run -> new Execution(prepareResume(run, options), true))
            .orElseGet(() -> new Execution(store.initRunState(absoluteSpec, new RunInitOptions(
                options.baseDir(), options.runId(), registry.names(), runConfig(options))), false));

        log.info("{} run {} for {} ({} phases)", execution.resumed ? "Resuming" : "Starting",
            execution.state().runId(), absoluteSpec, registry.names().size());
        execution.setStatus(RunStatus.IN_PROGRESS);
        execution.event(LogEntry.info(store.now(), execution.resumed ? "run resumed" : "run started",
            Map.of("spec_path", absoluteSpec.toString())));

        if (execution.resumed && options.stopAfter() != null
            && execution.state().step(options.stopAfter()).status() == StepStatus.COMPLETED) {
            execution.setStatus(RunStatus.STOPPED);
            return execution.result();
        }

        List<Phase> phases = registry.phases();
        for (int index = 0; index < phases.size(); index++) {
            Phase phase = phases.get(index);
            String name = phase.name();
            StepState current = execution.state().step(name);

            if (current.status().isTerminal()) {
                log.debug("Phase {} already {}, not re-run", name, current.status().value());
                execution.event(LogEntry.info(store.now(), "skipped (resume)", Map.of("step", name)));
                continue;
            }
            if (index < fromIndex) {
                execution.skip(name, REASON_BEFORE_FROM_STEP);
                continue;
            }
            if (!applicable.contains(name)) {
                execution.skip(name, REASON_NOT_APPLICABLE);
                continue;
            }
            if (options.dryRun()) {
                execution.skip(name, REASON_DRY_RUN);
                continue;
            }

            try {
                options.cancellation().throwIfAborted(name);
            } catch (PipelineAbortedException e) {
                log.warn("Run {} aborted before phase {}", execution.state().runId(), name);
                execution.event(LogEntry.warn(store.now(), e.getMessage(), Map.of("step", name)));
                execution.setStatus(RunStatus.ABORTED);
                return execution.result();
            }

            Optional<String> failedDependency = phase.dependsOn().stream()
                .filter(dependency -> execution.state().step(dependency).status() == StepStatus.FAILED)
                .findFirst();
            if (failedDependency.isPresent()) {
                execution.fail(name, ErrorCode.PHASE_DEPENDENCY_FAILED,
                    "Dependency '" + failedDependency.get() + "' failed");
                continue;
            }

            execute(execution, phase, spec, absoluteSpec, options);

            if (name.equals(options.stopAfter())
                && execution.state().step(name).status() == StepStatus.COMPLETED) {
                log.info("Stopping run {} after phase {}", execution.state().runId(), name);
                execution.setStatus(RunStatus.STOPPED);
                return execution.result();
            }
        }

        boolean failed = !execution.state().stepsIn(StepStatus.FAILED).isEmpty();
        execution.setStatus(failed ? RunStatus.FAILED : RunStatus.COMPLETED);
        execution.event(failed
            ? LogEntry.error(store.now(), "run failed", Map.of("failed", execution.state().stepsIn(StepStatus.FAILED)))
            : LogEntry.info(store.now(), "run completed", Map.of()));
        log.info("Run {} {}", execution.state().runId(), execution.state().status().value());
        return execution.result();
    }

    private void execute(Execution execution, Phase phase, Specification spec, Path specPath, PipelineOptions options) {
        String name = phase.name();
        execution.transition(name, execution.state().step(name).start(store.now()));
        execution.event(LogEntry.info(store.now(), "started", Map.of("step", name)));
        execution.executed.add(name);
        log.info("Running phase: {}", name);

        PhaseContext context = new PhaseContext(spec, specPath, execution.state().runId(), execution.runDir,
            completedOutputs(execution.state()), options);
        PhaseResult result;
        try {
            result = phase.run(context);
            if (result == null || !result.success()) {
                String message = result == null ? "Phase returned no result" : result.message();
                execution.fail(name, ErrorCode.PHASE_FAILED, message == null ? "Phase reported failure" : message);
                return;
            }
            // The step is still running here, so a checkpoint failure fails it cleanly.
            store.writeCheckpoint(execution.runDir, name, result.outputs());
        } catch (SpecForgeException e) {
            execution.fail(name, e.getErrorCode(), e.getMessage());
            return;
        } catch (IOException | RuntimeException e) {
            log.debug("Phase {} threw", name, e);
            execution.fail(name, ErrorCode.PHASE_FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
            return;
        }
        execution.transition(name, execution.state().step(name).complete(store.now(), result.outputs()));
        execution.event(LogEntry.info(store.now(), "completed", Map.of("step", name)));
        log.info("Phase {} completed", name);
    }

    private Optional<RunRecord> findResumable(Path specPath, PipelineOptions options) throws IOException {
        if (!options.resume() || options.fromStep() != null || options.runId() != null) {
            return Optional.empty();
        }
        Optional<RunRecord> latest = store.findLatestRunForSpec(options.baseDir(), specPath)
            .filter(run -> run.state().status() != RunStatus.COMPLETED);
        if (latest.isEmpty()) {
            return Optional.empty();
        }

        String currentHash = RunStateStore.hashSpec(Files.readAllBytes(specPath));
        RunRecord run = latest.get();
        if (!currentHash.equals(run.state().specHash())) {
            log.warn("Specification {} changed since run {}; starting a fresh run", specPath, run.state().runId());
            eventLog.appendLogLine(run.runDir(), LogEntry.warn(store.now(),
                "invalidated: specification changed", Map.of("spec_hash", currentHash)));
            return Optional.empty();
        }
        return latest;
    }

    private RunRecord prepareResume(RunRecord run, PipelineOptions options) {
        String now = store.now();
        RunState state = run.state().withConfig(runConfig(options), now);
        for (String name : registry.names()) {
            StepState step = state.steps().get(name);
            if (step == null) {
                state = state.withStep(name, StepState.pending(), now);
            } else if (step.status() == StepStatus.FAILED || step.status() == StepStatus.RUNNING) {
                state = state.withStep(name, step.resetForResume(), now);
            }
        }
        return run.withState(state);
    }

    private static RunConfig runConfig(PipelineOptions options) {
        List<String> skip = options.skipFlags().stream()
            .map(flag -> flag.name().toLowerCase(Locale.ROOT))
            .sorted()
            .toList();
        return new RunConfig(options.fromStep(), options.stopAfter(), options.dryRun(), skip);
    }

    private static Map<String, Map<String, String>> completedOutputs(RunState state) {
        Map<String, Map<String, String>> outputs = new LinkedHashMap<>();
        state.steps().forEach((name, step) -> {
            if (step.status() == StepStatus.COMPLETED) {
                outputs.put(name, step.outputs() == null ? Map.of() : step.outputs());
            }
        });
        return outputs;
    }

    /**
     * Mutable cursor over one run; every change is persisted before the next one.
     */
    private final class Execution {
        private final Path runDir;
        private final boolean resumed;
        private final List<String> executed = new ArrayList<>();
        private RunState state;

        Execution(RunRecord run, boolean resumed) {
            this.runDir = run.runDir();
            this.state = run.state();
            this.resumed = resumed;
        }

        RunState state() {
            return state;
        }

        void transition(String name, StepState next) {
            state = state.withStep(name, next, store.now());
            store.saveRunState(runDir, state);
        }

        void setStatus(RunStatus status) {
            state = state.withStatus(status, store.now());
            store.saveRunState(runDir, state);
        }

        void skip(String name, String reason) {
            transition(name, state.step(name).skip(store.now(), reason));
            event(LogEntry.info(store.now(), "skipped", Map.of("step", name, "reason", reason)));
            log.debug("Phase {} skipped ({})", name, reason);
        }

        void fail(String name, ErrorCode code, String message) {
            transition(name, state.step(name).fail(store.now(), code, message));
            event(LogEntry.error(store.now(), message, Map.of("step", name, "code", code.code())));
            log.error("Phase {} failed [{}]: {}", name, code.code(), message);
        }

        void event(LogEntry entry) {
            eventLog.appendLogLine(runDir, entry);
        }

        PipelineResult result() {
            return new PipelineResult(new RunRecord(runDir, state), executed, resumed);
        }
    }
}
