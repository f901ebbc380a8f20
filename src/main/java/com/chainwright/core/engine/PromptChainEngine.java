package com.chainwright.core.engine;

import com.chainwright.core.agent.AgentCoordinator;
import com.chainwright.core.analyzer.ContextAnalysisException;
import com.chainwright.core.analyzer.ContextAnalyzer;
import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.graph.StageGraph;
import com.chainwright.core.logging.MdcContext;
import com.chainwright.core.metrics.ChainMetrics;
import com.chainwright.core.model.ChainRun;
import com.chainwright.core.model.ProjectContext;
import com.chainwright.core.model.RunStatus;
import com.chainwright.core.model.StageId;
import com.chainwright.core.model.UserPreferences;
import com.chainwright.core.qualitygate.GateExecutionStrategy;
import com.chainwright.core.state.ChainState;
import com.chainwright.core.wave.WaveDecision;
import com.chainwright.core.wave.WaveModeAssessor;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives chain runs through their stages by invoking the compiled {@link StageGraph} once per stage.
 * <p>
 * {@link #start} analyses the project, assesses the wave mode and runs stages until the chain
 * completes, a required gate blocks, the run fails or it is aborted. A blocked run waits at its
 * stage; {@link #remediate} re-runs only that stage's gates against revised content and, once
 * they pass, carries on with the following stages.
 */
@Service
public class PromptChainEngine {

    private static final Logger log = LoggerFactory.getLogger(PromptChainEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final StageGraph stageGraph;
    private final RunRegistry runRegistry;
    private final ContextAnalyzer analyzer;
    private final WaveModeAssessor assessor;
    private final AgentCoordinator coordinator;
    private final EventBus eventBus;
    private final ChainMetrics metrics;

    public PromptChainEngine(StageGraph stageGraph, RunRegistry runRegistry, ContextAnalyzer analyzer,
                             WaveModeAssessor assessor, AgentCoordinator coordinator,
                             EventBus eventBus, ChainMetrics metrics) {
        this.stageGraph = stageGraph;
        this.runRegistry = runRegistry;
        this.analyzer = analyzer;
        this.assessor = assessor;
        this.coordinator = coordinator;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Starts a run with a freshly generated id.
     */
    public ChainRun start(String idea, Path projectRoot, UserPreferences prefs, GateExecutionStrategy strategy) {
        return start(generateRunId(), idea, projectRoot, prefs, strategy);
    }

    /**
     * Starts a run and drives it as far as it goes without caller input.
     *
     * @param runId       run id to use
     * @param idea        the free-form idea
     * @param projectRoot project to analyse, {@code null} for a greenfield run
     * @param prefs       agent preferences, {@code null} for none
     * @param strategy    gate strategy override, {@code null} for the configured default
     * @return the run snapshot: completed, waiting for remediation, failed or aborted
     */
    public ChainRun start(String runId, String idea, Path projectRoot, UserPreferences prefs,
                          GateExecutionStrategy strategy) {
        if (idea == null || idea.isBlank()) {
            throw new IllegalArgumentException("Idea must not be blank");
        }
        var preferences = prefs != null ? prefs : UserPreferences.none();
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {} (project: {}, gates: {}) with idea: {}", runId,
                    projectRoot != null ? projectRoot : "none", strategy != null ? strategy : "default", idea);

            var stateMap = new HashMap<String, Object>();
            stateMap.put("runId", runId);
            stateMap.put("idea", idea);
            stateMap.put("status", RunStatus.IN_PROGRESS.name());
            stateMap.put("currentStage", StageId.first().name());
            stateMap.put("preferences", preferences);
            if (projectRoot != null) {
                stateMap.put("projectRoot", projectRoot.toAbsolutePath().normalize().toString());
            }
            if (strategy != null) {
                stateMap.put("gateStrategy", strategy.name());
            }

            runRegistry.register(snapshot(new ChainState(stateMap)));
            eventBus.publish(ChainEvent.of("run.created", runId, StageId.first().name(), Map.of(
                    "idea", idea,
                    "hasProject", projectRoot != null)));

            ProjectContext context;
            try {
                context = projectRoot != null ? analyzer.analyze(projectRoot) : ProjectContext.empty();
            } catch (ContextAnalysisException e) {
                log.error("Run {} failed: context analysis of {} failed: {}", runId, projectRoot, e.getMessage());
                stateMap.put("errors", List.of(e.getMessage()));
                stateMap.put("status", RunStatus.FAILED.name());
                stateMap.put("failureReason", "Context analysis failed: " + e.getMessage());
                return finish(new ChainState(stateMap));
            }
            stateMap.put("projectContext", context);

            WaveDecision decision = assessor.assess(idea, context);
            metrics.recordWaveDecision(decision.strategy().name(), decision.total());
            eventBus.publish(ChainEvent.of("wave.assessed", runId, StageId.first().name(), Map.of(
                    "score", decision.total(),
                    "strategy", decision.strategy().name(),
                    "contextVersion", context.version(),
                    "reassessment", false)));
            stateMap.put("waveDecision", decision);

            return drive(runId, stateMap);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Re-runs the gates of the stage the run is waiting on, against the caller's revised content.
     * Content generation is not repeated.
     *
     * @throws IllegalArgumentException if the run is unknown
     * @throws IllegalStateException    if the run is not waiting for remediation
     */
    public ChainRun remediate(String runId, String revisedContent) {
        var run = runRegistry.find(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run " + runId));
        if (!run.awaitingRemediation()) {
            throw new IllegalStateException("Run " + runId + " is not waiting for remediation (status "
                    + run.status() + ")");
        }
        if (revisedContent == null || revisedContent.isBlank()) {
            throw new IllegalArgumentException("Revised content must not be blank");
        }
        StageTransitions.requireRemediation(run.currentStage(), run.pendingRemediation().stage());

        MdcContext.setStage(runId, run.currentStage().name());
        try {
            log.info("Remediating {} of run {} ({} chars)", run.currentStage(), runId, revisedContent.length());
            var stateMap = new HashMap<>(runRegistry.state(runId));
            stateMap.put("remediationContent", revisedContent);
            return drive(runId, stateMap);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Aborts a run. A run that is executing stops at its next routing decision, with its live agents
     * cancelled right away; a run that waits for remediation is aborted immediately.
     *
     * @return the run snapshot after the request
     */
    public ChainRun abort(String runId) {
        var run = runRegistry.find(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run " + runId));
        if (run.status().isTerminal()) {
            log.info("Run {} already {}, abort ignored", runId, run.status());
            return run;
        }
        runRegistry.requestAbort(runId);
        int cancelled = coordinator.cancelRun(runId);
        log.info("Abort requested for run {} ({} live agent(s) cancelled)", runId, cancelled);

        if (!runRegistry.isExecuting(runId)) {
            var aborted = run.withStatus(RunStatus.ABORTED, "aborted by caller at " + run.currentStage());
            runRegistry.update(aborted, null);
            publishTerminal(aborted);
            return aborted;
        }
        return runRegistry.find(runId).orElse(run);
    }

    public Optional<ChainRun> find(String runId) {
        return runRegistry.find(runId);
    }

    public List<ChainRun> runs() {
        return runRegistry.all();
    }

    /**
     * Invokes the stage graph repeatedly until the run stops advancing.
     */
    private ChainRun drive(String runId, Map<String, Object> initialState) {
        if (!runRegistry.beginExecution(runId)) {
            throw new IllegalStateException("Run " + runId + " is already executing");
        }
        try {
            Map<String, Object> input = initialState;
            while (true) {
                var config = RunnableConfig.builder()
                        .threadId(runId)
                        .build();

                var result = stageGraph.getCompiledGraph().invoke(input, config);
                var state = result.orElseThrow(() ->
                        new IllegalStateException("Graph execution returned empty state for run " + runId));

                var outcome = state.stageOutcome();
                if (state.status().isTerminal() || outcome != ChainState.StageOutcome.ADVANCED) {
                    return finish(state);
                }
                runRegistry.update(snapshot(state), state.data());
                input = state.data();
            }
        } catch (Exception e) {
            log.error("Run {} failed with an unexpected error", runId, e);
            var failed = runRegistry.find(runId).orElseThrow()
                    .withStatus(RunStatus.FAILED, "Unexpected error: " + e.getMessage());
            runRegistry.update(failed, null);
            publishTerminal(failed);
            return failed;
        } finally {
            runRegistry.endExecution(runId);
        }
    }

    private ChainRun finish(ChainState state) {
        var run = snapshot(state);
        runRegistry.update(run, state.data());
        if (run.status().isTerminal()) {
            publishTerminal(run);
        } else {
            log.info("Run {} waits at {} for remediation: {}", run.runId(), run.currentStage(),
                    run.pendingRemediation() != null ? run.pendingRemediation().summary() : "");
        }
        return run;
    }

    private void publishTerminal(ChainRun run) {
        metrics.recordRunResult(run.status().name());
        String type = switch (run.status()) {
            case COMPLETED -> "run.completed";
            case ABORTED -> "run.aborted";
            default -> "run.failed";
        };
        var payload = new HashMap<String, Object>();
        payload.put("stage", run.currentStage().name());
        payload.put("outputs", run.outputs().size());
        payload.put("reason", run.failureReason());
        eventBus.publish(ChainEvent.of(type, run.runId(), run.currentStage().name(), payload));
        if (run.status() == RunStatus.COMPLETED) {
            log.info("Run {} completed with {} stage output(s)", run.runId(), run.outputs().size());
        } else {
            log.warn("Run {} {} at {}: {}", run.runId(), run.status(), run.currentStage(), run.failureReason());
        }
    }

    static ChainRun snapshot(ChainState state) {
        var pending = state.stageOutcome() == ChainState.StageOutcome.REMEDIATION
                && state.status() == RunStatus.IN_PROGRESS
                ? state.gateReport().orElse(null) : null;
        return new ChainRun(
                state.runId(),
                state.idea(),
                state.status(),
                state.currentStage(),
                state.outputs(),
                state.projectContext(),
                state.waveDecision().orElse(null),
                pending,
                state.suggestions(),
                state.secondarySuggestions(),
                state.errors(),
                state.failureReason(),
                Instant.now());
    }

    /**
     * Generates a unique run id in the format CHN-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("CHN-%d-%04d", year, count);
    }
}
