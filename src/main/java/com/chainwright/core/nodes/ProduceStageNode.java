package com.chainwright.core.nodes;

import com.chainwright.core.agent.AgentCoordinator;
import com.chainwright.core.agent.AgentDescriptor;
import com.chainwright.core.agent.AgentKind;
import com.chainwright.core.agent.AgentTask;
import com.chainwright.core.agent.AggregatedResult;
import com.chainwright.core.agent.OutputConflictResolver;
import com.chainwright.core.agent.SecondarySuggestion;
import com.chainwright.core.analyzer.ContextAnalysisException;
import com.chainwright.core.catalog.ChainCatalog;
import com.chainwright.core.catalog.StageDefinition;
import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.llm.InferenceException;
import com.chainwright.core.llm.InferenceProvider;
import com.chainwright.core.llm.StagePromptBuilder;
import com.chainwright.core.logging.MdcContext;
import com.chainwright.core.model.Domain;
import com.chainwright.core.model.ProjectContext;
import com.chainwright.core.qualitygate.GateInput;
import com.chainwright.core.qualitygate.GateReport;
import com.chainwright.core.qualitygate.GateRequest;
import com.chainwright.core.qualitygate.QualityGateFramework;
import com.chainwright.core.state.ChainState;
import com.chainwright.core.wave.WaveDecision;
import com.chainwright.core.wave.WavePhase;
import com.chainwright.mcp.CapabilityUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Produces the content of the open stage.
 * <p>
 * The orchestrator writes the base draft from the stage prompt; the auto-spawned agents then
 * contribute their sections on top of it. Under a multi-wave decision the agents run in
 * FOUNDATION, ENHANCEMENT and OPTIMIZATION order, each wave building on the previous draft and
 * followed by a context refresh and a checkpoint gate pass. Checkpoint failures only stop the
 * stage under the VALIDATION strategy.
 */
@Component
public class ProduceStageNode {

    private static final Logger log = LoggerFactory.getLogger(ProduceStageNode.class);

    private final ChainCatalog catalog;
    private final AgentCoordinator coordinator;
    private final OutputConflictResolver resolver;
    private final InferenceProvider inferenceProvider;
    private final StagePromptBuilder promptBuilder;
    private final QualityGateFramework gates;
    private final StageContextRefresher refresher;
    private final EventBus eventBus;

    public ProduceStageNode(ChainCatalog catalog, AgentCoordinator coordinator, OutputConflictResolver resolver,
                            InferenceProvider inferenceProvider, StagePromptBuilder promptBuilder,
                            QualityGateFramework gates, StageContextRefresher refresher, EventBus eventBus) {
        this.catalog = catalog;
        this.coordinator = coordinator;
        this.resolver = resolver;
        this.inferenceProvider = inferenceProvider;
        this.promptBuilder = promptBuilder;
        this.gates = gates;
        this.refresher = refresher;
        this.eventBus = eventBus;
    }

    /** Running result of one stage's production. */
    private static final class Production {
        String draft;
        ProjectContext context;
        WaveDecision reassessed;
        GateReport blockedAt;
        boolean confidenceReduced;
        final Set<String> contributors = new LinkedHashSet<>();
        final List<SecondarySuggestion> secondary = new ArrayList<>();
        final List<String> errors = new ArrayList<>();

        Production(String draft, ProjectContext context) {
            this.draft = draft;
            this.context = context;
        }
    }

    public Map<String, Object> apply(ChainState state) {
        String runId = state.runId();
        var stage = catalog.stage(state.currentStage());
        MdcContext.setStage(runId, stage.id().name());

        var descriptors = state.spawnAgents().stream()
                .map(AgentKind::valueOf)
                .map(catalog::descriptor)
                .flatMap(Optional::stream)
                .toList();
        var task = new AgentTask(runId, stage, state.idea(), state.outputs(), null, "");
        var decision = state.waveDecision().orElse(null);

        try {
            var production = new Production("", state.projectContext());
            production.draft = orchestratorDraft(task, production, descriptors.isEmpty());

            if (descriptors.isEmpty()) {
                log.info("No agents auto-spawned for {} of run {}; orchestrator-only output", stage.id(), runId);
            } else if (decision != null && decision.multiWave()) {
                produceInWaves(state, stage, task, descriptors, decision, production);
            } else {
                var result = coordinator.await(coordinator.spawn(runId, descriptors, task, production.context));
                absorb(result, production);
            }

            if (production.draft.isBlank()) {
                return NodeResults.failed("No content produced for " + stage.id());
            }
            return updates(state, production);
        } catch (CapabilityUnavailableException e) {
            log.error("Stage {} of run {} lost a required capability: {}", stage.id(), runId, e.getMessage());
            return NodeResults.failed(e.getMessage());
        } catch (InferenceException e) {
            log.error("Orchestrator inference failed for {} of run {}: {}", stage.id(), runId, e.getMessage());
            return NodeResults.failed("Inference failed: " + e.getMessage());
        } catch (ContextAnalysisException e) {
            log.error("Context analysis failed at a wave checkpoint of run {}: {}", runId, e.getMessage());
            return NodeResults.failed("Context analysis failed: " + e.getMessage());
        } finally {
            MdcContext.clearWave();
        }
    }

    /**
     * Generates the base draft. Orchestrator failure is fatal only when no agent will contribute.
     */
    private String orchestratorDraft(AgentTask task, Production production, boolean orchestratorOnly) {
        var view = production.context.view(EnumSet.allOf(Domain.class));
        try {
            return inferenceProvider.generate(promptBuilder.forOrchestrator(task, view), view);
        } catch (InferenceException e) {
            if (orchestratorOnly) throw e;
            log.warn("Orchestrator draft failed for {}, continuing with agent output only: {}",
                    task.stage().id(), e.getMessage());
            production.errors.add("Orchestrator draft failed at " + task.stage().id() + ": " + e.getMessage());
            return "";
        }
    }

    private void produceInWaves(ChainState state, StageDefinition stage, AgentTask task,
                                List<AgentDescriptor> descriptors, WaveDecision decision, Production production) {
        String runId = state.runId();
        List<WavePhase> phases = decision.phases();
        for (int i = 0; i < phases.size(); i++) {
            var phase = phases.get(i);
            var waveAgents = descriptors.stream().filter(d -> d.kind().phase() == phase).toList();
            if (waveAgents.isEmpty()) {
                log.debug("No agents in the {} wave of {}", phase, stage.id());
                continue;
            }
            MdcContext.setWave(runId, phase.name());
            log.info("Starting {} wave of {} with {}", phase, stage.id(),
                    waveAgents.stream().map(d -> d.kind().name()).toList());
            var result = coordinator.await(coordinator.spawn(runId, waveAgents,
                    task.forWave(phase, production.draft), production.context));
            absorb(result, production);

            if (i < phases.size() - 1) {
                var report = checkpoint(state, stage, phase, decision, production);
                if (report.isBlocking() && decision.blockingCheckpoints()) {
                    log.warn("Checkpoint after {} wave blocked {} under {}: {}", phase, stage.id(),
                            decision.strategy(), report.summary());
                    production.blockedAt = report;
                    return;
                }
                if (report.isBlocking()) {
                    log.info("Checkpoint after {} wave found issues, continuing under {}: {}", phase,
                            decision.strategy(), report.summary());
                }
            }
            MdcContext.clearWave();
        }
    }

    private GateReport checkpoint(ChainState state, StageDefinition stage, WavePhase phase,
                                  WaveDecision decision, Production production) {
        String runId = state.runId();
        if (state.hasProjectRoot()) {
            var current = production.reassessed != null ? production.reassessed : decision;
            var refresh = refresher.refresh(runId, stage.id(), state.idea(), Path.of(state.projectRoot()),
                    production.context, current);
            production.context = refresh.context();
            if (refresh.reassessed() != null) {
                production.reassessed = refresh.reassessed();
            }
        }
        var input = new GateInput(stage, state.idea(), production.draft, state.outputs());
        var report = gates.evaluate(GateRequest.forStage(runId, input, state.gateStrategy().orElse(null)));
        eventBus.publish(ChainEvent.of("gates.evaluated", runId, stage.id().name(), Map.of(
                "checkpoint", phase.name(),
                "summary", report.summary(),
                "blocking", report.blocking().stream().map(r -> r.gateId()).toList())));
        return report;
    }

    private void absorb(AggregatedResult result, Production production) {
        production.draft = resolver.overlay(production.draft, result.content());
        result.contributors().forEach(k -> production.contributors.add(k.name()));
        production.secondary.addAll(result.secondarySuggestions());
        production.confidenceReduced |= result.confidenceReduced();
        if (result.partialCoordinationFailure()) {
            production.errors.add("Partial coordination failure, no contribution from " + result.failedAgents());
        }
    }

    private Map<String, Object> updates(ChainState state, Production production) {
        var updates = new HashMap<String, Object>();
        updates.put("stageDraft", production.draft);
        updates.put("stageContributors", List.copyOf(production.contributors));
        updates.put("stageConfidenceReduced", production.confidenceReduced);
        updates.put("secondarySuggestions", List.copyOf(production.secondary));
        updates.put("errors", List.copyOf(production.errors));
        if (production.context.version() != state.projectContext().version()) {
            updates.put("projectContext", production.context);
        }
        if (production.reassessed != null) {
            updates.put("pendingWaveDecision", production.reassessed);
        }
        if (production.blockedAt != null) {
            updates.put("checkpointBlocked", true);
            updates.put("gateReport", production.blockedAt);
        }
        return updates;
    }
}
