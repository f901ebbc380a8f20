package com.chainwright.core.nodes;

import com.chainwright.core.analyzer.ContextAnalysisException;
import com.chainwright.core.catalog.ChainCatalog;
import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.logging.MdcContext;
import com.chainwright.core.metrics.ChainMetrics;
import com.chainwright.core.model.AgentSuggestion;
import com.chainwright.core.model.StageOutput;
import com.chainwright.core.scoring.AgentScoringEngine;
import com.chainwright.core.scoring.ScoringResult;
import com.chainwright.core.scoring.SpawnDecision;
import com.chainwright.core.state.ChainState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Opens the current stage: applies a pending wave decision, re-derives the project context,
 * and scores every agent to decide which ones the stage spawns.
 * <p>
 * A remediation re-entry skips all of this; the stage content is already known and only the
 * gates run again.
 */
@Component
public class EnterStageNode {

    private static final Logger log = LoggerFactory.getLogger(EnterStageNode.class);

    private final ChainCatalog catalog;
    private final AgentScoringEngine scoringEngine;
    private final StageContextRefresher refresher;
    private final EventBus eventBus;
    private final ChainMetrics metrics;

    public EnterStageNode(ChainCatalog catalog, AgentScoringEngine scoringEngine, StageContextRefresher refresher,
                          EventBus eventBus, ChainMetrics metrics) {
        this.catalog = catalog;
        this.scoringEngine = scoringEngine;
        this.refresher = refresher;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ChainState state) {
        String runId = state.runId();
        var stageId = state.currentStage();
        MdcContext.setStage(runId, stageId.name());
        var stage = catalog.stage(stageId);

        if (state.isRemediating()) {
            log.info("Re-entering {} of run {} with revised content ({} chars)",
                    stageId, runId, state.remediationContent().length());
            eventBus.publish(ChainEvent.of("stage.entered", runId, stageId.name(), Map.of(
                    "remediation", true)));
            return Map.of(
                    "stageOutcome", ChainState.StageOutcome.NONE.name(),
                    "checkpointBlocked", false);
        }

        var updates = new HashMap<String, Object>();
        updates.put("stageStartedAt", System.currentTimeMillis());
        updates.put("stageDraft", "");
        updates.put("stageContributors", List.of());
        updates.put("stageConfidenceReduced", false);
        updates.put("stageRemediated", false);
        updates.put("checkpointBlocked", false);
        updates.put("stageOutcome", ChainState.StageOutcome.NONE.name());

        var decision = state.waveDecision().orElse(null);
        var pending = state.pendingWaveDecision().orElse(null);
        if (pending != null && !pending.equals(decision)) {
            log.info("Applying re-assessed wave strategy {} (was {}) from {}",
                    pending.strategy(), decision != null ? decision.strategy() : "none", stageId);
            decision = pending;
            updates.put("waveDecision", pending);
        }

        var context = state.projectContext();
        if (state.hasProjectRoot()) {
            try {
                var refresh = refresher.refresh(runId, stageId, state.idea(), Path.of(state.projectRoot()),
                        context, decision);
                if (refresh.changed(context)) {
                    context = refresh.context();
                    updates.put("projectContext", context);
                }
                if (refresh.reassessed() != null) {
                    updates.put("pendingWaveDecision", refresh.reassessed());
                }
            } catch (ContextAnalysisException e) {
                log.error("Context analysis failed entering {} of run {}: {}", stageId, runId, e.getMessage());
                return NodeResults.failed("Context analysis failed: " + e.getMessage());
            }
        }

        var results = scoringEngine.score(stage, workingText(state), context, state.preferences());
        var spawn = new ArrayList<String>();
        var suggestions = new ArrayList<AgentSuggestion>();
        var totals = new LinkedHashMap<String, Object>();
        for (ScoringResult r : results) {
            metrics.recordSpawnDecision(r.agent().name(), r.decision().name());
            totals.put(r.agent().name(), r.total());
            if (r.ambiguous()) {
                eventBus.publish(ChainEvent.of("scoring.ambiguity", runId, stageId.name(), Map.of(
                        "agent", r.agent().name(),
                        "total", r.total(),
                        "threshold", r.threshold(),
                        "decision", r.decision().name())));
            }
            if (r.decision() == SpawnDecision.AUTO_SPAWN) {
                spawn.add(r.agent().name());
            } else if (r.decision() == SpawnDecision.SUGGEST) {
                suggestions.add(new AgentSuggestion(stageId, r.agent(), r.total(), r.explain()));
            }
        }
        log.info("Entering {} of run {}: auto-spawn {}, suggested {}", stageId, runId, spawn,
                suggestions.stream().map(s -> s.agent().name()).toList());

        eventBus.publish(ChainEvent.of("stage.entered", runId, stageId.name(), Map.of(
                "remediation", false,
                "contextVersion", context.version())));
        eventBus.publish(ChainEvent.of("agents.scored", runId, stageId.name(), Map.of(
                "autoSpawn", List.copyOf(spawn),
                "suggested", suggestions.stream().map(s -> s.agent().name()).toList(),
                "totals", totals)));

        updates.put("spawnAgents", List.copyOf(spawn));
        updates.put("suggestions", List.copyOf(suggestions));
        return updates;
    }

    private static String workingText(ChainState state) {
        List<StageOutput> outputs = state.outputs();
        if (outputs.isEmpty()) return state.idea();
        return state.idea() + "\n\n" + outputs.get(outputs.size() - 1).content();
    }
}
