package com.chainwright.core.nodes;

import com.chainwright.core.catalog.ChainCatalog;
import com.chainwright.core.engine.StageTransitions;
import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.logging.MdcContext;
import com.chainwright.core.metrics.ChainMetrics;
import com.chainwright.core.model.RunStatus;
import com.chainwright.core.model.StageOutput;
import com.chainwright.core.state.ChainState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Accepts the stage output and moves the run to the next stage, or completes it after the last one.
 */
@Component
public class AdvanceStageNode {

    private static final Logger log = LoggerFactory.getLogger(AdvanceStageNode.class);

    private final ChainCatalog catalog;
    private final EventBus eventBus;
    private final ChainMetrics metrics;

    public AdvanceStageNode(ChainCatalog catalog, EventBus eventBus, ChainMetrics metrics) {
        this.catalog = catalog;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ChainState state) {
        String runId = state.runId();
        var current = state.currentStage();
        MdcContext.setStage(runId, current.name());
        var next = catalog.stage(current).nextStage();
        StageTransitions.requireForward(current, next);

        var output = new StageOutput(current, state.stageDraft(), state.stageContributors(),
                state.stageConfidenceReduced(), state.stageRemediated());
        if (state.stageStartedAt() > 0) {
            metrics.recordStageDuration(current.name(), System.currentTimeMillis() - state.stageStartedAt());
        }

        var payload = new HashMap<String, Object>();
        payload.put("from", current.name());
        payload.put("to", next != null ? next.name() : "DONE");
        payload.put("contributors", output.contributors());
        payload.put("remediated", output.remediated());
        payload.put("confidenceReduced", output.confidenceReduced());
        eventBus.publish(ChainEvent.of("stage.advanced", runId, current.name(), payload));

        var updates = new HashMap<String, Object>();
        updates.put("outputs", List.of(output));
        updates.put("stageOutcome", ChainState.StageOutcome.ADVANCED.name());
        if (next == null) {
            log.info("Run {} accepted {}, chain complete", runId, current);
            updates.put("status", RunStatus.COMPLETED.name());
        } else {
            log.info("Run {} accepted {}, advancing to {}", runId, current, next);
            updates.put("currentStage", next.name());
        }
        return updates;
    }
}
