package com.chainwright.core.nodes;

import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.metrics.ChainMetrics;
import com.chainwright.core.qualitygate.GateResult;
import com.chainwright.core.state.ChainState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Parks the run at its current stage with the blocking gate report as the remediation request.
 */
@Component
public class AwaitRemediationNode {

    private static final Logger log = LoggerFactory.getLogger(AwaitRemediationNode.class);

    private final EventBus eventBus;
    private final ChainMetrics metrics;

    public AwaitRemediationNode(EventBus eventBus, ChainMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ChainState state) {
        var stage = state.currentStage();
        List<String> blocking = state.gateReport()
                .map(r -> r.blocking().stream().map(GateResult::gateId).toList())
                .orElse(List.of());
        log.info("Run {} waits for remediation of {}: blocking gates {}", state.runId(), stage, blocking);
        metrics.recordRemediationRequest(stage.name());
        eventBus.publish(ChainEvent.of("remediation.requested", state.runId(), stage.name(), Map.of(
                "blocking", blocking,
                "checkpoint", state.checkpointBlocked())));
        return Map.of("stageOutcome", ChainState.StageOutcome.REMEDIATION.name());
    }
}
