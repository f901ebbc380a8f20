package com.chainwright.core.nodes;

import com.chainwright.core.catalog.ChainCatalog;
import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.logging.MdcContext;
import com.chainwright.core.qualitygate.GateInput;
import com.chainwright.core.qualitygate.GateRequest;
import com.chainwright.core.qualitygate.GateResult;
import com.chainwright.core.qualitygate.QualityGateFramework;
import com.chainwright.core.state.ChainState;
import com.chainwright.mcp.CapabilityUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Runs the stage's quality gates over the produced draft, or over the caller's revised content
 * when the stage was re-entered for remediation.
 */
@Component
public class EvaluateGatesNode {

    private static final Logger log = LoggerFactory.getLogger(EvaluateGatesNode.class);

    private final ChainCatalog catalog;
    private final QualityGateFramework gates;
    private final EventBus eventBus;

    public EvaluateGatesNode(ChainCatalog catalog, QualityGateFramework gates, EventBus eventBus) {
        this.catalog = catalog;
        this.gates = gates;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(ChainState state) {
        String runId = state.runId();
        var stage = catalog.stage(state.currentStage());
        MdcContext.setStage(runId, stage.id().name());

        boolean remediation = state.isRemediating();
        String content = remediation ? state.remediationContent() : state.stageDraft();
        var input = new GateInput(stage, state.idea(), content, state.outputs());

        try {
            var report = gates.evaluate(GateRequest.forStage(runId, input, state.gateStrategy().orElse(null)));
            for (GateResult warning : report.warnings()) {
                log.warn("Optional gate {} below threshold for {} ({} < {}): {}", warning.gateId(), stage.id(),
                        warning.score(), warning.threshold(), warning.findings());
            }
            eventBus.publish(ChainEvent.of("gates.evaluated", runId, stage.id().name(), Map.of(
                    "strategy", report.strategy().name(),
                    "remediation", remediation,
                    "summary", report.summary(),
                    "blocking", report.blocking().stream().map(GateResult::gateId).toList(),
                    "warnings", report.warnings().stream().map(GateResult::gateId).toList())));

            var updates = new HashMap<String, Object>();
            updates.put("gateReport", report);
            if (remediation) {
                updates.put("stageDraft", content);
                updates.put("stageRemediated", true);
                updates.put("remediationContent", "");
            }
            return updates;
        } catch (CapabilityUnavailableException e) {
            log.error("Gate evaluation for {} of run {} lost a required capability: {}",
                    stage.id(), runId, e.getMessage());
            return NodeResults.failed(e.getMessage());
        }
    }
}
