package com.chainwright.core.nodes;

import com.chainwright.core.agent.AgentCoordinator;
import com.chainwright.core.model.RunStatus;
import com.chainwright.core.state.ChainState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Terminates an aborted run: cancels whatever agents are still live and marks the run ABORTED.
 */
@Component
public class AbortRunNode {

    private static final Logger log = LoggerFactory.getLogger(AbortRunNode.class);

    private final AgentCoordinator coordinator;

    public AbortRunNode(AgentCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    public Map<String, Object> apply(ChainState state) {
        int cancelled = coordinator.cancelRun(state.runId());
        log.info("Run {} aborted at {} ({} live agent(s) cancelled)", state.runId(), state.currentStage(), cancelled);
        return Map.of(
                "status", RunStatus.ABORTED.name(),
                "stageOutcome", ChainState.StageOutcome.ABORTED.name(),
                "failureReason", "aborted by caller at " + state.currentStage());
    }
}
