package com.chainwright.core.nodes;

import com.chainwright.core.model.RunStatus;
import com.chainwright.core.state.ChainState;

import java.util.List;
import java.util.Map;

final class NodeResults {

    private NodeResults() {}

    /** State update that ends the run as FAILED. */
    static Map<String, Object> failed(String reason) {
        return Map.of(
                "status", RunStatus.FAILED.name(),
                "stageOutcome", ChainState.StageOutcome.FAILED.name(),
                "failureReason", reason,
                "errors", List.of(reason));
    }
}
