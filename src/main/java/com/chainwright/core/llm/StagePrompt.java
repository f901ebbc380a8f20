package com.chainwright.core.llm;

import com.chainwright.core.agent.AgentKind;
import com.chainwright.core.model.StageId;

/**
 * A fully rendered prompt for one inference call.
 *
 * @param stage  the stage being produced
 * @param agent  the agent the prompt is for, {@code null} for the orchestrator
 * @param system role and output instructions
 * @param user   task content
 */
public record StagePrompt(StageId stage, AgentKind agent, String system, String user) {

    public String caller() {
        return agent != null ? agent.name() : "ORCHESTRATOR";
    }
}
