package com.chainwright.core.agent;

/**
 * Runs one attempt of an agent instance. A single implementation serves every {@link AgentKind};
 * the descriptor carried by the instance selects role, capabilities and context.
 */
public interface AgentExecutor {

    /**
     * Executes the instance's task.
     *
     * @return the agent's output
     * @throws InterruptedException if the instance was cancelled while running
     * @throws Exception            any failure; the coordinator retries once
     */
    AgentOutput execute(AgentInstance instance) throws Exception;
}
