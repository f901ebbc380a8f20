package com.chainwright.core.agent;

/**
 * Terminal message an agent instance publishes on its completion channel.
 *
 * @param instanceId the instance
 * @param kind       its agent kind
 * @param priority   descriptor priority, used for aggregation order
 * @param state      COMPLETED, FAILED or CANCELLED
 * @param output     the output when COMPLETED, otherwise {@code null}
 * @param attempts   attempts made
 * @param error      failure description, {@code null} when COMPLETED
 * @param fatal      a run-fatal error raised by the agent, {@code null} normally
 * @param durationMs wall time from first attempt to outcome
 */
public record AgentOutcome(
    String instanceId,
    AgentKind kind,
    int priority,
    InstanceState state,
    AgentOutput output,
    int attempts,
    String error,
    RuntimeException fatal,
    long durationMs
) {
    static AgentOutcome completed(AgentInstance instance, AgentOutput output, long durationMs) {
        return new AgentOutcome(instance.id(), instance.kind(), instance.descriptor().priority(),
                InstanceState.COMPLETED, output, instance.attempts(), null, null, durationMs);
    }

    static AgentOutcome failed(AgentInstance instance, String error, RuntimeException fatal, long durationMs) {
        return new AgentOutcome(instance.id(), instance.kind(), instance.descriptor().priority(),
                InstanceState.FAILED, null, instance.attempts(), error, fatal, durationMs);
    }

    static AgentOutcome cancelled(AgentInstance instance, String reason, long durationMs) {
        return new AgentOutcome(instance.id(), instance.kind(), instance.descriptor().priority(),
                InstanceState.CANCELLED, null, instance.attempts(), reason, null, durationMs);
    }

    public boolean completed() {
        return state == InstanceState.COMPLETED;
    }
}
