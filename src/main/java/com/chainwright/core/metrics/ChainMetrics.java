package com.chainwright.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for chain execution.
 */
@Service
public class ChainMetrics {

    private final MeterRegistry registry;

    public ChainMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(String status) {
        Counter.builder("chainwright.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordStageDuration(String stage, long ms) {
        Timer.builder("chainwright.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAgentExecution(String agentKind, String outcome, long ms) {
        Timer.builder("chainwright.agent.duration")
                .tag("agent", agentKind)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSpawnDecision(String agentKind, String decision) {
        Counter.builder("chainwright.scoring.decisions")
                .tag("agent", agentKind)
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordGateResult(String gateId, String status) {
        Counter.builder("chainwright.gate.evaluations")
                .tag("gate", gateId)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRemediationRequest(String stage) {
        Counter.builder("chainwright.remediation.requests")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    /**
     * Records a lease attempt against a capability.
     *
     * @param capability the requested capability tag
     * @param outcome    "granted" or "unavailable"
     */
    public void recordLease(String capability, String outcome) {
        Counter.builder("chainwright.mcp.leases")
                .tag("capability", capability)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordCapabilityFallback(String capability, String fallback) {
        Counter.builder("chainwright.mcp.fallbacks")
                .description("Capability calls served by a documented fallback")
                .tag("capability", capability)
                .tag("fallback", fallback)
                .register(registry)
                .increment();
    }

    public void recordWaveDecision(String strategy, double score) {
        Counter.builder("chainwright.wave.decisions")
                .tag("strategy", strategy)
                .register(registry)
                .increment();

        DistributionSummary.builder("chainwright.wave.score")
                .description("Wave complexity scores")
                .register(registry)
                .record(score);
    }

    public void recordCoordinationFailure(String agentKind) {
        Counter.builder("chainwright.coordination.partial_failures")
                .tag("agent", agentKind)
                .register(registry)
                .increment();
    }
}
