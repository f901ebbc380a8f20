package com.chainwright.core.qualitygate;

import com.chainwright.core.catalog.AgentPolicy;
import com.chainwright.core.catalog.CatalogException;
import com.chainwright.core.catalog.ChainCatalog;
import com.chainwright.core.catalog.StageDefinition;
import com.chainwright.core.config.ChainwrightProperties;
import com.chainwright.core.metrics.ChainMetrics;
import com.chainwright.core.model.StageId;
import com.chainwright.mcp.CapabilityInvoker;
import com.chainwright.mcp.CapabilityResponse;
import com.chainwright.mcp.CapabilityUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link QualityGateFramework} with fixed-score checkers and a mocked capability invoker.
 */
class QualityGateFrameworkTest {

    /** Checker returning a fixed score, optionally after a delay. */
    private static GateChecker fixed(String id, double score, long delayMs) {
        return new GateChecker() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public GateCheck check(GateInput input) {
                if (delayMs > 0) {
                    try {
                        Thread.sleep(delayMs);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return GateCheck.of(score, "scored " + score);
            }
        };
    }

    private static GateChecker fixed(String id, double score) {
        return fixed(id, score, 0);
    }

    private CapabilityInvoker invoker;
    private ChainwrightProperties properties;
    private ChainMetrics metrics;
    private QualityGateFramework framework;

    @BeforeEach
    void setUp() {
        invoker = mock(CapabilityInvoker.class);
        properties = new ChainwrightProperties();
        metrics = new ChainMetrics(new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        if (framework != null) framework.shutdown();
    }

    private StageDefinition stage(List<String> required, List<String> optional) {
        return new StageDefinition(StageId.IDEA_DEFINITION, List.of("idea"), "markdown", List.of("Problem Statement"),
                required, optional, AgentPolicy.none(), null, "");
    }

    private QualityGateFramework framework(StageDefinition stage, List<QualityGate> gates,
                                           Map<StageId, List<String>> adaptive, GateChecker... checkers) {
        var catalog = new ChainCatalog(List.of(stage), List.of(), gates, adaptive);
        framework = new QualityGateFramework(catalog, List.of(checkers), invoker, properties, metrics);
        return framework;
    }

    private static QualityGate gate(String id, double threshold, boolean required, String... dependsOn) {
        return new QualityGate(id, id, List.of(), threshold, 5_000, required, List.of(dependsOn));
    }

    private static GateRequest request(StageDefinition stage, GateExecutionStrategy strategy) {
        return GateRequest.forStage("CHN-TEST", new GateInput(stage, "idea", "## Problem Statement\n\ntext", List.of()),
                strategy);
    }

    // ===================================================================
    // Pass / fail classification
    // ===================================================================

    @Nested
    @DisplayName("classification")
    class Classification {

        @Test
        @DisplayName("a required gate scoring 0.80 against 0.95 fails and blocks")
        void requiredBelowThresholdBlocks() {
            var stage = stage(List.of("strict"), List.of());
            framework(stage, List.of(gate("strict", 0.95, true)), Map.of(), fixed("strict", 0.80));

            var report = framework.evaluate(request(stage, GateExecutionStrategy.SEQUENTIAL));

            var result = report.result("strict").orElseThrow();
            assertEquals(GateStatus.FAILED, result.status());
            assertEquals(0.80, result.score(), 1e-9);
            assertTrue(result.blocking());
            assertTrue(report.isBlocking());
            assertEquals(List.of(result), report.blocking());
        }

        @Test
        @DisplayName("an optional gate below its threshold only warns")
        void optionalWarns() {
            var stage = stage(List.of(), List.of("soft"));
            framework(stage, List.of(gate("soft", 0.5, false)), Map.of(), fixed("soft", 0.2));

            var report = framework.evaluate(request(stage, GateExecutionStrategy.PARALLEL));

            assertEquals(GateStatus.WARNING, report.result("soft").orElseThrow().status());
            assertFalse(report.isBlocking());
            assertEquals(1, report.warnings().size());
        }

        @Test
        @DisplayName("a score exactly on the threshold passes")
        void boundaryPasses() {
            var stage = stage(List.of("edge"), List.of());
            framework(stage, List.of(gate("edge", 0.7, true)), Map.of(), fixed("edge", 0.7));

            var report = framework.evaluate(request(stage, GateExecutionStrategy.PARALLEL));
            assertEquals(GateStatus.PASSED, report.result("edge").orElseThrow().status());
        }

        @Test
        @DisplayName("the stage's optional list overrides a gate declared required in the catalog")
        void stageListsDecideRequired() {
            var stage = stage(List.of(), List.of("catalog-required"));
            var gate = gate("catalog-required", 0.9, true);
            framework(stage, List.of(gate), Map.of(), fixed("catalog-required", 0.1));

            var report = framework.evaluate(request(stage, GateExecutionStrategy.PARALLEL));

            var result = report.result("catalog-required").orElseThrow();
            assertFalse(result.required());
            assertEquals(GateStatus.WARNING, result.status());
            assertTrue(QualityGateFramework.requiredFor(gate, stage(List.of("catalog-required"), List.of())));
            assertTrue(QualityGateFramework.requiredFor(gate, stage(List.of(), List.of())));
        }

        @Test
        @DisplayName("evaluating the same content twice yields the same scores")
        void idempotent() {
            var stage = stage(List.of("a", "b"), List.of());
            framework(stage, List.of(gate("a", 0.5, true), gate("b", 0.5, true)), Map.of(),
                    fixed("a", 0.6), fixed("b", 0.3));

            var first = framework.evaluate(request(stage, GateExecutionStrategy.PARALLEL));
            var second = framework.evaluate(request(stage, GateExecutionStrategy.PARALLEL));

            assertEquals(first.results().stream().map(GateResult::score).toList(),
                    second.results().stream().map(GateResult::score).toList());
            assertEquals(first.results().stream().map(GateResult::status).toList(),
                    second.results().stream().map(GateResult::status).toList());
        }
    }

    // ===================================================================
    // Strategies and dependencies
    // ===================================================================

    @Nested
    @DisplayName("strategies")
    class Strategies {

        @Test
        @DisplayName("a gate whose dependency failed is blocked without running")
        void dependencyBlocks() {
            var stage = stage(List.of("base", "child"), List.of());
            framework(stage, List.of(gate("base", 0.9, true), gate("child", 0.1, true, "base")), Map.of(),
                    fixed("base", 0.2), fixed("child", 1.0));

            var report = framework.evaluate(request(stage, GateExecutionStrategy.PARALLEL));

            var child = report.result("child").orElseThrow();
            assertEquals(GateStatus.BLOCKED, child.status());
            assertTrue(child.findings().get(0).contains("base"));
        }

        @Test
        @DisplayName("sequential stops at the first required failure and lists the rest as not run")
        void sequentialFailFast() {
            var stage = stage(List.of("first", "second", "third"), List.of());
            framework(stage, List.of(gate("first", 0.5, true), gate("second", 0.5, true), gate("third", 0.5, true)),
                    Map.of(), fixed("first", 0.9), fixed("second", 0.1), fixed("third", 0.9));

            var report = framework.evaluate(request(stage, GateExecutionStrategy.SEQUENTIAL));

            assertEquals(List.of("first", "second"), report.results().stream().map(GateResult::gateId).toList());
            assertEquals(List.of("third"), report.notRun());
        }

        @Test
        @DisplayName("parallel reports results in dependency order whatever the completion order")
        void parallelOrder() {
            var stage = stage(List.of("slow", "fast", "after"), List.of());
            framework(stage, List.of(gate("slow", 0.5, true), gate("fast", 0.5, true), gate("after", 0.5, true, "fast")),
                    Map.of(), fixed("slow", 0.9, 200), fixed("fast", 0.9), fixed("after", 0.9));

            var report = framework.evaluate(request(stage, GateExecutionStrategy.PARALLEL));

            assertEquals(List.of("slow", "fast", "after"), report.results().stream().map(GateResult::gateId).toList());
            assertTrue(report.notRun().isEmpty());
        }

        @Test
        @DisplayName("adaptive takes the catalog's stage mapping and pulls in dependencies")
        void adaptiveMapping() {
            var stage = stage(List.of("base", "child", "extra"), List.of());
            framework(stage, List.of(gate("base", 0.5, true), gate("child", 0.5, true, "base"), gate("extra", 0.5, true)),
                    Map.of(StageId.IDEA_DEFINITION, List.of("child")),
                    fixed("base", 0.9), fixed("child", 0.9), fixed("extra", 0.9));

            var report = framework.evaluate(request(stage, GateExecutionStrategy.ADAPTIVE));

            assertEquals(GateExecutionStrategy.ADAPTIVE, report.strategy());
            assertEquals(List.of("base", "child"), report.results().stream().map(GateResult::gateId).toList());
        }

        @Test
        @DisplayName("a null strategy uses the configured default")
        void defaultStrategy() {
            properties.getGates().setStrategy(GateExecutionStrategy.SEQUENTIAL);
            var stage = stage(List.of("only"), List.of());
            framework(stage, List.of(gate("only", 0.5, true)), Map.of(), fixed("only", 0.9));

            assertEquals(GateExecutionStrategy.SEQUENTIAL, framework.evaluate(request(stage, null)).strategy());
        }

        @Test
        @DisplayName("dependency levels put each gate one past its deepest dependency")
        void levels() {
            var a = gate("a", 0.5, true);
            var b = gate("b", 0.5, true, "a");
            var c = gate("c", 0.5, true);
            var d = gate("d", 0.5, true, "b", "c");
            var levels = QualityGateFramework.levels(List.of(a, b, c, d));
            assertEquals(List.of(List.of(a, c), List.of(b), List.of(d)), levels);
        }
    }

    // ===================================================================
    // Timeouts, errors and capabilities
    // ===================================================================

    @Nested
    @DisplayName("execution")
    class Execution {

        @Test
        @DisplayName("a gate exceeding its timeout scores zero")
        void timeout() {
            var stage = stage(List.of("slow"), List.of());
            var slow = new QualityGate("slow", "slow", List.of(), 0.5, 50, true, List.of());
            framework(stage, List.of(slow), Map.of(), fixed("slow", 1.0, 2_000));

            var result = framework.evaluate(request(stage, GateExecutionStrategy.PARALLEL)).result("slow").orElseThrow();

            assertEquals(0.0, result.score());
            assertEquals(GateStatus.FAILED, result.status());
            assertTrue(result.findings().get(0).contains("timed out"));
        }

        @Test
        @DisplayName("a checker that throws scores zero with the error as a finding")
        void checkerError() {
            var stage = stage(List.of("broken"), List.of());
            GateChecker broken = new GateChecker() {
                @Override
                public String id() {
                    return "broken";
                }

                @Override
                public GateCheck check(GateInput input) {
                    throw new IllegalStateException("boom");
                }
            };
            framework(stage, List.of(gate("broken", 0.5, true)), Map.of(), broken);

            var result = framework.evaluate(request(stage, GateExecutionStrategy.PARALLEL)).result("broken").orElseThrow();
            assertEquals(0.0, result.score());
            assertTrue(result.findings().get(0).contains("boom"));
        }

        @Test
        @DisplayName("a server's structured score is averaged with the checker score")
        void capabilityBlend() {
            when(invoker.invoke(any())).thenReturn(new CapabilityResponse("security-scan", "security-scan",
                    "scanner-1", "{\"score\":0.4,\"findings\":[\"weak tls\"]}", 12, true, false));
            var stage = stage(List.of("sec"), List.of());
            var sec = new QualityGate("sec", "sec", List.of("security-scan"), 0.5, 5_000, true, List.of());
            framework(stage, List.of(sec), Map.of(), fixed("sec", 0.8));

            var result = framework.evaluate(request(stage, GateExecutionStrategy.PARALLEL)).result("sec").orElseThrow();

            assertEquals(0.6, result.score(), 1e-9);
            assertEquals(0.4, result.breakdown().get("mcp:scanner-1"), 1e-9);
            assertTrue(result.findings().contains("scanner-1: weak tls"));
        }

        @Test
        @DisplayName("a degraded capability leaves the checker score alone and notes it")
        void degradedCapability() {
            when(invoker.invoke(any())).thenReturn(CapabilityResponse.degraded("security-scan"));
            var stage = stage(List.of("sec"), List.of());
            var sec = new QualityGate("sec", "sec", List.of("security-scan"), 0.5, 5_000, true, List.of());
            framework(stage, List.of(sec), Map.of(), fixed("sec", 0.8));

            var result = framework.evaluate(request(stage, GateExecutionStrategy.PARALLEL)).result("sec").orElseThrow();

            assertEquals(0.8, result.score(), 1e-9);
            assertTrue(result.findings().stream().anyMatch(f -> f.contains("confidence reduced")));
        }

        @Test
        @DisplayName("an unavailable non-degradable capability propagates")
        void unavailableCapability() {
            when(invoker.invoke(any())).thenThrow(
                    new CapabilityUnavailableException("security-scan", List.of("security-scan"), null));
            var stage = stage(List.of("sec"), List.of());
            var sec = new QualityGate("sec", "sec", List.of("security-scan"), 0.5, 5_000, true, List.of());
            framework(stage, List.of(sec), Map.of(), fixed("sec", 0.8));

            assertThrows(CapabilityUnavailableException.class,
                    () -> framework.evaluate(request(stage, GateExecutionStrategy.SEQUENTIAL)));
        }

        @Test
        @DisplayName("a catalog gate naming an unknown checker is rejected at construction")
        void unknownChecker() {
            var stage = stage(List.of("orphan"), List.of());
            var catalog = new ChainCatalog(List.of(stage), List.of(), List.of(gate("orphan", 0.5, true)), Map.of());
            assertThrows(CatalogException.class,
                    () -> new QualityGateFramework(catalog, List.of(), invoker, properties, metrics));
            verifyNoInteractions(invoker);
        }
    }
}
