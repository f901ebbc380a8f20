package com.chainwright.mcp;

import com.chainwright.core.agent.AgentKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link McpServerSelector} and the lease bookkeeping in {@link ServerRegistry}.
 */
class McpServerSelectorTest {

    private static ServerRegistry registry(McpServerDescriptor... servers) {
        return new ServerRegistry(List.of(servers), 10);
    }

    private static McpServerSelector selector(ServerRegistry registry) {
        return new McpServerSelector(registry, Map.of(), 0.5, 5_000);
    }

    // ===================================================================
    // Selection order
    // ===================================================================

    @Nested
    @DisplayName("selection")
    class Selection {

        @Test
        @DisplayName("the lowest priority value wins")
        void priority() {
            var registry = registry(McpServerDescriptor.of("backup", List.of("search"), 2, 1),
                    McpServerDescriptor.of("primary", List.of("search"), 1, 1));
            assertEquals("primary", selector(registry).select("search").id());
        }

        @Test
        @DisplayName("unhealthy servers are never selected")
        void unhealthySkipped() {
            var registry = registry(McpServerDescriptor.of("primary", List.of("search"), 1, 1),
                    McpServerDescriptor.of("backup", List.of("search"), 2, 1));
            for (int i = 0; i < 3; i++) registry.recordHealthCheck("primary", false);

            assertEquals("backup", selector(registry).select("search").id());
        }

        @Test
        @DisplayName("a server under the success-rate floor is passed over")
        void metricFloor() {
            var registry = registry(McpServerDescriptor.of("flaky", List.of("search"), 1, 1),
                    McpServerDescriptor.of("steady", List.of("search"), 2, 1));
            for (int i = 0; i < 4; i++) registry.recordCall("flaky", 10, false);

            assertEquals("steady", selector(registry).select("search").id());
        }

        @Test
        @DisplayName("one failed call on a fresh server does not drop it under the floor")
        void floorNeedsMinimumSamples() {
            var registry = registry(McpServerDescriptor.of("docs", List.of("documentation"), 1, 1));
            var selector = selector(registry);

            try (var lease = selector.acquire("documentation", "h1", null)) {
                selector.recordOutcome(lease, 10, false);
            }

            assertEquals(0.0, registry.status("docs").orElseThrow().successRate());
            assertEquals("docs", selector.select("documentation").id());
        }

        @Test
        @DisplayName("a server dropped under the floor comes back after a successful health check")
        void floorRecoversOnHealthyCheck() {
            var registry = registry(McpServerDescriptor.of("docs", List.of("documentation"), 1, 1));
            var selector = new McpServerSelector(registry, Map.of(), 0.5, 5_000, 1);

            try (var lease = selector.acquire("documentation", "h1", null)) {
                selector.recordOutcome(lease, 10, false);
            }
            assertThrows(NoAvailableServerException.class, () -> selector.select("documentation"));

            assertEquals(ServerHealth.HEALTHY, registry.recordHealthCheck("docs", true));

            assertEquals(0, registry.status("docs").orElseThrow().samples());
            assertEquals("docs", selector.select("documentation").id());
        }

        @Test
        @DisplayName("servers passed in the skip set are not leased")
        void skipSet() {
            var registry = registry(McpServerDescriptor.of("docs-a", List.of("documentation"), 1, 1),
                    McpServerDescriptor.of("docs-b", List.of("documentation"), 1, 1));
            var selector = selector(registry);

            for (int i = 0; i < 3; i++) {
                try (var lease = selector.acquire("documentation", "h" + i, null, Set.of("docs-a"))) {
                    assertEquals("docs-b", lease.server().id());
                }
            }
            assertThrows(NoAvailableServerException.class, () -> selector.acquire("documentation", "h9", null,
                    Set.of("docs-a", "docs-b")));
        }

        @Test
        @DisplayName("an agent's affinity servers come before priority order")
        void affinity() {
            var registry = registry(McpServerDescriptor.of("general", List.of("documentation"), 1, 1),
                    McpServerDescriptor.of("ui-docs", List.of("documentation"), 5, 1));
            var selector = new McpServerSelector(registry, Map.of(AgentKind.FRONTEND, List.of("ui-docs")), 0.5, 5_000);

            assertEquals("ui-docs", selector.select("documentation", AgentKind.FRONTEND).id());
            assertEquals("general", selector.select("documentation", AgentKind.BACKEND).id());
        }

        @Test
        @DisplayName("no server for a capability raises NoAvailableServerException")
        void noServer() {
            var selector = selector(registry(McpServerDescriptor.of("docs", List.of("documentation"), 1, 1)));
            var ex = assertThrows(NoAvailableServerException.class, () -> selector.select("security-scan"));
            assertEquals("security-scan", ex.getCapability());
        }
    }

    // ===================================================================
    // Leases
    // ===================================================================

    @Nested
    @DisplayName("leases")
    class Leases {

        @Test
        @DisplayName("equal-priority servers are leased round-robin")
        void roundRobin() {
            var registry = registry(McpServerDescriptor.of("a", List.of("search"), 1, 5),
                    McpServerDescriptor.of("b", List.of("search"), 1, 5));
            var selector = selector(registry);

            var used = new HashSet<String>();
            for (int i = 0; i < 4; i++) {
                try (var lease = selector.acquire("search", "holder-" + i, null)) {
                    used.add(lease.server().id());
                }
            }
            assertEquals(2, used.size());
        }

        @Test
        @DisplayName("a full server overflows to the next tier and frees up on release")
        void capOverflow() {
            var registry = registry(McpServerDescriptor.of("primary", List.of("search"), 1, 1),
                    McpServerDescriptor.of("backup", List.of("search"), 2, 1));
            var selector = selector(registry);

            var first = selector.acquire("search", "h1", null);
            var second = selector.acquire("search", "h2", null);
            assertEquals("primary", first.server().id());
            assertEquals("backup", second.server().id());
            assertThrows(NoAvailableServerException.class, () -> selector.acquire("search", "h3", null));

            first.close();
            assertEquals("primary", selector.acquire("search", "h3", null).server().id());
        }

        @Test
        @DisplayName("closing a lease twice releases one slot")
        void idempotentClose() {
            var registry = registry(McpServerDescriptor.of("only", List.of("search"), 1, 2));
            var selector = selector(registry);
            var kept = selector.acquire("search", "h1", null);
            var lease = selector.acquire("search", "h2", null);

            lease.close();
            lease.close();

            assertEquals(1, registry.status("only").orElseThrow().activeLeases());
            assertFalse(kept.isReleased());
        }

        @Test
        @DisplayName("releaseAll frees every lease of a holder")
        void releaseAll() {
            var registry = registry(McpServerDescriptor.of("a", List.of("search", "reasoning"), 1, 5));
            var selector = selector(registry);
            selector.acquire("search", "agent-1", null);
            selector.acquire("reasoning", "agent-1", null);
            selector.acquire("search", "agent-2", null);

            assertEquals(2, selector.releaseAll("agent-1"));
            assertEquals(0, selector.activeLeaseCount("agent-1"));
            assertEquals(1, registry.status("a").orElseThrow().activeLeases());
            assertEquals(0, selector.releaseAll("agent-1"));
        }

        @Test
        @DisplayName("concurrent acquirers never exceed a server's lease cap")
        void capUnderContention() throws Exception {
            var registry = registry(McpServerDescriptor.of("only", List.of("search"), 1, 3));
            var selector = selector(registry);
            var pool = Executors.newFixedThreadPool(8);
            var start = new CountDownLatch(1);
            var granted = new AtomicInteger();
            var maxSeen = new AtomicInteger();
            var failures = new ArrayList<Throwable>();

            for (int i = 0; i < 40; i++) {
                String holder = "h" + i;
                pool.submit(() -> {
                    try {
                        start.await();
                        try (var lease = selector.acquire("search", holder, null)) {
                            granted.incrementAndGet();
                            int active = registry.status("only").orElseThrow().activeLeases();
                            maxSeen.accumulateAndGet(active, Math::max);
                            Thread.sleep(2);
                        }
                    } catch (NoAvailableServerException e) {
                        // expected when all slots are taken
                    } catch (Throwable t) {
                        synchronized (failures) {
                            failures.add(t);
                        }
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

            assertTrue(failures.isEmpty(), failures.toString());
            assertTrue(granted.get() > 0);
            assertTrue(maxSeen.get() <= 3);
            assertEquals(0, registry.status("only").orElseThrow().activeLeases());
        }
    }

    // ===================================================================
    // Health
    // ===================================================================

    @Test
    @DisplayName("health turns unhealthy at the failure threshold and recovers on one success")
    void healthTransitions() {
        var registry = registry(McpServerDescriptor.of("s", List.of("search"), 1, 1));

        assertEquals(ServerHealth.UNKNOWN, registry.status("s").orElseThrow().health());
        assertEquals(ServerHealth.UNKNOWN, registry.recordHealthCheck("s", false));
        assertEquals(ServerHealth.UNKNOWN, registry.recordHealthCheck("s", false));
        assertEquals(ServerHealth.UNHEALTHY, registry.recordHealthCheck("s", false));
        assertEquals(ServerHealth.HEALTHY, registry.recordHealthCheck("s", true));
        assertEquals(0, registry.status("s").orElseThrow().consecutiveFailures());
    }

    @Test
    @DisplayName("a successful health check keeps a window of successful calls")
    void healthyCheckKeepsCleanWindow() {
        var registry = registry(McpServerDescriptor.of("s", List.of("search"), 1, 1));
        registry.recordCall("s", 40, true);
        registry.recordCall("s", 60, true);

        registry.recordHealthCheck("s", true);

        assertEquals(2, registry.status("s").orElseThrow().samples());
        assertEquals(50.0, registry.status("s").orElseThrow().averageLatencyMs());
    }

    @Test
    @DisplayName("duplicate server ids are rejected")
    void duplicateIds() {
        assertThrows(IllegalArgumentException.class, () -> registry(
                McpServerDescriptor.of("s", List.of("search"), 1, 1),
                McpServerDescriptor.of("s", List.of("search"), 2, 1)));
    }
}
