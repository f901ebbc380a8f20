package com.chainwright.core.agent;

import com.chainwright.TestFixtures;
import com.chainwright.core.catalog.ChainCatalog;
import com.chainwright.core.config.ChainwrightProperties;
import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.metrics.ChainMetrics;
import com.chainwright.core.model.ProjectContext;
import com.chainwright.core.model.StageId;
import com.chainwright.mcp.CapabilityUnavailableException;
import com.chainwright.mcp.McpServerSelector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link AgentCoordinator}: retries, timeouts, cancellation, ownership and
 * priority-ordered aggregation.
 */
class AgentCoordinatorTest {

    private ChainCatalog catalog;
    private ChainwrightProperties properties;
    private McpServerSelector selector;
    private List<ChainEvent> events;
    private EventBus eventBus;
    private AgentCoordinator coordinator;

    @BeforeEach
    void setUp() {
        catalog = TestFixtures.catalog();
        properties = TestFixtures.properties();
        properties.getCoordinator().setInstanceTimeoutSeconds(2);
        properties.getCoordinator().setCancelGraceSeconds(1);
        selector = mock(McpServerSelector.class);
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
    }

    @AfterEach
    void tearDown() {
        if (coordinator != null) coordinator.shutdown();
    }

    private AgentCoordinator coordinator(AgentExecutor executor) {
        coordinator = new AgentCoordinator(executor, new OutputConflictResolver(), selector, eventBus,
                new ChainMetrics(new SimpleMeterRegistry()), properties);
        return coordinator;
    }

    private AgentTask task(String runId) {
        return new AgentTask(runId, catalog.stage(StageId.PRD), "idea", List.of(), null, "");
    }

    private List<AgentDescriptor> descriptors(AgentKind... kinds) {
        return List.of(kinds).stream().map(k -> catalog.descriptor(k).orElseThrow()).toList();
    }

    private List<AgentInstance> spawn(String runId, AgentKind... kinds) {
        return coordinator.spawn(runId, descriptors(kinds), task(runId), ProjectContext.empty());
    }

    // ===================================================================
    // Aggregation
    // ===================================================================

    @Nested
    @DisplayName("aggregation")
    class Aggregation {

        @Test
        @DisplayName("contributions and region winners follow priority whatever the completion order")
        void priorityUnderJitter() {
            coordinator(instance -> {
                Thread.sleep(ThreadLocalRandom.current().nextInt(0, 60));
                return new AgentOutput("## Risks\n\nfrom " + instance.kind() + "\n\n## "
                        + instance.kind().name() + " Notes\n\nnotes", false, List.of());
            });

            for (int round = 0; round < 5; round++) {
                var runId = "RUN-" + round;
                var result = coordinator.await(spawn(runId, AgentKind.SCRIBE, AgentKind.SECURITY, AgentKind.ANALYZER));

                assertEquals(List.of(AgentKind.ANALYZER, AgentKind.SECURITY, AgentKind.SCRIBE),
                        result.contributions().stream().map(AgentContribution::kind).toList());
                assertTrue(result.content().contains("from ANALYZER"));
                assertFalse(result.content().contains("from SECURITY"));
                assertEquals(2, result.secondarySuggestions().size());
                assertTrue(result.secondarySuggestions().stream().allMatch(s -> s.overriddenBy() == AgentKind.ANALYZER));
                assertFalse(result.partialCoordinationFailure());
            }
        }

        @Test
        @DisplayName("reduced confidence of a contributor carries into the result")
        void confidenceReduced() {
            coordinator(instance -> new AgentOutput("## " + instance.kind() + "\n\nx",
                    instance.kind() == AgentKind.FRONTEND, List.of()));

            var result = coordinator.await(spawn("RUN-1", AgentKind.BACKEND, AgentKind.FRONTEND));

            assertTrue(result.confidenceReduced());
            assertEquals(List.of(AgentKind.BACKEND, AgentKind.FRONTEND), result.contributors());
        }
    }

    // ===================================================================
    // Failures
    // ===================================================================

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a failed first attempt is retried once")
        void retryOnce() {
            var calls = new ConcurrentHashMap<String, AtomicInteger>();
            coordinator(instance -> {
                if (calls.computeIfAbsent(instance.id(), k -> new AtomicInteger()).incrementAndGet() == 1) {
                    throw new IllegalStateException("transient");
                }
                return new AgentOutput("## Notes\n\nok", false, List.of());
            });

            var result = coordinator.await(spawn("RUN-1", AgentKind.BACKEND));

            var contribution = result.contributions().get(0);
            assertEquals(InstanceState.COMPLETED, contribution.state());
            assertEquals(2, contribution.attempts());
            assertFalse(result.partialCoordinationFailure());
        }

        @Test
        @DisplayName("an agent failing twice is dropped and the result is partial")
        void failsTwice() {
            coordinator(instance -> {
                if (instance.kind() == AgentKind.SECURITY) throw new IllegalStateException("model error");
                return new AgentOutput("## Backend\n\nok", false, List.of());
            });

            var result = coordinator.await(spawn("RUN-1", AgentKind.SECURITY, AgentKind.BACKEND));

            assertTrue(result.partialCoordinationFailure());
            assertEquals(List.of(AgentKind.SECURITY), result.failedAgents());
            assertEquals(List.of(AgentKind.BACKEND), result.contributors());
            assertTrue(result.content().contains("## Backend"));
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals("agent.failed")));
        }

        @Test
        @DisplayName("a straggler past the instance timeout counts as failed")
        void timeout() {
            properties.getCoordinator().setInstanceTimeoutSeconds(1);
            properties.getCoordinator().setMaxAttempts(1);
            coordinator(instance -> {
                Thread.sleep(10_000);
                return new AgentOutput("late", false, List.of());
            });

            long start = System.currentTimeMillis();
            var result = coordinator.await(spawn("RUN-1", AgentKind.PERFORMANCE));

            assertTrue(System.currentTimeMillis() - start < 5_000);
            assertEquals(InstanceState.FAILED, result.contributions().get(0).state());
            assertTrue(result.contributions().get(0).error().contains("timed out"));
            assertTrue(result.partialCoordinationFailure());
        }

        @Test
        @DisplayName("an unavailable capability is fatal to the await")
        void fatalCapability() {
            coordinator(instance -> {
                throw new CapabilityUnavailableException("security-scan", List.of("security-scan"), null);
            });

            assertThrows(CapabilityUnavailableException.class,
                    () -> coordinator.await(spawn("RUN-1", AgentKind.SECURITY)));
        }
    }

    // ===================================================================
    // Cancellation and ownership
    // ===================================================================

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("cancelRun stops only the run's instances and releases their leases")
        void cancelRun() throws Exception {
            var started = new CountDownLatch(2);
            coordinator(instance -> {
                started.countDown();
                if (instance.runId().equals("RUN-A")) {
                    Thread.sleep(30_000);
                }
                return new AgentOutput("## Done\n\n" + instance.runId(), false, List.of());
            });

            var a = spawn("RUN-A", AgentKind.BACKEND);
            var b = spawn("RUN-B", AgentKind.BACKEND);
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertEquals(1, coordinator.cancelRun("RUN-A"));

            var resultA = coordinator.await(a);
            assertEquals(InstanceState.CANCELLED, resultA.contributions().get(0).state());
            assertTrue(coordinator.liveInstances("RUN-A").isEmpty());
            verify(selector, atLeastOnce()).releaseAll(a.get(0).id());

            var resultB = coordinator.await(b);
            assertEquals(InstanceState.COMPLETED, resultB.contributions().get(0).state());
        }

        @Test
        @DisplayName("cancelling a run with no live instances is a no-op")
        void nothingToCancel() {
            coordinator(instance -> new AgentOutput("x", false, List.of()));
            assertEquals(0, coordinator.cancelRun("RUN-NONE"));
        }

        @Test
        @DisplayName("an instance cannot be assigned to a run that does not own it")
        void ownership() {
            coordinator(instance -> new AgentOutput("x", false, List.of()));
            var instance = new AgentInstance("RUN-A", catalog.descriptor(AgentKind.SCRIBE).orElseThrow(),
                    task("RUN-A"), ProjectContext.empty().view(List.of()));

            assertThrows(IllegalStateException.class, () -> coordinator.assign(instance, "RUN-B"));
            coordinator.assign(instance, "RUN-A");
            assertThrows(IllegalStateException.class, () -> coordinator.assign(instance, "RUN-A"));
        }
    }

    @Test
    @DisplayName("no more than the configured number of agents run at once")
    void concurrencyCap() {
        properties.getCoordinator().setMaxConcurrentAgents(2);
        var running = new AtomicInteger();
        var maxSeen = new AtomicInteger();
        coordinator(instance -> {
            maxSeen.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                Thread.sleep(50);
            } finally {
                running.decrementAndGet();
            }
            return new AgentOutput("## " + instance.kind() + "\n\nok", false, List.of());
        });

        var result = coordinator.await(spawn("RUN-1", AgentKind.ARCHITECT, AgentKind.ANALYZER, AgentKind.BACKEND,
                AgentKind.FRONTEND, AgentKind.SCRIBE));

        assertEquals(5, result.contributors().size());
        assertTrue(maxSeen.get() <= 2);
    }
}
