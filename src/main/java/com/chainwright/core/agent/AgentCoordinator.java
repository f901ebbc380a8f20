package com.chainwright.core.agent;

import com.chainwright.core.config.ChainwrightProperties;
import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.logging.MdcContext;
import com.chainwright.core.metrics.ChainMetrics;
import com.chainwright.core.model.ProjectContext;
import com.chainwright.mcp.CapabilityUnavailableException;
import com.chainwright.mcp.McpServerSelector;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spawns, supervises and aggregates concurrent agent instances.
 * <p>
 * At most {@code maxConcurrentAgents} instances run at once across all runs; the rest wait on a
 * semaphore. Each attempt is bounded by the per-instance timeout, after which the straggler is
 * interrupted and counted as failed. A failed attempt is retried once with the same descriptor;
 * a second failure drops that agent's contribution and marks the result as a partial
 * coordination failure. Results are aggregated in descriptor-priority order.
 */
@Service
public class AgentCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AgentCoordinator.class);

    private final AgentExecutor agentExecutor;
    private final OutputConflictResolver conflictResolver;
    private final McpServerSelector selector;
    private final EventBus eventBus;
    private final ChainMetrics metrics;
    private final ChainwrightProperties.Coordinator config;

    private final Semaphore slots;
    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;

    /** Live instances by id; an instance is owned by exactly one run. */
    private final Map<String, AgentInstance> live = new ConcurrentHashMap<>();

    public AgentCoordinator(AgentExecutor agentExecutor, OutputConflictResolver conflictResolver,
                            McpServerSelector selector, EventBus eventBus, ChainMetrics metrics,
                            ChainwrightProperties properties) {
        this.agentExecutor = agentExecutor;
        this.conflictResolver = conflictResolver;
        this.selector = selector;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.config = properties.getCoordinator();
        this.slots = new Semaphore(Math.max(1, config.getMaxConcurrentAgents()), true);

        var count = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "agent-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "agent-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates one instance per descriptor, each with a read-only view of its domain, and starts them.
     *
     * @return the spawned instances, in descriptor order
     */
    public List<AgentInstance> spawn(String runId, List<AgentDescriptor> descriptors, AgentTask task,
                                     ProjectContext context) {
        var instances = new ArrayList<AgentInstance>();
        for (var descriptor : descriptors) {
            var view = context.view(List.of(descriptor.kind().domain()));
            var instance = new AgentInstance(runId, descriptor, task, view);
            assign(instance, runId);
            instances.add(instance);
            eventBus.publish(ChainEvent.of("agent.spawned", runId, task.stage().id().name(), Map.of(
                    "agent", descriptor.kind().name(),
                    "instanceId", instance.id(),
                    "wavePhase", task.wavePhase() != null ? task.wavePhase().name() : "SINGLE_PASS")));
            workers.execute(() -> runInstance(instance));
        }
        log.info("Spawned {} agent(s) for run {} at {}: {}", instances.size(), runId, task.stage().id(),
                instances.stream().map(AgentInstance::id).toList());
        return instances;
    }

    /**
     * Registers the instance as live for the run.
     *
     * @throws IllegalStateException if the instance belongs to another run or is already assigned
     */
    public void assign(AgentInstance instance, String runId) {
        if (!instance.runId().equals(runId)) {
            throw new IllegalStateException("Instance " + instance.id() + " is owned by run " + instance.runId()
                    + ", cannot assign to " + runId);
        }
        var previous = live.putIfAbsent(instance.id(), instance);
        if (previous != null) {
            throw new IllegalStateException("Instance " + instance.id() + " is already assigned to run "
                    + previous.runId());
        }
    }

    /**
     * Waits until every instance reaches a terminal state, then aggregates in priority order.
     *
     * @throws CapabilityUnavailableException if an agent hit a required capability with no fallback left
     */
    public AggregatedResult await(List<AgentInstance> instances) {
        var outcomes = new ArrayList<AgentOutcome>();
        for (var instance : instances) {
            outcomes.add(join(instance));
            live.remove(instance.id());
        }

        outcomes.sort(Comparator.comparingInt(AgentOutcome::priority).thenComparing(AgentOutcome::kind));

        for (var outcome : outcomes) {
            if (outcome.fatal() != null) {
                throw outcome.fatal();
            }
        }

        var resolution = conflictResolver.resolve(outcomes);
        var contributions = new ArrayList<AgentContribution>();
        boolean partial = false;
        boolean reduced = false;
        for (var outcome : outcomes) {
            boolean ok = outcome.completed();
            partial |= !ok;
            boolean outcomeReduced = ok && outcome.output().confidenceReduced();
            reduced |= outcomeReduced;
            contributions.add(new AgentContribution(outcome.kind(), outcome.instanceId(), outcome.state(),
                    outcome.attempts(), resolution.sectionsWon().getOrDefault(outcome.kind(), List.of()),
                    outcomeReduced, outcome.error()));
        }
        if (partial) {
            log.warn("Partial coordination failure: {}", contributions.stream()
                    .filter(c -> c.state() != InstanceState.COMPLETED)
                    .map(c -> c.kind() + " " + c.state()).toList());
        }
        return new AggregatedResult(resolution.content(), contributions, resolution.secondarySuggestions(),
                partial, reduced);
    }

    /**
     * Cancels every live instance of the run: signals them, waits up to the grace period for
     * acknowledgement, force-terminates the rest and releases their MCP leases.
     *
     * @return the number of instances cancelled
     */
    public int cancelRun(String runId) {
        var targets = live.values().stream().filter(i -> i.runId().equals(runId)).toList();
        if (targets.isEmpty()) return 0;

        log.info("Cancelling {} agent instance(s) of run {}", targets.size(), runId);
        for (var instance : targets) {
            instance.requestCancel();
        }

        var acks = targets.stream().map(AgentInstance::outcome).toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(acks).get(config.getCancelGraceSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Agent instances of run {} did not acknowledge cancellation within {}s; forcing",
                    runId, config.getCancelGraceSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.debug("Cancellation wait ended with {}", e.getCause().getMessage());
        }

        for (var instance : targets) {
            if (instance.finish(AgentOutcome.cancelled(instance, "force-terminated after grace period", 0))) {
                log.warn("Force-terminated agent instance {}", instance.id());
            }
            selector.releaseAll(instance.id());
            live.remove(instance.id());
        }
        return targets.size();
    }

    public List<AgentInstance> liveInstances(String runId) {
        return live.values().stream().filter(i -> i.runId().equals(runId)).toList();
    }

    private AgentOutcome join(AgentInstance instance) {
        try {
            return instance.outcome().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            instance.requestCancel();
            instance.finish(AgentOutcome.cancelled(instance, "coordinator interrupted", 0));
            return instance.outcome().getNow(AgentOutcome.cancelled(instance, "coordinator interrupted", 0));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Agent outcome channel failed for " + instance.id(), e.getCause());
        }
    }

    private void runInstance(AgentInstance instance) {
        String stage = instance.task().stage().id().name();
        long start = System.currentTimeMillis();
        boolean acquired = false;
        try {
            slots.acquire();
            acquired = true;
            MdcContext.setAgent(instance.runId(), stage, instance.kind().name(), instance.id());
            if (instance.task().wavePhase() != null) {
                MdcContext.setWave(instance.runId(), instance.task().wavePhase().name());
            }
            runAttempts(instance, start);
        } catch (InterruptedException e) {
            instance.finish(AgentOutcome.cancelled(instance, "cancelled while queued", elapsed(start)));
        } finally {
            instance.clearRunner();
            if (acquired) slots.release();
            selector.releaseAll(instance.id());
            MdcContext.clear();
        }
    }

    private void runAttempts(AgentInstance instance, long start) {
        String stage = instance.task().stage().id().name();
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        String lastError = null;

        while (instance.attempts() < maxAttempts) {
            if (instance.isCancelRequested()) {
                instance.finish(AgentOutcome.cancelled(instance, "cancelled", elapsed(start)));
                return;
            }
            if (!instance.markRunning(Thread.currentThread())) {
                return;
            }
            int attempt = instance.nextAttempt();
            ScheduledFuture<?> timeout = watchdog.schedule(() -> timeOut(instance, start),
                    config.getInstanceTimeoutSeconds(), TimeUnit.SECONDS);
            try {
                var output = agentExecutor.execute(instance);
                long elapsed = elapsed(start);
                if (instance.finish(AgentOutcome.completed(instance, output, elapsed))) {
                    metrics.recordAgentExecution(instance.kind().name(), "completed", elapsed);
                    eventBus.publish(ChainEvent.of("agent.completed", instance.runId(), stage, Map.of(
                            "agent", instance.kind().name(), "instanceId", instance.id(),
                            "attempts", attempt, "confidenceReduced", output.confidenceReduced())));
                    log.info("Agent {} completed in {}ms (attempt {})", instance.id(), elapsed, attempt);
                }
                return;
            } catch (CapabilityUnavailableException e) {
                log.error("Agent {} needs unavailable capability '{}'", instance.id(), e.getCapability());
                instance.finish(AgentOutcome.failed(instance, e.getMessage(), e, elapsed(start)));
                return;
            } catch (InterruptedException e) {
                instance.finish(AgentOutcome.cancelled(instance, "cancelled while running", elapsed(start)));
                return;
            } catch (Exception e) {
                if (instance.state().isTerminal()) {
                    // timed out or force-cancelled; the outcome is already published
                    return;
                }
                var failure = new AgentSpawnException("Agent " + instance.id() + " failed on attempt " + attempt
                        + ": " + e.getMessage(), e);
                lastError = failure.getMessage();
                log.warn(failure.getMessage(), e);
            } finally {
                timeout.cancel(false);
                Thread.interrupted();
            }
        }

        long elapsed = elapsed(start);
        if (instance.finish(AgentOutcome.failed(instance, lastError, null, elapsed))) {
            metrics.recordAgentExecution(instance.kind().name(), "failed", elapsed);
            metrics.recordCoordinationFailure(instance.kind().name());
            eventBus.publish(ChainEvent.of("agent.failed", instance.runId(), stage, Map.of(
                    "agent", instance.kind().name(), "instanceId", instance.id(),
                    "attempts", instance.attempts(), "error", String.valueOf(lastError))));
        }
    }

    private void timeOut(AgentInstance instance, long start) {
        String reason = "timed out after " + config.getInstanceTimeoutSeconds() + "s";
        if (instance.finish(AgentOutcome.failed(instance, reason, null, elapsed(start)))) {
            log.warn("Agent {} {}", instance.id(), reason);
            instance.requestCancel();
            metrics.recordAgentExecution(instance.kind().name(), "timeout", elapsed(start));
            metrics.recordCoordinationFailure(instance.kind().name());
            eventBus.publish(ChainEvent.of("agent.failed", instance.runId(), instance.task().stage().id().name(),
                    Map.of("agent", instance.kind().name(), "instanceId", instance.id(), "error", reason)));
        }
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }

    @PreDestroy
    public void shutdown() {
        watchdog.shutdownNow();
        workers.shutdownNow();
    }
}
