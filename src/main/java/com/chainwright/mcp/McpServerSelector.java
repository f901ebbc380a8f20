package com.chainwright.mcp;

import com.chainwright.core.agent.AgentKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Matches a capability to the best available MCP server and hands out leases on it.
 * <p>
 * Candidates are the selectable servers declaring the capability that clear the rolling metric
 * thresholds. The thresholds apply once a server has {@code minSamples} calls in its window. They are grouped in tiers: the agent's affinity
 * servers first, then one tier per priority value, lower first. Within a tier the servers with
 * free lease slots are tried round-robin; a tier with no free slot falls through to the next.
 */
public class McpServerSelector {

    private static final Logger log = LoggerFactory.getLogger(McpServerSelector.class);

    public static final int DEFAULT_MIN_SAMPLES = 3;

    private final ServerRegistry registry;
    private final Map<AgentKind, List<String>> affinity;
    private final double minSuccessRate;
    private final long maxAverageLatencyMs;
    private final int minSamples;

    private final Map<String, AtomicInteger> roundRobin = new ConcurrentHashMap<>();
    private final Map<String, List<ServerLease>> leasesByHolder = new ConcurrentHashMap<>();

    public McpServerSelector(ServerRegistry registry, Map<AgentKind, List<String>> affinity,
                             double minSuccessRate, long maxAverageLatencyMs, int minSamples) {
        this.registry = registry;
        this.affinity = affinity == null ? Map.of() : Map.copyOf(affinity);
        this.minSuccessRate = minSuccessRate;
        this.maxAverageLatencyMs = maxAverageLatencyMs;
        this.minSamples = Math.max(1, minSamples);
    }

    public McpServerSelector(ServerRegistry registry, Map<AgentKind, List<String>> affinity,
                             double minSuccessRate, long maxAverageLatencyMs) {
        this(registry, affinity, minSuccessRate, maxAverageLatencyMs, DEFAULT_MIN_SAMPLES);
    }

    public ServerRegistry registry() {
        return registry;
    }

    /**
     * Returns the server an {@link #acquire} would currently pick first, without taking a lease.
     *
     * @throws NoAvailableServerException if no server can serve the capability
     */
    public McpServerDescriptor select(String capability, AgentKind agentKind) {
        for (var tier : tiers(capability, agentKind)) {
            for (var status : tier) {
                if (status.hasFreeSlot()) {
                    return status.descriptor();
                }
            }
        }
        throw noServer(capability);
    }

    public McpServerDescriptor select(String capability) {
        return select(capability, null);
    }

    /**
     * Leases a slot on the best available server for the capability.
     *
     * @param capability the capability tag
     * @param holderId   the agent instance or gate run holding the lease
     * @param agentKind  the requesting agent kind, {@code null} for gates
     * @return the lease; close it when the call completes
     * @throws NoAvailableServerException if every candidate is unhealthy, under-performing or at its cap
     */
    public ServerLease acquire(String capability, String holderId, AgentKind agentKind) {
        return acquire(capability, holderId, agentKind, Set.of());
    }

    /**
     * Leases a slot like {@link #acquire(String, String, AgentKind)}, passing over the given servers.
     * Used to retry a capability on another server after a failed call.
     */
    public ServerLease acquire(String capability, String holderId, AgentKind agentKind, Set<String> skip) {
        for (var tier : tiers(capability, agentKind)) {
            tier.removeIf(s -> skip.contains(s.descriptor().id()));
            if (tier.isEmpty()) continue;
            String tierKey = capability + "|" + tierKey(tier);
            int start = Math.floorMod(roundRobin.computeIfAbsent(tierKey, k -> new AtomicInteger())
                    .getAndIncrement(), tier.size());
            for (int i = 0; i < tier.size(); i++) {
                var descriptor = tier.get((start + i) % tier.size()).descriptor();
                if (registry.tryLease(descriptor.id())) {
                    var lease = new ServerLease(this, descriptor, capability, holderId, agentKind);
                    leasesByHolder.computeIfAbsent(holderId, k -> new CopyOnWriteArrayList<>()).add(lease);
                    log.debug("Leased {} for {} to {}", descriptor.id(), capability, holderId);
                    return lease;
                }
            }
            log.debug("No free slot in tier {} for {}", tierKey(tier), capability);
        }
        throw noServer(capability);
    }

    /**
     * Releases one lease. Safe to call more than once.
     */
    public void release(ServerLease lease) {
        if (lease.markReleased()) {
            registry.release(lease.server().id());
            var held = leasesByHolder.get(lease.holderId());
            if (held != null) {
                held.remove(lease);
                if (held.isEmpty()) {
                    leasesByHolder.remove(lease.holderId(), held);
                }
            }
            log.debug("Released {}", lease);
        }
    }

    /**
     * Releases every lease the holder still has. Used when an agent instance is cancelled.
     *
     * @return the number of leases released
     */
    public int releaseAll(String holderId) {
        var held = leasesByHolder.get(holderId);
        if (held == null) return 0;
        int count = 0;
        for (var lease : List.copyOf(held)) {
            if (!lease.isReleased()) {
                release(lease);
                count++;
            }
        }
        if (count > 0) {
            log.info("Released {} outstanding lease(s) held by {}", count, holderId);
        }
        return count;
    }

    public int activeLeaseCount(String holderId) {
        var held = leasesByHolder.get(holderId);
        return held == null ? 0 : held.size();
    }

    /** Records the outcome of a leased call in the server's rolling metrics. */
    public void recordOutcome(ServerLease lease, long latencyMs, boolean success) {
        registry.recordCall(lease.server().id(), latencyMs, success);
    }

    List<List<ServerStatus>> tiers(String capability, AgentKind agentKind) {
        var eligible = new ArrayList<ServerStatus>();
        for (var status : registry.candidates(capability)) {
            if (!status.health().selectable()) continue;
            if (status.samples() >= minSamples && (status.successRate() < minSuccessRate
                    || status.averageLatencyMs() > maxAverageLatencyMs)) {
                log.debug("Server {} below metric thresholds (success {}, latency {}ms)",
                        status.descriptor().id(), status.successRate(), status.averageLatencyMs());
                continue;
            }
            eligible.add(status);
        }

        var tiers = new ArrayList<List<ServerStatus>>();
        Set<String> placed = new LinkedHashSet<>();
        if (agentKind != null) {
            var preferred = new ArrayList<ServerStatus>();
            for (String id : affinity.getOrDefault(agentKind, List.of())) {
                eligible.stream().filter(s -> s.descriptor().id().equals(id)).findFirst().ifPresent(s -> {
                    preferred.add(s);
                    placed.add(id);
                });
            }
            if (!preferred.isEmpty()) tiers.add(preferred);
        }

        var byPriority = new TreeMap<Integer, List<ServerStatus>>();
        for (var status : eligible) {
            if (placed.contains(status.descriptor().id())) continue;
            byPriority.computeIfAbsent(status.descriptor().priority(), p -> new ArrayList<>()).add(status);
        }
        for (var tier : byPriority.values()) {
            tier.sort(Comparator.comparing(s -> s.descriptor().id()));
            tiers.add(tier);
        }
        return tiers;
    }

    private static String tierKey(List<ServerStatus> tier) {
        var sb = new StringBuilder();
        for (var s : tier) sb.append(s.descriptor().id()).append(',');
        return sb.toString();
    }

    private NoAvailableServerException noServer(String capability) {
        return new NoAvailableServerException(capability,
                "No healthy MCP server with free capacity serves '" + capability + "'");
    }
}
