package com.chainwright.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the mutable health, load and metrics state of every configured MCP server.
 * <p>
 * This is the only mutable state shared across runs. Every method is synchronized; callers
 * receive {@link ServerStatus} copies. Lease counts change only through the
 * {@link McpServerSelector} lease API and health only through {@link McpHealthMonitor}.
 */
public class ServerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServerRegistry.class);

    private static final class Entry {
        final McpServerDescriptor descriptor;
        final RollingMetrics metrics;
        ServerHealth health = ServerHealth.UNKNOWN;
        int consecutiveFailures;
        int activeLeases;

        Entry(McpServerDescriptor descriptor, int window) {
            this.descriptor = descriptor;
            this.metrics = new RollingMetrics(window);
        }

        ServerStatus status() {
            return new ServerStatus(descriptor, health, consecutiveFailures, activeLeases,
                    metrics.size(), metrics.successRate(), metrics.averageLatencyMs());
        }
    }

    private final Map<String, Entry> servers = new LinkedHashMap<>();

    public ServerRegistry(List<McpServerDescriptor> descriptors, int metricsWindow) {
        for (var d : descriptors) {
            if (servers.put(d.id(), new Entry(d, metricsWindow)) != null) {
                throw new IllegalArgumentException("Duplicate MCP server id: " + d.id());
            }
        }
    }

    public synchronized List<ServerStatus> statuses() {
        var list = new ArrayList<ServerStatus>(servers.size());
        for (var e : servers.values()) {
            list.add(e.status());
        }
        return list;
    }

    public synchronized Optional<ServerStatus> status(String serverId) {
        var e = servers.get(serverId);
        return e == null ? Optional.empty() : Optional.of(e.status());
    }

    /** Statuses of the servers that declare the capability, in registration order. */
    public synchronized List<ServerStatus> candidates(String capability) {
        var list = new ArrayList<ServerStatus>();
        for (var e : servers.values()) {
            if (e.descriptor.serves(capability)) {
                list.add(e.status());
            }
        }
        return list;
    }

    public synchronized boolean isEmpty() {
        return servers.isEmpty();
    }

    /**
     * Takes a lease slot on the server if it is selectable and below its cap.
     *
     * @return {@code true} when a slot was taken
     */
    synchronized boolean tryLease(String serverId) {
        var e = servers.get(serverId);
        if (e == null || !e.health.selectable() || e.activeLeases >= e.descriptor.maxConcurrentLeases()) {
            return false;
        }
        e.activeLeases++;
        return true;
    }

    synchronized void release(String serverId) {
        var e = servers.get(serverId);
        if (e != null && e.activeLeases > 0) {
            e.activeLeases--;
        }
    }

    synchronized void recordCall(String serverId, long latencyMs, boolean success) {
        var e = servers.get(serverId);
        if (e != null) {
            e.metrics.record(latencyMs, success);
        }
    }

    /**
     * Applies one health-check outcome. A server turns unhealthy after its failure threshold of
     * consecutive failures and healthy again after one success. A success also clears a call
     * window holding failures, so a server dropped under the metric floor becomes selectable again.
     *
     * @return the resulting health
     */
    synchronized ServerHealth recordHealthCheck(String serverId, boolean success) {
        var e = servers.get(serverId);
        if (e == null) return ServerHealth.UNKNOWN;
        ServerHealth before = e.health;
        if (success) {
            e.consecutiveFailures = 0;
            e.health = ServerHealth.HEALTHY;
            if (e.metrics.hasFailures()) {
                log.info("MCP server '{}' answered its health check; clearing {} call sample(s) (success rate {})",
                        serverId, e.metrics.size(), String.format("%.2f", e.metrics.successRate()));
                e.metrics.clear();
            }
        } else {
            e.consecutiveFailures++;
            if (e.consecutiveFailures >= e.descriptor.failureThreshold()) {
                e.health = ServerHealth.UNHEALTHY;
            }
        }
        if (before != e.health) {
            log.info("MCP server '{}' health {} -> {} ({} consecutive failures)",
                    serverId, before, e.health, e.consecutiveFailures);
        }
        return e.health;
    }
}
