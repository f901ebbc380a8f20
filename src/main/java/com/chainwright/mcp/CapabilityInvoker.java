package com.chainwright.mcp;

import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.metrics.ChainMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Invokes a capability through a leased server, walking the capability's fallback chain when no
 * server can serve it.
 * <p>
 * The chain is the requested capability followed by its configured fallbacks. A failed call is
 * retried on the other servers of the same capability before the chain moves on. An answer from a
 * fallback is tagged {@code confidenceReduced}. When the chain is exhausted a degradable
 * capability yields {@link CapabilityResponse#degraded}, any other capability raises
 * {@link CapabilityUnavailableException}.
 */
public class CapabilityInvoker {

    private static final Logger log = LoggerFactory.getLogger(CapabilityInvoker.class);

    private final McpServerSelector selector;
    private final CapabilityTransport transport;
    private final Map<String, List<String>> fallbacks;
    private final Set<String> degradable;
    private final EventBus eventBus;
    private final ChainMetrics metrics;

    public CapabilityInvoker(McpServerSelector selector, CapabilityTransport transport,
                             Map<String, List<String>> fallbacks, Set<String> degradable,
                             EventBus eventBus, ChainMetrics metrics) {
        this.selector = selector;
        this.transport = transport;
        this.fallbacks = fallbacks == null ? Map.of() : Map.copyOf(fallbacks);
        this.degradable = degradable == null ? Set.of() : Set.copyOf(degradable);
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public boolean isDegradable(String capability) {
        return degradable.contains(capability);
    }

    public List<String> chainFor(String capability) {
        var chain = new ArrayList<String>();
        chain.add(capability);
        for (String fb : fallbacks.getOrDefault(capability, List.of())) {
            if (!chain.contains(fb)) chain.add(fb);
        }
        return chain;
    }

    /**
     * Invokes the capability.
     *
     * @throws CapabilityUnavailableException if the chain is exhausted for a non-degradable capability
     */
    public CapabilityResponse invoke(CapabilityCall call) {
        var chain = chainFor(call.capability());
        RuntimeException lastFailure = null;

        for (String capability : chain) {
            var failedServers = new HashSet<String>();
            while (true) {
                ServerLease lease;
                try {
                    lease = selector.acquire(capability, call.holderId(), call.agentKind(), failedServers);
                } catch (NoAvailableServerException e) {
                    metrics.recordLease(capability, "unavailable");
                    log.warn("No server for capability '{}' ({})", capability, e.getMessage());
                    if (lastFailure == null) lastFailure = e;
                    break;
                }
                metrics.recordLease(capability, "granted");

                try (lease) {
                    long start = System.currentTimeMillis();
                    try {
                        String result = transport.callTool(lease.server(), lease.server().toolFor(capability),
                                call.arguments());
                        long latency = System.currentTimeMillis() - start;
                        selector.recordOutcome(lease, latency, true);
                        boolean viaFallback = !capability.equals(call.capability());
                        if (viaFallback) {
                            onFallback(call, capability);
                        }
                        return new CapabilityResponse(call.capability(), capability, lease.server().id(),
                                result == null ? "" : result, latency, true, viaFallback);
                    } catch (Exception e) {
                        long latency = System.currentTimeMillis() - start;
                        selector.recordOutcome(lease, latency, false);
                        log.warn("Capability '{}' call on {} failed after {}ms, trying another server: {}",
                                capability, lease.server().id(), latency, e.getMessage());
                        failedServers.add(lease.server().id());
                        lastFailure = e instanceof RuntimeException re ? re : new IllegalStateException(e.getMessage(), e);
                    }
                }
            }
        }

        if (isDegradable(call.capability())) {
            log.warn("Capability '{}' exhausted fallbacks {}; continuing degraded", call.capability(), chain);
            onFallback(call, "degraded");
            return CapabilityResponse.degraded(call.capability());
        }
        throw new CapabilityUnavailableException(call.capability(), chain, lastFailure);
    }

    private void onFallback(CapabilityCall call, String fallback) {
        metrics.recordCapabilityFallback(call.capability(), fallback);
        eventBus.publish(ChainEvent.of("capability.fallback", call.runId(), null, Map.of(
                "capability", call.capability(),
                "fallback", fallback,
                "holder", call.holderId())));
    }
}
