package com.chainwright.mcp;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically pings every registered MCP server and feeds the outcome into the
 * {@link ServerRegistry}. Each server is checked on its own interval and timeout.
 */
public class McpHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(McpHealthMonitor.class);

    private final ServerRegistry registry;
    private final CapabilityTransport transport;
    private final boolean scheduled;
    private ScheduledExecutorService scheduler;

    public McpHealthMonitor(ServerRegistry registry, CapabilityTransport transport, boolean scheduled) {
        this.registry = registry;
        this.transport = transport;
        this.scheduled = scheduled;
    }

    @PostConstruct
    void start() {
        if (!scheduled || registry.isEmpty()) {
            log.info("MCP health monitor idle ({} servers, scheduling {})",
                    registry.statuses().size(), scheduled ? "on" : "off");
            return;
        }
        scheduler = Executors.newScheduledThreadPool(1, r -> {
            var t = new Thread(r, "mcp-health");
            t.setDaemon(true);
            return t;
        });
        for (var status : registry.statuses()) {
            var server = status.descriptor();
            scheduler.scheduleWithFixedDelay(() -> check(server), 0, server.healthIntervalMs(), TimeUnit.MILLISECONDS);
        }
        log.info("MCP health monitor started for {} server(s)", registry.statuses().size());
    }

    /**
     * Runs one health check against every server.
     */
    public void checkAll() {
        for (var status : registry.statuses()) {
            check(status.descriptor());
        }
    }

    /**
     * Runs one health check and records the outcome.
     *
     * @return the server's health after the check
     */
    public ServerHealth check(McpServerDescriptor server) {
        boolean ok;
        try {
            transport.ping(server, Duration.ofMillis(server.healthTimeoutMs()));
            ok = true;
        } catch (Exception e) {
            log.debug("Health check failed for MCP server '{}': {}", server.id(), e.getMessage());
            ok = false;
        }
        return registry.recordHealthCheck(server.id(), ok);
    }

    @PreDestroy
    void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }
}
