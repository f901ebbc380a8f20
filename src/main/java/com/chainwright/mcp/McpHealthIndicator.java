package com.chainwright.mcp;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator over the MCP server registry.
 */
@Component
public class McpHealthIndicator implements HealthIndicator {

    private final ServerRegistry registry;

    public McpHealthIndicator(ServerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        var statuses = registry.statuses();
        if (statuses.isEmpty()) {
            return Health.unknown().withDetail("reason", "no MCP servers configured").build();
        }

        var builder = Health.up();
        boolean anyDown = false;
        for (var status : statuses) {
            builder.withDetail(status.descriptor().id(), String.format("%s, leases %d/%d, success %.2f",
                    status.health(), status.activeLeases(), status.descriptor().maxConcurrentLeases(),
                    status.successRate()));
            if (status.health() == ServerHealth.UNHEALTHY) {
                anyDown = true;
            }
        }
        return anyDown ? builder.status("DEGRADED").build() : builder.build();
    }
}
