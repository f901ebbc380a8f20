package com.chainwright.mcp;

import java.util.List;
import java.util.Map;

/**
 * Static description of one MCP capability server.
 *
 * @param id                   configured server name
 * @param url                  server base URL (blank for in-process test servers)
 * @param capabilityTags       capabilities this server serves
 * @param priority             selection priority, lower wins
 * @param maxConcurrentLeases  lease cap
 * @param healthIntervalMs     health-check period
 * @param healthTimeoutMs      health-check timeout
 * @param failureThreshold     consecutive failed checks before the server is unhealthy
 * @param tools                capability tag to MCP tool name; unmapped tags use the tag itself
 */
public record McpServerDescriptor(
    String id,
    String url,
    List<String> capabilityTags,
    int priority,
    int maxConcurrentLeases,
    long healthIntervalMs,
    long healthTimeoutMs,
    int failureThreshold,
    Map<String, String> tools
) {
    public McpServerDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("MCP server requires an id");
        }
        if (maxConcurrentLeases < 1) {
            throw new IllegalArgumentException("Server " + id + " needs a lease cap of at least 1");
        }
        url = url == null ? "" : url;
        capabilityTags = capabilityTags == null ? List.of() : List.copyOf(capabilityTags);
        tools = tools == null ? Map.of() : Map.copyOf(tools);
        failureThreshold = failureThreshold < 1 ? 3 : failureThreshold;
    }

    public static McpServerDescriptor of(String id, List<String> capabilityTags, int priority, int maxConcurrentLeases) {
        return new McpServerDescriptor(id, "", capabilityTags, priority, maxConcurrentLeases, 30_000, 5_000, 3, Map.of());
    }

    public static McpServerDescriptor from(String id, McpProperties.ServerConfig config) {
        var hc = config.getHealthCheck();
        return new McpServerDescriptor(id, config.getUrl(), config.getCapabilityTags(), config.getPriority(),
                config.getMaxConcurrentLeases(), hc.getIntervalMs(), hc.getTimeoutMs(), hc.getFailureThreshold(),
                config.getTools());
    }

    public boolean serves(String capability) {
        return capabilityTags.contains(capability);
    }

    public String toolFor(String capability) {
        return tools.getOrDefault(capability, capability);
    }
}
