package com.chainwright.mcp;

import com.chainwright.core.agent.AgentKind;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.metrics.ChainMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Wires the MCP registry, selector, invoker and health monitor from {@link McpProperties}.
 * With MCP disabled the registry is empty and every capability takes its fallback path.
 */
@Configuration
public class McpConfig {

    @Bean
    public ServerRegistry serverRegistry(McpProperties props) {
        var descriptors = new ArrayList<McpServerDescriptor>();
        if (props.isEnabled()) {
            props.getServers().forEach((id, config) -> descriptors.add(McpServerDescriptor.from(id, config)));
        }
        return new ServerRegistry(descriptors, props.getMetricsWindow());
    }

    @Bean
    public McpServerSelector mcpServerSelector(ServerRegistry registry, McpProperties props) {
        return new McpServerSelector(registry, affinity(props.getAffinity()),
                props.getMinSuccessRate(), props.getMaxAverageLatencyMs(), props.getMinSamples());
    }

    @Bean
    public CapabilityInvoker capabilityInvoker(McpServerSelector selector, McpClientManager transport,
                                               McpProperties props, EventBus eventBus, ChainMetrics metrics) {
        return new CapabilityInvoker(selector, transport, props.getFallbacks(),
                new HashSet<>(props.getDegradable()), eventBus, metrics);
    }

    @Bean
    public McpHealthMonitor mcpHealthMonitor(ServerRegistry registry, McpClientManager transport,
                                             McpProperties props) {
        return new McpHealthMonitor(registry, transport, props.isConfigured());
    }

    static Map<AgentKind, List<String>> affinity(Map<String, List<String>> raw) {
        var map = new EnumMap<AgentKind, List<String>>(AgentKind.class);
        raw.forEach((kind, servers) -> map.put(AgentKind.valueOf(kind.trim().toUpperCase()), List.copyOf(servers)));
        return map;
    }
}
