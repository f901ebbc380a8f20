package com.chainwright.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for MCP capability servers.
 * <p>
 * Each named server declares the capability tags it serves, a priority (lower wins), a lease cap
 * and its health-check settings. Affinity, fallback and degradation rules are shared.
 *
 * <pre>
 * chainwright:
 *   mcp:
 *     enabled: true
 *     servers:
 *       docs-primary:
 *         url: http://localhost:8090
 *         capability-tags: [documentation]
 *         priority: 1
 *         max-concurrent-leases: 4
 *         health-check:
 *           interval-ms: 30000
 *           timeout-ms: 5000
 *         tools:
 *           documentation: lookup_docs
 *     affinity:
 *       FRONTEND: [ui-server]
 *     fallbacks:
 *       documentation: [search]
 *     degradable: [documentation, reasoning]
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "chainwright.mcp")
public class McpProperties {

    private boolean enabled = false;
    private Map<String, ServerConfig> servers = new LinkedHashMap<>();
    private Map<String, List<String>> affinity = new HashMap<>();
    private Map<String, List<String>> fallbacks = new HashMap<>();
    private List<String> degradable = new ArrayList<>();
    private double minSuccessRate = 0.5;
    private long maxAverageLatencyMs = 10_000;
    private int metricsWindow = 20;
    private int minSamples = McpServerSelector.DEFAULT_MIN_SAMPLES;
    private int requestTimeoutSeconds = 30;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Map<String, ServerConfig> getServers() { return servers; }
    public void setServers(Map<String, ServerConfig> servers) { this.servers = servers; }
    public Map<String, List<String>> getAffinity() { return affinity; }
    public void setAffinity(Map<String, List<String>> affinity) { this.affinity = affinity; }
    public Map<String, List<String>> getFallbacks() { return fallbacks; }
    public void setFallbacks(Map<String, List<String>> fallbacks) { this.fallbacks = fallbacks; }
    public List<String> getDegradable() { return degradable; }
    public void setDegradable(List<String> degradable) { this.degradable = degradable; }
    public double getMinSuccessRate() { return minSuccessRate; }
    public void setMinSuccessRate(double minSuccessRate) { this.minSuccessRate = minSuccessRate; }
    public long getMaxAverageLatencyMs() { return maxAverageLatencyMs; }
    public void setMaxAverageLatencyMs(long maxAverageLatencyMs) { this.maxAverageLatencyMs = maxAverageLatencyMs; }
    public int getMetricsWindow() { return metricsWindow; }
    public void setMetricsWindow(int metricsWindow) { this.metricsWindow = metricsWindow; }
    public int getMinSamples() { return minSamples; }
    public void setMinSamples(int minSamples) { this.minSamples = minSamples; }
    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }

    /**
     * Returns {@code true} when MCP is enabled and at least one server has a URL.
     */
    public boolean isConfigured() {
        return enabled && !servers.isEmpty()
                && servers.values().stream()
                    .anyMatch(s -> s.getUrl() != null && !s.getUrl().isBlank());
    }

    public static class ServerConfig {
        private String url = "";
        private String token = "";
        private List<String> capabilityTags = new ArrayList<>();
        private int priority = 100;
        private int maxConcurrentLeases = 2;
        private HealthCheck healthCheck = new HealthCheck();
        private Map<String, String> tools = new HashMap<>();

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public List<String> getCapabilityTags() { return capabilityTags; }
        public void setCapabilityTags(List<String> capabilityTags) { this.capabilityTags = capabilityTags; }
        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }
        public int getMaxConcurrentLeases() { return maxConcurrentLeases; }
        public void setMaxConcurrentLeases(int maxConcurrentLeases) { this.maxConcurrentLeases = maxConcurrentLeases; }
        public HealthCheck getHealthCheck() { return healthCheck; }
        public void setHealthCheck(HealthCheck healthCheck) { this.healthCheck = healthCheck; }
        public Map<String, String> getTools() { return tools; }
        public void setTools(Map<String, String> tools) { this.tools = tools; }
    }

    public static class HealthCheck {
        private long intervalMs = 30_000;
        private long timeoutMs = 5_000;
        private int failureThreshold = 3;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
    }
}
