package com.chainwright.dispatch.cli;

import com.chainwright.mcp.McpHealthMonitor;
import com.chainwright.mcp.ServerHealth;
import com.chainwright.mcp.ServerRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: chainwright servers
 * <p>
 * Lists the configured MCP capability servers with their health, lease usage and rolling metrics.
 */
@Command(name = "servers", mixinStandardHelpOptions = true, description = "List MCP capability servers")
@Component
public class ServersCommand implements Runnable {

    @Option(names = {"--check", "-c"}, description = "Run a health check against every server first")
    private boolean check;

    private final ServerRegistry registry;
    private final McpHealthMonitor healthMonitor;

    public ServersCommand(ServerRegistry registry, McpHealthMonitor healthMonitor) {
        this.registry = registry;
        this.healthMonitor = healthMonitor;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (registry.isEmpty()) {
            ConsoleOutput.info("No MCP servers configured; capabilities use their fallback paths.");
            return;
        }
        if (check) {
            ConsoleOutput.info("Checking " + registry.statuses().size() + " server(s)...");
            healthMonitor.checkAll();
        }

        var statuses = registry.statuses();
        for (var status : statuses) {
            ConsoleOutput.server(status);
        }
        long unhealthy = statuses.stream().filter(s -> s.health() == ServerHealth.UNHEALTHY).count();
        System.out.println("──────────────────────────────────");
        if (unhealthy == 0) {
            ConsoleOutput.success("No unhealthy servers");
        } else {
            ConsoleOutput.error(unhealthy + " of " + statuses.size() + " server(s) unhealthy");
        }
    }
}
